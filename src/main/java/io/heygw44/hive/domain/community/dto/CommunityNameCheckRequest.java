package io.heygw44.hive.domain.community.dto;

import io.heygw44.hive.domain.community.entity.Community;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CommunityNameCheckRequest(
    @NotBlank(message = "커뮤니티 이름을 입력해주세요")
    @Size(max = Community.NAME_MAX_LENGTH, message = "커뮤니티 이름은 32자를 초과할 수 없습니다")
    @Pattern(regexp = Community.NAME_REGEX, message = "커뮤니티 이름은 영문, 숫자, 밑줄(_)만 사용할 수 있습니다")
    String name
) {}
