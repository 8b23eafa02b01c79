package io.heygw44.hive.domain.community.dto;

import io.heygw44.hive.domain.community.entity.Community;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 커뮤니티 생성 요청 DTO
 * JSON 본문과 multipart 폼 필드 모두 이 DTO로 바인딩
 * 카테고리 개수, 설명/규칙 길이는 설정값 기준으로 CommunityCreationValidator에서 검증
 */
public record CreateCommunityRequest(
    @NotBlank(message = "커뮤니티 이름을 입력해주세요")
    @Size(max = Community.NAME_MAX_LENGTH, message = "커뮤니티 이름은 32자를 초과할 수 없습니다")
    @Pattern(regexp = Community.NAME_REGEX, message = "커뮤니티 이름은 영문, 숫자, 밑줄(_)만 사용할 수 있습니다")
    String name,

    @NotBlank(message = "커뮤니티 유형을 선택해주세요")
    @Pattern(regexp = "^[PT]$", message = "커뮤니티 유형은 P(공개) 또는 T(비공개)여야 합니다")
    String type,

    @NotBlank(message = "커뮤니티 제목을 입력해주세요")
    @Size(max = Community.TITLE_MAX_LENGTH, message = "커뮤니티 제목은 32자를 초과할 수 없습니다")
    String title,

    @NotBlank(message = "커뮤니티 색상을 입력해주세요")
    @Pattern(regexp = Community.COLOR_REGEX, message = "색상은 #RRGGBB 형식이어야 합니다")
    String color,

    @NotNull(message = "카테고리를 선택해주세요")
    List<String> categories,

    String description,

    String rules,

    @Size(max = Community.ADJECTIVE_MAX_LENGTH, message = "구성원 호칭은 16자를 초과할 수 없습니다")
    String userAdjective,

    @Size(max = Community.ADJECTIVE_MAX_LENGTH, message = "구성원 복수 호칭은 16자를 초과할 수 없습니다")
    String usersAdjective
) {}
