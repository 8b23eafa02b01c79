package io.heygw44.hive.domain.community.dto;

import io.heygw44.hive.domain.community.entity.Community;
import io.heygw44.hive.domain.community.entity.CommunityType;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 커뮤니티 응답 DTO
 * 생성/상세/가입 목록/즐겨찾기 목록에서 공통 사용
 */
public record CommunityResponse(
    Long id,
    String name,
    String title,
    CommunityType type,
    String color,
    String description,
    String rules,
    String userAdjective,
    String usersAdjective,
    String avatar,
    String cover,
    Long creatorId,
    List<CategoryResponse> categories,
    LocalDateTime createdAt
) {
    public static CommunityResponse from(Community community) {
        return new CommunityResponse(
            community.getId(),
            community.getName(),
            community.getTitle(),
            community.getType(),
            community.getColor(),
            community.getDescription(),
            community.getRules(),
            community.getUserAdjective(),
            community.getUsersAdjective(),
            community.getAvatar(),
            community.getCover(),
            community.getCreatorId(),
            community.getSortedCategories().stream()
                .map(CategoryResponse::from)
                .toList(),
            community.getCreatedAt()
        );
    }
}
