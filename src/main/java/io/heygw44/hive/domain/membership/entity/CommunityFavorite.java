package io.heygw44.hive.domain.membership.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 커뮤니티 즐겨찾기 엔티티
 * 가입한 커뮤니티에 대해서만 생성 (MembershipService에서 보장)
 */
@Entity
@Table(name = "community_favorite",
       uniqueConstraints = @UniqueConstraint(
           name = "uk_favorite_community_user",
           columnNames = {"community_id", "user_id"}
       ),
       indexes = {
           @Index(name = "idx_favorite_user", columnList = "user_id")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CommunityFavorite {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "community_id", nullable = false)
    private Long communityId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private CommunityFavorite(Long communityId, Long userId) {
        this.communityId = communityId;
        this.userId = userId;
        this.createdAt = LocalDateTime.now();
    }

    public static CommunityFavorite mark(Long communityId, Long userId) {
        return new CommunityFavorite(communityId, userId);
    }
}
