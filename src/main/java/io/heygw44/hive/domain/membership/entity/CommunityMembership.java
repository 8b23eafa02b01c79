package io.heygw44.hive.domain.membership.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 커뮤니티 가입 엔티티
 */
@Entity
@Table(name = "community_membership",
       uniqueConstraints = @UniqueConstraint(
           name = "uk_membership_community_user",
           columnNames = {"community_id", "user_id"}
       ),
       indexes = {
           @Index(name = "idx_membership_user", columnList = "user_id")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CommunityMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "community_id", nullable = false)
    private Long communityId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private CommunityMembership(Long communityId, Long userId) {
        this.communityId = communityId;
        this.userId = userId;
        this.createdAt = LocalDateTime.now();
    }

    public static CommunityMembership join(Long communityId, Long userId) {
        return new CommunityMembership(communityId, userId);
    }
}
