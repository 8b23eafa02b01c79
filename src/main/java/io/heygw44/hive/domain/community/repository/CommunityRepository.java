package io.heygw44.hive.domain.community.repository;

import io.heygw44.hive.domain.community.entity.Community;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CommunityRepository extends JpaRepository<Community, Long> {

    /**
     * 이름 중복 확인 (대소문자 무시)
     */
    boolean existsByNameIgnoreCase(String name);

    /**
     * 이름으로 단건 조회 (카테고리 함께 로딩)
     */
    @EntityGraph(attributePaths = "categories")
    Optional<Community> findByNameIgnoreCase(String name);

    /**
     * 사용자가 가입한 커뮤니티 목록
     * 인덱스: idx_membership_user (user_id)
     */
    @Query("""
        SELECT DISTINCT c FROM Community c
        LEFT JOIN FETCH c.categories
        WHERE c.id IN (
            SELECT m.communityId FROM CommunityMembership m WHERE m.userId = :userId
        )
        ORDER BY c.createdAt DESC
        """)
    List<Community> findJoinedByUserId(@Param("userId") Long userId);

    /**
     * 사용자가 즐겨찾기한 커뮤니티 목록
     * 즐겨찾기는 가입 상태에서만 유효하므로 멤버십도 함께 확인
     */
    @Query("""
        SELECT DISTINCT c FROM Community c
        LEFT JOIN FETCH c.categories
        WHERE c.id IN (
            SELECT f.communityId FROM CommunityFavorite f WHERE f.userId = :userId
        )
        AND c.id IN (
            SELECT m.communityId FROM CommunityMembership m WHERE m.userId = :userId
        )
        ORDER BY c.createdAt DESC
        """)
    List<Community> findFavoriteByUserId(@Param("userId") Long userId);
}
