package io.heygw44.hive.domain.membership.repository;

import io.heygw44.hive.domain.membership.entity.CommunityFavorite;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CommunityFavoriteRepository extends JpaRepository<CommunityFavorite, Long> {

    boolean existsByCommunityIdAndUserId(Long communityId, Long userId);

    Optional<CommunityFavorite> findByCommunityIdAndUserId(Long communityId, Long userId);

    long countByUserId(Long userId);
}
