package io.heygw44.hive.domain.membership.repository;

import io.heygw44.hive.domain.membership.entity.CommunityMembership;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CommunityMembershipRepository extends JpaRepository<CommunityMembership, Long> {

    boolean existsByCommunityIdAndUserId(Long communityId, Long userId);

    Optional<CommunityMembership> findByCommunityIdAndUserId(Long communityId, Long userId);

    long countByCommunityId(Long communityId);

    long countByUserId(Long userId);
}
