package io.heygw44.hive.domain.membership.service;

import io.heygw44.hive.domain.community.dto.CommunityResponse;
import io.heygw44.hive.domain.community.entity.Community;
import io.heygw44.hive.domain.community.repository.CommunityRepository;
import io.heygw44.hive.domain.membership.entity.CommunityFavorite;
import io.heygw44.hive.domain.membership.entity.CommunityMembership;
import io.heygw44.hive.domain.membership.repository.CommunityFavoriteRepository;
import io.heygw44.hive.domain.membership.repository.CommunityMembershipRepository;
import io.heygw44.hive.global.exception.BusinessException;
import io.heygw44.hive.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 커뮤니티 가입/즐겨찾기 비즈니스 로직 서비스
 * 불변식: 즐겨찾기는 항상 가입 상태를 전제로 함
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class MembershipService {

    private final CommunityRepository communityRepository;
    private final CommunityMembershipRepository membershipRepository;
    private final CommunityFavoriteRepository favoriteRepository;

    /**
     * 커뮤니티 가입
     */
    @Transactional
    public CommunityResponse joinCommunity(String communityName, Long userId) {
        Community community = getCommunityOrThrow(communityName);

        // 중복 가입 확인 → COMMUNITY-409-MEMBER
        if (membershipRepository.existsByCommunityIdAndUserId(community.getId(), userId)) {
            throw new BusinessException(ErrorCode.COMMUNITY_ALREADY_MEMBER);
        }

        try {
            membershipRepository.save(CommunityMembership.join(community.getId(), userId));
        } catch (DataIntegrityViolationException ex) {
            // 동시 가입 요청으로 유니크 제약 위반 시 중복 가입으로 매핑
            throw new BusinessException(ErrorCode.COMMUNITY_ALREADY_MEMBER);
        }

        log.info("커뮤니티 가입 완료: communityId={}, userId={}", community.getId(), userId);
        return CommunityResponse.from(community);
    }

    /**
     * 커뮤니티 탈퇴
     * 즐겨찾기도 함께 제거
     */
    @Transactional
    public void leaveCommunity(String communityName, Long userId) {
        Community community = getCommunityOrThrow(communityName);

        CommunityMembership membership = membershipRepository
            .findByCommunityIdAndUserId(community.getId(), userId)
            .orElseThrow(() -> new BusinessException(ErrorCode.COMMUNITY_NOT_MEMBER));

        favoriteRepository.findByCommunityIdAndUserId(community.getId(), userId)
            .ifPresent(favoriteRepository::delete);
        membershipRepository.delete(membership);

        log.info("커뮤니티 탈퇴 완료: communityId={}, userId={}", community.getId(), userId);
    }

    /**
     * 커뮤니티 즐겨찾기
     * 가입하지 않은 커뮤니티는 즐겨찾기 불가
     */
    @Transactional
    public CommunityResponse favoriteCommunity(String communityName, Long userId) {
        Community community = getCommunityOrThrow(communityName);

        if (!membershipRepository.existsByCommunityIdAndUserId(community.getId(), userId)) {
            throw new BusinessException(ErrorCode.COMMUNITY_NOT_MEMBER);
        }
        if (favoriteRepository.existsByCommunityIdAndUserId(community.getId(), userId)) {
            throw new BusinessException(ErrorCode.COMMUNITY_ALREADY_FAVORITE);
        }

        try {
            favoriteRepository.save(CommunityFavorite.mark(community.getId(), userId));
        } catch (DataIntegrityViolationException ex) {
            throw new BusinessException(ErrorCode.COMMUNITY_ALREADY_FAVORITE);
        }

        log.info("커뮤니티 즐겨찾기 완료: communityId={}, userId={}", community.getId(), userId);
        return CommunityResponse.from(community);
    }

    /**
     * 커뮤니티 즐겨찾기 해제
     */
    @Transactional
    public void unfavoriteCommunity(String communityName, Long userId) {
        Community community = getCommunityOrThrow(communityName);

        CommunityFavorite favorite = favoriteRepository
            .findByCommunityIdAndUserId(community.getId(), userId)
            .orElseThrow(() -> new BusinessException(ErrorCode.COMMUNITY_NOT_FAVORITE));
        favoriteRepository.delete(favorite);

        log.info("커뮤니티 즐겨찾기 해제 완료: communityId={}, userId={}", community.getId(), userId);
    }

    /**
     * 가입한 커뮤니티 목록
     */
    public List<CommunityResponse> getJoinedCommunities(Long userId) {
        return toResponses(communityRepository.findJoinedByUserId(userId));
    }

    /**
     * 즐겨찾기한 커뮤니티 목록 (가입한 커뮤니티의 부분집합)
     */
    public List<CommunityResponse> getFavoriteCommunities(Long userId) {
        return toResponses(communityRepository.findFavoriteByUserId(userId));
    }

    // === Private Helper Methods ===

    private Community getCommunityOrThrow(String communityName) {
        return communityRepository.findByNameIgnoreCase(communityName)
            .orElseThrow(() -> new BusinessException(ErrorCode.RESOURCE_NOT_FOUND));
    }

    private List<CommunityResponse> toResponses(List<Community> communities) {
        return communities.stream()
            .map(CommunityResponse::from)
            .toList();
    }
}
