package io.heygw44.hive.domain.community.service;

import io.heygw44.hive.domain.community.dto.CommunityNameCheckResponse;
import io.heygw44.hive.domain.community.dto.CommunityResponse;
import io.heygw44.hive.domain.community.dto.CreateCommunityRequest;
import io.heygw44.hive.domain.community.entity.Category;
import io.heygw44.hive.domain.community.entity.Community;
import io.heygw44.hive.domain.community.entity.CommunityType;
import io.heygw44.hive.domain.community.repository.CommunityRepository;
import io.heygw44.hive.domain.membership.entity.CommunityMembership;
import io.heygw44.hive.domain.membership.repository.CommunityMembershipRepository;
import io.heygw44.hive.global.exception.BusinessException;
import io.heygw44.hive.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Set;

/**
 * 커뮤니티 비즈니스 로직 서비스
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class CommunityService {

    private final CommunityRepository communityRepository;
    private final CommunityMembershipRepository membershipRepository;
    private final CommunityCreationValidator communityCreationValidator;
    private final CommunityImageStorage communityImageStorage;

    /**
     * 커뮤니티 생성 (이미지 없음)
     */
    @Transactional
    public CommunityResponse createCommunity(CreateCommunityRequest request, Long creatorId) {
        return createCommunity(request, null, null, creatorId);
    }

    /**
     * 커뮤니티 생성
     * 생성자는 자동으로 첫 번째 멤버가 됨
     */
    @Transactional
    public CommunityResponse createCommunity(CreateCommunityRequest request, MultipartFile avatar,
                                             MultipartFile cover, Long creatorId) {
        // 설정값/DB 의존 규칙 검증 (필드별 오류 일괄 보고)
        Set<Category> categories = communityCreationValidator.validate(request);
        communityImageStorage.validateImage("avatar", avatar);
        communityImageStorage.validateImage("cover", cover);

        CommunityType type = CommunityType.fromCode(request.type())
            .orElseThrow(() -> BusinessException.invalidField("type", "알 수 없는 커뮤니티 유형입니다"));

        Community community = Community.create(
            request.name(),
            request.title(),
            type,
            request.color(),
            request.description(),
            request.rules(),
            request.userAdjective(),
            request.usersAdjective(),
            creatorId,
            categories
        );

        Community saved;
        try {
            saved = communityRepository.saveAndFlush(community);
        } catch (DataIntegrityViolationException ex) {
            // 동시 생성으로 이름 유니크 제약 위반 시 이름 중복으로 매핑
            throw new BusinessException(ErrorCode.VALIDATION_ERROR,
                List.of(CommunityCreationValidator.nameTakenError()));
        }

        saved.attachImages(
            communityImageStorage.store("avatars", saved.getId(), avatar),
            communityImageStorage.store("covers", saved.getId(), cover)
        );
        membershipRepository.save(CommunityMembership.join(saved.getId(), creatorId));

        log.info("커뮤니티 생성 완료: communityId={}, name={}, creatorId={}",
            saved.getId(), saved.getName(), creatorId);
        return CommunityResponse.from(saved);
    }

    /**
     * 커뮤니티 이름 사용 가능 여부 확인 (읽기 전용)
     */
    public CommunityNameCheckResponse checkNameAvailability(String name) {
        communityCreationValidator.validateNameAvailable(name);
        return CommunityNameCheckResponse.available(name);
    }

    /**
     * 이름으로 커뮤니티 조회
     */
    public Community getCommunity(String name) {
        return communityRepository.findByNameIgnoreCase(name)
            .orElseThrow(() -> new BusinessException(ErrorCode.RESOURCE_NOT_FOUND));
    }

    public CommunityResponse getCommunityResponse(String name) {
        return CommunityResponse.from(getCommunity(name));
    }
}
