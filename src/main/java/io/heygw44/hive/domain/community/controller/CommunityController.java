package io.heygw44.hive.domain.community.controller;

import io.heygw44.hive.domain.community.dto.CommunityNameCheckRequest;
import io.heygw44.hive.domain.community.dto.CommunityNameCheckResponse;
import io.heygw44.hive.domain.community.dto.CommunityResponse;
import io.heygw44.hive.domain.community.dto.CreateCommunityRequest;
import io.heygw44.hive.domain.community.service.CommunityService;
import io.heygw44.hive.global.response.ApiResponse;
import io.heygw44.hive.global.security.CustomUserDetails;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

/**
 * 커뮤니티 REST API 컨트롤러
 * API: PUT /api/communities, POST /api/community-name-check, GET /api/communities/{communityName}
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CommunityController {

    private final CommunityService communityService;

    /**
     * 커뮤니티 생성 (JSON)
     * PUT /api/communities
     */
    @PutMapping(value = "/communities", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse<CommunityResponse>> createCommunity(
            @Valid @RequestBody CreateCommunityRequest request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        CommunityResponse response = communityService.createCommunity(request, userDetails.getUserId());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.success(response));
    }

    /**
     * 커뮤니티 생성 (multipart, 아바타/커버 이미지 포함 가능)
     * PUT /api/communities
     */
    @PutMapping(value = "/communities", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<CommunityResponse>> createCommunityWithImages(
            @Valid @ModelAttribute CreateCommunityRequest request,
            @RequestPart(value = "avatar", required = false) MultipartFile avatar,
            @RequestPart(value = "cover", required = false) MultipartFile cover,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        CommunityResponse response = communityService.createCommunity(
            request, avatar, cover, userDetails.getUserId());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.success(response));
    }

    /**
     * 커뮤니티 이름 사용 가능 여부 확인
     * POST /api/community-name-check
     * 사용 가능 시 202, 중복/형식 오류 시 400 (name 필드 오류)
     */
    @PostMapping("/community-name-check")
    public ResponseEntity<ApiResponse<CommunityNameCheckResponse>> checkCommunityName(
            @Valid @RequestBody CommunityNameCheckRequest request) {

        CommunityNameCheckResponse response = communityService.checkNameAvailability(request.name());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.success(response));
    }

    /**
     * 커뮤니티 상세 조회
     * GET /api/communities/{communityName}
     */
    @GetMapping("/communities/{communityName}")
    public ResponseEntity<ApiResponse<CommunityResponse>> getCommunity(@PathVariable String communityName) {
        return ResponseEntity.ok(ApiResponse.success(communityService.getCommunityResponse(communityName)));
    }
}
