package io.heygw44.hive.domain.membership.controller;

import io.heygw44.hive.domain.community.dto.CommunityResponse;
import io.heygw44.hive.domain.membership.service.MembershipService;
import io.heygw44.hive.global.response.ApiResponse;
import io.heygw44.hive.global.security.CustomUserDetails;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 커뮤니티 가입/즐겨찾기 REST API 컨트롤러
 * API: GET /api/joined-communities, GET /api/favorite-communities,
 *      POST /api/communities/{communityName}/members/join|leave,
 *      PUT/DELETE /api/communities/{communityName}/favorite
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MembershipController {

    private final MembershipService membershipService;

    /**
     * 가입한 커뮤니티 목록
     * GET /api/joined-communities
     */
    @GetMapping("/joined-communities")
    public ResponseEntity<ApiResponse<List<CommunityResponse>>> getJoinedCommunities(
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        List<CommunityResponse> response = membershipService.getJoinedCommunities(userDetails.getUserId());
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    /**
     * 즐겨찾기한 커뮤니티 목록
     * GET /api/favorite-communities
     */
    @GetMapping("/favorite-communities")
    public ResponseEntity<ApiResponse<List<CommunityResponse>>> getFavoriteCommunities(
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        List<CommunityResponse> response = membershipService.getFavoriteCommunities(userDetails.getUserId());
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    /**
     * 커뮤니티 가입
     * POST /api/communities/{communityName}/members/join
     */
    @PostMapping("/communities/{communityName}/members/join")
    public ResponseEntity<ApiResponse<CommunityResponse>> joinCommunity(
            @PathVariable String communityName,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        CommunityResponse response = membershipService.joinCommunity(communityName, userDetails.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.success(response));
    }

    /**
     * 커뮤니티 탈퇴
     * POST /api/communities/{communityName}/members/leave
     */
    @PostMapping("/communities/{communityName}/members/leave")
    public ResponseEntity<Void> leaveCommunity(
            @PathVariable String communityName,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        membershipService.leaveCommunity(communityName, userDetails.getUserId());
        return ResponseEntity.noContent().build();
    }

    /**
     * 커뮤니티 즐겨찾기
     * PUT /api/communities/{communityName}/favorite
     */
    @PutMapping("/communities/{communityName}/favorite")
    public ResponseEntity<ApiResponse<CommunityResponse>> favoriteCommunity(
            @PathVariable String communityName,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        CommunityResponse response = membershipService.favoriteCommunity(communityName, userDetails.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.success(response));
    }

    /**
     * 커뮤니티 즐겨찾기 해제
     * DELETE /api/communities/{communityName}/favorite
     */
    @DeleteMapping("/communities/{communityName}/favorite")
    public ResponseEntity<Void> unfavoriteCommunity(
            @PathVariable String communityName,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        membershipService.unfavoriteCommunity(communityName, userDetails.getUserId());
        return ResponseEntity.noContent().build();
    }
}
