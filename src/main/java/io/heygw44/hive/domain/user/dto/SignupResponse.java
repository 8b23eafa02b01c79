package io.heygw44.hive.domain.user.dto;

public record SignupResponse(
        Long id,
        String email,
        String nickname
) {
}
