package io.heygw44.hive.domain.user.dto;

public record LoginResponse(
        Long id,
        String email,
        String nickname
) {
}
