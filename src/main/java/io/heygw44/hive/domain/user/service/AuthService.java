package io.heygw44.hive.domain.user.service;

import io.heygw44.hive.domain.user.dto.LoginResponse;
import io.heygw44.hive.domain.user.dto.SignupRequest;
import io.heygw44.hive.domain.user.dto.SignupResponse;
import io.heygw44.hive.domain.user.entity.User;
import io.heygw44.hive.domain.user.repository.UserRepository;
import io.heygw44.hive.global.exception.BusinessException;
import io.heygw44.hive.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private static final int MIN_PASSWORD_LENGTH = 10;

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional
    public SignupResponse signup(SignupRequest request) {
        validateSignupRequest(request);

        String passwordHash = passwordEncoder.encode(request.password());
        User savedUser = userRepository.save(User.create(request.email(), passwordHash, request.nickname()));

        log.info("회원가입 완료: userId={}", savedUser.getId());
        return new SignupResponse(
                savedUser.getId(),
                savedUser.getEmail(),
                savedUser.getNickname()
        );
    }

    private void validateSignupRequest(SignupRequest request) {
        if (request.password().length() < MIN_PASSWORD_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_PASSWORD_LENGTH);
        }

        if (userRepository.existsByEmail(request.email())) {
            throw new BusinessException(ErrorCode.DUPLICATE_EMAIL);
        }

        if (userRepository.existsByNickname(request.nickname())) {
            throw new BusinessException(ErrorCode.DUPLICATE_NICKNAME);
        }
    }

    public LoginResponse getLoginResponse(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_CREDENTIALS));

        return new LoginResponse(user.getId(), user.getEmail(), user.getNickname());
    }
}
