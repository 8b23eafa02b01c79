package io.heygw44.hive.global.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    // Common
    AUTH_UNAUTHORIZED("AUTH-401", "인증이 필요합니다", HttpStatus.UNAUTHORIZED),
    AUTH_FORBIDDEN("AUTH-403", "권한이 없습니다", HttpStatus.FORBIDDEN),
    VALIDATION_ERROR("REQ-400", "입력값이 올바르지 않습니다", HttpStatus.BAD_REQUEST),
    MALFORMED_REQUEST("REQ-400-BODY", "요청 본문을 읽을 수 없습니다", HttpStatus.BAD_REQUEST),
    UNSUPPORTED_MEDIA_TYPE("REQ-415", "지원하지 않는 요청 형식입니다", HttpStatus.UNSUPPORTED_MEDIA_TYPE),
    RESOURCE_NOT_FOUND("RES-404", "리소스를 찾을 수 없습니다", HttpStatus.NOT_FOUND),

    // Auth
    INVALID_CREDENTIALS("AUTH-401-CREDENTIALS", "이메일 또는 비밀번호가 올바르지 않습니다", HttpStatus.UNAUTHORIZED),
    DUPLICATE_EMAIL("AUTH-409-EMAIL", "이미 사용 중인 이메일입니다", HttpStatus.CONFLICT),
    DUPLICATE_NICKNAME("AUTH-409-NICKNAME", "이미 사용 중인 닉네임입니다", HttpStatus.CONFLICT),
    INVALID_PASSWORD_LENGTH("AUTH-400-PASSWORD", "비밀번호는 10자 이상이어야 합니다", HttpStatus.BAD_REQUEST),
    SESSION_LIMIT_EXCEEDED("AUTH-409-SESSION", "허용된 세션 수를 초과했습니다", HttpStatus.CONFLICT),

    // Community
    COMMUNITY_ALREADY_MEMBER("COMMUNITY-409-MEMBER", "이미 가입한 커뮤니티입니다", HttpStatus.CONFLICT),
    COMMUNITY_NOT_MEMBER("COMMUNITY-409-NOT-MEMBER", "가입하지 않은 커뮤니티입니다", HttpStatus.CONFLICT),
    COMMUNITY_ALREADY_FAVORITE("COMMUNITY-409-FAVORITE", "이미 즐겨찾기한 커뮤니티입니다", HttpStatus.CONFLICT),
    COMMUNITY_NOT_FAVORITE("COMMUNITY-409-NOT-FAVORITE", "즐겨찾기하지 않은 커뮤니티입니다", HttpStatus.CONFLICT),

    // Image
    IMAGE_STORE_FAILED("IMAGE-500", "이미지를 저장하지 못했습니다", HttpStatus.INTERNAL_SERVER_ERROR),

    INTERNAL_ERROR("SYS-500", "서버 오류가 발생했습니다", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus httpStatus;

    ErrorCode(String code, String message, HttpStatus httpStatus) {
        this.code = code;
        this.message = message;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
