package io.heygw44.hive.global.exception;

import io.heygw44.hive.global.response.FieldError;
import lombok.Getter;

import java.util.List;

/**
 * 도메인 규칙 위반 예외
 * 필드 단위 오류가 있으면 fieldErrors로 함께 전달
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;
    private final List<FieldError> fieldErrors;

    public BusinessException(ErrorCode errorCode) {
        this(errorCode, List.of());
    }

    public BusinessException(ErrorCode errorCode, List<FieldError> fieldErrors) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.fieldErrors = List.copyOf(fieldErrors);
    }

    public static BusinessException invalidField(String field, String message) {
        return new BusinessException(ErrorCode.VALIDATION_ERROR, List.of(new FieldError(field, message)));
    }
}
