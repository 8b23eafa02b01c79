package io.heygw44.hive.global.response;

import io.heygw44.hive.global.exception.ErrorCode;
import io.heygw44.hive.global.filter.TraceIdFilter;
import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;

public record ErrorResponse(
        String code,
        String message,
        String traceId,
        List<FieldError> fieldErrors
) {
    public static ErrorResponse from(ErrorCode errorCode) {
        return of(errorCode, Collections.emptyList());
    }

    public static ErrorResponse of(ErrorCode errorCode, List<FieldError> fieldErrors) {
        return new ErrorResponse(
                errorCode.getCode(),
                errorCode.getMessage(),
                currentTraceId(),
                fieldErrors
        );
    }

    public static ErrorResponse validation(List<FieldError> fieldErrors) {
        return of(ErrorCode.VALIDATION_ERROR, fieldErrors);
    }

    public static ErrorResponse internal() {
        return from(ErrorCode.INTERNAL_ERROR);
    }

    private static String currentTraceId() {
        return MDC.get(TraceIdFilter.MDC_KEY);
    }
}
