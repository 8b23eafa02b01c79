package io.heygw44.hive.global.response;

import io.heygw44.hive.global.filter.TraceIdFilter;
import org.slf4j.MDC;

public record ApiResponse<T>(T data, String traceId) {
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(data, MDC.get(TraceIdFilter.MDC_KEY));
    }
}
