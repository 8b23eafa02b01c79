package io.heygw44.hive.global.response;

public record FieldError(String field, String message) {}
