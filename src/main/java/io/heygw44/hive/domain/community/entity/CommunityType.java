package io.heygw44.hive.domain.community.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * 커뮤니티 공개 범위
 * 요청에서는 한 글자 코드(P/T)로 주고받음
 */
public enum CommunityType {
    PUBLIC("P"),    // 공개
    PRIVATE("T");   // 비공개

    private final String code;

    CommunityType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<CommunityType> fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst();
    }
}
