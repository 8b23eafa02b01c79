package io.heygw44.hive.domain.community.dto;

public record CommunityNameCheckResponse(
    String name,
    boolean available
) {
    public static CommunityNameCheckResponse available(String name) {
        return new CommunityNameCheckResponse(name, true);
    }
}
