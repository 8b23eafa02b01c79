package io.heygw44.hive.global.config;

import io.heygw44.hive.domain.community.entity.Community;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 커뮤니티 생성 정책 설정
 * application.yml의 hive.community.* 값으로 바인딩
 */
@ConfigurationProperties(prefix = "hive.community")
public record CommunityProperties(
        int categoriesMinAmount,
        int categoriesMaxAmount,
        int descriptionMaxLength,
        int rulesMaxLength,
        String imageDirectory
) {
    public CommunityProperties {
        if (categoriesMinAmount < 0 || categoriesMaxAmount < categoriesMinAmount) {
            throw new IllegalArgumentException(
                    "카테고리 개수 범위가 올바르지 않습니다: [" + categoriesMinAmount + ", " + categoriesMaxAmount + "]");
        }
        requireWithinColumn("description-max-length", descriptionMaxLength);
        requireWithinColumn("rules-max-length", rulesMaxLength);
    }

    // 설정값이 컬럼 크기를 넘으면 검증은 통과하고 저장에서 실패하므로 기동 시 거부
    private static void requireWithinColumn(String property, int maxLength) {
        if (maxLength <= 0 || maxLength > Community.TEXT_COLUMN_LENGTH) {
            throw new IllegalArgumentException(
                    property + "는 1 이상 " + Community.TEXT_COLUMN_LENGTH + " 이하여야 합니다: " + maxLength);
        }
    }
}
