package io.heygw44.hive.domain.community.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 커뮤니티 엔티티
 * name은 전역 유일하며 생성 후 변경 불가 (변경 메서드 없음)
 */
@Entity
@Table(name = "community", indexes = {
    @Index(name = "idx_community_creator", columnList = "creator_id"),
    @Index(name = "idx_community_created", columnList = "created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Community {

    public static final int NAME_MAX_LENGTH = 32;
    public static final String NAME_REGEX = "^[a-zA-Z0-9_]+$";
    public static final int TITLE_MAX_LENGTH = 32;
    public static final int ADJECTIVE_MAX_LENGTH = 16;
    public static final String COLOR_REGEX = "^#([0-9a-fA-F]{6}|[0-9a-fA-F]{3})$";
    public static final int TEXT_COLUMN_LENGTH = 5000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, updatable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Column(nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private CommunityType type;

    @Column(nullable = false, length = 7)
    private String color;

    @Column(length = TEXT_COLUMN_LENGTH)
    private String description;

    @Column(length = TEXT_COLUMN_LENGTH)
    private String rules;

    @Column(name = "user_adjective", length = ADJECTIVE_MAX_LENGTH)
    private String userAdjective;

    @Column(name = "users_adjective", length = ADJECTIVE_MAX_LENGTH)
    private String usersAdjective;

    @Column(length = 255)
    private String avatar;

    @Column(length = 255)
    private String cover;

    @Column(name = "creator_id", nullable = false, updatable = false)
    private Long creatorId;

    @ManyToMany
    @JoinTable(name = "community_category",
            joinColumns = @JoinColumn(name = "community_id"),
            inverseJoinColumns = @JoinColumn(name = "category_id"))
    private Set<Category> categories = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private Community(String name, String title, CommunityType type, String color, String description,
                      String rules, String userAdjective, String usersAdjective, Long creatorId,
                      Collection<Category> categories) {
        this.name = name;
        this.title = title;
        this.type = type;
        this.color = color;
        this.description = description;
        this.rules = rules;
        this.userAdjective = userAdjective;
        this.usersAdjective = usersAdjective;
        this.creatorId = creatorId;
        this.categories.addAll(categories);
        this.createdAt = LocalDateTime.now();
    }

    /**
     * 커뮤니티 생성 팩토리 메서드
     */
    public static Community create(String name, String title, CommunityType type, String color,
                                   String description, String rules, String userAdjective,
                                   String usersAdjective, Long creatorId, Collection<Category> categories) {
        return new Community(name, title, type, color, description, rules, userAdjective,
                usersAdjective, creatorId, categories);
    }

    /**
     * 저장된 이미지 경로 연결 (null이면 기존 값 유지)
     */
    public void attachImages(String avatar, String cover) {
        if (avatar != null) {
            this.avatar = avatar;
        }
        if (cover != null) {
            this.cover = cover;
        }
    }

    /**
     * 표시 순서대로 정렬된 카테고리
     */
    public List<Category> getSortedCategories() {
        return categories.stream()
                .sorted(Comparator.comparingInt(Category::getOrderIndex).thenComparing(Category::getName))
                .toList();
    }
}
