package io.heygw44.hive.domain.community.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 카테고리 엔티티
 * 커뮤니티가 참조만 하고 소유하지 않음
 */
@Entity
@Table(name = "category")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Category {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 32)
    private String name;

    @Column(nullable = false, length = 64)
    private String title;

    @Column(length = 7)
    private String color;

    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    private Category(String name, String title, String color, int orderIndex) {
        this.name = name;
        this.title = title;
        this.color = color;
        this.orderIndex = orderIndex;
    }

    public static Category create(String name, String title, String color, int orderIndex) {
        return new Category(name, title, color, orderIndex);
    }
}
