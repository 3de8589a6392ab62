package com.cred.freestyle.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Ad category. Only the fields the listing filters need are mapped here.
 *
 * @author Marketplace Team
 */
@Entity
@Table(name = "categories", indexes = {
    @Index(name = "idx_categories_slug", columnList = "slug", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Category {

    @Id
    @Column(name = "category_id", nullable = false, length = 36)
    private String categoryId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "slug", nullable = false, unique = true, length = 120)
    private String slug;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Category parent;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "display_order", nullable = false)
    @Builder.Default
    private Integer displayOrder = 0;

    @PrePersist
    protected void onCreate() {
        if (categoryId == null) {
            categoryId = UUID.randomUUID().toString();
        }
    }
}
