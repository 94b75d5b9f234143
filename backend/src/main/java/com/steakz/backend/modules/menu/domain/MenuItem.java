package com.steakz.backend.modules.menu.domain;

import java.math.BigDecimal;

import com.steakz.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Dish offered by one branch. Order lines copy the price at the time of ordering.
 */
@Entity
@Table(name = "menu_item")
public class MenuItem extends AbstractTimestampedEntity {

    public static final String DEFAULT_CATEGORY = "Other";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "description", nullable = false, length = 500)
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "category", nullable = false, length = 60)
    private String category;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private Long branchId;

    protected MenuItem() {
    }

    public MenuItem(String name, String description, BigDecimal price, String category, Long branchId) {
        this.name = name;
        this.description = description;
        this.price = price;
        this.category = category;
        this.branchId = branchId;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public String getCategory() {
        return category;
    }

    public Long getBranchId() {
        return branchId;
    }
}
