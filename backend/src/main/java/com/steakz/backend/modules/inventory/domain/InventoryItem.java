package com.steakz.backend.modules.inventory.domain;

import com.steakz.backend.global.jpa.AbstractTimestampedEntity;
import com.steakz.backend.modules.menu.domain.MenuItem;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(
        name = "inventory_item",
        uniqueConstraints = @UniqueConstraint(name = "uq_inventory_item_menu_branch", columnNames = {"menu_item_id", "branch_id"})
)
public class InventoryItem extends AbstractTimestampedEntity {

    public static final int DEFAULT_MIN_QUANTITY = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "menu_item_id", nullable = false, updatable = false)
    private MenuItem menuItem;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private Long branchId;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "min_quantity", nullable = false)
    private int minQuantity;

    protected InventoryItem() {
    }

    public InventoryItem(MenuItem menuItem, Long branchId, int quantity, int minQuantity) {
        this.menuItem = menuItem;
        this.branchId = branchId;
        this.quantity = Math.max(0, quantity);
        this.minQuantity = Math.max(0, minQuantity);
    }

    public Long getId() {
        return id;
    }

    public MenuItem getMenuItem() {
        return menuItem;
    }

    public Long getBranchId() {
        return branchId;
    }

    public int getQuantity() {
        return quantity;
    }

    public void setQuantity(int quantity) {
        this.quantity = quantity;
    }

    public int getMinQuantity() {
        return minQuantity;
    }

    public void setMinQuantity(int minQuantity) {
        this.minQuantity = minQuantity;
    }

    public boolean isLowStock() {
        return quantity < minQuantity;
    }
}
