package com.steakz.backend.modules.auth.domain;

import com.steakz.backend.global.jpa.AbstractTimestampedEntity;
import com.steakz.backend.modules.access.domain.Role;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Account of a customer or staff member. The home branch is fixed at creation;
 * only the top role uses {@code activeBranchId}.
 */
@Entity
@Table(name = "app_user")
public class AppUser extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private Role role;

    @Column(name = "branch_id", updatable = false)
    private Long branchId;

    @Column(name = "active_branch_id")
    private Long activeBranchId;

    protected AppUser() {
    }

    public AppUser(String email, String passwordHash, Role role, Long branchId) {
        this.email = email;
        this.passwordHash = passwordHash;
        this.role = role;
        this.branchId = branchId;
    }

    public Long getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public Role getRole() {
        return role;
    }

    public Long getBranchId() {
        return branchId;
    }

    public Long getActiveBranchId() {
        return activeBranchId;
    }

    public void setActiveBranchId(Long activeBranchId) {
        this.activeBranchId = activeBranchId;
    }
}
