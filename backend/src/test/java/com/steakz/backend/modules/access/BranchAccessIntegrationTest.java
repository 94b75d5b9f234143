package com.steakz.backend.modules.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.auth.domain.AppUser;
import com.steakz.backend.modules.branch.domain.Branch;
import com.steakz.backend.modules.inventory.infrastructure.persistence.InventoryItemRepository;
import com.steakz.backend.modules.menu.domain.MenuItem;
import com.steakz.backend.support.AbstractPostgresIntegrationTest;
import com.steakz.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class BranchAccessIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private InventoryItemRepository inventoryItemRepository;

    private Branch branchOne;
    private Branch branchTwo;
    private AppUser owner;
    private AppUser manager;
    private AppUser frontStaff;
    private AppUser kitchenStaff;
    private AppUser customer;

    @BeforeEach
    void setUp() {
        branchOne = testUserFactory.createBranch("North");
        branchTwo = testUserFactory.createBranch("South");
        owner = testUserFactory.createUser(Role.OWNER_ADMIN, branchOne.getId());
        manager = testUserFactory.createUser(Role.BRANCH_MANAGER, branchOne.getId());
        frontStaff = testUserFactory.createUser(Role.FRONT_STAFF, branchOne.getId());
        kitchenStaff = testUserFactory.createUser(Role.KITCHEN_STAFF, branchOne.getId());
        customer = testUserFactory.createUser(Role.CUSTOMER, branchOne.getId());
    }

    @Test
    @DisplayName("manager reading another branch's inventory gets 403 forbidden_branch")
    void managerCrossBranchInventory() throws Exception {
        mockMvc.perform(get("/api/inventory/branch/{branchId}", branchTwo.getId())
                        .header("Authorization", testUserFactory.bearer(manager)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access.forbidden_branch"));

        mockMvc.perform(get("/api/inventory/branch/{branchId}", branchOne.getId())
                        .header("Authorization", testUserFactory.bearer(manager)))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("owner lists inventory of the requested branch")
    void ownerRequestedBranchInventory() throws Exception {
        testUserFactory.stockMenuItem(branchTwo.getId(), "Tomahawk", "54.00", 8);

        mockMvc.perform(get("/api/inventory")
                        .param("branchId", branchTwo.getId().toString())
                        .header("Authorization", testUserFactory.bearer(owner)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].branchId").value(branchTwo.getId()))
                .andExpect(jsonPath("$[0].lowStock").value(true));
    }

    @Test
    @DisplayName("front staff order is placed in the home branch even when another branch is named")
    void frontStaffOrderPinnedToHomeBranch() throws Exception {
        MenuItem ribeye = testUserFactory.stockMenuItem(branchOne.getId(), "Ribeye", "32.50", 10);

        mockMvc.perform(post("/api/orders")
                        .header("Authorization", testUserFactory.bearer(frontStaff))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "branchId": "%d",
                                  "items": [{"menuItemId": %d, "quantity": 3}]
                                }
                                """.formatted(branchTwo.getId(), ribeye.getId())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.branchId").value(branchOne.getId()))
                .andExpect(jsonPath("$.total").value(97.5));

        int remaining = inventoryItemRepository.findByBranchIdOrderByIdAsc(branchOne.getId()).get(0).getQuantity();
        assertThat(remaining).isEqualTo(7);
    }

    @Test
    void orderBeyondStockIsConflict() throws Exception {
        MenuItem ribeye = testUserFactory.stockMenuItem(branchOne.getId(), "Ribeye", "32.50", 1);

        mockMvc.perform(post("/api/orders")
                        .header("Authorization", testUserFactory.bearer(customer))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items": [{"menuItemId": %d, "quantity": 2}]}
                                """.formatted(ribeye.getId())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("orders.insufficient_inventory"));
    }

    @Test
    @DisplayName("kitchen staff reaches the order queue but not reservations")
    void kitchenStaffCategory() throws Exception {
        mockMvc.perform(get("/api/orders")
                        .header("Authorization", testUserFactory.bearer(kitchenStaff)))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/reservations")
                        .header("Authorization", testUserFactory.bearer(kitchenStaff)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access.forbidden_category"));
    }

    @Test
    @DisplayName("customer listing staff gets 403 forbidden_role")
    void customerStaffList() throws Exception {
        mockMvc.perform(get("/api/staff/branch/{branchId}", branchOne.getId())
                        .header("Authorization", testUserFactory.bearer(customer)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access.forbidden_role"));
    }

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/orders"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.unauthenticated"));
    }

    @Test
    void ownerSwitchesActiveBranchAndListsFollow() throws Exception {
        mockMvc.perform(patch("/api/users/{userId}/active-branch", owner.getId())
                        .header("Authorization", testUserFactory.bearer(owner))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"branchId": "%d"}
                                """.formatted(branchTwo.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeBranchId").value(branchTwo.getId()));

        testUserFactory.stockMenuItem(branchTwo.getId(), "Flank", "21.00", 40);

        mockMvc.perform(get("/api/inventory")
                        .header("Authorization", testUserFactory.bearer(owner)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].branchId").value(branchTwo.getId()));
    }
}
