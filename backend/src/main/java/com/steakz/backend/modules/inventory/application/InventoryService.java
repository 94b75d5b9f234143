package com.steakz.backend.modules.inventory.application;

import java.math.BigDecimal;
import java.util.List;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.application.BranchAccessGuard;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.ProtectedOperation;
import com.steakz.backend.modules.branch.infrastructure.persistence.BranchRepository;
import com.steakz.backend.modules.inventory.domain.InventoryItem;
import com.steakz.backend.modules.inventory.infrastructure.persistence.InventoryItemRepository;
import com.steakz.backend.modules.inventory.presentation.dto.CreateInventoryRequest;
import com.steakz.backend.modules.inventory.presentation.dto.CreateInventoryWithItemRequest;
import com.steakz.backend.modules.inventory.presentation.dto.InventoryItemResponse;
import com.steakz.backend.modules.inventory.presentation.dto.UpdateInventoryRequest;
import com.steakz.backend.modules.menu.domain.MenuItem;
import com.steakz.backend.modules.menu.infrastructure.persistence.MenuItemRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InventoryService {

    private final InventoryItemRepository inventoryItemRepository;
    private final MenuItemRepository menuItemRepository;
    private final BranchRepository branchRepository;
    private final BranchAccessGuard accessGuard;

    public InventoryService(
            InventoryItemRepository inventoryItemRepository,
            MenuItemRepository menuItemRepository,
            BranchRepository branchRepository,
            BranchAccessGuard accessGuard
    ) {
        this.inventoryItemRepository = inventoryItemRepository;
        this.menuItemRepository = menuItemRepository;
        this.branchRepository = branchRepository;
        this.accessGuard = accessGuard;
    }

    @Transactional(readOnly = true)
    public List<InventoryItemResponse> list(Actor actor, String requestedBranchId) {
        Long branchId = accessGuard.authorizeBranchScope(ProtectedOperation.INVENTORY_LIST, actor, requestedBranchId);
        return findByBranch(branchId);
    }

    @Transactional(readOnly = true)
    public List<InventoryItemResponse> listForBranch(Actor actor, String pathBranchId) {
        Long branchId = accessGuard.authorizeBranchPath(ProtectedOperation.INVENTORY_LIST, actor, pathBranchId);
        return findByBranch(branchId);
    }

    @Transactional
    public InventoryItemResponse create(Actor actor, CreateInventoryRequest request) {
        Long branchId = accessGuard.authorizeBranchScope(ProtectedOperation.INVENTORY_CREATE, actor, request.branchId());

        MenuItem menuItem = menuItemRepository.findById(request.menuItemId())
                .orElseThrow(() -> ProblemException.notFound("menu.item_not_found", "menu item " + request.menuItemId() + " not found"));
        if (!branchId.equals(menuItem.getBranchId())) {
            throw ProblemException.badRequest("inventory.menu_item_other_branch", "menu item belongs to another branch");
        }
        if (inventoryItemRepository.existsByMenuItemIdAndBranchId(menuItem.getId(), branchId)) {
            throw ProblemException.conflict("inventory.duplicate", "inventory already exists for this menu item at this branch");
        }

        InventoryItem item = new InventoryItem(
                menuItem,
                branchId,
                orZero(request.quantity()),
                request.minQuantity() == null ? InventoryItem.DEFAULT_MIN_QUANTITY : request.minQuantity()
        );
        return InventoryItemResponse.from(inventoryItemRepository.save(item));
    }

    @Transactional
    public InventoryItemResponse createWithItem(Actor actor, CreateInventoryWithItemRequest request) {
        Long branchId = accessGuard.authorizeBranchScope(ProtectedOperation.INVENTORY_CREATE, actor, request.branchId());
        if (!branchRepository.existsById(branchId)) {
            throw ProblemException.notFound("branch.not_found", "branch " + branchId + " does not exist");
        }

        String name = request.name().trim();
        String description = request.description() != null && !request.description().isBlank()
                ? request.description().trim()
                : name + " inventory item";
        String category = request.category() != null && !request.category().isBlank()
                ? request.category().trim()
                : MenuItem.DEFAULT_CATEGORY;
        BigDecimal price = request.price() == null ? BigDecimal.ZERO : request.price();

        MenuItem menuItem = menuItemRepository.save(new MenuItem(name, description, price, category, branchId));
        InventoryItem item = new InventoryItem(
                menuItem,
                branchId,
                orZero(request.quantity()),
                request.minQuantity() == null ? InventoryItem.DEFAULT_MIN_QUANTITY : request.minQuantity()
        );
        return InventoryItemResponse.from(inventoryItemRepository.save(item));
    }

    @Transactional
    public InventoryItemResponse update(Actor actor, Long inventoryItemId, UpdateInventoryRequest request) {
        accessGuard.authorizeResource(ProtectedOperation.INVENTORY_UPDATE, actor,
                () -> inventoryItemRepository.findBranchIdById(inventoryItemId).orElseThrow(() -> notFound(inventoryItemId)));

        InventoryItem item = inventoryItemRepository.findById(inventoryItemId).orElseThrow(() -> notFound(inventoryItemId));
        if (request.quantity() != null) {
            item.setQuantity(request.quantity());
        }
        if (request.minQuantity() != null) {
            item.setMinQuantity(request.minQuantity());
        }
        return InventoryItemResponse.from(item);
    }

    private List<InventoryItemResponse> findByBranch(Long branchId) {
        return inventoryItemRepository.findByBranchIdOrderByIdAsc(branchId).stream()
                .map(InventoryItemResponse::from)
                .toList();
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private static ProblemException notFound(Long id) {
        return ProblemException.notFound("inventory.not_found", "inventory item " + id + " not found");
    }
}
