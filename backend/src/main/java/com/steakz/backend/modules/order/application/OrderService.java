package com.steakz.backend.modules.order.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.application.BranchAccessGuard;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.ProtectedOperation;
import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.inventory.infrastructure.persistence.InventoryItemRepository;
import com.steakz.backend.modules.menu.domain.MenuItem;
import com.steakz.backend.modules.menu.infrastructure.persistence.MenuItemRepository;
import com.steakz.backend.modules.order.domain.CustomerOrder;
import com.steakz.backend.modules.order.domain.OrderItem;
import com.steakz.backend.modules.order.domain.OrderStatus;
import com.steakz.backend.modules.order.infrastructure.persistence.CustomerOrderRepository;
import com.steakz.backend.modules.order.presentation.dto.CreateOrderRequest;
import com.steakz.backend.modules.order.presentation.dto.OrderLineRequest;
import com.steakz.backend.modules.order.presentation.dto.OrderResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final CustomerOrderRepository orderRepository;
    private final MenuItemRepository menuItemRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final BranchAccessGuard accessGuard;
    private final Clock clock;

    public OrderService(
            CustomerOrderRepository orderRepository,
            MenuItemRepository menuItemRepository,
            InventoryItemRepository inventoryItemRepository,
            BranchAccessGuard accessGuard,
            Clock clock
    ) {
        this.orderRepository = orderRepository;
        this.menuItemRepository = menuItemRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    /**
     * Places an order in the resolved branch. Prices come from the menu; stock for every line is
     * taken in the same transaction and a short line rolls back the whole order.
     */
    @Transactional
    public OrderResponse create(Actor actor, CreateOrderRequest request) {
        Long branchId = accessGuard.authorizeBranchScope(ProtectedOperation.ORDER_CREATE, actor, request.branchId());

        List<Long> menuItemIds = request.items().stream().map(OrderLineRequest::menuItemId).distinct().toList();
        Map<Long, MenuItem> menuItems = menuItemRepository.findAllById(menuItemIds).stream()
                .collect(Collectors.toMap(MenuItem::getId, Function.identity()));

        CustomerOrder order = new CustomerOrder(actor.id(), branchId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (OrderLineRequest line : request.items()) {
            MenuItem menuItem = menuItems.get(line.menuItemId());
            if (menuItem == null) {
                throw ProblemException.notFound("menu.item_not_found", "menu item " + line.menuItemId() + " not found");
            }
            if (!branchId.equals(menuItem.getBranchId())) {
                throw ProblemException.badRequest("orders.menu_item_other_branch",
                        "menu item " + menuItem.getId() + " is not served at branch " + branchId);
            }
            int taken = inventoryItemRepository.decrementIfAvailable(menuItem.getId(), branchId, line.quantity(), now);
            if (taken == 0) {
                throw ProblemException.conflict("orders.insufficient_inventory",
                        "insufficient inventory for menu item " + menuItem.getId());
            }
            order.addItem(new OrderItem(menuItem, line.quantity()));
        }

        CustomerOrder saved = orderRepository.save(order);
        log.info("Order {} placed in branch {} by user {}", saved.getId(), branchId, actor.id());
        return OrderResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<OrderResponse> list(Actor actor, String requestedBranchId) {
        Long branchId = accessGuard.authorizeBranchScope(ProtectedOperation.ORDER_LIST, actor, requestedBranchId);
        return findVisible(actor, branchId);
    }

    @Transactional(readOnly = true)
    public List<OrderResponse> listForBranch(Actor actor, String pathBranchId) {
        Long branchId = accessGuard.authorizeBranchPath(ProtectedOperation.ORDER_LIST, actor, pathBranchId);
        return findVisible(actor, branchId);
    }

    @Transactional
    public OrderResponse updateStatus(Actor actor, Long orderId, OrderStatus status) {
        accessGuard.authorizeResource(ProtectedOperation.ORDER_STATUS_UPDATE, actor,
                () -> orderRepository.findBranchIdById(orderId).orElseThrow(() -> notFound(orderId)));

        CustomerOrder order = orderRepository.findById(orderId).orElseThrow(() -> notFound(orderId));
        if (order.getStatus().isTerminal() && order.getStatus() != status) {
            throw ProblemException.conflict("orders.status_terminal",
                    "order " + orderId + " is already " + order.getStatus());
        }
        order.setStatus(status);
        return OrderResponse.from(order);
    }

    private List<OrderResponse> findVisible(Actor actor, Long branchId) {
        List<CustomerOrder> orders = actor.hasRole(Role.CUSTOMER)
                ? orderRepository.findByBranchIdAndUserIdOrderByCreatedAtDescIdDesc(branchId, actor.id())
                : orderRepository.findByBranchIdOrderByCreatedAtDescIdDesc(branchId);
        return orders.stream().map(OrderResponse::from).toList();
    }

    private static ProblemException notFound(Long orderId) {
        return ProblemException.notFound("orders.not_found", "order " + orderId + " not found");
    }
}
