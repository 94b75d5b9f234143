package com.steakz.backend.modules.order.application;

import static com.steakz.backend.support.AccessFixtures.ADMIN;
import static com.steakz.backend.support.AccessFixtures.BRANCH_1;
import static com.steakz.backend.support.AccessFixtures.BRANCH_2;
import static com.steakz.backend.support.AccessFixtures.CUSTOMER_B1;
import static com.steakz.backend.support.AccessFixtures.FRONT_B1;
import static com.steakz.backend.support.AccessFixtures.KITCHEN_B1;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.application.AccessDeniedProblem;
import com.steakz.backend.modules.access.domain.AccessOutcome;
import com.steakz.backend.modules.inventory.infrastructure.persistence.InventoryItemRepository;
import com.steakz.backend.modules.menu.domain.MenuItem;
import com.steakz.backend.modules.menu.infrastructure.persistence.MenuItemRepository;
import com.steakz.backend.modules.order.domain.CustomerOrder;
import com.steakz.backend.modules.order.domain.OrderStatus;
import com.steakz.backend.modules.order.infrastructure.persistence.CustomerOrderRepository;
import com.steakz.backend.modules.order.presentation.dto.CreateOrderRequest;
import com.steakz.backend.modules.order.presentation.dto.OrderLineRequest;
import com.steakz.backend.modules.order.presentation.dto.OrderResponse;
import com.steakz.backend.support.AccessFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class OrderServiceTest {

    private static final Instant NOW = Instant.parse("2025-05-01T18:30:00Z");

    @Mock
    private CustomerOrderRepository orderRepository;

    @Mock
    private MenuItemRepository menuItemRepository;

    @Mock
    private InventoryItemRepository inventoryItemRepository;

    private OrderService orderService;

    @BeforeEach
    void setUp() {
        orderService = new OrderService(
                orderRepository,
                menuItemRepository,
                inventoryItemRepository,
                AccessFixtures.guard(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    @DisplayName("front staff order lands in the home branch even when another branch is requested")
    void frontStaffOrderPinnedToHomeBranch() {
        MenuItem ribeye = menuItem(11L, "Ribeye", "32.50", BRANCH_1);
        when(menuItemRepository.findAllById(List.of(11L))).thenReturn(List.of(ribeye));
        when(inventoryItemRepository.decrementIfAvailable(eq(11L), eq(BRANCH_1), eq(2), any(OffsetDateTime.class)))
                .thenReturn(1);
        when(orderRepository.save(any(CustomerOrder.class))).thenAnswer(invocation -> invocation.getArgument(0));

        OrderResponse response = orderService.create(FRONT_B1,
                new CreateOrderRequest("2", List.of(new OrderLineRequest(11L, 2))));

        assertThat(response.branchId()).isEqualTo(BRANCH_1);
        assertThat(response.userId()).isEqualTo(FRONT_B1.id());
        assertThat(response.status()).isEqualTo("PENDING");
        assertThat(response.total()).isEqualByComparingTo("65.00");
        assertThat(response.items()).singleElement().satisfies(line -> {
            assertThat(line.menuItemId()).isEqualTo(11L);
            assertThat(line.price()).isEqualByComparingTo("32.50");
        });
    }

    @Test
    void adminOrderUsesRequestedBranch() {
        MenuItem sirloin = menuItem(21L, "Sirloin", "28.00", BRANCH_2);
        when(menuItemRepository.findAllById(List.of(21L))).thenReturn(List.of(sirloin));
        when(inventoryItemRepository.decrementIfAvailable(eq(21L), eq(BRANCH_2), eq(1), any(OffsetDateTime.class)))
                .thenReturn(1);
        when(orderRepository.save(any(CustomerOrder.class))).thenAnswer(invocation -> invocation.getArgument(0));

        OrderResponse response = orderService.create(ADMIN,
                new CreateOrderRequest("2", List.of(new OrderLineRequest(21L, 1))));

        assertThat(response.branchId()).isEqualTo(BRANCH_2);
    }

    @Test
    void shortStockRejectsOrder() {
        MenuItem ribeye = menuItem(11L, "Ribeye", "32.50", BRANCH_1);
        when(menuItemRepository.findAllById(List.of(11L))).thenReturn(List.of(ribeye));
        when(inventoryItemRepository.decrementIfAvailable(eq(11L), eq(BRANCH_1), eq(5), any(OffsetDateTime.class)))
                .thenReturn(0);

        assertThatThrownBy(() -> orderService.create(CUSTOMER_B1,
                new CreateOrderRequest(null, List.of(new OrderLineRequest(11L, 5)))))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("orders.insufficient_inventory");
        verify(orderRepository, never()).save(any());
    }

    @Test
    void menuItemFromAnotherBranchIsRejected() {
        MenuItem foreign = menuItem(31L, "Paella", "19.00", BRANCH_2);
        when(menuItemRepository.findAllById(List.of(31L))).thenReturn(List.of(foreign));

        assertThatThrownBy(() -> orderService.create(CUSTOMER_B1,
                new CreateOrderRequest(null, List.of(new OrderLineRequest(31L, 1)))))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("orders.menu_item_other_branch");
    }

    @Test
    void customerSeesOnlyOwnOrders() {
        when(orderRepository.findByBranchIdAndUserIdOrderByCreatedAtDescIdDesc(BRANCH_1, CUSTOMER_B1.id()))
                .thenReturn(List.of(new CustomerOrder(CUSTOMER_B1.id(), BRANCH_1)));

        assertThat(orderService.list(CUSTOMER_B1, null)).hasSize(1);
        verify(orderRepository, never()).findByBranchIdOrderByCreatedAtDescIdDesc(anyLong());
    }

    @Test
    void kitchenStaffSeesBranchQueue() {
        when(orderRepository.findByBranchIdOrderByCreatedAtDescIdDesc(BRANCH_1))
                .thenReturn(List.of(new CustomerOrder(7L, BRANCH_1), new CustomerOrder(8L, BRANCH_1)));

        assertThat(orderService.listForBranch(KITCHEN_B1, "1")).hasSize(2);
    }

    @Test
    void kitchenStaffCannotReadAnotherBranchQueue() {
        assertThatThrownBy(() -> orderService.listForBranch(KITCHEN_B1, "2"))
                .isInstanceOf(AccessDeniedProblem.class)
                .extracting(ex -> ((AccessDeniedProblem) ex).getOutcome())
                .isEqualTo(AccessOutcome.FORBIDDEN_BRANCH);
    }

    @Test
    void kitchenStaffAdvancesOrderInOwnBranch() {
        CustomerOrder order = new CustomerOrder(7L, BRANCH_1);
        when(orderRepository.findBranchIdById(5L)).thenReturn(Optional.of(BRANCH_1));
        when(orderRepository.findById(5L)).thenReturn(Optional.of(order));

        OrderResponse response = orderService.updateStatus(KITCHEN_B1, 5L, OrderStatus.PREPARING);

        assertThat(response.status()).isEqualTo("PREPARING");
    }

    @Test
    void frontStaffCannotChangeOrderStatus() {
        assertThatThrownBy(() -> orderService.updateStatus(FRONT_B1, 5L, OrderStatus.PREPARING))
                .isInstanceOf(AccessDeniedProblem.class)
                .extracting(ex -> ((AccessDeniedProblem) ex).getOutcome())
                .isEqualTo(AccessOutcome.FORBIDDEN_ROLE);
        verify(orderRepository, never()).findBranchIdById(anyLong());
    }

    @Test
    void terminalOrderCannotChange() {
        CustomerOrder order = new CustomerOrder(7L, BRANCH_1);
        order.setStatus(OrderStatus.COMPLETED);
        when(orderRepository.findBranchIdById(5L)).thenReturn(Optional.of(BRANCH_1));
        when(orderRepository.findById(5L)).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.updateStatus(ADMIN, 5L, OrderStatus.PENDING))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("orders.status_terminal");
    }

    @Test
    void unknownOrderIsNotFound() {
        when(orderRepository.findBranchIdById(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orderService.updateStatus(ADMIN, 404L, OrderStatus.CANCELLED))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("orders.not_found");
    }

    private static MenuItem menuItem(Long id, String name, String price, Long branchId) {
        MenuItem item = new MenuItem(name, name, new BigDecimal(price), "Steaks", branchId);
        ReflectionTestUtils.setField(item, "id", id);
        return item;
    }
}
