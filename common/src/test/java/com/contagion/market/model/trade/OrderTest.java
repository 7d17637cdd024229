package com.contagion.market.model.trade;

import com.contagion.market.InvalidOrderException;
import com.contagion.market.OrderError;
import com.contagion.market.enums.Direction;
import com.contagion.market.enums.OrderStatus;
import com.contagion.market.enums.OrderType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class OrderTest {
    static final long TRADER = 7L;

    @Test
    void rejectInvalidTerms() {
        assertError(OrderError.DIRECTION_INVALID,
                () -> new Order(1, TRADER, null, OrderType.LIMIT, 10, 0, bd("10.1"), 5));
        assertError(OrderError.ORDER_TYPE_INVALID,
                () -> new Order(1, TRADER, Direction.BUY, null, 10, 0, bd("10.1"), 5));
        assertError(OrderError.QUANTITY_INVALID,
                () -> new Order(1, TRADER, Direction.BUY, OrderType.LIMIT, 0, 0, bd("10.1"), 5));
        assertError(OrderError.QUANTITY_INVALID,
                () -> new Order(1, TRADER, Direction.SELL, OrderType.MARKET, -3, 0, null, 5));
        assertError(OrderError.PRICE_INVALID,
                () -> new Order(1, TRADER, Direction.BUY, OrderType.LIMIT, 10, 0, null, 5));
        assertError(OrderError.PRICE_INVALID,
                () -> new Order(1, TRADER, Direction.SELL, OrderType.LIMIT, 10, 0, bd("0"), 5));
        assertError(OrderError.PRICE_INVALID,
                () -> new Order(1, TRADER, Direction.SELL, OrderType.MARKET, 10, 0, bd("-1.5"), 5));
        assertError(OrderError.MAX_WAIT_TIME_INVALID,
                () -> new Order(1, TRADER, Direction.SELL, OrderType.LIMIT, 10, 0, bd("10.1"), -1));
    }

    @Test
    void marketOrderWithoutBound() {
        Order order = new Order(1, TRADER, Direction.BUY, OrderType.MARKET, 10, 0, null, 5);
        assertNull(order.price);
        assertTrue(order.acceptsPrice(bd("99999")));
        assertTrue(order.isExecutable(null, null));
    }

    @Test
    void partialThenFullExecution() {
        Order order = limit(Direction.BUY, 500, "10.1");
        order.execute(bd("10.1"), 1, 200);
        assertEquals(300, order.getQuantity());
        assertEquals(OrderStatus.PENDING, order.getStatus());
        assertTrue(order.isPending());

        order.execute(bd("10.0"), 2, 300);
        assertEquals(0, order.getQuantity());
        assertEquals(500, order.initialQuantity);
        assertEquals(OrderStatus.EXECUTED, order.getStatus());
        assertEquals(bd("10.0"), order.getExecutedPrice());
        assertEquals(2, order.getExecutedTimestep());
        assertFalse(order.isPending());

        assertThrows(IllegalStateException.class, () -> order.execute(bd("10.0"), 3, 1));
    }

    @Test
    void rejectOverfill() {
        Order order = limit(Direction.SELL, 10, "10.1");
        assertThrows(IllegalArgumentException.class, () -> order.execute(bd("10.1"), 1, 11));
        assertThrows(IllegalArgumentException.class, () -> order.execute(bd("10.1"), 1, 0));
        assertEquals(10, order.getQuantity());
    }

    @Test
    void checkTimeout() {
        Order order = new Order(1, TRADER, Direction.BUY, OrderType.LIMIT, 10, 3, bd("10.1"), 2);
        assertFalse(order.checkTimeout(4));
        // 等于最大等待时间时不超时
        assertFalse(order.checkTimeout(5));
        assertEquals(OrderStatus.PENDING, order.getStatus());

        assertTrue(order.checkTimeout(6));
        assertEquals(OrderStatus.CANCELLED, order.getStatus());
        assertEquals(6, order.getCancelledTimestep());

        // 重复调用仍返回 true，且不改变取消时间
        assertTrue(order.checkTimeout(9));
        assertEquals(6, order.getCancelledTimestep());
        assertEquals(10, order.getQuantity());
    }

    @Test
    void executedOrderNeverTimesOut() {
        Order order = new Order(1, TRADER, Direction.SELL, OrderType.LIMIT, 10, 0, bd("10.1"), 0);
        order.execute(bd("10.1"), 0, 10);
        assertFalse(order.checkTimeout(100));
        assertEquals(OrderStatus.EXECUTED, order.getStatus());
    }

    @Test
    void isExecutable() {
        Order buy = limit(Direction.BUY, 10, "10.1");
        assertTrue(buy.isExecutable(null, bd("10.1")));
        assertTrue(buy.isExecutable(null, bd("10.0")));
        assertFalse(buy.isExecutable(bd("10.5"), bd("10.2")));
        assertFalse(buy.isExecutable(bd("10.5"), null));

        Order sell = limit(Direction.SELL, 10, "10.1");
        assertTrue(sell.isExecutable(bd("10.1"), null));
        assertTrue(sell.isExecutable(bd("10.3"), bd("9.0")));
        assertFalse(sell.isExecutable(bd("10.0"), bd("9.0")));
        assertFalse(sell.isExecutable(null, bd("9.0")));

        Order market = new Order(2, TRADER, Direction.SELL, OrderType.MARKET, 10, 0, bd("10.1"), 5);
        assertTrue(market.isExecutable(null, null));
    }

    @Test
    void acceptsPrice() {
        Order buy = new Order(1, TRADER, Direction.BUY, OrderType.MARKET, 10, 0, bd("10.2"), 5);
        assertTrue(buy.acceptsPrice(bd("10.2")));
        assertTrue(buy.acceptsPrice(bd("10.10")));
        assertFalse(buy.acceptsPrice(bd("10.21")));

        Order sell = new Order(2, TRADER, Direction.SELL, OrderType.MARKET, 10, 0, bd("10.0"), 5);
        assertTrue(sell.acceptsPrice(bd("10.0")));
        assertTrue(sell.acceptsPrice(bd("10.1")));
        assertFalse(sell.acceptsPrice(bd("9.99")));
    }

    @Test
    void reclassifyKeepsIdentityAndTerms() {
        Order order = limit(Direction.BUY, 10, "10.1");
        Order market = order.withOrderType(OrderType.MARKET);
        assertEquals(order.orderId, market.orderId);
        assertEquals(order, market);
        assertEquals(OrderType.MARKET, market.orderType);
        assertEquals(order.price, market.price);
        assertEquals(order.maxWaitTime, market.maxWaitTime);

        order.execute(bd("10.1"), 0, 1);
        assertThrows(IllegalStateException.class, () -> order.withOrderType(OrderType.MARKET));
    }

    @Test
    void statusTransitions() {
        assertTrue(OrderStatus.PENDING.canTransitionTo(OrderStatus.EXECUTED));
        assertTrue(OrderStatus.PENDING.canTransitionTo(OrderStatus.CANCELLED));
        assertFalse(OrderStatus.PENDING.canTransitionTo(OrderStatus.PENDING));
        for(OrderStatus next : OrderStatus.values()) {
            assertFalse(OrderStatus.EXECUTED.canTransitionTo(next));
            assertFalse(OrderStatus.CANCELLED.canTransitionTo(next));
        }
        assertThrows(IllegalStateException.class, () -> OrderStatus.EXECUTED.transitionTo(OrderStatus.CANCELLED));

        Order order = limit(Direction.SELL, 10, "10.1");
        order.cancel(1);
        assertThrows(IllegalStateException.class, () -> order.cancel(2));
        assertThrows(IllegalStateException.class, () -> order.execute(bd("10.1"), 2, 1));
    }

    Order limit(Direction direction, long quantity, String price) {
        return new Order(1, TRADER, direction, OrderType.LIMIT, quantity, 0, bd(price), 10);
    }

    void assertError(OrderError expected, Runnable constructor) {
        InvalidOrderException e = assertThrows(InvalidOrderException.class, constructor::run);
        assertEquals(expected, e.error);
    }

    BigDecimal bd(String s) {
        return new BigDecimal(s);
    }
}
