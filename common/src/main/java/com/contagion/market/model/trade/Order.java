package com.contagion.market.model.trade;

import com.contagion.market.InvalidOrderException;
import com.contagion.market.OrderError;
import com.contagion.market.enums.Direction;
import com.contagion.market.enums.OrderStatus;
import com.contagion.market.enums.OrderType;
import jakarta.annotation.Nullable;

import java.math.BigDecimal;

/**
 * An order submitted by a trader. The terms are fixed at construction; the
 * remaining quantity and status are mutated only by the matching engine through
 * {@link #execute}, {@link #checkTimeout} and {@link #cancel}.
 */
public class Order {
    // 订单ID，同时作为时间优先的排序依据
    public final long orderId;
    public final long traderId;

    public final Direction direction;
    public final OrderType orderType;

    // 限价单必填；市价单可选，作为扫单时的价格边界
    @Nullable
    public final BigDecimal price;

    public final long initialQuantity;
    // 提交时的时间步
    public final long timestep;
    public final long maxWaitTime;

    // 剩余数量
    private long quantity;
    private OrderStatus status = OrderStatus.PENDING;

    private BigDecimal executedPrice;
    private long executedTimestep = -1;
    private long cancelledTimestep = -1;

    public Order(long orderId, long traderId, Direction direction, OrderType orderType, long quantity,
                 long timestep, @Nullable BigDecimal price, long maxWaitTime) {
        if(direction == null)
            throw new InvalidOrderException(OrderError.DIRECTION_INVALID, "direction", "direction is required.");
        if(orderType == null)
            throw new InvalidOrderException(OrderError.ORDER_TYPE_INVALID, "orderType", "orderType is required.");
        if(quantity <= 0)
            throw new InvalidOrderException(OrderError.QUANTITY_INVALID, "quantity", "quantity must be positive.");
        if(orderType == OrderType.LIMIT && price == null)
            throw new InvalidOrderException(OrderError.PRICE_INVALID, "price", "price is required for limit order.");
        if(price != null && price.signum() <= 0)
            throw new InvalidOrderException(OrderError.PRICE_INVALID, "price", "price must be positive.");
        if(maxWaitTime < 0)
            throw new InvalidOrderException(OrderError.MAX_WAIT_TIME_INVALID, "maxWaitTime",
                    "maxWaitTime must not be negative.");
        this.orderId = orderId;
        this.traderId = traderId;
        this.direction = direction;
        this.orderType = orderType;
        this.quantity = this.initialQuantity = quantity;
        this.timestep = timestep;
        this.price = price;
        this.maxWaitTime = maxWaitTime;
    }

    // 同一订单ID与条款，仅改变订单类型；只允许对未成交的新订单使用
    public Order withOrderType(OrderType orderType) {
        if(this.status != OrderStatus.PENDING || this.quantity != this.initialQuantity)
            throw new IllegalStateException("Cannot reclassify a touched order: " + this);
        return new Order(orderId, traderId, direction, orderType, quantity, timestep, price, maxWaitTime);
    }

    public void execute(BigDecimal executedPrice, long executedTimestep, long fillQuantity) {
        if(this.status.isFinalStatus)
            throw new IllegalStateException("Cannot execute order in final status: " + this);
        if(fillQuantity <= 0 || fillQuantity > this.quantity)
            throw new IllegalArgumentException("Invalid fill quantity " + fillQuantity + " for order: " + this);
        this.executedPrice = executedPrice;
        this.executedTimestep = executedTimestep;
        this.quantity -= fillQuantity;
        // 没有剩余时才标记为完全成交
        if(this.quantity <= 0)
            this.status = this.status.transitionTo(OrderStatus.EXECUTED);
    }

    public boolean checkTimeout(long currentTimestep) {
        switch (this.status) {
            case CANCELLED -> {
                return true;
            }
            case EXECUTED -> {
                return false;
            }
            case PENDING -> {
                if(currentTimestep - this.timestep > this.maxWaitTime) {
                    cancel(currentTimestep);
                    return true;
                }
                return false;
            }
            default -> throw new IllegalStateException("Unexpected status: " + this.status);
        }
    }

    public void cancel(long currentTimestep) {
        this.status = this.status.transitionTo(OrderStatus.CANCELLED);
        this.cancelledTimestep = currentTimestep;
    }

    public boolean isExecutable(@Nullable BigDecimal bestBid, @Nullable BigDecimal bestAsk) {
        if(this.orderType == OrderType.MARKET)
            return true;
        return switch (this.direction) {
            case BUY -> bestAsk != null && this.price.compareTo(bestAsk) >= 0;
            case SELL -> bestBid != null && this.price.compareTo(bestBid) <= 0;
        };
    }

    // 对手盘价格是否在本单价格边界之内
    public boolean acceptsPrice(BigDecimal restingPrice) {
        if(this.price == null)
            return true;
        return switch (this.direction) {
            case BUY -> restingPrice.compareTo(this.price) <= 0;
            case SELL -> restingPrice.compareTo(this.price) >= 0;
        };
    }

    public boolean isPending() {
        return this.status == OrderStatus.PENDING && this.quantity > 0;
    }

    public long getQuantity() {
        return this.quantity;
    }

    public OrderStatus getStatus() {
        return this.status;
    }

    @Nullable
    public BigDecimal getExecutedPrice() {
        return this.executedPrice;
    }

    public long getExecutedTimestep() {
        return this.executedTimestep;
    }

    public long getCancelledTimestep() {
        return this.cancelledTimestep;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o)
            return true;
        if(o instanceof Order e) {
            return this.orderId == e.orderId;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(this.orderId);
    }

    @Override
    public String toString() {
        return "Order [" + "orderId=" + orderId +
                ", traderId=" + traderId + ", type=" + orderType +
                ", direction=" + direction + ", price=" + (price == null ? "MKT" : price.toPlainString()) +
                ", quantity=" + quantity + ", initialQuantity=" + initialQuantity +
                ", status=" + status + ", timestep=" + timestep +
                ", maxWaitTime=" + maxWaitTime + ']';
    }
}
