package com.contagion.market.enums;

public enum OrderStatus {
    // 等待成交 (quantity > 0)
    PENDING(false),

    // 完全成交 (quantity <= 0)
    EXECUTED(true),

    // 超时或剩余部分转出后取消
    CANCELLED(true);

    // 订单是否处理完成
    public final boolean isFinalStatus;

    OrderStatus(boolean status) {
        this.isFinalStatus = status;
    }

    public boolean canTransitionTo(OrderStatus next) {
        return switch (this) {
            case PENDING -> next == EXECUTED || next == CANCELLED;
            case EXECUTED, CANCELLED -> false;
        };
    }

    public OrderStatus transitionTo(OrderStatus next) {
        if(!canTransitionTo(next))
            throw new IllegalStateException("Illegal order status transition: " + this + " -> " + next);
        return next;
    }
}
