package com.contagion.market.order;

import org.springframework.stereotype.Component;

// 单个撮合引擎内单调递增的订单ID，不同引擎实例互不共享
@Component
public class OrderSequence {
    private long lastOrderId;

    public OrderSequence() {
        this(0);
    }

    public OrderSequence(long lastOrderId) {
        this.lastOrderId = lastOrderId;
    }

    public long next() {
        return ++this.lastOrderId;
    }
}
