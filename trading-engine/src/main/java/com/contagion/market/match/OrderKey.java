package com.contagion.market.match;

import java.math.BigDecimal;

// 订单的顺序由价格和 orderId 决定
public record OrderKey(long orderId, BigDecimal price) {
}
