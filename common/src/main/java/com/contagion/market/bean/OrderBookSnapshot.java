package com.contagion.market.bean;

import jakarta.annotation.Nullable;

import java.math.BigDecimal;

// depth 为买卖盘容器大小，可能包含尚未清理的已完成订单
public record OrderBookSnapshot(@Nullable BigDecimal bestBid, @Nullable BigDecimal bestAsk,
                                int buyDepth, int sellDepth) {
}
