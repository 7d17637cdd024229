package com.contagion.market.match;

import com.contagion.market.model.trade.Order;

import java.math.BigDecimal;

public record MatchDetailRecord(BigDecimal price, long quantity, Order takerOrder, Order makerOrder) {
}
