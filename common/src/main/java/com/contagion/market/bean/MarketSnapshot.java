package com.contagion.market.bean;

import jakarta.annotation.Nullable;

import java.math.BigDecimal;
import java.util.List;

public record MarketSnapshot(BigDecimal lastPrice, double fundamentalPrice, List<Double> logReturns,
                             @Nullable BigDecimal bestAsk, @Nullable BigDecimal bestBid) {

    public MarketSnapshot {
        logReturns = List.copyOf(logReturns);
    }
}
