package com.contagion.market.strategy;

import com.contagion.market.bean.MarketSnapshot;
import com.contagion.market.bean.OrderRequest;

import java.util.Optional;

/**
 * Decision logic of a trading agent. Called by the market driver at most once
 * per step for an activated agent; an empty result means the agent stays out
 * of the market for that step.
 */
@FunctionalInterface
public interface TradingStrategy {

    Optional<OrderRequest> generateOrder(long timestep, MarketSnapshot snapshot);
}
