package com.contagion.market.bean;

import com.contagion.market.enums.Direction;
import com.contagion.market.enums.OrderType;
import jakarta.annotation.Nullable;

import java.math.BigDecimal;

/**
 * Order terms proposed by a trading agent. The trader id, timestep and order id
 * are filled in when the request is turned into an order.
 */
public record OrderRequest(Direction direction, OrderType orderType, long quantity,
                           @Nullable BigDecimal price, long maxWaitTime) {

    public static OrderRequest limit(Direction direction, long quantity, BigDecimal price, long maxWaitTime) {
        return new OrderRequest(direction, OrderType.LIMIT, quantity, price, maxWaitTime);
    }

    public static OrderRequest market(Direction direction, long quantity, @Nullable BigDecimal bound,
                                      long maxWaitTime) {
        return new OrderRequest(direction, OrderType.MARKET, quantity, bound, maxWaitTime);
    }
}
