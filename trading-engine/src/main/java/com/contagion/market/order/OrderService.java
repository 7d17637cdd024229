package com.contagion.market.order;

import com.contagion.market.bean.OrderRequest;
import com.contagion.market.enums.Direction;
import com.contagion.market.enums.OrderType;
import com.contagion.market.model.trade.Order;
import jakarta.annotation.Nullable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class OrderService {
    final OrderSequence orderSequence;

    public OrderService(@Autowired OrderSequence orderSequence) {
        this.orderSequence = orderSequence;
    }

    // 创建订单，条款非法时抛出 InvalidOrderException
    public Order createOrder(long traderId, Direction direction, OrderType orderType, long quantity,
                             long timestep, @Nullable BigDecimal price, long maxWaitTime) {
        return new Order(orderSequence.next(), traderId, direction, orderType, quantity, timestep, price,
                maxWaitTime);
    }

    public Order createOrder(long traderId, long timestep, OrderRequest request) {
        return createOrder(traderId, request.direction(), request.orderType(), request.quantity(), timestep,
                request.price(), request.maxWaitTime());
    }

    public Order createLimitOrder(long traderId, Direction direction, long quantity, long timestep,
                                  BigDecimal price, long maxWaitTime) {
        return createOrder(traderId, direction, OrderType.LIMIT, quantity, timestep, price, maxWaitTime);
    }

    public Order createMarketOrder(long traderId, Direction direction, long quantity, long timestep,
                                   @Nullable BigDecimal bound, long maxWaitTime) {
        return createOrder(traderId, direction, OrderType.MARKET, quantity, timestep, bound, maxWaitTime);
    }
}
