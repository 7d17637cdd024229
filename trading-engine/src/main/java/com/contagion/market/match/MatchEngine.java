package com.contagion.market.match;

import com.contagion.market.bean.OrderBookSnapshot;
import com.contagion.market.bean.TradeRecord;
import com.contagion.market.enums.Direction;
import com.contagion.market.enums.OrderType;
import com.contagion.market.model.trade.Order;
import com.contagion.market.order.OrderSequence;
import com.contagion.market.support.LoggerSupport;
import jakarta.annotation.Nullable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single-instrument matching engine.
 * <p>
 * Limit orders are only rested, never matched on arrival: a limit order that
 * crosses the opposite side must be reclassified as a market order by the
 * caller before it is submitted. Market orders sweep the opposite side at the
 * resting orders' prices, within their optional price bound, and any unfilled
 * remainder is resubmitted as a limit order at that bound.
 * <p>
 * Not thread-safe. All calls are expected from one driver thread.
 */
@Component
public class MatchEngine extends LoggerSupport {
    public final OrderBook buyBook = new OrderBook(Direction.BUY);
    public final OrderBook sellBook = new OrderBook(Direction.SELL);

    final OrderSequence orderSequence;
    // 成交日志，只追加
    final List<TradeRecord> tradeLog = new ArrayList<>();

    public MatchEngine(@Autowired OrderSequence orderSequence) {
        this.orderSequence = orderSequence;
    }

    public MatchResult submitOrder(Order order) {
        if(!order.isPending())
            throw new IllegalArgumentException("Only pending order can be submitted: " + order);
        return switch (order.orderType) {
            case LIMIT -> submitLimitOrder(order);
            case MARKET -> matchMarketOrder(order);
        };
    }

    private MatchResult submitLimitOrder(Order order) {
        if(!bookOf(order.direction).add(order))
            throw new IllegalArgumentException("Duplicate order in order book: " + order);
        if(logger.isDebugEnabled())
            logger.debug("rest limit order {}", order);
        return new MatchResult(order);
    }

    private MatchResult matchMarketOrder(Order takerOrder) {
        OrderBook makerBook = bookOf(takerOrder.direction.negate());
        MatchResult matchResult = new MatchResult(takerOrder);
        if(makerBook.getFirst() == null) {
            // 没有对手盘，不做任何修改
            logger.info("no counter order for market order {}, skipped.", takerOrder.orderId);
            return matchResult;
        }
        long ts = takerOrder.timestep;
        long takerUnfilledQuantity = takerOrder.getQuantity();
        while(takerUnfilledQuantity > 0) {
            Order makerOrder = makerBook.getFirst();
            if(makerOrder == null)
                break; // 对手盘已空
            if(!takerOrder.acceptsPrice(makerOrder.price))
                break; // 第一档超出价格边界，maker 保留在订单簿
            // 以 Maker 价格成交，数量为两者较小值
            long matchedQuantity = Math.min(takerUnfilledQuantity, makerOrder.getQuantity());
            takerOrder.execute(makerOrder.price, ts, matchedQuantity);
            makerOrder.execute(makerOrder.price, ts, matchedQuantity);
            matchResult.add(makerOrder.price, matchedQuantity, makerOrder);
            this.tradeLog.add(toTradeRecord(takerOrder, makerOrder, matchedQuantity, ts));
            takerUnfilledQuantity -= matchedQuantity;
            if(!makerOrder.isPending())
                // 对手盘完全成交后，从订单簿删除
                makerBook.remove(makerOrder);
        }
        if(takerUnfilledQuantity > 0)
            convertRemainder(takerOrder, matchResult);
        if(logger.isDebugEnabled())
            logger.debug("market order {}: {}", takerOrder.orderId, matchResult);
        return matchResult;
    }

    // 市价单剩余部分按边界价格转为限价单挂单
    private void convertRemainder(Order takerOrder, MatchResult matchResult) {
        long remaining = takerOrder.getQuantity();
        takerOrder.cancel(takerOrder.timestep);
        if(takerOrder.price == null) {
            logger.info("market order {} has no price bound, unfilled {} discarded.",
                    takerOrder.orderId, remaining);
            return;
        }
        Order limitOrder = new Order(orderSequence.next(), takerOrder.traderId, takerOrder.direction,
                OrderType.LIMIT, remaining, takerOrder.timestep, takerOrder.price, takerOrder.maxWaitTime);
        submitOrder(limitOrder);
        matchResult.remainderOrder = limitOrder;
        logger.info("remaining {} of market order {} converted to limit order {} at price {}",
                remaining, takerOrder.orderId, limitOrder.orderId, limitOrder.price);
    }

    private OrderBook bookOf(Direction direction) {
        return direction == Direction.BUY ? this.buyBook : this.sellBook;
    }

    private static TradeRecord toTradeRecord(Order takerOrder, Order makerOrder, long quantity, long ts) {
        Order buy = takerOrder.direction == Direction.BUY ? takerOrder : makerOrder;
        Order sell = takerOrder.direction == Direction.BUY ? makerOrder : takerOrder;
        return new TradeRecord(buy.traderId, sell.traderId, buy.orderId, sell.orderId,
                makerOrder.price, quantity, ts);
    }

    @Nullable
    public BigDecimal bestBid() {
        Order first = this.buyBook.getFirst();
        return first == null ? null : first.price;
    }

    @Nullable
    public BigDecimal bestAsk() {
        Order first = this.sellBook.getFirst();
        return first == null ? null : first.price;
    }

    public OrderBookSnapshot snapshot() {
        BigDecimal bestBid = bestBid();
        BigDecimal bestAsk = bestAsk();
        return new OrderBookSnapshot(bestBid, bestAsk, this.buyBook.size(), this.sellBook.size());
    }

    // 每个时间步开始时由驱动调用
    public List<Order> cancelTimedOutOrders(long currentTimestep) {
        List<Order> cancelled = new ArrayList<>(this.buyBook.removeTimedOut(currentTimestep));
        cancelled.addAll(this.sellBook.removeTimedOut(currentTimestep));
        for(Order order : cancelled)
            logger.info("order {} has been cancelled due to timeout at timestep {}.",
                    order.orderId, currentTimestep);
        return cancelled;
    }

    public List<TradeRecord> getTradeLog() {
        return Collections.unmodifiableList(this.tradeLog);
    }

    public void reset() {
        this.buyBook.clear();
        this.sellBook.clear();
        this.tradeLog.clear();
    }
}
