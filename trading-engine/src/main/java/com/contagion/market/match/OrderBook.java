package com.contagion.market.match;

import com.contagion.market.enums.Direction;
import com.contagion.market.model.trade.Order;

import java.util.*;

/**
 * One side of the book. Entries are kept in price-time priority.
 * <p>
 * Orders are mutated in place by fills and cancellations, so an entry may
 * still reference an order that is no longer pending. Such tombstones are
 * discarded lazily when they reach the top of the book.
 */
public class OrderBook {
    public final Direction direction;
    public final TreeMap<OrderKey, Order> book;

    public OrderBook(Direction direction) {
        this.direction = direction;
        this.book = new TreeMap<>(this.direction == Direction.BUY ? SORT_BUY : SORT_SELL);
    }

    // 返回第一个有效订单，顶部已完成的订单直接丢弃
    public Order getFirst() {
        while(!book.isEmpty()) {
            Map.Entry<OrderKey, Order> first = book.firstEntry();
            if(first.getValue().isPending())
                return first.getValue();
            book.pollFirstEntry();
        }
        return null;
    }

    public boolean remove(Order order) {
        return this.book.remove(keyOf(order)) != null;
    }

    public boolean add(Order order) {
        if(order.price == null)
            throw new IllegalArgumentException("Resting order must have a price: " + order);
        return this.book.put(keyOf(order), order) == null;
    }

    public boolean exist(Order order) {
        return this.book.containsKey(keyOf(order));
    }

    // 包含尚未清理的已完成订单
    public int size() {
        return this.book.size();
    }

    public void clear() {
        this.book.clear();
    }

    // 删除超时订单，顺带清理已完成订单
    public List<Order> removeTimedOut(long currentTimestep) {
        List<Order> cancelled = new ArrayList<>();
        Iterator<Order> it = this.book.values().iterator();
        while(it.hasNext()) {
            Order order = it.next();
            if(order.checkTimeout(currentTimestep)) {
                it.remove();
                cancelled.add(order);
            } else if(!order.isPending()) {
                it.remove();
            }
        }
        return cancelled;
    }

    private static OrderKey keyOf(Order order) {
        return new OrderKey(order.orderId, order.price);
    }

    @Override
    public String toString() {
        if(this.book.isEmpty())
            return "(empty)";
        List<String> orders = new ArrayList<>(10);
        for(Map.Entry<OrderKey, Order> entry : this.book.entrySet()) {
            Order order = entry.getValue();
            orders.add(" " + order.price + " " + order.getQuantity() + " " + order);
        }
        if(direction == Direction.SELL)
            Collections.reverse(orders);
        return String.join("\n", orders);
    }

    // 定义买卖盘的订单排序规则
    private static final Comparator<OrderKey> SORT_SELL = new Comparator<OrderKey>() {
        @Override
        public int compare(OrderKey o1, OrderKey o2) {
            // 卖方价格低优先
            int cmp = o1.price().compareTo(o2.price());
            // 订单ID小在前
            return cmp == 0 ? Long.compare(o1.orderId(), o2.orderId()) : cmp;
        }
    };
    private static final Comparator<OrderKey> SORT_BUY = new Comparator<OrderKey>() {
        @Override
        public int compare(OrderKey o1, OrderKey o2) {
            // 买方价格高优先
            int cmp = o2.price().compareTo(o1.price());
            // 订单ID小在前
            return cmp == 0 ? Long.compare(o1.orderId(), o2.orderId()) : cmp;
        }
    };
}
