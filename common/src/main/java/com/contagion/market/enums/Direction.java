package com.contagion.market.enums;

public enum Direction {
    // 买入：现金 -> 股票，卖出：股票 -> 现金
    BUY, SELL;

    // get negate direction
    public Direction negate() {
        return this == BUY ? SELL : BUY;
    }
}
