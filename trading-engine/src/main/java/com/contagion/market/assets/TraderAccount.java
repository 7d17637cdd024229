package com.contagion.market.assets;

import java.math.BigDecimal;

public class TraderAccount {
    public final long traderId;
    // 现金 / 持股数量
    BigDecimal cash;
    long stock;

    public TraderAccount(long traderId, BigDecimal cash, long stock) {
        this.traderId = traderId;
        this.cash = cash;
        this.stock = stock;
    }

    public BigDecimal getCash() {
        return cash;
    }

    public long getStock() {
        return stock;
    }

    @Override
    public String toString() {
        return "TraderAccount [traderId=" + traderId + ", cash=" + cash + ", stock=" + stock + ']';
    }
}
