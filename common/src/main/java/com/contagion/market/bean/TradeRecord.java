package com.contagion.market.bean;

import java.math.BigDecimal;

// 成交记录，写入后不可修改；buyerId / sellerId 为交易者ID
public record TradeRecord(long buyerId, long sellerId, long buyOrderId, long sellOrderId,
                          BigDecimal tradePrice, long tradeQty, long tradeTimestamp) {
}
