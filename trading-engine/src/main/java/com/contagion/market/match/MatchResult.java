package com.contagion.market.match;

import com.contagion.market.model.trade.Order;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public class MatchResult {
    public final Order takerOrder;
    public final List<MatchDetailRecord> matchDetails = new ArrayList<>();
    // 市价单未成交部分转成的限价单
    public Order remainderOrder;

    public MatchResult(Order takerOrder) {
        this.takerOrder = takerOrder;
    }

    public void add(BigDecimal price, long matchedQuantity, Order makerOrder) {
        this.matchDetails.add(new MatchDetailRecord(price, matchedQuantity, this.takerOrder, makerOrder));
    }

    public long matchedQuantity() {
        long total = 0;
        for(MatchDetailRecord detail : matchDetails)
            total += detail.quantity();
        return total;
    }

    @Override
    public String toString() {
        if(matchDetails.isEmpty())
            return "No matched.";
        return matchDetails.size() + " matched: " +
                String.join(", ", matchDetails.stream()
                        .map(MatchDetailRecord::toString)
                        .toArray(String[]::new));
    }
}
