package com.contagion.market.clearing;

import com.contagion.market.assets.AccountService;
import com.contagion.market.assets.TraderAccount;
import com.contagion.market.bean.TradeRecord;
import com.contagion.market.support.LoggerSupport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

@Component
public class ClearingService extends LoggerSupport {

    final AccountService accountService;

    public ClearingService(@Autowired AccountService accountService) {
        this.accountService = accountService;
    }

    // 返回实际完成交收的成交笔数
    public int clearTrades(List<TradeRecord> trades) {
        int cleared = 0;
        for(TradeRecord trade : trades) {
            TraderAccount buyer = accountService.getAccount(trade.buyerId());
            TraderAccount seller = accountService.getAccount(trade.sellerId());
            if(buyer == null || seller == null) {
                logger.warn("skip clearing trade without registered accounts: {}", trade);
                continue;
            }
            BigDecimal amount = trade.tradePrice().multiply(BigDecimal.valueOf(trade.tradeQty()));
            // 买方现金转入卖方账户
            accountService.transferCash(buyer, seller, amount);
            // 卖方股票转入买方账户
            accountService.transferStock(seller, buyer, trade.tradeQty());
            if(logger.isDebugEnabled()) {
                logger.debug("clear trade: price = {}, quantity = {}, buyer = {}, seller = {}",
                        trade.tradePrice(), trade.tradeQty(), buyer, seller);
            }
            cleared++;
        }
        return cleared;
    }
}
