package com.contagion.market.assets;

import com.contagion.market.support.LoggerSupport;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Component
public class AccountService extends LoggerSupport {
    // TraderId -> TraderAccount
    final ConcurrentMap<Long, TraderAccount> accounts = new ConcurrentHashMap<>();

    public TraderAccount openAccount(long traderId, BigDecimal cash, long stock) {
        if(cash.signum() < 0 || stock < 0)
            throw new IllegalArgumentException("Negative initial balance for trader " + traderId);
        TraderAccount account = new TraderAccount(traderId, cash, stock);
        if(this.accounts.putIfAbsent(traderId, account) != null)
            throw new IllegalArgumentException("Account already exists for trader " + traderId);
        if(logger.isDebugEnabled())
            logger.debug("open account {}", account);
        return account;
    }

    // 不存在返回 null
    public TraderAccount getAccount(long traderId) {
        return this.accounts.get(traderId);
    }

    // 余额不足时截断为0
    public void transferCash(TraderAccount from, TraderAccount to, BigDecimal amount) {
        from.cash = from.cash.subtract(amount).max(BigDecimal.ZERO);
        to.cash = to.cash.add(amount);
    }

    public void transferStock(TraderAccount from, TraderAccount to, long quantity) {
        from.stock = Math.max(from.stock - quantity, 0);
        to.stock += quantity;
    }

    public BigDecimal totalCash() {
        return this.accounts.values().stream()
                .map(TraderAccount::getCash)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
