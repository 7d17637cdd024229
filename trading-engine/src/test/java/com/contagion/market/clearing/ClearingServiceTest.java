package com.contagion.market.clearing;

import com.contagion.market.assets.AccountService;
import com.contagion.market.assets.TraderAccount;
import com.contagion.market.bean.TradeRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClearingServiceTest {
    static final long BUYER = 1L;
    static final long SELLER = 2L;

    AccountService accountService;
    ClearingService clearingService;

    @BeforeEach
    void setup() {
        accountService = new AccountService();
        clearingService = new ClearingService(accountService);
        accountService.openAccount(BUYER, bd("1000"), 0);
        accountService.openAccount(SELLER, bd("0"), 50);
    }

    @Test
    void clearTrade() {
        int cleared = clearingService.clearTrades(List.of(new TradeRecord(BUYER, SELLER, 11, 12, bd("10.5"), 10, 0)));
        assertEquals(1, cleared);
        TraderAccount buyer = accountService.getAccount(BUYER);
        TraderAccount seller = accountService.getAccount(SELLER);
        assertBDEquals("895.0", buyer.getCash());
        assertEquals(10, buyer.getStock());
        assertBDEquals("105.0", seller.getCash());
        assertEquals(40, seller.getStock());
        assertBDEquals("1000", accountService.totalCash());
    }

    @Test
    void balancesClampedAtZero() {
        clearingService.clearTrades(List.of(new TradeRecord(BUYER, SELLER, 11, 12, bd("30"), 60, 0)));
        TraderAccount buyer = accountService.getAccount(BUYER);
        TraderAccount seller = accountService.getAccount(SELLER);
        assertBDEquals("0", buyer.getCash());
        assertEquals(60, buyer.getStock());
        assertBDEquals("1800", seller.getCash());
        assertEquals(0, seller.getStock());
    }

    @Test
    void skipUnknownTrader() {
        int cleared = clearingService.clearTrades(List.of(
                new TradeRecord(BUYER, 99L, 11, 12, bd("10"), 1, 0),
                new TradeRecord(BUYER, SELLER, 13, 14, bd("10"), 1, 0)));
        assertEquals(1, cleared);
        assertEquals(1, accountService.getAccount(BUYER).getStock());
    }

    @Test
    void rejectDuplicateAccount() {
        assertThrows(IllegalArgumentException.class, () -> accountService.openAccount(BUYER, bd("1"), 1));
        assertThrows(IllegalArgumentException.class, () -> accountService.openAccount(3L, bd("-1"), 1));
    }

    void assertBDEquals(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    BigDecimal bd(String s) {
        return new BigDecimal(s);
    }
}
