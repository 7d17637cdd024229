package com.contagion.market;

import com.contagion.market.assets.AccountService;
import com.contagion.market.bean.MarketSnapshot;
import com.contagion.market.bean.OrderRequest;
import com.contagion.market.bean.TradeRecord;
import com.contagion.market.clearing.ClearingService;
import com.contagion.market.config.ActivationMode;
import com.contagion.market.enums.OrderType;
import com.contagion.market.match.MatchEngine;
import com.contagion.market.model.trade.Order;
import com.contagion.market.order.OrderService;
import com.contagion.market.strategy.TradingStrategy;
import com.contagion.market.support.LoggerSupport;
import com.contagion.market.util.JsonUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

/**
 * Step-driven market driver. Each step reaps timed-out orders, moves the
 * fundamental price, lets the activated agents trade against the book and
 * settles the resulting trades.
 */
@Component
public class MarketSimulationService extends LoggerSupport {

    @Value("#{simulationConfiguration.maxTimesteps}")
    int maxTimesteps = 20;
    @Value("#{simulationConfiguration.mode}")
    ActivationMode mode = ActivationMode.ALL_AGENTS_PER_STEP;
    @Value("#{simulationConfiguration.activationRatio}")
    double activationRatio = 0.1;
    @Value("#{simulationConfiguration.fundamentalDrift}")
    double fundamentalDrift = 0.0001;
    @Value("#{simulationConfiguration.fundamentalVolatility}")
    double fundamentalVolatility = 0.001;

    @Autowired
    MatchEngine matchEngine;
    @Autowired
    OrderService orderService;
    @Autowired
    AccountService accountService;
    @Autowired
    ClearingService clearingService;

    double fundamentalPrice;
    Random random;

    long currentTime = 0;
    // 注册顺序即 ALL_AGENTS_PER_STEP 模式下的激活顺序
    final Map<Long, TradingStrategy> traders = new LinkedHashMap<>();
    final List<BigDecimal> priceHistory = new ArrayList<>();
    final List<Double> logReturns = new ArrayList<>();
    final List<Double> fundamentalPriceHistory = new ArrayList<>();

    public MarketSimulationService(
            @Value("#{simulationConfiguration.fundamentalPrice}") double fundamentalPrice,
            @Value("#{simulationConfiguration.seed}") long seed) {
        this.fundamentalPrice = fundamentalPrice;
        this.fundamentalPriceHistory.add(fundamentalPrice);
        this.random = new Random(seed);
    }

    public void registerTrader(long traderId, TradingStrategy strategy, BigDecimal initialCash, long initialStock) {
        if(this.traders.containsKey(traderId))
            throw new IllegalArgumentException("Trader already registered: " + traderId);
        this.accountService.openAccount(traderId, initialCash, initialStock);
        this.traders.put(traderId, strategy);
    }

    public void run() {
        logger.info("start simulation with {} traders for {} timesteps...", traders.size(), maxTimesteps);
        for(int i = 0; i < this.maxTimesteps; i++)
            step();
        logger.info("simulation finished at timestep {}, {} trades, last price {}",
                currentTime, matchEngine.getTradeLog().size(), lastPrice());
    }

    public void step() {
        this.matchEngine.cancelTimedOutOrders(this.currentTime);
        if(logger.isDebugEnabled())
            logger.debug("timestep {}: {}", currentTime, matchEngine.snapshot());
        // 基础价格服从带漂移的几何布朗运动
        double z = this.random.nextGaussian();
        double sigma = this.fundamentalVolatility;
        this.fundamentalPrice *= Math.exp((this.fundamentalDrift - 0.5 * sigma * sigma) + sigma * z);
        this.fundamentalPriceHistory.add(this.fundamentalPrice);

        if(!this.traders.isEmpty()) {
            for(Long traderId : selectTraders())
                processTrader(traderId, this.traders.get(traderId));
        }
        updatePriceHistory();
        this.currentTime++;
    }

    List<Long> selectTraders() {
        List<Long> ids = new ArrayList<>(this.traders.keySet());
        return switch (this.mode) {
            case SINGLE_AGENT_PER_STEP -> List.of(ids.get(this.random.nextInt(ids.size())));
            case PARTIAL_AGENTS_PER_STEP -> {
                int n = Math.max(1, (int) (ids.size() * this.activationRatio));
                Collections.shuffle(ids, this.random);
                yield ids.subList(0, Math.min(n, ids.size()));
            }
            case ALL_AGENTS_PER_STEP -> ids;
        };
    }

    private void processTrader(long traderId, TradingStrategy strategy) {
        MarketSnapshot snapshot = buildMarketSnapshot();
        Optional<OrderRequest> request;
        try {
            request = strategy.generateOrder(this.currentTime, snapshot);
        } catch (RuntimeException e) {
            // 策略异常不能影响撮合
            logger.warn("strategy of trader {} failed at timestep {}, no order.", traderId, currentTime, e);
            return;
        }
        if(request == null || request.isEmpty()) {
            if(logger.isDebugEnabled())
                logger.debug("trader {} chose not to trade.", traderId);
            return;
        }
        Order order;
        try {
            order = this.orderService.createOrder(traderId, this.currentTime, request.get());
        } catch (InvalidOrderException e) {
            logger.warn("trader {} sent invalid order request {}: {}", traderId, request.get(), e.getMessage());
            return;
        }
        submit(order);
    }

    // 撮合引擎不会主动撮合限价单，穿价的限价单需转为市价单后提交
    public Order submit(Order order) {
        Order classified = reclassify(order);
        int before = this.matchEngine.getTradeLog().size();
        this.matchEngine.submitOrder(classified);
        List<TradeRecord> tradeLog = this.matchEngine.getTradeLog();
        if(tradeLog.size() > before)
            this.clearingService.clearTrades(tradeLog.subList(before, tradeLog.size()));
        return classified;
    }

    Order reclassify(Order order) {
        if(order.orderType == OrderType.LIMIT
                && order.isExecutable(this.matchEngine.bestBid(), this.matchEngine.bestAsk())) {
            if(logger.isDebugEnabled())
                logger.debug("limit order {} crosses the book, submit as market order.", order.orderId);
            return order.withOrderType(OrderType.MARKET);
        }
        return order;
    }

    private void updatePriceHistory() {
        List<TradeRecord> tradeLog = this.matchEngine.getTradeLog();
        if(tradeLog.isEmpty())
            return;
        this.priceHistory.add(tradeLog.get(tradeLog.size() - 1).tradePrice());
        int n = this.priceHistory.size();
        if(n >= 2) {
            double r = Math.log(this.priceHistory.get(n - 1).doubleValue() / this.priceHistory.get(n - 2).doubleValue());
            this.logReturns.add(r);
        }
    }

    public MarketSnapshot buildMarketSnapshot() {
        BigDecimal bestBid = this.matchEngine.bestBid();
        BigDecimal bestAsk = this.matchEngine.bestAsk();
        return new MarketSnapshot(lastPrice(), this.fundamentalPrice, this.logReturns, bestAsk, bestBid);
    }

    // 最新成交价；无成交时取买卖中间价，再退回基础价格
    BigDecimal lastPrice() {
        if(!this.priceHistory.isEmpty())
            return this.priceHistory.get(this.priceHistory.size() - 1);
        BigDecimal bestBid = this.matchEngine.bestBid();
        BigDecimal bestAsk = this.matchEngine.bestAsk();
        if(bestBid != null && bestAsk != null)
            return bestBid.add(bestAsk).divide(BigDecimal.valueOf(2),
                    Math.max(bestBid.scale(), bestAsk.scale()) + 1, RoundingMode.HALF_EVEN);
        return BigDecimal.valueOf(this.fundamentalPrice);
    }

    public String exportTradeLog() {
        return JsonUtil.writeJson(this.matchEngine.getTradeLog());
    }

    public long getCurrentTime() {
        return currentTime;
    }

    public double getFundamentalPrice() {
        return fundamentalPrice;
    }

    public List<BigDecimal> getPriceHistory() {
        return Collections.unmodifiableList(priceHistory);
    }

    public List<Double> getLogReturns() {
        return Collections.unmodifiableList(logReturns);
    }

    public List<Double> getFundamentalPriceHistory() {
        return Collections.unmodifiableList(fundamentalPriceHistory);
    }
}
