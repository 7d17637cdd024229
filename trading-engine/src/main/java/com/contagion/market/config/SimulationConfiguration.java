package com.contagion.market.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "simulation")
public class SimulationConfiguration {

    private int maxTimesteps = 20;

    private ActivationMode mode = ActivationMode.ALL_AGENTS_PER_STEP;

    private double activationRatio = 0.1;

    private double fundamentalPrice = 300.0;

    private double fundamentalDrift = 0.0001;

    private double fundamentalVolatility = 0.001;

    private long seed = 42L;

    public int getMaxTimesteps() {
        return maxTimesteps;
    }

    public void setMaxTimesteps(int maxTimesteps) {
        this.maxTimesteps = maxTimesteps;
    }

    public ActivationMode getMode() {
        return mode;
    }

    public void setMode(ActivationMode mode) {
        this.mode = mode;
    }

    public double getActivationRatio() {
        return activationRatio;
    }

    public void setActivationRatio(double activationRatio) {
        this.activationRatio = activationRatio;
    }

    public double getFundamentalPrice() {
        return fundamentalPrice;
    }

    public void setFundamentalPrice(double fundamentalPrice) {
        this.fundamentalPrice = fundamentalPrice;
    }

    public double getFundamentalDrift() {
        return fundamentalDrift;
    }

    public void setFundamentalDrift(double fundamentalDrift) {
        this.fundamentalDrift = fundamentalDrift;
    }

    public double getFundamentalVolatility() {
        return fundamentalVolatility;
    }

    public void setFundamentalVolatility(double fundamentalVolatility) {
        this.fundamentalVolatility = fundamentalVolatility;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }
}
