package com.contagion.market.config;

public enum ActivationMode {
    // 每步随机激活一个交易者
    SINGLE_AGENT_PER_STEP,

    // 每步按比例随机激活部分交易者
    PARTIAL_AGENTS_PER_STEP,

    // 每步按注册顺序激活全部交易者
    ALL_AGENTS_PER_STEP
}
