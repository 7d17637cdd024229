package com.contagion.market.enums;

public enum OrderType {
    // 市价单：扫对手盘，可带价格边界
    MARKET,

    // 限价单：直接挂单，不主动撮合
    LIMIT
}
