package com.contagion.market;

public enum OrderError {
    DIRECTION_INVALID,

    ORDER_TYPE_INVALID,

    QUANTITY_INVALID,

    PRICE_INVALID,

    MAX_WAIT_TIME_INVALID
}
