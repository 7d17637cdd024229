package com.contagion.market;

/**
 * Raised synchronously when an order is constructed with terms that violate
 * its direction, quantity or price constraints.
 */
public class InvalidOrderException extends RuntimeException {

    public final OrderError error;
    public final String field;

    public InvalidOrderException(OrderError error, String field, String message) {
        super(message);
        this.error = error;
        this.field = field;
    }

    @Override
    public String toString() {
        return "InvalidOrderException [error=" + error + ", field=" + field + ", message=" + getMessage() + ']';
    }
}
