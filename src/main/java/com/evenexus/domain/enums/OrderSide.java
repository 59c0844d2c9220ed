package com.evenexus.domain.enums;

/**
 * Side of the order book. BUY orders are standing bids (sell into them for revenue),
 * SELL orders are standing asks (buy from them at a cost).
 */
public enum OrderSide {
    BUY,
    SELL;

    public boolean matches(boolean buyOrder) {
        return (this == BUY) == buyOrder;
    }
}
