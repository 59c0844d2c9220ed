package com.evenexus.exception;

/**
 * Raised by a market data provider when an order book cannot be retrieved
 * (network error, non-2xx response, undecodable body).
 *
 * <p>The order book fetcher absorbs this per item and degrades to an empty book,
 * so it only reaches API callers from single-item endpoints.
 */
public class MarketDataException extends BaseException {

    public MarketDataException(String message) {
        super(ErrorCode.MARKET_DATA_ERROR, message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(ErrorCode.MARKET_DATA_ERROR, message, cause);
    }
}
