package trader.aggregator.model;

public enum SourceErrorType {
    SOURCE_TIMEOUT,
    SOURCE_RATE_LIMITED,
    INVALID_PRICE_DATA,
    SOURCE_FAILURE,
    FEED_DISCONNECTED
}
