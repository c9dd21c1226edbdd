package trader.aggregator.model;

public enum RouteType {
    DIRECT,
    MULTI_HOP,
    ARBITRAGE
}
