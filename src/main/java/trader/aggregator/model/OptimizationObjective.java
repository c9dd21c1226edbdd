package trader.aggregator.model;

public enum OptimizationObjective {
    PRICE,
    GAS,
    SPEED,
    BALANCED
}
