package trader.aggregator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import trader.aggregator.model.OptimizationObjective;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {
    private OptimizationObjective objective = OptimizationObjective.BALANCED;
    private int maxHops = 3;
    private int maxRoutes = 10;
    private BigDecimal minLiquidityUsd = BigDecimal.valueOf(10000);
    /** Restrict intermediate hops of multi-hop routes to the stablecoin set. */
    private boolean stablecoinRouting = false;
    private Set<String> stablecoins = new LinkedHashSet<>(List.of(
            "USDC", "USDT", "DAI", "BUSD", "FRAX",
            "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48",
            "0xdAC17F958D2ee523a2206206994597C13D831ec7",
            "0x6B175474E89094C44Da98b954EedeAC495271d0F"));
    private long routeCacheTtl = 30000;
    private int historySize = 100;
    private BigDecimal largeOrderThreshold = BigDecimal.valueOf(100000);
    private BigDecimal maxSplitSize = BigDecimal.valueOf(50000);
    private int splitTimePenalty = 5;
    private double splitRiskReduction = 10;
    private double minArbitrageProfit = 0.01;
    private double serviceFeeRate = 0.0033;
    private long gasCeiling = 500000;
    private int speedCeiling = 60;
    private Weights weights = new Weights();
    private RiskTiers riskTiers = new RiskTiers();

    /**
     * Weights of the balanced objective. Expected to sum to 1.
     */
    @Data
    public static class Weights {
        private double output = 0.4;
        private double gas = 0.2;
        private double speed = 0.2;
        private double confidence = 0.1;
        private double risk = 0.1;
    }

    /**
     * Average pool TVL (USD) cut-offs for triangular arbitrage risk.
     */
    @Data
    public static class RiskTiers {
        private BigDecimal lowRiskTvl = BigDecimal.valueOf(10_000_000);
        private BigDecimal mediumRiskTvl = BigDecimal.valueOf(1_000_000);
        private double lowRisk = 20;
        private double mediumRisk = 50;
        private double highRisk = 80;
    }
}
