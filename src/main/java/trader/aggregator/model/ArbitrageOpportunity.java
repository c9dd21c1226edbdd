package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ArbitrageOpportunity {
    String pairKey;
    DexType buyDex;
    DexType sellDex;
    BigDecimal buyPrice;
    BigDecimal sellPrice;
    double spreadPercent;
    double profitMargin;
    BigDecimal volume;
    double riskScore;
    BigDecimal minAmount;
    BigDecimal maxAmount;
    long gasEstimate;
    double confidence;
    Instant detectedAt;
}
