package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One quote from one source. Never mutated, superseded through {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class PriceData {
    DexType dex;
    String source;
    Token tokenIn;
    Token tokenOut;
    BigDecimal price;
    BigDecimal amountOut;
    double priceImpact;
    BigDecimal liquidity;
    long gasEstimate;
    Instant timestamp;
    Long blockNumber;
    double confidence;
    String poolAddress;
    @Builder.Default
    double fee = 0.003;
    BigDecimal volume24h;
}
