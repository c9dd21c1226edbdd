package trader.aggregator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class RouteStep {
    DexType dex;
    Token tokenIn;
    Token tokenOut;
    BigDecimal amountIn;
    BigDecimal amountOut;
    String poolAddress;
    double fee;
    double priceImpact;
}
