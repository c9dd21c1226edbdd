package trader.aggregator.service.routing;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class SwapQuote {
    BigDecimal amountIn;
    BigDecimal amountOut;
    /** Percent deviation of the effective price from the pre-trade marginal price. */
    double priceImpact;
}
