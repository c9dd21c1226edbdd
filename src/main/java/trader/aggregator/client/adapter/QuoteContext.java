package trader.aggregator.client.adapter;

import lombok.Builder;
import lombok.Value;
import trader.aggregator.model.PriceSource;
import trader.aggregator.model.Token;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class QuoteContext {
    PriceSource source;
    Token tokenIn;
    Token tokenOut;
    BigDecimal amountIn;
    Instant receivedAt;
}
