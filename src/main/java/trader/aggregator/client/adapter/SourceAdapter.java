package trader.aggregator.client.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import trader.aggregator.client.SourceRequest;
import trader.aggregator.model.DexType;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.PriceSource;
import trader.aggregator.model.Token;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Knows how to ask one DEX for a quote and how to read its answer.
 */
public interface SourceAdapter {

    DexType dex();

    SourceRequest buildRequest(PriceSource source, Token tokenIn, Token tokenOut, BigDecimal amountIn);

    /**
     * @return the quote, or empty when the body is not in this source's native shape
     */
    Optional<PriceData> parseResponse(JsonNode body, QuoteContext context);
}
