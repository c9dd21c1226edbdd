package trader.aggregator.client.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import trader.aggregator.model.PriceData;

import java.math.BigDecimal;

/**
 * Generic mapping for sources answering with flat {@code price / amountOut / liquidity / gas} fields.
 */
@Component
public class DefaultResponseMapper {

    static final long DEFAULT_GAS = 150000;
    static final double DEFAULT_FEE = 0.003;

    public PriceData map(JsonNode body, QuoteContext context) {
        BigDecimal amountOut = JsonFields.decimal(body, "amountOut")
                .or(() -> JsonFields.decimal(body, "outputAmount"))
                .orElse(BigDecimal.ZERO);
        long gas = JsonFields.decimal(body, "gas")
                .or(() -> JsonFields.decimal(body, "gasEstimate"))
                .map(BigDecimal::longValue)
                .filter(value -> value > 0)
                .orElse(DEFAULT_GAS);
        Long blockNumber = JsonFields.decimal(body, "blockNumber").map(BigDecimal::longValue).orElse(null);

        return PriceData.builder()
                .dex(context.getSource().getDex())
                .source(context.getSource().getName())
                .tokenIn(context.getTokenIn())
                .tokenOut(context.getTokenOut())
                .price(JsonFields.decimal(body, "price").orElse(BigDecimal.ZERO))
                .amountOut(amountOut)
                .priceImpact(JsonFields.number(body, "priceImpact", 0))
                .liquidity(JsonFields.decimal(body, "liquidity").orElse(BigDecimal.ZERO))
                .gasEstimate(gas)
                .timestamp(context.getReceivedAt())
                .blockNumber(blockNumber)
                .confidence(context.getSource().getReliability())
                .poolAddress(JsonFields.text(body, "poolAddress").orElse(null))
                .fee(JsonFields.number(body, "fee", DEFAULT_FEE))
                .volume24h(JsonFields.decimal(body, "volume24h").orElse(BigDecimal.ZERO))
                .build();
    }
}
