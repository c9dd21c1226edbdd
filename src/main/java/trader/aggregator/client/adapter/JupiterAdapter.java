package trader.aggregator.client.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import trader.aggregator.model.DexType;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.Token;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

@Component
public class JupiterAdapter extends QueryStringSourceAdapter {

    private static final int SLIPPAGE_BPS = 50;
    private static final long SOLANA_COMPUTE_ESTIMATE = 5000;

    @Override
    public DexType dex() {
        return DexType.JUPITER;
    }

    @Override
    protected String path() {
        return "/quote";
    }

    @Override
    protected void addQueryParams(MultiValueMap<String, String> params, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        params.add("inputMint", tokenIn.getAddress());
        params.add("outputMint", tokenOut.getAddress());
        params.add("amount", baseUnits(amountIn, tokenIn));
        params.add("slippageBps", String.valueOf(SLIPPAGE_BPS));
    }

    /**
     * Quote API shape: raw {@code outAmount} in output-token units and a fractional {@code priceImpactPct}.
     */
    @Override
    public Optional<PriceData> parseResponse(JsonNode body, QuoteContext context) {
        Optional<BigDecimal> rawOut = JsonFields.decimal(body, "outAmount");
        if (rawOut.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal amountOut = rawOut.get().movePointLeft(context.getTokenOut().getDecimals());
        BigDecimal price = amountOut.divide(context.getAmountIn(), MathContext.DECIMAL64);
        JsonNode swapInfo = body.path("routePlan").path(0).path("swapInfo");

        return Optional.of(PriceData.builder()
                .dex(dex())
                .source(context.getSource().getName())
                .tokenIn(context.getTokenIn())
                .tokenOut(context.getTokenOut())
                .price(price)
                .amountOut(amountOut)
                .priceImpact(JsonFields.number(body, "priceImpactPct", 0) * 100)
                .liquidity(JsonFields.decimal(body, "liquidity").orElse(BigDecimal.ZERO))
                .gasEstimate(SOLANA_COMPUTE_ESTIMATE)
                .timestamp(context.getReceivedAt())
                .blockNumber(JsonFields.decimal(body, "contextSlot").map(BigDecimal::longValue).orElse(null))
                .confidence(context.getSource().getReliability())
                .poolAddress(swapInfo.isMissingNode() ? null : JsonFields.text(swapInfo, "ammKey").orElse(null))
                .fee(DefaultResponseMapper.DEFAULT_FEE)
                .volume24h(BigDecimal.ZERO)
                .build());
    }
}
