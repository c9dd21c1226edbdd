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
public class UniswapV3Adapter extends QueryStringSourceAdapter {

    @Override
    public DexType dex() {
        return DexType.UNISWAP_V3;
    }

    @Override
    protected String path() {
        return "/quote";
    }

    @Override
    protected void addQueryParams(MultiValueMap<String, String> params, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        params.add("tokenIn", tokenIn.getAddress());
        params.add("tokenOut", tokenOut.getAddress());
        params.add("amount", plain(amountIn));
        params.add("chainId", String.valueOf(tokenIn.getChainId()));
    }

    /**
     * Routing API shape: {@code quoteDecimals}, {@code gasUseEstimate}, {@code priceImpact}.
     */
    @Override
    public Optional<PriceData> parseResponse(JsonNode body, QuoteContext context) {
        Optional<BigDecimal> quote = JsonFields.decimal(body, "quoteDecimals");
        if (quote.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal amountOut = quote.get();
        BigDecimal price = amountOut.divide(context.getAmountIn(), MathContext.DECIMAL64);

        return Optional.of(PriceData.builder()
                .dex(dex())
                .source(context.getSource().getName())
                .tokenIn(context.getTokenIn())
                .tokenOut(context.getTokenOut())
                .price(price)
                .amountOut(amountOut)
                .priceImpact(JsonFields.number(body, "priceImpact", 0))
                .liquidity(JsonFields.decimal(body, "liquidity").orElse(BigDecimal.ZERO))
                .gasEstimate(JsonFields.decimal(body, "gasUseEstimate")
                        .map(BigDecimal::longValue)
                        .orElse(DefaultResponseMapper.DEFAULT_GAS))
                .timestamp(context.getReceivedAt())
                .blockNumber(JsonFields.decimal(body, "blockNumber").map(BigDecimal::longValue).orElse(null))
                .confidence(context.getSource().getReliability())
                .poolAddress(JsonFields.text(body, "poolAddress").orElse(null))
                .fee(JsonFields.number(body, "fee", DefaultResponseMapper.DEFAULT_FEE))
                .volume24h(BigDecimal.ZERO)
                .build());
    }
}
