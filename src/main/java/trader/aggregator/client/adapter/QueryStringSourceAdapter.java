package trader.aggregator.client.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import trader.aggregator.client.SourceRequest;
import trader.aggregator.model.PriceData;
import trader.aggregator.model.PriceSource;
import trader.aggregator.model.Token;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Base for sources quoted with a single GET on {@code endpoint + path + query}.
 */
public abstract class QueryStringSourceAdapter implements SourceAdapter {

    protected abstract String path();

    protected abstract void addQueryParams(MultiValueMap<String, String> params, Token tokenIn, Token tokenOut, BigDecimal amountIn);

    @Override
    public SourceRequest buildRequest(PriceSource source, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        addQueryParams(params, tokenIn, tokenOut, amountIn);

        return SourceRequest.builder()
                .uri(UriComponentsBuilder.fromHttpUrl(source.getApiEndpoint())
                        .path(path())
                        .queryParams(params)
                        .encode()
                        .build()
                        .toUri())
                .headers(source.getHeaders())
                .build();
    }

    @Override
    public Optional<PriceData> parseResponse(JsonNode body, QuoteContext context) {
        return Optional.empty();
    }

    protected static String plain(BigDecimal amount) {
        return amount.stripTrailingZeros().toPlainString();
    }

    /** Amount in the token's smallest unit. */
    protected static String baseUnits(BigDecimal amount, Token token) {
        return amount.movePointRight(token.getDecimals()).toBigInteger().toString();
    }
}
