package trader.aggregator.service.aggregation;

import org.springframework.stereotype.Component;
import trader.aggregator.model.PriceData;

import java.math.BigDecimal;
import java.util.Optional;

@Component
public class PriceDataValidator {

    /**
     * @return the first violated rule, or empty when the quote is usable
     */
    public Optional<String> violation(PriceData data) {
        if (data.getPrice() == null || data.getPrice().signum() <= 0) {
            return Optional.of("price must be positive");
        }
        if (data.getAmountOut() == null || data.getAmountOut().signum() <= 0) {
            return Optional.of("amountOut must be positive");
        }
        if (Double.isNaN(data.getPriceImpact()) || data.getPriceImpact() < 0 || data.getPriceImpact() > 100) {
            return Optional.of("priceImpact out of [0, 100]: " + data.getPriceImpact());
        }
        if (data.getLiquidity() == null || data.getLiquidity().compareTo(BigDecimal.ZERO) < 0) {
            return Optional.of("liquidity must not be negative");
        }
        if (data.getGasEstimate() <= 0) {
            return Optional.of("gasEstimate must be positive");
        }
        if (Double.isNaN(data.getConfidence()) || data.getConfidence() < 0 || data.getConfidence() > 100) {
            return Optional.of("confidence out of [0, 100]: " + data.getConfidence());
        }
        if (data.getTimestamp() == null) {
            return Optional.of("timestamp missing");
        }
        return Optional.empty();
    }

    public boolean isValid(PriceData data) {
        return violation(data).isEmpty();
    }
}
