package trader.aggregator.service.routing;

import org.springframework.stereotype.Component;
import trader.aggregator.model.LiquidityPool;
import trader.aggregator.model.Token;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Constant-product swap math. Pure: the result depends only on reserves, fee and input.
 */
@Component
public class AmmQuoteCalculator {

    static final int SCALE = 18;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public SwapQuote quote(LiquidityPool pool, Token tokenIn, BigDecimal amountIn) {
        return quote(pool.reserveOf(tokenIn), pool.reserveOf(pool.otherToken(tokenIn)), pool.getFee(), amountIn);
    }

    /**
     * {@code amountOut = reserveOut - reserveIn * reserveOut / (reserveIn + amountIn * (1 - fee))}.
     * The division is rounded up so the pool never pays out more than the invariant allows.
     */
    public SwapQuote quote(BigDecimal reserveIn, BigDecimal reserveOut, double fee, BigDecimal amountIn) {
        if (amountIn.signum() <= 0) {
            throw new IllegalArgumentException("amountIn must be positive: " + amountIn);
        }
        if (reserveIn.signum() <= 0 || reserveOut.signum() <= 0) {
            throw new IllegalArgumentException("Pool reserves must be positive");
        }
        if (fee < 0 || fee >= 1) {
            throw new IllegalArgumentException("Fee must be in [0, 1): " + fee);
        }

        BigDecimal amountInAfterFee = amountIn.multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(fee)));
        BigDecimal invariant = reserveIn.multiply(reserveOut);
        BigDecimal reserveOutAfter = invariant.divide(reserveIn.add(amountInAfterFee), SCALE, RoundingMode.CEILING);
        BigDecimal amountOut = reserveOut.subtract(reserveOutAfter).max(BigDecimal.ZERO);

        return new SwapQuote(amountIn, amountOut, priceImpact(reserveIn, reserveOut, amountIn, amountOut));
    }

    public BigDecimal amountOut(LiquidityPool pool, Token tokenIn, BigDecimal amountIn) {
        return quote(pool, tokenIn, amountIn).getAmountOut();
    }

    private static double priceImpact(BigDecimal reserveIn, BigDecimal reserveOut, BigDecimal amountIn, BigDecimal amountOut) {
        BigDecimal marginal = reserveOut.divide(reserveIn, MathContext.DECIMAL128);
        BigDecimal effective = amountOut.divide(amountIn, MathContext.DECIMAL128);
        double impact = marginal.subtract(effective)
                .divide(marginal, MathContext.DECIMAL128)
                .multiply(HUNDRED)
                .doubleValue();
        return Math.max(0, Math.min(100, impact));
    }
}
