package trader.aggregator.service.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import trader.aggregator.model.DexType;
import trader.aggregator.model.LiquidityPool;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static trader.aggregator.Fixtures.USDC;
import static trader.aggregator.Fixtures.WETH;
import static trader.aggregator.Fixtures.pool;

class AmmQuoteCalculatorTest {

    private final AmmQuoteCalculator calculator = new AmmQuoteCalculator();

    @Test
    @DisplayName("matches the constant-product reference value")
    void referenceValue() {
        SwapQuote quote = calculator.quote(new BigDecimal("1000000"), new BigDecimal("500"), 0.003, new BigDecimal("10000"));

        assertThat(quote.getAmountOut().doubleValue()).isCloseTo(4.93579017, within(1e-8));
        assertThat(quote.getPriceImpact()).isCloseTo(1.2842, within(0.001));
    }

    @Test
    @DisplayName("the invariant never shrinks after a swap")
    void invariantHolds() {
        BigDecimal reserveIn = new BigDecimal("1234567.89");
        BigDecimal reserveOut = new BigDecimal("987.654321");
        BigDecimal amountIn = new BigDecimal("4321.5");
        double fee = 0.003;

        BigDecimal amountOut = calculator.quote(reserveIn, reserveOut, fee, amountIn).getAmountOut();
        BigDecimal afterFee = amountIn.multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(fee)));

        assertThat(reserveIn.add(afterFee).multiply(reserveOut.subtract(amountOut)))
                .isGreaterThanOrEqualTo(reserveIn.multiply(reserveOut));
        assertThat(amountOut).isLessThan(reserveOut);
    }

    @Test
    void quotesEitherDirectionOfAPool() {
        LiquidityPool pool = pool("0xpool", DexType.UNISWAP_V3, USDC, WETH, "3000000", "1000", "6000000");

        assertThat(calculator.amountOut(pool, USDC, new BigDecimal("3000")).doubleValue()).isCloseTo(0.996, within(0.001));
        assertThat(calculator.amountOut(pool, WETH, BigDecimal.ONE).doubleValue()).isCloseTo(2988.0, within(1.0));
    }

    @Test
    void zeroFeeTinyTradeHasNegligibleImpact() {
        SwapQuote quote = calculator.quote(new BigDecimal("1000000"), new BigDecimal("1000000"), 0, BigDecimal.ONE);

        assertThat(quote.getPriceImpact()).isBetween(0.0, 0.001);
    }

    @Test
    void rejectsUnusableInputs() {
        assertThatThrownBy(() -> calculator.quote(BigDecimal.TEN, BigDecimal.TEN, 0.003, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.quote(BigDecimal.ZERO, BigDecimal.TEN, 0.003, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.quote(BigDecimal.TEN, BigDecimal.TEN, 1.0, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
