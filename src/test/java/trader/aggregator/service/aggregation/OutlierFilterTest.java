package trader.aggregator.service.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import trader.aggregator.model.DexType;
import trader.aggregator.model.PriceData;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static trader.aggregator.Fixtures.quote;

class OutlierFilterTest {

    private final OutlierFilter filter = new OutlierFilter();

    @Test
    @DisplayName("a single far price is dropped from an otherwise flat set")
    void dropsExtremePrice() {
        List<PriceData> prices = List.of(
                quote(DexType.UNISWAP_V3, "10"),
                quote(DexType.SUSHISWAP, "10"),
                quote(DexType.CURVE, "10"),
                quote(DexType.BALANCER, "10"),
                quote(DexType.PANCAKESWAP, "1000"));

        assertThat(filter.filter(prices))
                .extracting(PriceData::getDex)
                .containsExactly(DexType.UNISWAP_V3, DexType.SUSHISWAP, DexType.CURVE, DexType.BALANCER);
    }

    @Test
    @DisplayName("three quotes with one far away keep the close two")
    void threeQuoteScenario() {
        List<PriceData> prices = List.of(
                quote(DexType.UNISWAP_V3, "100"),
                quote(DexType.SUSHISWAP, "102"),
                quote(DexType.CURVE, "1000"));

        assertThat(filter.filter(prices))
                .extracting(PriceData::getDex)
                .containsExactly(DexType.UNISWAP_V3, DexType.SUSHISWAP);
    }

    @Test
    @DisplayName("fewer than three prices pass through untouched")
    void smallSamplesAreNotFiltered() {
        List<PriceData> prices = List.of(quote(DexType.UNISWAP_V3, "1"), quote(DexType.CURVE, "1000"));

        assertThat(filter.filter(prices)).isSameAs(prices);
    }

    @Test
    void tightClusterKeepsEverything() {
        List<PriceData> prices = List.of(
                quote(DexType.UNISWAP_V3, "100"),
                quote(DexType.SUSHISWAP, "101"),
                quote(DexType.CURVE, "99"),
                quote(DexType.BALANCER, "100.5"));

        assertThat(filter.filter(prices)).hasSize(4);
    }
}
