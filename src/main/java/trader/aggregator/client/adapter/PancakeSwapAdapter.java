package trader.aggregator.client.adapter;

import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import trader.aggregator.model.DexType;
import trader.aggregator.model.Token;

import java.math.BigDecimal;

@Component
public class PancakeSwapAdapter extends QueryStringSourceAdapter {

    @Override
    public DexType dex() {
        return DexType.PANCAKESWAP;
    }

    @Override
    protected String path() {
        return "/quote";
    }

    @Override
    protected void addQueryParams(MultiValueMap<String, String> params, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        params.add("from", tokenIn.getAddress());
        params.add("to", tokenOut.getAddress());
        params.add("amount", plain(amountIn));
    }
}
