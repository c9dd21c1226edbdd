package trader.aggregator.client.adapter;

import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import trader.aggregator.model.DexType;
import trader.aggregator.model.Token;

import java.math.BigDecimal;

@Component
public class SushiSwapAdapter extends QueryStringSourceAdapter {

    @Override
    public DexType dex() {
        return DexType.SUSHISWAP;
    }

    @Override
    protected String path() {
        return "/swap";
    }

    @Override
    protected void addQueryParams(MultiValueMap<String, String> params, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        params.add("tokenIn", tokenIn.getAddress());
        params.add("tokenOut", tokenOut.getAddress());
        params.add("amount", plain(amountIn));
        params.add("chainId", String.valueOf(tokenIn.getChainId()));
    }
}
