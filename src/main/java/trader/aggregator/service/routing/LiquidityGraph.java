package trader.aggregator.service.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import trader.aggregator.model.LiquidityPool;
import trader.aggregator.model.Token;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pools indexed by the tokens they hold. The index is swapped as a whole, so a search always reads one snapshot.
 */
@Slf4j
@Component
public class LiquidityGraph {

    private volatile Map<String, List<LiquidityPool>> poolsByToken = Collections.emptyMap();
    private volatile int poolCount;

    public List<LiquidityPool> poolsFor(Token token) {
        return poolsByToken.getOrDefault(token.key(), Collections.emptyList());
    }

    public synchronized void replaceAll(Collection<LiquidityPool> pools) {
        Map<String, List<LiquidityPool>> index = new HashMap<>();
        for (LiquidityPool pool : pools) {
            index.computeIfAbsent(pool.getToken0().key(), key -> new ArrayList<>()).add(pool);
            index.computeIfAbsent(pool.getToken1().key(), key -> new ArrayList<>()).add(pool);
        }
        index.replaceAll((key, list) -> List.copyOf(list));
        poolsByToken = Collections.unmodifiableMap(index);
        poolCount = pools.size();
        log.info("Liquidity graph rebuilt: {} pools over {} tokens", pools.size(), index.size());
    }

    public int poolCount() {
        return poolCount;
    }

    public int tokenCount() {
        return poolsByToken.size();
    }
}
