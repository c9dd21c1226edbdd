package trader.aggregator.client.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import trader.aggregator.model.DexType;
import trader.aggregator.model.PriceData;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class SourceAdapterRegistry {

    private final Map<DexType, SourceAdapter> adapters = new EnumMap<>(DexType.class);
    private final DefaultResponseMapper defaultMapper;

    public SourceAdapterRegistry(List<SourceAdapter> adapters, DefaultResponseMapper defaultMapper) {
        this.defaultMapper = defaultMapper;
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = this.adapters.put(adapter.dex(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.dex());
            }
        }
    }

    public SourceAdapter adapterFor(DexType dex) {
        SourceAdapter adapter = adapters.get(dex);
        if (adapter == null) {
            throw new IllegalArgumentException("No source adapter registered for " + dex);
        }
        return adapter;
    }

    /**
     * Source-specific parsing first, then the generic field mapping.
     */
    public PriceData parse(DexType dex, JsonNode body, QuoteContext context) {
        return adapterFor(dex).parseResponse(body, context)
                .orElseGet(() -> {
                    log.debug("{} response not in native shape, using default mapping", dex);
                    return defaultMapper.map(body, context);
                });
    }
}
