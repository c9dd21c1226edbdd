package trader.aggregator.client;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Request/response channel to a price source.
 */
public interface PriceSourceClient {

    Mono<JsonNode> execute(SourceRequest request);
}
