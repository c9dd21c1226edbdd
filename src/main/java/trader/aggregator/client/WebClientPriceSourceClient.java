package trader.aggregator.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class WebClientPriceSourceClient implements PriceSourceClient {

    private final WebClient priceSourceWebClient;
    private final Counter apiCallsCounter;

    @Override
    public Mono<JsonNode> execute(SourceRequest request) {
        return Mono.defer(() -> {
            apiCallsCounter.increment();
            log.debug("Calling price source {} {}", request.getMethod(), request.getUri());
            return priceSourceWebClient.method(request.getMethod())
                    .uri(request.getUri())
                    .headers(headers -> request.getHeaders().forEach(headers::set))
                    .retrieve()
                    .bodyToMono(JsonNode.class);
        });
    }
}
