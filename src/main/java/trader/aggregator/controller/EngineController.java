package trader.aggregator.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import trader.aggregator.controller.dto.QuoteRequest;
import trader.aggregator.controller.dto.RouteOutcomeRequest;
import trader.aggregator.controller.dto.RouteRequest;
import trader.aggregator.controller.dto.ServiceFeeRequest;
import trader.aggregator.exception.NoValidPricesException;
import trader.aggregator.model.Token;
import trader.aggregator.service.DexAggregationEngine;

import java.math.BigDecimal;
import java.util.Map;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class EngineController {
    private final DexAggregationEngine engine;

    @Bean
    public RouterFunction<ServerResponse> engineRoutes() {
        return RouterFunctions.route()
                .path("/api", this::buildEngineRoutes)
                .build();
    }

    private RouterFunction<ServerResponse> buildEngineRoutes() {
        return RouterFunctions.route()
                .POST("/quotes", this::handleQuote)
                .POST("/routes", this::handleRoutes)
                .POST("/routes/outcome", this::handleRouteOutcome)
                .POST("/fees", this::handleServiceFee)
                .GET("/fees/revenue", request -> ServerResponse.ok().bodyValue(engine.getRevenueStats()))
                .GET("/stats", request -> ServerResponse.ok().bodyValue(engine.getStats()))
                .DELETE("/cache", this::handleClearCache)
                .GET("/stream/prices", request -> stream(engine.priceUpdates().map(price -> event("price", price))))
                .GET("/stream/arbitrage", request -> stream(engine.arbitrageOpportunities().map(op -> event("arbitrage", op))))
                .onError(NoValidPricesException.class, (error, request) -> errorResponse(HttpStatus.SERVICE_UNAVAILABLE, error))
                .onError(IllegalArgumentException.class, (error, request) -> errorResponse(HttpStatus.BAD_REQUEST, error))
                .onError(ServerWebInputException.class, (error, request) -> errorResponse(HttpStatus.BAD_REQUEST, error))
                .build();
    }

    private Mono<ServerResponse> handleQuote(ServerRequest request) {
        return request.bodyToMono(QuoteRequest.class)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("Request body is required")))
                .doOnNext(body -> validateTrade(body.getTokenIn(), body.getTokenOut(), body.getAmountIn()))
                .flatMap(body -> engine.getAggregatedPrice(body.getTokenIn(), body.getTokenOut(), body.getAmountIn()))
                .flatMap(price -> ServerResponse.ok().bodyValue(price));
    }

    private Mono<ServerResponse> handleRoutes(ServerRequest request) {
        return request.bodyToMono(RouteRequest.class)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("Request body is required")))
                .doOnNext(body -> validateTrade(body.getTokenIn(), body.getTokenOut(), body.getAmountIn()))
                .flatMap(body -> body.isLargeVolume()
                        ? engine.findOptimalRouteForLargeVolume(body.getTokenIn(), body.getTokenOut(), body.getAmountIn())
                        : engine.findOptimalRoutes(body.getTokenIn(), body.getTokenOut(), body.getAmountIn()))
                .flatMap(routes -> ServerResponse.ok().bodyValue(engine.compareRoutes(routes)));
    }

    private Mono<ServerResponse> handleRouteOutcome(ServerRequest request) {
        return request.bodyToMono(RouteOutcomeRequest.class)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("Request body is required")))
                .flatMap(body -> {
                    if (body.getSignature() == null || body.getSignature().isBlank()) {
                        return Mono.error(new IllegalArgumentException("signature is required"));
                    }
                    engine.recordRouteOutcome(body.getSignature(), body.isSuccess());
                    return ServerResponse.accepted().build();
                });
    }

    private Mono<ServerResponse> handleServiceFee(ServerRequest request) {
        return request.bodyToMono(ServiceFeeRequest.class)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("Request body is required")))
                .flatMap(body -> {
                    requirePositive(body.getAmountIn());
                    return ServerResponse.ok().bodyValue(engine.calculateServiceFee(body.getAmountIn(), body.getUserAddress()));
                });
    }

    private Mono<ServerResponse> handleClearCache(ServerRequest request) {
        engine.clearCache();
        return ServerResponse.noContent().build();
    }

    private Mono<ServerResponse> stream(Flux<ServerSentEvent<Object>> events) {
        return ServerResponse.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(BodyInserters.fromServerSentEvents(events));
    }

    private static ServerSentEvent<Object> event(String name, Object data) {
        return ServerSentEvent.builder(data).event(name).build();
    }

    private Mono<ServerResponse> errorResponse(HttpStatus status, Throwable error) {
        log.warn("Request failed with {}: {}", status.value(), error.getMessage());
        return ServerResponse.status(status).bodyValue(Map.of(
                "status", status.value(),
                "error", String.valueOf(error.getMessage())));
    }

    private static void validateTrade(Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        if (tokenIn == null || tokenOut == null || tokenIn.getAddress() == null || tokenOut.getAddress() == null) {
            throw new IllegalArgumentException("tokenIn and tokenOut with addresses are required");
        }
        requirePositive(amountIn);
    }

    private static void requirePositive(BigDecimal amountIn) {
        if (amountIn == null || amountIn.signum() <= 0) {
            throw new IllegalArgumentException("amountIn must be positive");
        }
    }
}
