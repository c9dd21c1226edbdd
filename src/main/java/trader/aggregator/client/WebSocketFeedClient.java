package trader.aggregator.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.publisher.Mono;

import java.net.URI;

@Slf4j
@Service
@RequiredArgsConstructor
public class WebSocketFeedClient implements FeedTransport {

    private final ReactorNettyWebSocketClient feedWebSocketClient;

    @Override
    public Mono<Void> connect(URI uri, FeedListener listener) {
        log.info("Connecting to price feed {}", uri);
        return feedWebSocketClient.execute(uri, session -> {
            listener.onOpen(text -> session.send(Mono.just(session.textMessage(text)))
                    .subscribe(
                            null,
                            error -> log.error("Error sending to feed {}: {}", uri, error.getMessage())
                    ));

            return session.receive()
                    .map(WebSocketMessage::getPayloadAsText)
                    .doOnNext(listener::onMessage)
                    .then();
        });
    }
}
