package trader.aggregator.client;

import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Persistent push connection to a price source. The returned Mono completes when the remote side closes
 * the connection and errors when it fails. Cancelling the subscription closes it.
 */
public interface FeedTransport {

    Mono<Void> connect(URI uri, FeedListener listener);
}
