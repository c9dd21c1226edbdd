package trader.aggregator.client;

/**
 * Callbacks of one push feed connection.
 */
public interface FeedListener {

    void onOpen(FeedSender sender);

    void onMessage(String payload);
}
