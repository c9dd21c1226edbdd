package trader.aggregator.client;

@FunctionalInterface
public interface FeedSender {
    void send(String text);
}
