package trader.aggregator.service.event;

/**
 * Handle returned by a subscription. Cancelling is idempotent.
 */
@FunctionalInterface
public interface ListenerRegistration {
    void cancel();
}
