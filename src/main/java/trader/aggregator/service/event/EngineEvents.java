package trader.aggregator.service.event;

import org.springframework.stereotype.Component;
import trader.aggregator.model.AggregatedPrice;
import trader.aggregator.model.ArbitrageOpportunity;
import trader.aggregator.model.SourceErrorEvent;

import java.util.function.Consumer;

@Component
public class EngineEvents {

    private final EventChannel<AggregatedPrice> priceUpdates = new EventChannel<>("price-update");
    private final EventChannel<ArbitrageOpportunity> arbitrageOpportunities = new EventChannel<>("arbitrage");
    private final EventChannel<SourceErrorEvent> errors = new EventChannel<>("error");

    public ListenerRegistration onPriceUpdate(Consumer<? super AggregatedPrice> listener) {
        return priceUpdates.subscribe(listener);
    }

    public ListenerRegistration onArbitrageOpportunity(Consumer<? super ArbitrageOpportunity> listener) {
        return arbitrageOpportunities.subscribe(listener);
    }

    public ListenerRegistration onError(Consumer<? super SourceErrorEvent> listener) {
        return errors.subscribe(listener);
    }

    public void publishPriceUpdate(AggregatedPrice price) {
        priceUpdates.publish(price);
    }

    public void publishArbitrage(ArbitrageOpportunity opportunity) {
        arbitrageOpportunities.publish(opportunity);
    }

    public void publishError(SourceErrorEvent error) {
        errors.publish(error);
    }

    public EventChannel<AggregatedPrice> priceUpdates() {
        return priceUpdates;
    }

    public EventChannel<ArbitrageOpportunity> arbitrageOpportunities() {
        return arbitrageOpportunities;
    }

    public EventChannel<SourceErrorEvent> errors() {
        return errors;
    }
}
