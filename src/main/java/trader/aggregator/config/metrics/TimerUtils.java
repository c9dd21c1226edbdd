package trader.aggregator.config.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.experimental.UtilityClass;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@UtilityClass
public class TimerUtils {

    /**
     * Records the duration of the supplied Mono, tagged with its outcome.
     */
    public <T> Mono<T> timedMono(Supplier<Mono<T>> supplier, MeterRegistry registry, String name, String... tags) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(registry);
            return supplier.get()
                    .doOnSuccess(result -> stopTimer(sample, registry, name, "success", tags))
                    .doOnError(error -> stopTimer(sample, registry, name, "error", tags));
        });
    }

    public long timerCount(MeterRegistry registry, String name) {
        return registry.find(name).timers().stream()
                .mapToLong(Timer::count)
                .sum();
    }

    public double meanMillis(MeterRegistry registry, String name) {
        long count = timerCount(registry, name);
        if (count == 0) {
            return 0;
        }
        double total = registry.find(name).timers().stream()
                .mapToDouble(timer -> timer.totalTime(TimeUnit.MILLISECONDS))
                .sum();
        return total / count;
    }

    private void stopTimer(Timer.Sample sample, MeterRegistry registry, String name, String outcome, String... tags) {
        sample.stop(
                Timer.builder(name)
                        .tags(tags)
                        .tag("outcome", outcome)
                        .description("Timed operation: " + name)
                        .register(registry)
        );
    }
}
