package trader.aggregator.config.metrics;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

/**
 * Wraps every public call into an outbound client (price source HTTP, push feed, on-chain reserves) in an observation.
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
public class TracingAspect {

    private final ObservationRegistry observationRegistry;

    @Pointcut("execution(public * trader.aggregator.client.*Client.*(..))")
    public void outboundClientMethods() {}

    @Around("outboundClientMethods()")
    public Object traceClientCalls(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        String methodName = method.getName();
        String className = method.getDeclaringClass().getSimpleName();

        return Observation.createNotStarted("engine.client." + className + "." + methodName, observationRegistry)
                .lowCardinalityKeyValue("className", className)
                .lowCardinalityKeyValue("methodName", methodName)
                .observeChecked(() -> joinPoint.proceed());
    }
}
