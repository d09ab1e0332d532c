package io.courier.core.behavior;

import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.pipeline.Continuation;
import io.courier.core.pipeline.PipelineBehavior;
import io.courier.core.request.BaseRequest;
import io.smallrye.mutiny.Uni;
import java.time.Duration;
import java.util.Objects;
import org.jboss.logging.Logger;

/// Logs how long each request takes to pass through the rest of the pipeline.
///
/// One entry per dispatch:
/// - below the threshold: INFO `Request: {type} ({ms} ms)`
/// - at or above the threshold: WARN `Slow request detected: {type} ({ms} ms)`
/// - on failure: ERROR with the failure and the elapsed time; the failure is then
///   propagated unchanged
///
/// Timing starts when the continuation is subscribed, so registering this behavior first
/// measures every inner behavior as well as the handler.
///
/// @param <Q> the request type
/// @param <R> the response type
public class PerformanceLoggingBehavior<Q extends BaseRequest, R>
        implements PipelineBehavior<Q, R> {

    private static final Logger LOG = Logger.getLogger(PerformanceLoggingBehavior.class);

    /// Default slow-request threshold.
    public static final Duration DEFAULT_SLOW_THRESHOLD = Duration.ofMillis(500);

    private final long slowThresholdMillis;

    public PerformanceLoggingBehavior() {
        this(DEFAULT_SLOW_THRESHOLD);
    }

    /// Creates the behavior with a custom threshold.
    ///
    /// @param slowThreshold elapsed time at which a request is reported as slow, not null
    ///     and not negative
    public PerformanceLoggingBehavior(Duration slowThreshold) {
        Objects.requireNonNull(slowThreshold, "slowThreshold must not be null");
        if (slowThreshold.isNegative()) {
            throw new IllegalArgumentException("slowThreshold must not be negative");
        }
        this.slowThresholdMillis = slowThreshold.toMillis();
    }

    @Override
    public Uni<R> handle(Q request, Continuation<R> next, CancellationSignal signal) {
        String requestType = request.getClass().getSimpleName();
        return Uni.createFrom()
                .deferred(
                        () -> {
                            long start = System.nanoTime();
                            return next.proceed()
                                    .onItem()
                                    .invoke(response -> logCompletion(requestType, start))
                                    .onFailure()
                                    .invoke(
                                            failure ->
                                                    LOG.errorv(
                                                            failure,
                                                            "Request failed: {0} ({1} ms)",
                                                            requestType,
                                                            elapsedMillis(start)))
                                    .onCancellation()
                                    .invoke(
                                            () ->
                                                    LOG.debugv(
                                                            "Request cancelled: {0} ({1} ms)",
                                                            requestType,
                                                            elapsedMillis(start)));
                        });
    }

    private void logCompletion(String requestType, long start) {
        long elapsed = elapsedMillis(start);
        if (elapsed >= slowThresholdMillis) {
            LOG.warnv("Slow request detected: {0} ({1} ms)", requestType, elapsed);
        } else {
            LOG.infov("Request: {0} ({1} ms)", requestType, elapsed);
        }
    }

    private static long elapsedMillis(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
