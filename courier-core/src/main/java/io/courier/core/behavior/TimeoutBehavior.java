package io.courier.core.behavior;

import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.exception.RequestTimeoutException;
import io.courier.core.pipeline.Continuation;
import io.courier.core.pipeline.PipelineBehavior;
import io.courier.core.request.BaseRequest;
import io.smallrye.mutiny.Uni;
import java.time.Duration;
import java.util.Objects;

/// Fails a dispatch with {@link RequestTimeoutException} when the rest of the pipeline
/// does not produce an outcome within the configured duration. The inner subscription is
/// cancelled on expiry.
///
/// @param <Q> the request type
/// @param <R> the response type
public class TimeoutBehavior<Q extends BaseRequest, R> implements PipelineBehavior<Q, R> {

    private final Duration timeout;

    /// Creates the behavior.
    ///
    /// @param timeout maximum time to wait, positive
    public TimeoutBehavior(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
    }

    @Override
    public Uni<R> handle(Q request, Continuation<R> next, CancellationSignal signal) {
        Class<?> requestType = request.getClass();
        return next.proceed()
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new RequestTimeoutException(requestType, timeout));
    }

    public Duration getTimeout() {
        return timeout;
    }
}
