package io.courier.core.exception;

import java.io.Serial;
import java.time.Duration;

/// Thrown by the timeout behavior when a request does not complete in time.
public class RequestTimeoutException extends MediatorException {

    @Serial private static final long serialVersionUID = 3316905762217148520L;

    private final Class<?> requestType;
    private final Duration timeout;

    public RequestTimeoutException(Class<?> requestType, Duration timeout) {
        super(
                "Request "
                        + requestType.getSimpleName()
                        + " timed out after "
                        + timeout.toMillis()
                        + "ms");
        this.requestType = requestType;
        this.timeout = timeout;
    }

    public Class<?> getRequestType() {
        return requestType;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
