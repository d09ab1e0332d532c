package io.courier.core.exception;

import java.io.Serial;

/// Thrown when a request, command or stream request is dispatched and no handler is
/// registered for its type.
///
/// Raised lazily, when the behavior chain reaches the handler. A behavior that answers
/// without calling its continuation never triggers it.
public class HandlerNotFoundException extends MediatorException {

    @Serial private static final long serialVersionUID = 7354021981163425094L;

    /// Kind of handler that was looked up.
    public enum HandlerKind {
        REQUEST,
        COMMAND,
        STREAM
    }

    private final Class<?> requestType;
    private final HandlerKind kind;

    /// Creates the exception for a missing handler.
    ///
    /// @param requestType the dispatched type, not null
    /// @param kind the handler kind that was looked up, not null
    public HandlerNotFoundException(Class<?> requestType, HandlerKind kind) {
        super(
                "No "
                        + kind.name().toLowerCase()
                        + " handler registered for type: "
                        + requestType.getName());
        this.requestType = requestType;
        this.kind = kind;
    }

    public Class<?> getRequestType() {
        return requestType;
    }

    public HandlerKind getKind() {
        return kind;
    }
}
