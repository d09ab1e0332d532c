package io.courier.core.exception;

import java.io.Serial;

/// Base class for failures raised by the dispatch engine and its built-in behaviors.
///
/// Unchecked so it travels through `Uni` failures and `await()` unchanged. Failures
/// raised by handlers themselves are never wrapped in this type.
public class MediatorException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2870419183519271066L;

    public MediatorException(String message) {
        super(message);
    }

    public MediatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
