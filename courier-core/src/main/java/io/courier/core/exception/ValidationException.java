package io.courier.core.exception;

import io.courier.core.validation.FieldError;
import java.io.Serial;
import java.util.List;
import java.util.stream.Collectors;

/// Thrown by the validation behavior when one or more validators reject a request.
///
/// Carries every reported {@link FieldError}, in validator order. The handler has not
/// been invoked when this exception is raised.
public class ValidationException extends MediatorException {

    @Serial private static final long serialVersionUID = -4129880571240236581L;

    private final Class<?> requestType;
    private final transient List<FieldError> errors;

    /// Creates a validation failure.
    ///
    /// @param requestType the rejected request type, not null
    /// @param errors the reported errors, not null and not empty
    public ValidationException(Class<?> requestType, List<FieldError> errors) {
        super(buildMessage(requestType, errors));
        this.requestType = requestType;
        this.errors = List.copyOf(errors);
    }

    public Class<?> getRequestType() {
        return requestType;
    }

    /// Returns the errors reported by all validators.
    ///
    /// @return immutable list of errors, never empty
    public List<FieldError> getErrors() {
        return errors;
    }

    private static String buildMessage(Class<?> requestType, List<FieldError> errors) {
        return "Validation failed for "
                + requestType.getSimpleName()
                + ": "
                + errors.stream()
                        .map(error -> error.field() + " " + error.message())
                        .collect(Collectors.joining("; "));
    }
}
