package io.courier.core.validation;

import java.util.Objects;

/// A single validation failure reported for a request.
///
/// @param field name or path of the offending property, empty for object-level errors
/// @param message human-readable description, not null
public record FieldError(String field, String message) {

    public FieldError {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /// Creates an error that does not belong to a single property.
    ///
    /// @param message description of the failure, not null
    /// @return object-level error, never null
    public static FieldError global(String message) {
        return new FieldError("", message);
    }
}
