package io.courier.core.validation;

import io.courier.core.dispatch.CancellationSignal;
import io.smallrye.mutiny.Uni;
import java.util.List;

/// Checks a request before it reaches its handler.
///
/// A validator reports problems by emitting them; an empty list means the request is
/// valid. Failing the `Uni` signals that validation itself could not run, and that
/// failure is propagated to the caller as is.
///
/// @param <Q> the request type this validator checks
/// @see ValidatorRegistry
/// @see io.courier.core.behavior.ValidationBehavior
@FunctionalInterface
public interface Validator<Q> {

    /// Validates a request.
    ///
    /// @param request the request to check, not null
    /// @param signal cancellation signal of the dispatch, not null
    /// @return lazy list of errors, empty when valid
    Uni<List<FieldError>> validate(Q request, CancellationSignal signal);
}
