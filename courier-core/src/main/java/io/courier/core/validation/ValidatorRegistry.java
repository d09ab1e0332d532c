package io.courier.core.validation;

import java.util.List;

/// Lookup of the validators that apply to a request type.
///
/// @see DefaultValidatorRegistry
public interface ValidatorRegistry {

    /// Adds a validator for a request type and its subtypes.
    ///
    /// @param requestType the request class, or a supertype shared by several, not null
    /// @param validator the validator, not null
    /// @param <Q> the validated type
    <Q> void register(Class<Q> requestType, Validator<? super Q> validator);

    /// Resolves every validator applicable to a runtime request type.
    ///
    /// @param requestType runtime class of the request, not null
    /// @param <Q> the request type
    /// @return validators in registration order, empty if none, never null
    <Q> List<Validator<Q>> resolveValidators(Class<?> requestType);
}
