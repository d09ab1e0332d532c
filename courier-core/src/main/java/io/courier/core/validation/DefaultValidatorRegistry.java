package io.courier.core.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Default mutable {@link ValidatorRegistry}.
///
/// A validator registered for a type applies to that type and every subtype of it, so a
/// validator registered for {@link io.courier.core.request.BaseRequest} applies to all
/// requests.
///
/// @implNote Not thread-safe for concurrent registration. Safe for concurrent resolution
/// after registration is complete.
public class DefaultValidatorRegistry implements ValidatorRegistry {

    private final List<Registration> registrations = new ArrayList<>();

    @Override
    public <Q> void register(Class<Q> requestType, Validator<? super Q> validator) {
        Objects.requireNonNull(requestType, "requestType must not be null");
        Objects.requireNonNull(validator, "validator must not be null");
        registrations.add(new Registration(requestType, validator));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <Q> List<Validator<Q>> resolveValidators(Class<?> requestType) {
        Objects.requireNonNull(requestType, "requestType must not be null");
        List<Validator<Q>> matched = new ArrayList<>();
        for (Registration registration : registrations) {
            if (registration.requestType().isAssignableFrom(requestType)) {
                matched.add((Validator<Q>) registration.validator());
            }
        }
        return List.copyOf(matched);
    }

    private record Registration(Class<?> requestType, Validator<?> validator) {}
}
