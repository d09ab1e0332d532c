package io.courier.adapter.beanvalidation;

import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.request.BaseRequest;
import io.courier.core.validation.FieldError;
import io.courier.core.validation.Validator;
import io.courier.core.validation.ValidatorRegistry;
import io.smallrye.mutiny.Uni;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ValidatorFactory;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/// Jakarta Bean Validation implementation of the Courier {@link Validator} capability.
///
/// Evaluates the constraint annotations declared on a request (`@NotBlank`, `@Size`,
/// `@Valid` cascades, custom constraints) and reports each
/// {@link ConstraintViolation} as a {@link FieldError} whose field is the violation's
/// property path. Errors are sorted by field, then message, since the provider returns
/// violations in no particular order.
///
/// {@snippet :
/// var validators = new DefaultValidatorRegistry();
/// BeanValidationValidator.registerFor(validators, factory.getValidator());
/// }
///
/// @implNote Thread-safe as long as the delegate is, which Bean Validation guarantees for
/// validators obtained from a {@link ValidatorFactory}.
///
/// @param <Q> the validated request type
public class BeanValidationValidator<Q> implements Validator<Q> {

    private static final Logger LOG = Logger.getLogger(BeanValidationValidator.class);

    private static final Comparator<FieldError> ORDER =
            Comparator.comparing(FieldError::field).thenComparing(FieldError::message);

    private final jakarta.validation.Validator delegate;
    private final Class<?>[] groups;

    /// Creates the adapter.
    ///
    /// @param delegate Bean Validation validator, not null
    /// @param groups validation groups to evaluate, none for the default group
    public BeanValidationValidator(jakarta.validation.Validator delegate, Class<?>... groups) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.groups = groups.clone();
    }

    /// Registers an adapter that validates every request.
    ///
    /// @param registry the registry to add to, not null
    /// @param delegate Bean Validation validator, not null
    /// @param groups validation groups to evaluate, none for the default group
    public static void registerFor(
            ValidatorRegistry registry, jakarta.validation.Validator delegate, Class<?>... groups) {
        Objects.requireNonNull(registry, "registry must not be null");
        registry.register(BaseRequest.class, new BeanValidationValidator<>(delegate, groups));
    }

    @Override
    public Uni<List<FieldError>> validate(Q request, CancellationSignal signal) {
        return Uni.createFrom().item(() -> toFieldErrors(delegate.validate(request, groups)));
    }

    private List<FieldError> toFieldErrors(Set<ConstraintViolation<Q>> violations) {
        if (violations.isEmpty()) {
            return List.of();
        }
        LOG.tracev(
                "{0} constraint violation(s) on {1}",
                violations.size(),
                violations.iterator().next().getRootBeanClass().getSimpleName());
        return violations.stream()
                .map(violation -> new FieldError(path(violation), violation.getMessage()))
                .sorted(ORDER)
                .collect(Collectors.toList());
    }

    private static String path(ConstraintViolation<?> violation) {
        return violation.getPropertyPath() == null ? "" : violation.getPropertyPath().toString();
    }
}
