package io.courier.core.behavior;

import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.exception.ValidationException;
import io.courier.core.pipeline.Continuation;
import io.courier.core.pipeline.PipelineBehavior;
import io.courier.core.request.BaseRequest;
import io.courier.core.validation.FieldError;
import io.courier.core.validation.Validator;
import io.courier.core.validation.ValidatorRegistry;
import io.smallrye.mutiny.Uni;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/// Runs every validator registered for the request type before the rest of the pipeline.
///
/// Validators run concurrently. Their errors are concatenated in validator order; any
/// error fails the dispatch with {@link ValidationException} and the continuation is never
/// called. A failure raised by a validator itself is propagated unchanged.
///
/// ### Contracts
/// - **Postcondition**: no errors → the continuation is called exactly once
/// - **Postcondition**: errors → the continuation is not called
///
/// @implNote Request types found to have no validators are remembered, and later
/// dispatches of those types skip the registry lookup. Validators must therefore be
/// registered before the first dispatch.
///
/// @param <Q> the request type
/// @param <R> the response type
public class ValidationBehavior<Q extends BaseRequest, R> implements PipelineBehavior<Q, R> {

    private static final Logger LOG = Logger.getLogger(ValidationBehavior.class);

    private final ValidatorRegistry validators;
    private final Set<Class<?>> typesWithoutValidators = ConcurrentHashMap.newKeySet();

    /// Creates the behavior.
    ///
    /// @param validators registry to resolve validators from, not null
    public ValidationBehavior(ValidatorRegistry validators) {
        this.validators = Objects.requireNonNull(validators, "validators must not be null");
    }

    @Override
    public Uni<R> handle(Q request, Continuation<R> next, CancellationSignal signal) {
        Class<?> requestType = request.getClass();
        if (typesWithoutValidators.contains(requestType)) {
            return next.proceed();
        }
        List<Validator<Q>> resolved = validators.resolveValidators(requestType);
        if (resolved.isEmpty()) {
            typesWithoutValidators.add(requestType);
            return next.proceed();
        }

        List<Uni<List<FieldError>>> runs = new ArrayList<>(resolved.size());
        for (Validator<Q> validator : resolved) {
            runs.add(Uni.createFrom().deferred(() -> validator.validate(request, signal)));
        }
        return Uni.join()
                .all(runs)
                .andFailFast()
                .onItem()
                .transformToUni(
                        results -> {
                            List<FieldError> errors = collect(results);
                            if (errors.isEmpty()) {
                                return next.proceed();
                            }
                            LOG.warnv(
                                    "Validation failed for {0} with {1} error(s)",
                                    requestType.getSimpleName(), errors.size());
                            if (LOG.isDebugEnabled()) {
                                for (FieldError error : errors) {
                                    LOG.debugv("  {0}: {1}", error.field(), error.message());
                                }
                            }
                            return Uni.createFrom()
                                    .failure(new ValidationException(requestType, errors));
                        });
    }

    private static List<FieldError> collect(List<List<FieldError>> results) {
        List<FieldError> errors = new ArrayList<>();
        for (List<FieldError> result : results) {
            if (result != null) {
                errors.addAll(result);
            }
        }
        return errors;
    }
}
