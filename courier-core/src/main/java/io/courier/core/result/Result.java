package io.courier.core.result;

import io.smallrye.mutiny.Uni;
import java.util.Objects;
import java.util.function.Function;

/// Outcome of an operation: either a success carrying a value or a failure carrying a
/// message.
///
/// Handlers that prefer returning expected failures as values instead of raising them
/// can use `Result<T>` as their response type. {@link #fold(Function, Function)} turns
/// either side into a single representation at the edge of the application.
///
/// ### Contracts
/// - **Invariant**: exactly one of {@link #isSuccess()} / {@link #isFailure()} is `true`
/// - **Invariant**: a failure always carries a non-null error message
///
/// {@snippet :
/// Result<Order> result = mediator.send(new PlaceOrder(cart)).await().indefinitely();
/// String view = result.fold(order -> "placed " + order.id(), error -> "rejected: " + error);
/// }
///
/// @param <T> the success value type
public final class Result<T> {

    private final boolean success;
    private final T value;
    private final String error;

    private Result(boolean success, T value, String error) {
        this.success = success;
        this.value = value;
        this.error = error;
    }

    /// Creates a successful result.
    ///
    /// @param value the success value, may be null
    /// @param <T> the value type
    /// @return success result, never null
    public static <T> Result<T> success(T value) {
        return new Result<>(true, value, null);
    }

    /// Creates a successful result without a meaningful value.
    ///
    /// @return success result holding {@link Unit#VALUE}, never null
    public static Result<Unit> success() {
        return new Result<>(true, Unit.VALUE, null);
    }

    /// Creates a failed result.
    ///
    /// @param error description of the failure, not null
    /// @param <T> the value type the caller expected
    /// @return failure result, never null
    public static <T> Result<T> failure(String error) {
        Objects.requireNonNull(error, "error must not be null");
        return new Result<>(false, null, error);
    }

    /// Converts the outcome of a `Uni` into a `Result`.
    ///
    /// An item becomes a success, a failure becomes a failed result carrying the
    /// exception message (or the exception class name when it has no message).
    ///
    /// @param uni the asynchronous operation, not null
    /// @param <T> the item type
    /// @return `Uni` that never fails with the operation's exception, never null
    public static <T> Uni<Result<T>> capture(Uni<T> uni) {
        Objects.requireNonNull(uni, "uni must not be null");
        return uni.onItem()
                .transform(Result::success)
                .onFailure()
                .recoverWithItem(failure -> Result.failure(describe(failure)));
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /// Returns the success value.
    ///
    /// @return the value, may be null if the success was created with null
    /// @throws IllegalStateException if this result is a failure
    public T getValue() {
        if (!success) {
            throw new IllegalStateException("Cannot read the value of a failed result: " + error);
        }
        return value;
    }

    /// Returns the failure message.
    ///
    /// @return error message, never null
    /// @throws IllegalStateException if this result is a success
    public String getError() {
        if (success) {
            throw new IllegalStateException("Cannot read the error of a successful result");
        }
        return error;
    }

    /// Applies one of two functions depending on the outcome.
    ///
    /// @param onSuccess applied to the value of a success, not null
    /// @param onFailure applied to the message of a failure, not null
    /// @param <U> the common result type
    /// @return the applied function's result
    public <U> U fold(
            Function<? super T, ? extends U> onSuccess, Function<String, ? extends U> onFailure) {
        return success ? onSuccess.apply(value) : onFailure.apply(error);
    }

    /// Transforms the success value, leaving failures untouched.
    ///
    /// @param mapper applied to the success value, not null
    /// @param <U> the new value type
    /// @return mapped result, never null
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return success ? Result.success(mapper.apply(value)) : Result.failure(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Result<?> other)) return false;
        return success == other.success
                && Objects.equals(value, other.value)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, value, error);
    }

    @Override
    public String toString() {
        return success ? "Success[" + value + "]" : "Failure[" + error + "]";
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message != null ? message : failure.getClass().getName();
    }
}
