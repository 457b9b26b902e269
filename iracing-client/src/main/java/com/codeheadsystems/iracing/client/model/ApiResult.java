package com.codeheadsystems.iracing.client.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a data client call: either a value, or the kind of failure that prevented one.
 * <p>
 * Expected failures (throttling, maintenance, bad payloads, network trouble) are returned as
 * values rather than thrown, so callers can apply their own fallback with a simple check.
 *
 * @param value   the value; null exactly when {@code failure} is set
 * @param failure the failure kind; null on success
 * @param <T>     the value type
 */
public record ApiResult<T>(T value, FailureKind failure) {

  public ApiResult {
    if ((value == null) == (failure == null)) {
      throw new IllegalArgumentException("Exactly one of value or failure must be set");
    }
  }

  /**
   * Success.
   *
   * @param value the value
   * @param <T>   the value type
   * @return the result
   */
  public static <T> ApiResult<T> success(T value) {
    return new ApiResult<>(Objects.requireNonNull(value, "value"), null);
  }

  /**
   * Failure.
   *
   * @param failure the failure kind
   * @param <T>     the value type
   * @return the result
   */
  public static <T> ApiResult<T> failure(FailureKind failure) {
    return new ApiResult<>(null, Objects.requireNonNull(failure, "failure"));
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public Optional<T> toOptional() {
    return Optional.ofNullable(value);
  }

  /**
   * Transforms a successful value; failures pass through unchanged.
   *
   * @param mapper the mapping function
   * @param <R>    the new value type
   * @return the mapped result
   */
  public <R> ApiResult<R> map(Function<? super T, ? extends R> mapper) {
    if (!isSuccess()) {
      return failure(failure);
    }
    return success(mapper.apply(value));
  }
}
