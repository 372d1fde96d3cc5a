package com.codeheadsystems.bulwark.common;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a security operation: either a value or a {@link SecurityError}.
 * <p>
 * Pipelines in this project return results instead of throwing so that callers are forced
 * to look at the failure kind. Instances are immutable.
 *
 * @param <T> the success value type
 */
public final class SecurityResult<T> {

  private final T value;
  private final SecurityError error;

  private SecurityResult(T value, SecurityError error) {
    this.value = value;
    this.error = error;
  }

  /**
   * Success result.
   *
   * @param <T>   the type parameter
   * @param value the value, may be null for operations without a payload
   * @return the result
   */
  public static <T> SecurityResult<T> success(T value) {
    return new SecurityResult<>(value, null);
  }

  /**
   * Failure result.
   *
   * @param <T>   the type parameter
   * @param error the error
   * @return the result
   */
  public static <T> SecurityResult<T> failure(SecurityError error) {
    return new SecurityResult<>(null, Objects.requireNonNull(error, "error"));
  }

  /**
   * Failure result.
   *
   * @param <T>     the type parameter
   * @param code    the code
   * @param message the message
   * @return the result
   */
  public static <T> SecurityResult<T> failure(SecurityErrorCode code, String message) {
    return failure(new SecurityError(code, message));
  }

  public boolean isSuccess() {
    return error == null;
  }

  public boolean isFailure() {
    return error != null;
  }

  /**
   * Returns the success value.
   *
   * @return the value
   * @throws NoSuchElementException if this is a failure
   */
  public T value() {
    if (error != null) {
      throw new NoSuchElementException("No value present: " + error.code() + " " + error.message());
    }
    return value;
  }

  /**
   * Returns the error.
   *
   * @return the error
   * @throws NoSuchElementException if this is a success
   */
  public SecurityError error() {
    if (error == null) {
      throw new NoSuchElementException("Result is a success");
    }
    return error;
  }

  /**
   * The error code if this is a failure.
   *
   * @return the optional code
   */
  public Optional<SecurityErrorCode> errorCode() {
    return error == null ? Optional.empty() : Optional.of(error.code());
  }

  /**
   * Maps the success value.
   *
   * @param <R>    the type parameter
   * @param mapper the mapper
   * @return the mapped result, or this failure re-typed
   */
  public <R> SecurityResult<R> map(Function<? super T, ? extends R> mapper) {
    if (error != null) {
      return failure(error);
    }
    return success(mapper.apply(value));
  }

  /**
   * Chains another result-producing step.
   *
   * @param <R>    the type parameter
   * @param mapper the mapper
   * @return the chained result
   */
  public <R> SecurityResult<R> flatMap(Function<? super T, SecurityResult<R>> mapper) {
    if (error != null) {
      return failure(error);
    }
    return Objects.requireNonNull(mapper.apply(value), "mapper returned null");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SecurityResult<?> that)) {
      return false;
    }
    return Objects.equals(value, that.value) && Objects.equals(error, that.error);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, error);
  }

  @Override
  public String toString() {
    return error == null ? "Success[" + value + "]" : "Failure[" + error.code() + ": " + error.message() + "]";
  }
}
