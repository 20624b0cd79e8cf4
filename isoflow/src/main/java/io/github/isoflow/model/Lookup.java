package io.github.isoflow.model;

import io.github.isoflow.exception.DatasetNotFoundException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a lookup that distinguishes an unknown dataset from a value. Failures other
 * than "not found" are exceptions and never end up here.
 *
 * @param <T> the value type
 */
public final class Lookup<T> {

  private final T value;
  private final String notFoundMessage;

  private Lookup(final T value, final String notFoundMessage) {
    this.value = value;
    this.notFoundMessage = notFoundMessage;
  }

  /**
   * Found lookup.
   *
   * @param value the value
   * @param <T>   the value type
   * @return the lookup
   */
  public static <T> Lookup<T> found(final T value) {
    return new Lookup<>(Objects.requireNonNull(value, "value"), null);
  }

  /**
   * Not found lookup.
   *
   * @param message describes what was missing
   * @param <T>     the value type
   * @return the lookup
   */
  public static <T> Lookup<T> notFound(final String message) {
    return new Lookup<>(null, Objects.requireNonNull(message, "message"));
  }

  public boolean isFound() {
    return value != null;
  }

  public boolean isNotFound() {
    return value == null;
  }

  /**
   * Message of a not found lookup.
   *
   * @return the message, null when found
   */
  public String notFoundMessage() {
    return notFoundMessage;
  }

  /**
   * The value.
   *
   * @return the value
   * @throws DatasetNotFoundException when not found
   */
  public T get() {
    if (value == null) {
      throw new DatasetNotFoundException(notFoundMessage);
    }
    return value;
  }

  /**
   * Map the value.
   *
   * @param mapper the mapper
   * @param <R>    the result type
   * @return the mapped lookup
   */
  public <R> Lookup<R> map(final Function<T, R> mapper) {
    return value == null ? notFound(notFoundMessage) : found(mapper.apply(value));
  }

  @Override
  public String toString() {
    return value == null ? "Lookup.notFound(" + notFoundMessage + ")" : "Lookup.found(" + value + ")";
  }
}
