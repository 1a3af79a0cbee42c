package org.anyvals;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The outcome of a check that produces no value: either {@link Pass} or a {@link Fail}
 * carrying an error of type {@code E}.
 *
 * @param <E> the error type
 */
public abstract class Validation<E> {

  @SuppressWarnings("rawtypes")
  private static final Validation PASS = new Pass<>();

  private Validation() {}

  @SuppressWarnings("unchecked")
  public static <E> Validation<E> pass() {
    return (Validation<E>) PASS;
  }

  public static <E> Validation<E> fail(E error) {
    return new Fail<>(error);
  }

  public abstract boolean isPass();

  public final boolean isFail() {
    return !isPass();
  }

  /**
   * Returns the error of a failed validation.
   *
   * @throws NoSuchElementException if this validation passed
   */
  public abstract E error();

  public Optional<E> toOptional() {
    return isPass() ? Optional.empty() : Optional.of(error());
  }

  /** Returns this validation if it failed, otherwise evaluates {@code next}. */
  public Validation<E> and(Supplier<Validation<E>> next) {
    return isPass() ? next.get() : this;
  }

  public <F> Validation<F> mapError(Function<? super E, ? extends F> f) {
    return isPass() ? pass() : fail(f.apply(error()));
  }

  /** A successful validation. */
  public static final class Pass<E> extends Validation<E> {
    private Pass() {}

    @Override
    public boolean isPass() {
      return true;
    }

    @Override
    public E error() {
      throw new NoSuchElementException("Pass has no error");
    }

    @Override
    public String toString() {
      return "Pass";
    }
  }

  /** A failed validation. */
  public static final class Fail<E> extends Validation<E> {
    private final E error;

    private Fail(E error) {
      this.error = Objects.requireNonNull(error, "error");
    }

    @Override
    public boolean isPass() {
      return false;
    }

    @Override
    public E error() {
      return error;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Fail && error.equals(((Fail<?>) other).error);
    }

    @Override
    public int hashCode() {
      return error.hashCode();
    }

    @Override
    public String toString() {
      return "Fail(" + error + ")";
    }
  }
}
