package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.NonZero;

/**
 * An {@code int} that is not zero.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the non-zero range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class NonZeroInt extends IntRefinement<NonZeroInt> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Integer, NonZeroInt> TYPE =
      RefinementType.<Integer, NonZeroInt>builder("NonZeroInt", PrimitiveKind.INT)
          .predicate(NonZeroInt::isValid)
          .constructor(NonZeroInt::new)
          .bounds(Integer.MIN_VALUE, Integer.MAX_VALUE)
          .description("non-zero (i != 0)")
          .example("NonZeroInt.of(42)")
          .widensTo("NonZeroLong", "NonZeroFloat", "NonZeroDouble")
          .build();

  /** The smallest value of this type, {@code NonZeroInt(-2147483648)}. */
  public static final NonZeroInt MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code NonZeroInt(2147483647)}. */
  public static final NonZeroInt MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private NonZeroInt(int value) {
    super(value);
  }

  @Override
  protected RefinementType<Integer, NonZeroInt> type() {
    return TYPE;
  }

  /**
   * Returns the non-zero constant {@code value} as a {@code NonZeroInt}.
   *
   * @throws AssertionError if {@code value} is not non-zero, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static NonZeroInt of(@NonZero int value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is non-zero: {@code value != 0}. */
  public static boolean isValid(int value) {
    return value != 0;
  }

  public static Optional<NonZeroInt> from(int value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code NonZeroInt}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static NonZeroInt ensuringValid(int value) {
    return TYPE.ensuringValid(value);
  }

  public static NonZeroInt fromOrElse(int value, NonZeroInt fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<NonZeroInt, B> goodOrElse(int value, Function<? super Integer, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(int value, Function<? super Integer, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<NonZeroInt, AssertionError> tryingValid(int value) {
    return TYPE.tryingValid(value);
  }

  // Widening conversions

  public NonZeroLong toNonZeroLong() {
    return NonZeroLong.ensuringValid(toLong());
  }

  public NonZeroFloat toNonZeroFloat() {
    return NonZeroFloat.ensuringValid(toFloat());
  }

  public NonZeroDouble toNonZeroDouble() {
    return NonZeroDouble.ensuringValid(toDouble());
  }
}
