package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.NonZero;

/**
 * A {@code long} that is not zero.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the non-zero range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class NonZeroLong extends LongRefinement<NonZeroLong> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Long, NonZeroLong> TYPE =
      RefinementType.<Long, NonZeroLong>builder("NonZeroLong", PrimitiveKind.LONG)
          .predicate(NonZeroLong::isValid)
          .constructor(NonZeroLong::new)
          .bounds(Long.MIN_VALUE, Long.MAX_VALUE)
          .description("non-zero (i != 0L)")
          .example("NonZeroLong.of(42L)")
          .widensTo("NonZeroFloat", "NonZeroDouble")
          .build();

  /** The smallest value of this type, {@code NonZeroLong(-9223372036854775808)}. */
  public static final NonZeroLong MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code NonZeroLong(9223372036854775807)}. */
  public static final NonZeroLong MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private NonZeroLong(long value) {
    super(value);
  }

  @Override
  protected RefinementType<Long, NonZeroLong> type() {
    return TYPE;
  }

  /**
   * Returns the non-zero constant {@code value} as a {@code NonZeroLong}.
   *
   * @throws AssertionError if {@code value} is not non-zero, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static NonZeroLong of(@NonZero long value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is non-zero: {@code value != 0L}. */
  public static boolean isValid(long value) {
    return value != 0L;
  }

  public static Optional<NonZeroLong> from(long value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code NonZeroLong}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static NonZeroLong ensuringValid(long value) {
    return TYPE.ensuringValid(value);
  }

  public static NonZeroLong fromOrElse(long value, NonZeroLong fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<NonZeroLong, B> goodOrElse(long value, Function<? super Long, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(long value, Function<? super Long, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<NonZeroLong, AssertionError> tryingValid(long value) {
    return TYPE.tryingValid(value);
  }

  // Widening conversions

  public NonZeroFloat toNonZeroFloat() {
    return NonZeroFloat.ensuringValid(toFloat());
  }

  public NonZeroDouble toNonZeroDouble() {
    return NonZeroDouble.ensuringValid(toDouble());
  }
}
