package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.NonZero;

/**
 * A {@code double} that is not zero. Both infinities and NaN are valid {@code NonZeroDouble}
 * values.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the non-zero range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class NonZeroDouble extends DoubleRefinement<NonZeroDouble> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Double, NonZeroDouble> TYPE =
      RefinementType.<Double, NonZeroDouble>builder("NonZeroDouble", PrimitiveKind.DOUBLE)
          .predicate(NonZeroDouble::isValid)
          .constructor(NonZeroDouble::new)
          .bounds(-Double.MAX_VALUE, Double.MAX_VALUE)
          .description("non-zero (i != 0.0)")
          .example("NonZeroDouble.of(42.0)")
          .build();

  /** The smallest value of this type, {@code NonZeroDouble(-1.7976931348623157E308)}. */
  public static final NonZeroDouble MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code NonZeroDouble(1.7976931348623157E308)}. */
  public static final NonZeroDouble MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private NonZeroDouble(double value) {
    super(value);
  }

  @Override
  protected RefinementType<Double, NonZeroDouble> type() {
    return TYPE;
  }

  /**
   * Returns the non-zero constant {@code value} as a {@code NonZeroDouble}.
   *
   * @throws AssertionError if {@code value} is not non-zero, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static NonZeroDouble of(@NonZero double value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is non-zero: {@code value != 0.0}. */
  public static boolean isValid(double value) {
    return value != 0.0;
  }

  public static Optional<NonZeroDouble> from(double value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code NonZeroDouble}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static NonZeroDouble ensuringValid(double value) {
    return TYPE.ensuringValid(value);
  }

  public static NonZeroDouble fromOrElse(double value, NonZeroDouble fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<NonZeroDouble, B> goodOrElse(double value, Function<? super Double, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(double value, Function<? super Double, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<NonZeroDouble, AssertionError> tryingValid(double value) {
    return TYPE.tryingValid(value);
  }

  public long round() {
    return Math.round(value());
  }

  /** Returns the ceiling as a plain {@code double}, since {@code ceil(-0.5)} is zero. */
  public double ceil() {
    return Math.ceil(value());
  }

  public double floor() {
    return Math.floor(value());
  }

  public double toRadians() {
    return Math.toRadians(value());
  }

  public NonZeroDouble toDegrees() {
    return ensuringValid(Math.toDegrees(value()));
  }
}
