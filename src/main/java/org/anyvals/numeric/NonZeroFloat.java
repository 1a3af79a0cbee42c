package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.NonZero;

/**
 * A {@code float} that is not zero. Both infinities and NaN are valid {@code NonZeroFloat}
 * values.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the non-zero range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class NonZeroFloat extends FloatRefinement<NonZeroFloat> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Float, NonZeroFloat> TYPE =
      RefinementType.<Float, NonZeroFloat>builder("NonZeroFloat", PrimitiveKind.FLOAT)
          .predicate(NonZeroFloat::isValid)
          .constructor(NonZeroFloat::new)
          .bounds(-Float.MAX_VALUE, Float.MAX_VALUE)
          .description("non-zero (i != 0.0f)")
          .example("NonZeroFloat.of(42.0f)")
          .widensTo("NonZeroDouble")
          .build();

  /** The smallest value of this type, {@code NonZeroFloat(-3.4028235E38)}. */
  public static final NonZeroFloat MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code NonZeroFloat(3.4028235E38)}. */
  public static final NonZeroFloat MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private NonZeroFloat(float value) {
    super(value);
  }

  @Override
  protected RefinementType<Float, NonZeroFloat> type() {
    return TYPE;
  }

  /**
   * Returns the non-zero constant {@code value} as a {@code NonZeroFloat}.
   *
   * @throws AssertionError if {@code value} is not non-zero, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static NonZeroFloat of(@NonZero float value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is non-zero: {@code value != 0.0f}. */
  public static boolean isValid(float value) {
    return value != 0.0f;
  }

  public static Optional<NonZeroFloat> from(float value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code NonZeroFloat}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static NonZeroFloat ensuringValid(float value) {
    return TYPE.ensuringValid(value);
  }

  public static NonZeroFloat fromOrElse(float value, NonZeroFloat fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<NonZeroFloat, B> goodOrElse(float value, Function<? super Float, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(float value, Function<? super Float, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<NonZeroFloat, AssertionError> tryingValid(float value) {
    return TYPE.tryingValid(value);
  }

  public int round() {
    return Math.round(value());
  }

  /** Returns the ceiling as a plain {@code float}, since {@code ceil(-0.5f)} is zero. */
  public float ceil() {
    return (float) Math.ceil(value());
  }

  public float floor() {
    return (float) Math.floor(value());
  }

  public float toRadians() {
    return (float) Math.toRadians(value());
  }

  public NonZeroFloat toDegrees() {
    return ensuringValid((float) Math.toDegrees(value()));
  }

  // Widening conversions

  public NonZeroDouble toNonZeroDouble() {
    return NonZeroDouble.ensuringValid(toDouble());
  }
}
