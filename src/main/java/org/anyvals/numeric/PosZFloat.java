package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.PosZ;

/**
 * A {@code float} that is greater than or equal to zero. Positive infinity is a valid
 * {@code PosZFloat}, NaN is not.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the non-negative range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class PosZFloat extends FloatRefinement<PosZFloat> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Float, PosZFloat> TYPE =
      RefinementType.<Float, PosZFloat>builder("PosZFloat", PrimitiveKind.FLOAT)
          .predicate(PosZFloat::isValid)
          .constructor(PosZFloat::new)
          .bounds(0.0f, Float.MAX_VALUE)
          .description("non-negative (i >= 0.0f)")
          .example("PosZFloat.of(42.0f)")
          .widensTo("PosZDouble")
          .build();

  /** The smallest value of this type, {@code PosZFloat(0.0)}. */
  public static final PosZFloat MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code PosZFloat(3.4028235E38)}. */
  public static final PosZFloat MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private PosZFloat(float value) {
    super(value);
  }

  @Override
  protected RefinementType<Float, PosZFloat> type() {
    return TYPE;
  }

  /**
   * Returns the non-negative constant {@code value} as a {@code PosZFloat}.
   *
   * @throws AssertionError if {@code value} is not non-negative, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static PosZFloat of(@PosZ float value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is non-negative: {@code value >= 0.0f}. */
  public static boolean isValid(float value) {
    return value >= 0.0f;
  }

  public static Optional<PosZFloat> from(float value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code PosZFloat}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static PosZFloat ensuringValid(float value) {
    return TYPE.ensuringValid(value);
  }

  public static PosZFloat fromOrElse(float value, PosZFloat fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<PosZFloat, B> goodOrElse(float value, Function<? super Float, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(float value, Function<? super Float, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<PosZFloat, AssertionError> tryingValid(float value) {
    return TYPE.tryingValid(value);
  }

  public PosZInt round() {
    return PosZInt.ensuringValid(Math.round(value()));
  }

  public PosZFloat ceil() {
    return ensuringValid((float) Math.ceil(value()));
  }

  public PosZFloat floor() {
    return ensuringValid((float) Math.floor(value()));
  }

  /** Converts an angle in degrees to radians. */
  public PosZFloat toRadians() {
    return ensuringValid((float) Math.toRadians(value()));
  }

  /** Converts an angle in radians to degrees. */
  public PosZFloat toDegrees() {
    return ensuringValid((float) Math.toDegrees(value()));
  }

  // Widening conversions

  /** Widens this value to a {@link PosZDouble}. */
  public PosZDouble toPosZDouble() {
    return PosZDouble.ensuringValid(toDouble());
  }
}
