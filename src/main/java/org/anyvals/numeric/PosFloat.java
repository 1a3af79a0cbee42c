package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.Pos;

/**
 * A {@code float} that is greater than zero. Positive infinity is a valid {@code PosFloat},
 * NaN is not.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the positive range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class PosFloat extends FloatRefinement<PosFloat> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Float, PosFloat> TYPE =
      RefinementType.<Float, PosFloat>builder("PosFloat", PrimitiveKind.FLOAT)
          .predicate(PosFloat::isValid)
          .constructor(PosFloat::new)
          .bounds(Float.MIN_VALUE, Float.MAX_VALUE)
          .description("positive (i > 0.0f)")
          .example("PosFloat.of(42.0f)")
          .widensTo("PosZFloat", "NonZeroFloat", "PosDouble", "PosZDouble", "NonZeroDouble")
          .build();

  /** The smallest value of this type, {@code PosFloat(1.4E-45)}. */
  public static final PosFloat MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code PosFloat(3.4028235E38)}. */
  public static final PosFloat MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private PosFloat(float value) {
    super(value);
  }

  @Override
  protected RefinementType<Float, PosFloat> type() {
    return TYPE;
  }

  /**
   * Returns the positive constant {@code value} as a {@code PosFloat}.
   *
   * @throws AssertionError if {@code value} is not positive, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static PosFloat of(@Pos float value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is positive: {@code value > 0.0f}. */
  public static boolean isValid(float value) {
    return value > 0.0f;
  }

  public static Optional<PosFloat> from(float value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code PosFloat}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static PosFloat ensuringValid(float value) {
    return TYPE.ensuringValid(value);
  }

  public static PosFloat fromOrElse(float value, PosFloat fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<PosFloat, B> goodOrElse(float value, Function<? super Float, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(float value, Function<? super Float, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<PosFloat, AssertionError> tryingValid(float value) {
    return TYPE.tryingValid(value);
  }

  /** Rounds to the closest {@code int}; small values round to zero. */
  public PosZInt round() {
    return PosZInt.ensuringValid(Math.round(value()));
  }

  public PosFloat ceil() {
    return ensuringValid((float) Math.ceil(value()));
  }

  public PosZFloat floor() {
    return PosZFloat.ensuringValid((float) Math.floor(value()));
  }

  /** Converts an angle in degrees to radians. Tiny angles underflow to zero. */
  public PosZFloat toRadians() {
    return PosZFloat.ensuringValid((float) Math.toRadians(value()));
  }

  /** Converts an angle in radians to degrees. */
  public PosFloat toDegrees() {
    return ensuringValid((float) Math.toDegrees(value()));
  }

  // Widening conversions

  /** Widens this value to a {@link PosZFloat}. */
  public PosZFloat toPosZFloat() {
    return PosZFloat.ensuringValid(value());
  }

  /** Widens this value to a {@link NonZeroFloat}. */
  public NonZeroFloat toNonZeroFloat() {
    return NonZeroFloat.ensuringValid(value());
  }

  /** Widens this value to a {@link PosDouble}. */
  public PosDouble toPosDouble() {
    return PosDouble.ensuringValid(toDouble());
  }

  /** Widens this value to a {@link PosZDouble}. */
  public PosZDouble toPosZDouble() {
    return PosZDouble.ensuringValid(toDouble());
  }

  /** Widens this value to a {@link NonZeroDouble}. */
  public NonZeroDouble toNonZeroDouble() {
    return NonZeroDouble.ensuringValid(toDouble());
  }
}
