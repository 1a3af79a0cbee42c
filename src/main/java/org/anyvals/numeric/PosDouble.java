package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.Pos;

/**
 * A {@code double} that is greater than zero. Positive infinity is a valid
 * {@code PosDouble}, NaN is not.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the positive range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class PosDouble extends DoubleRefinement<PosDouble> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Double, PosDouble> TYPE =
      RefinementType.<Double, PosDouble>builder("PosDouble", PrimitiveKind.DOUBLE)
          .predicate(PosDouble::isValid)
          .constructor(PosDouble::new)
          .bounds(Double.MIN_VALUE, Double.MAX_VALUE)
          .description("positive (i > 0.0)")
          .example("PosDouble.of(42.0)")
          .widensTo("PosZDouble", "NonZeroDouble")
          .build();

  /** The smallest value of this type, {@code PosDouble(4.9E-324)}. */
  public static final PosDouble MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code PosDouble(1.7976931348623157E308)}. */
  public static final PosDouble MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private PosDouble(double value) {
    super(value);
  }

  @Override
  protected RefinementType<Double, PosDouble> type() {
    return TYPE;
  }

  /**
   * Returns the positive constant {@code value} as a {@code PosDouble}.
   *
   * @throws AssertionError if {@code value} is not positive, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static PosDouble of(@Pos double value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is positive: {@code value > 0.0}. */
  public static boolean isValid(double value) {
    return value > 0.0;
  }

  public static Optional<PosDouble> from(double value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code PosDouble}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static PosDouble ensuringValid(double value) {
    return TYPE.ensuringValid(value);
  }

  public static PosDouble fromOrElse(double value, PosDouble fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<PosDouble, B> goodOrElse(double value, Function<? super Double, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(double value, Function<? super Double, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<PosDouble, AssertionError> tryingValid(double value) {
    return TYPE.tryingValid(value);
  }

  /** Rounds to the closest {@code long}; small values round to zero. */
  public PosZLong round() {
    return PosZLong.ensuringValid(Math.round(value()));
  }

  public PosDouble ceil() {
    return ensuringValid(Math.ceil(value()));
  }

  public PosZDouble floor() {
    return PosZDouble.ensuringValid(Math.floor(value()));
  }

  /** Converts an angle in degrees to radians. Tiny angles underflow to zero. */
  public PosZDouble toRadians() {
    return PosZDouble.ensuringValid(Math.toRadians(value()));
  }

  /** Converts an angle in radians to degrees. */
  public PosDouble toDegrees() {
    return ensuringValid(Math.toDegrees(value()));
  }

  // Widening conversions

  /** Widens this value to a {@link PosZDouble}. */
  public PosZDouble toPosZDouble() {
    return PosZDouble.ensuringValid(value());
  }

  /** Widens this value to a {@link NonZeroDouble}. */
  public NonZeroDouble toNonZeroDouble() {
    return NonZeroDouble.ensuringValid(value());
  }
}
