package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.PosZ;

/**
 * A {@code double} that is greater than or equal to zero. Positive infinity is a valid
 * {@code PosZDouble}, NaN is not.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the non-negative range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class PosZDouble extends DoubleRefinement<PosZDouble> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Double, PosZDouble> TYPE =
      RefinementType.<Double, PosZDouble>builder("PosZDouble", PrimitiveKind.DOUBLE)
          .predicate(PosZDouble::isValid)
          .constructor(PosZDouble::new)
          .bounds(0.0, Double.MAX_VALUE)
          .description("non-negative (i >= 0.0)")
          .example("PosZDouble.of(42.0)")
          .build();

  /** The smallest value of this type, {@code PosZDouble(0.0)}. */
  public static final PosZDouble MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code PosZDouble(1.7976931348623157E308)}. */
  public static final PosZDouble MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private PosZDouble(double value) {
    super(value);
  }

  @Override
  protected RefinementType<Double, PosZDouble> type() {
    return TYPE;
  }

  /**
   * Returns the non-negative constant {@code value} as a {@code PosZDouble}.
   *
   * @throws AssertionError if {@code value} is not non-negative, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static PosZDouble of(@PosZ double value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is non-negative: {@code value >= 0.0}. */
  public static boolean isValid(double value) {
    return value >= 0.0;
  }

  public static Optional<PosZDouble> from(double value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code PosZDouble}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static PosZDouble ensuringValid(double value) {
    return TYPE.ensuringValid(value);
  }

  public static PosZDouble fromOrElse(double value, PosZDouble fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<PosZDouble, B> goodOrElse(double value, Function<? super Double, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(double value, Function<? super Double, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<PosZDouble, AssertionError> tryingValid(double value) {
    return TYPE.tryingValid(value);
  }

  public PosZLong round() {
    return PosZLong.ensuringValid(Math.round(value()));
  }

  public PosZDouble ceil() {
    return ensuringValid(Math.ceil(value()));
  }

  public PosZDouble floor() {
    return ensuringValid(Math.floor(value()));
  }

  /** Converts an angle in degrees to radians. */
  public PosZDouble toRadians() {
    return ensuringValid(Math.toRadians(value()));
  }

  /** Converts an angle in radians to degrees. */
  public PosZDouble toDegrees() {
    return ensuringValid(Math.toDegrees(value()));
  }
}
