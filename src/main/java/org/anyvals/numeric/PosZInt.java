package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.PosZ;

/**
 * An {@code int} that is greater than or equal to zero.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the non-negative range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class PosZInt extends IntRefinement<PosZInt> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Integer, PosZInt> TYPE =
      RefinementType.<Integer, PosZInt>builder("PosZInt", PrimitiveKind.INT)
          .predicate(PosZInt::isValid)
          .constructor(PosZInt::new)
          .bounds(0, Integer.MAX_VALUE)
          .description("non-negative (i >= 0)")
          .example("PosZInt.of(42)")
          .widensTo("PosZLong", "PosZFloat", "PosZDouble")
          .build();

  /** The smallest value of this type, {@code PosZInt(0)}. */
  public static final PosZInt MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code PosZInt(2147483647)}. */
  public static final PosZInt MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private PosZInt(int value) {
    super(value);
  }

  @Override
  protected RefinementType<Integer, PosZInt> type() {
    return TYPE;
  }

  /**
   * Returns the non-negative constant {@code value} as a {@code PosZInt}.
   *
   * @throws AssertionError if {@code value} is not non-negative, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static PosZInt of(@PosZ int value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is non-negative: {@code value >= 0}. */
  public static boolean isValid(int value) {
    return value >= 0;
  }

  public static Optional<PosZInt> from(int value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code PosZInt}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static PosZInt ensuringValid(int value) {
    return TYPE.ensuringValid(value);
  }

  public static PosZInt fromOrElse(int value, PosZInt fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<PosZInt, B> goodOrElse(int value, Function<? super Integer, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(int value, Function<? super Integer, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<PosZInt, AssertionError> tryingValid(int value) {
    return TYPE.tryingValid(value);
  }

  // Widening conversions

  /** Widens this value to a {@link PosZLong}. */
  public PosZLong toPosZLong() {
    return PosZLong.ensuringValid(toLong());
  }

  /** Widens this value to a {@link PosZFloat}. */
  public PosZFloat toPosZFloat() {
    return PosZFloat.ensuringValid(toFloat());
  }

  /** Widens this value to a {@link PosZDouble}. */
  public PosZDouble toPosZDouble() {
    return PosZDouble.ensuringValid(toDouble());
  }
}
