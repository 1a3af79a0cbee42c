package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.Pos;

/**
 * An {@code int} that is greater than zero.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the positive range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class PosInt extends IntRefinement<PosInt> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Integer, PosInt> TYPE =
      RefinementType.<Integer, PosInt>builder("PosInt", PrimitiveKind.INT)
          .predicate(PosInt::isValid)
          .constructor(PosInt::new)
          .bounds(1, Integer.MAX_VALUE)
          .description("positive (i > 0)")
          .example("PosInt.of(42)")
          .widensTo("PosZInt", "NonZeroInt", "PosLong", "PosZLong", "NonZeroLong", "PosFloat", "PosZFloat", "NonZeroFloat", "PosDouble", "PosZDouble", "NonZeroDouble")
          .build();

  /** The smallest value of this type, {@code PosInt(1)}. */
  public static final PosInt MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code PosInt(2147483647)}. */
  public static final PosInt MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private PosInt(int value) {
    super(value);
  }

  @Override
  protected RefinementType<Integer, PosInt> type() {
    return TYPE;
  }

  /**
   * Returns the positive constant {@code value} as a {@code PosInt}.
   *
   * @throws AssertionError if {@code value} is not positive, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static PosInt of(@Pos int value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is positive: {@code value > 0}. */
  public static boolean isValid(int value) {
    return value > 0;
  }

  public static Optional<PosInt> from(int value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code PosInt}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static PosInt ensuringValid(int value) {
    return TYPE.ensuringValid(value);
  }

  public static PosInt fromOrElse(int value, PosInt fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<PosInt, B> goodOrElse(int value, Function<? super Integer, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(int value, Function<? super Integer, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<PosInt, AssertionError> tryingValid(int value) {
    return TYPE.tryingValid(value);
  }

  // Widening conversions

  /** Widens this value to a {@link PosZInt}. */
  public PosZInt toPosZInt() {
    return PosZInt.ensuringValid(value());
  }

  /** Widens this value to a {@link NonZeroInt}. */
  public NonZeroInt toNonZeroInt() {
    return NonZeroInt.ensuringValid(value());
  }

  /** Widens this value to a {@link PosLong}. */
  public PosLong toPosLong() {
    return PosLong.ensuringValid(toLong());
  }

  /** Widens this value to a {@link PosZLong}. */
  public PosZLong toPosZLong() {
    return PosZLong.ensuringValid(toLong());
  }

  /** Widens this value to a {@link NonZeroLong}. */
  public NonZeroLong toNonZeroLong() {
    return NonZeroLong.ensuringValid(toLong());
  }

  /** Widens this value to a {@link PosFloat}. */
  public PosFloat toPosFloat() {
    return PosFloat.ensuringValid(toFloat());
  }

  /** Widens this value to a {@link PosZFloat}. */
  public PosZFloat toPosZFloat() {
    return PosZFloat.ensuringValid(toFloat());
  }

  /** Widens this value to a {@link NonZeroFloat}. */
  public NonZeroFloat toNonZeroFloat() {
    return NonZeroFloat.ensuringValid(toFloat());
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
