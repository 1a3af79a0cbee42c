package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.Pos;

/**
 * A {@code long} that is greater than zero.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the positive range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class PosLong extends LongRefinement<PosLong> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Long, PosLong> TYPE =
      RefinementType.<Long, PosLong>builder("PosLong", PrimitiveKind.LONG)
          .predicate(PosLong::isValid)
          .constructor(PosLong::new)
          .bounds(1L, Long.MAX_VALUE)
          .description("positive (i > 0L)")
          .example("PosLong.of(42L)")
          .widensTo("PosZLong", "NonZeroLong", "PosFloat", "PosZFloat", "NonZeroFloat", "PosDouble", "PosZDouble", "NonZeroDouble")
          .build();

  /** The smallest value of this type, {@code PosLong(1)}. */
  public static final PosLong MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code PosLong(9223372036854775807)}. */
  public static final PosLong MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private PosLong(long value) {
    super(value);
  }

  @Override
  protected RefinementType<Long, PosLong> type() {
    return TYPE;
  }

  /**
   * Returns the positive constant {@code value} as a {@code PosLong}.
   *
   * @throws AssertionError if {@code value} is not positive, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static PosLong of(@Pos long value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is positive: {@code value > 0L}. */
  public static boolean isValid(long value) {
    return value > 0L;
  }

  public static Optional<PosLong> from(long value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code PosLong}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static PosLong ensuringValid(long value) {
    return TYPE.ensuringValid(value);
  }

  public static PosLong fromOrElse(long value, PosLong fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<PosLong, B> goodOrElse(long value, Function<? super Long, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(long value, Function<? super Long, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<PosLong, AssertionError> tryingValid(long value) {
    return TYPE.tryingValid(value);
  }

  // Widening conversions

  /** Widens this value to a {@link PosZLong}. */
  public PosZLong toPosZLong() {
    return PosZLong.ensuringValid(value());
  }

  /** Widens this value to a {@link NonZeroLong}. */
  public NonZeroLong toNonZeroLong() {
    return NonZeroLong.ensuringValid(value());
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
