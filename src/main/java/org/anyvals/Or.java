package org.anyvals;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A value that is either a {@link Good} of type {@code G} or a {@link Bad} of type {@code B}.
 *
 * <p>Refinement types return an {@code Or} from {@code goodOrElse} and {@code tryingValid}:
 * the good side holds the constructed instance, the bad side holds whatever the caller's
 * error mapping produced for the rejected value.
 *
 * @param <G> the type of the good value
 * @param <B> the type of the bad value
 */
public abstract class Or<G, B> {

  private Or() {}

  public static <G, B> Or<G, B> good(G value) {
    return new Good<>(value);
  }

  public static <G, B> Or<G, B> bad(B value) {
    return new Bad<>(value);
  }

  public abstract boolean isGood();

  public final boolean isBad() {
    return !isGood();
  }

  /**
   * Returns the good value.
   *
   * @throws NoSuchElementException if this is a {@code Bad}
   */
  public abstract G get();

  /**
   * Returns the bad value.
   *
   * @throws NoSuchElementException if this is a {@code Good}
   */
  public abstract B getBad();

  public abstract <R> R fold(Function<? super G, ? extends R> ifGood, Function<? super B, ? extends R> ifBad);

  public <H> Or<H, B> map(Function<? super G, ? extends H> f) {
    return fold(g -> Or.<H, B>good(f.apply(g)), Or::bad);
  }

  public <C> Or<G, C> badMap(Function<? super B, ? extends C> f) {
    return fold(Or::good, b -> Or.<G, C>bad(f.apply(b)));
  }

  public Optional<G> toOptional() {
    return isGood() ? Optional.of(get()) : Optional.empty();
  }

  public G getOrElse(G fallback) {
    return isGood() ? get() : fallback;
  }

  /** The good side of an {@link Or}. */
  public static final class Good<G, B> extends Or<G, B> {
    private final G value;

    private Good(G value) {
      this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isGood() {
      return true;
    }

    @Override
    public G get() {
      return value;
    }

    @Override
    public B getBad() {
      throw new NoSuchElementException("Good(" + value + ") has no bad value");
    }

    @Override
    public <R> R fold(Function<? super G, ? extends R> ifGood, Function<? super B, ? extends R> ifBad) {
      return ifGood.apply(value);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Good && value.equals(((Good<?, ?>) other).value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return "Good(" + value + ")";
    }
  }

  /** The bad side of an {@link Or}. */
  public static final class Bad<G, B> extends Or<G, B> {
    private final B value;

    private Bad(B value) {
      this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isGood() {
      return false;
    }

    @Override
    public G get() {
      throw new NoSuchElementException("Bad(" + value + ") has no good value");
    }

    @Override
    public B getBad() {
      return value;
    }

    @Override
    public <R> R fold(Function<? super G, ? extends R> ifGood, Function<? super B, ? extends R> ifBad) {
      return ifBad.apply(value);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Bad && value.equals(((Bad<?, ?>) other).value);
    }

    @Override
    public int hashCode() {
      return 31 * value.hashCode() + 1;
    }

    @Override
    public String toString() {
      return "Bad(" + value + ")";
    }
  }
}
