package org.anyvals.numeric;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import org.anyvals.Or;
import org.anyvals.Validation;

/**
 * The binding that defines one refinement type: its name, the primitive it wraps, the
 * predicate every instance satisfies, and the extreme values allowed by that predicate.
 *
 * <p>Each concrete type (for example {@link PosZDouble}) holds exactly one binding in a
 * {@code TYPE} constant and routes every runtime construction path through it, so that
 * {@link #from}, {@link #ensuringValid}, {@link #fromOrElse}, {@link #goodOrElse},
 * {@link #passOrElse}, {@link #tryingValid} and {@link #isValid} can never disagree on
 * which values are valid.
 *
 * <p>A binding is checked when it is built. A binding with no name, no predicate, no
 * constructor, bounds of the wrong primitive type, or bounds that fail the predicate is
 * rejected with an {@link IllegalStateException} naming the binding, which makes the
 * owning class fail to initialize.
 *
 * @param <P> the boxed primitive type
 * @param <T> the refinement type
 */
public final class RefinementType<P extends Comparable<? super P>, T> {

  private final String name;
  private final PrimitiveKind kind;
  private final Predicate<P> predicate;
  private final Function<P, T> constructor;
  private final P minValue;
  private final P maxValue;
  private final String description;
  private final String example;
  private final List<String> wideningTargets;

  private RefinementType(Builder<P, T> builder) {
    this.name = builder.name;
    this.kind = builder.kind;
    this.predicate = builder.predicate;
    this.constructor = builder.constructor;
    this.minValue = builder.minValue;
    this.maxValue = builder.maxValue;
    this.description = builder.description;
    this.example = builder.example;
    this.wideningTargets = Collections.unmodifiableList(new ArrayList<>(builder.wideningTargets));
  }

  public static <P extends Comparable<? super P>, T> Builder<P, T> builder(String name, PrimitiveKind kind) {
    return new Builder<>(name, kind);
  }

  public String name() {
    return name;
  }

  public PrimitiveKind kind() {
    return kind;
  }

  /** The smallest finite value of the underlying primitive accepted by the predicate. */
  public P minValue() {
    return minValue;
  }

  /** The largest finite value of the underlying primitive accepted by the predicate. */
  public P maxValue() {
    return maxValue;
  }

  /** A short phrase naming the accepted range, e.g. {@code non-negative (i >= 0)}. */
  public String description() {
    return description;
  }

  /** An example of a valid literal construction, e.g. {@code PosInt.of(42)}. */
  public String example() {
    return example;
  }

  /** Names of the refinement types this type converts to without loss of its invariant. */
  public List<String> wideningTargets() {
    return wideningTargets;
  }

  public boolean isValid(P value) {
    return predicate.test(value);
  }

  public Optional<T> from(P value) {
    return isValid(value) ? Optional.of(constructor.apply(value)) : Optional.empty();
  }

  /**
   * Returns an instance wrapping {@code value}.
   *
   * @throws AssertionError if {@code value} is not valid for this type
   */
  public T ensuringValid(P value) {
    if (!isValid(value)) {
      throw invalid(value);
    }
    return constructor.apply(value);
  }

  public T fromOrElse(P value, T fallback) {
    return isValid(value) ? constructor.apply(value) : fallback;
  }

  public <B> Or<T, B> goodOrElse(P value, Function<? super P, ? extends B> onInvalid) {
    if (isValid(value)) {
      return Or.good(constructor.apply(value));
    }
    return Or.bad(onInvalid.apply(value));
  }

  public <E> Validation<E> passOrElse(P value, Function<? super P, ? extends E> onInvalid) {
    if (isValid(value)) {
      return Validation.pass();
    }
    return Validation.fail(onInvalid.apply(value));
  }

  public Or<T, AssertionError> tryingValid(P value) {
    if (isValid(value)) {
      return Or.good(constructor.apply(value));
    }
    return Or.bad(invalid(value));
  }

  private AssertionError invalid(P value) {
    return new AssertionError(value + " was not a valid " + name);
  }

  @Override
  public String toString() {
    return "RefinementType(" + name + ": " + kind.keyword() + ", " + description + ")";
  }

  /** Collects and checks the parameters of a {@link RefinementType}. */
  public static final class Builder<P extends Comparable<? super P>, T> {
    private final String name;
    private final PrimitiveKind kind;
    private Predicate<P> predicate;
    private Function<P, T> constructor;
    private P minValue;
    private P maxValue;
    private String description = "";
    private String example = "";
    private final List<String> wideningTargets = new ArrayList<>();

    private Builder(String name, PrimitiveKind kind) {
      this.name = name;
      this.kind = kind;
    }

    public Builder<P, T> predicate(Predicate<P> predicate) {
      this.predicate = predicate;
      return this;
    }

    public Builder<P, T> constructor(Function<P, T> constructor) {
      this.constructor = constructor;
      return this;
    }

    public Builder<P, T> bounds(P minValue, P maxValue) {
      this.minValue = minValue;
      this.maxValue = maxValue;
      return this;
    }

    public Builder<P, T> description(String description) {
      this.description = description;
      return this;
    }

    public Builder<P, T> example(String example) {
      this.example = example;
      return this;
    }

    public Builder<P, T> widensTo(String... targets) {
      wideningTargets.addAll(Arrays.asList(targets));
      return this;
    }

    public RefinementType<P, T> build() {
      if (name == null || name.isBlank()) {
        throw new IllegalStateException("Refinement binding has no name");
      }
      check(kind != null, "has no primitive kind");
      check(predicate != null, "has no predicate");
      check(constructor != null, "has no constructor");
      check(minValue != null && maxValue != null, "has no bounds");
      check(
          kind.boxedType().isInstance(minValue) && kind.boxedType().isInstance(maxValue),
          "has bounds that are not " + kind.keyword() + " values");
      check(predicate.test(minValue), "has a MinValue " + minValue + " that fails its predicate");
      check(predicate.test(maxValue), "has a MaxValue " + maxValue + " that fails its predicate");
      check(minValue.compareTo(maxValue) <= 0, "has MinValue " + minValue + " above MaxValue " + maxValue);
      check(!wideningTargets.contains(name), "lists itself as a widening target");
      return new RefinementType<>(this);
    }

    private void check(boolean condition, String problem) {
      if (!condition) {
        throw new IllegalStateException("Malformed refinement binding " + name + ": " + problem);
      }
    }
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof RefinementType && name.equals(((RefinementType<?, ?>) other).name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }
}
