package org.anyvals.numeric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/** Properties every concrete refinement type shares. */
class RefinementCatalogTest {

  static Stream<Binding<?, ?>> bindings() {
    return Stream.of(
        Binding.of(PosInt.TYPE, 0, null, List.of(-1, Integer.MIN_VALUE)),
        Binding.of(PosZInt.TYPE, -1, null, List.of(Integer.MIN_VALUE)),
        Binding.of(NegInt.TYPE, null, 0, List.of(1, Integer.MAX_VALUE)),
        Binding.of(NegZInt.TYPE, null, 1, List.of(Integer.MAX_VALUE)),
        Binding.of(NonZeroInt.TYPE, null, null, List.of(0)),
        Binding.of(PosLong.TYPE, 0L, null, List.of(-1L, Long.MIN_VALUE)),
        Binding.of(PosZLong.TYPE, -1L, null, List.of(Long.MIN_VALUE)),
        Binding.of(NonZeroLong.TYPE, null, null, List.of(0L)),
        Binding.of(
            PosFloat.TYPE,
            0.0f,
            null,
            List.of(-0.0f, -1.0f, Float.NaN, Float.NEGATIVE_INFINITY, Float.POSITIVE_INFINITY)),
        Binding.of(
            PosZFloat.TYPE,
            -Float.MIN_VALUE,
            null,
            List.of(-0.0f, Float.NaN, Float.NEGATIVE_INFINITY, Float.POSITIVE_INFINITY)),
        Binding.of(
            NonZeroFloat.TYPE,
            null,
            null,
            List.of(0.0f, -0.0f, Float.NaN, Float.NEGATIVE_INFINITY, Float.POSITIVE_INFINITY)),
        Binding.of(
            PosDouble.TYPE,
            0.0,
            null,
            List.of(-0.0, -1.0, Double.NaN, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY)),
        Binding.of(
            PosZDouble.TYPE,
            -Double.MIN_VALUE,
            null,
            List.of(-0.0, Double.NaN, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY)),
        Binding.of(
            NonZeroDouble.TYPE,
            null,
            null,
            List.of(0.0, -0.0, Double.NaN, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY)),
        Binding.of(NumericChar.TYPE, '/', ':', List.of('a', Character.MIN_VALUE, Character.MAX_VALUE)));
  }

  @ParameterizedTest
  @MethodSource("bindings")
  void boundsSatisfyThePredicate(Binding<?, ?> binding) {
    assertBoundsValid(binding);
  }

  @ParameterizedTest
  @MethodSource("bindings")
  void documentsItself(Binding<?, ?> binding) {
    RefinementType<?, ?> type = binding.type;

    assertThat(type.description()).isNotBlank();
    assertThat(type.example()).startsWith(type.name() + ".of(");
    assertThat(type.minValue()).isInstanceOf(type.kind().boxedType());
    assertThat(type.kind().isIntegral()).isEqualTo(!(type.minValue() instanceof Float || type.minValue() instanceof Double));
  }

  @ParameterizedTest
  @MethodSource("bindings")
  void boundsAreExtremalAmongFiniteValues(Binding<?, ?> binding) {
    assertNeighboursInvalid(binding);
  }

  @ParameterizedTest
  @MethodSource("bindings")
  void everyConstructionPathAgreesWithIsValid(Binding<?, ?> binding) {
    assertPathsAgree(binding);
  }

  @ParameterizedTest
  @MethodSource("bindings")
  void wideningNeverFailsOnTheBounds(Binding<?, ?> binding) throws Exception {
    assertWideningOnBounds(binding);
  }

  @ParameterizedTest
  @MethodSource("bindings")
  void minAndMaxConstantsMatchTheBinding(Binding<?, ?> binding) throws Exception {
    assertConstantsMatch(binding);
  }

  private static <P extends Comparable<? super P>, T> void assertBoundsValid(Binding<P, T> binding) {
    RefinementType<P, T> type = binding.type;

    assertThat(type.isValid(type.minValue())).isTrue();
    assertThat(type.isValid(type.maxValue())).isTrue();
  }

  private static <P extends Comparable<? super P>, T> void assertNeighboursInvalid(Binding<P, T> binding) {
    RefinementType<P, T> type = binding.type;

    if (binding.below != null) {
      assertThat(type.isValid(binding.below)).as("value below %s", type.minValue()).isFalse();
    }
    if (binding.above != null) {
      assertThat(type.isValid(binding.above)).as("value above %s", type.maxValue()).isFalse();
    }
  }

  private static <P extends Comparable<? super P>, T> void assertPathsAgree(Binding<P, T> binding) {
    RefinementType<P, T> type = binding.type;
    T fallback = type.ensuringValid(type.minValue());

    for (P value : binding.values()) {
      boolean valid = type.isValid(value);
      String label = type.name() + " given " + value;

      assertThat(type.from(value).isPresent()).as(label).isEqualTo(valid);
      assertThat(type.goodOrElse(value, v -> "rejected " + v).isGood()).as(label).isEqualTo(valid);
      assertThat(type.passOrElse(value, v -> v).isPass()).as(label).isEqualTo(valid);
      assertThat(type.tryingValid(value).isGood()).as(label).isEqualTo(valid);

      if (valid) {
        T instance = type.ensuringValid(value);
        assertThat(type.from(value)).as(label).contains(instance);
        assertThat(type.fromOrElse(value, fallback)).as(label).isEqualTo(instance);
        assertThat(type.goodOrElse(value, v -> "rejected " + v).get()).as(label).isEqualTo(instance);
        assertThat(type.tryingValid(value).get()).as(label).isEqualTo(instance);
      } else {
        String message = value + " was not a valid " + type.name();
        assertThatThrownBy(() -> type.ensuringValid(value))
            .as(label)
            .isInstanceOf(AssertionError.class)
            .hasMessage(message);
        assertThat(type.fromOrElse(value, fallback)).as(label).isSameAs(fallback);
        assertThat(type.goodOrElse(value, v -> "rejected " + v).getBad()).as(label).isEqualTo("rejected " + value);
        assertThat(type.passOrElse(value, v -> v).error()).as(label).isEqualTo(value);
        assertThat(type.tryingValid(value).getBad()).as(label).hasMessage(message);
      }
    }
  }

  private static <P extends Comparable<? super P>, T> void assertWideningOnBounds(Binding<P, T> binding)
      throws Exception {
    RefinementType<P, T> type = binding.type;
    T min = type.ensuringValid(type.minValue());
    T max = type.ensuringValid(type.maxValue());

    for (String target : type.wideningTargets()) {
      Method widen = min.getClass().getMethod("to" + target);
      assertThat(widen.invoke(min).getClass().getSimpleName()).isEqualTo(target);
      assertThat(widen.invoke(max).getClass().getSimpleName()).isEqualTo(target);
    }
  }

  private static <P extends Comparable<? super P>, T> void assertConstantsMatch(Binding<P, T> binding)
      throws Exception {
    RefinementType<P, T> type = binding.type;
    T min = type.ensuringValid(type.minValue());
    Class<?> owner = min.getClass();

    assertThat(min.toString()).isEqualTo(type.name() + "(" + type.minValue() + ")");
    assertThat(owner.getSimpleName()).isEqualTo(type.name());
    assertThat(owner.getField("MIN_VALUE").get(null)).isEqualTo(min);
    assertThat(owner.getField("MAX_VALUE").get(null)).isEqualTo(type.ensuringValid(type.maxValue()));
    assertThat(owner.getField("TYPE").get(null)).isSameAs(type);
  }

  /**
   * A binding under test, with the nearest finite values outside its bounds (null where the
   * bound is the primitive's own extreme) and further values worth trying.
   */
  static final class Binding<P extends Comparable<? super P>, T> {
    final RefinementType<P, T> type;
    final P below;
    final P above;
    final List<P> samples;

    private Binding(RefinementType<P, T> type, P below, P above, List<P> samples) {
      this.type = type;
      this.below = below;
      this.above = above;
      this.samples = samples;
    }

    static <P extends Comparable<? super P>, T> Binding<P, T> of(
        RefinementType<P, T> type, P below, P above, List<P> samples) {
      return new Binding<>(type, below, above, samples);
    }

    List<P> values() {
      List<P> values = new ArrayList<>();
      values.add(type.minValue());
      values.add(type.maxValue());
      if (below != null) {
        values.add(below);
      }
      if (above != null) {
        values.add(above);
      }
      values.addAll(samples);
      return values;
    }

    @Override
    public String toString() {
      return type.name();
    }
  }
}
