package org.anyvals.numeric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Optional;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RefinementTypeTest {

  private static RefinementType.Builder<Integer, PosInt> positive(String name) {
    return RefinementType.<Integer, PosInt>builder(name, PrimitiveKind.INT)
        .predicate(x -> x > 0)
        .constructor(PosInt::ensuringValid)
        .bounds(1, Integer.MAX_VALUE);
  }

  @Test
  void buildsAWellFormedBinding() {
    RefinementType<Integer, PosInt> type =
        positive("Positive").description("positive (i > 0)").widensTo("PosZInt").build();

    assertThat(type.name()).isEqualTo("Positive");
    assertThat(type.kind()).isEqualTo(PrimitiveKind.INT);
    assertThat(type.wideningTargets()).containsExactly("PosZInt");
    assertThat(type).hasToString("RefinementType(Positive: int, positive (i > 0))");
  }

  @Test
  void rejectsABlankName() {
    assertThatThrownBy(() -> positive(" ").build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Refinement binding has no name");
  }

  @Test
  void rejectsAMissingPredicate() {
    assertThatThrownBy(
            () ->
                RefinementType.<Integer, PosInt>builder("NoPredicate", PrimitiveKind.INT)
                    .constructor(PosInt::ensuringValid)
                    .bounds(1, 2)
                    .build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Malformed refinement binding NoPredicate: has no predicate");
  }

  @Test
  void rejectsBoundsThatFailThePredicate() {
    assertThatThrownBy(() -> positive("Broken").bounds(0, 10).build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Malformed refinement binding Broken: has a MinValue 0 that fails its predicate");
    assertThatThrownBy(() -> positive("Broken").bounds(1, -1).build())
        .hasMessage("Malformed refinement binding Broken: has a MaxValue -1 that fails its predicate");
  }

  @Test
  void rejectsInvertedBounds() {
    assertThatThrownBy(() -> positive("Inverted").bounds(10, 1).build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Malformed refinement binding Inverted: has MinValue 10 above MaxValue 1");
  }

  @Test
  void rejectsBoundsOfTheWrongPrimitive() {
    assertThatThrownBy(
            () ->
                RefinementType.<Integer, PosInt>builder("WrongKind", PrimitiveKind.LONG)
                    .predicate(x -> x > 0)
                    .constructor(PosInt::ensuringValid)
                    .bounds(1, 2)
                    .build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Malformed refinement binding WrongKind: has bounds that are not long values");
  }

  @Test
  void rejectsWideningToItself() {
    assertThatThrownBy(() -> positive("Loop").widensTo("Loop").build())
        .hasMessage("Malformed refinement binding Loop: lists itself as a widening target");
  }

  @ParameterizedTest
  @ValueSource(ints = {Integer.MIN_VALUE, -7, -1, 0, 1, 2, 42, Integer.MAX_VALUE})
  void allConstructionPathsAgree(int raw) {
    boolean valid = PosInt.isValid(raw);
    PosInt fallback = PosInt.of(99);

    Optional<PosInt> from = PosInt.from(raw);
    Or<PosInt, String> good = PosInt.goodOrElse(raw, v -> "bad " + v);
    Validation<String> pass = PosInt.passOrElse(raw, v -> "bad " + v);
    Or<PosInt, AssertionError> trying = PosInt.tryingValid(raw);

    assertThat(from.isPresent()).isEqualTo(valid);
    assertThat(good.isGood()).isEqualTo(valid);
    assertThat(pass.isPass()).isEqualTo(valid);
    assertThat(trying.isGood()).isEqualTo(valid);
    assertThat(PosInt.TYPE.isValid(raw)).isEqualTo(valid);
    if (valid) {
      assertThat(from.get().value()).isEqualTo(raw);
      assertThat(PosInt.ensuringValid(raw).value()).isEqualTo(raw);
      assertThat(PosInt.fromOrElse(raw, fallback).value()).isEqualTo(raw);
      assertThat(good.get()).isEqualTo(from.get());
    } else {
      assertThatThrownBy(() -> PosInt.ensuringValid(raw))
          .isInstanceOf(AssertionError.class)
          .hasMessage(raw + " was not a valid PosInt");
      assertThat(PosInt.fromOrElse(raw, fallback)).isSameAs(fallback);
      assertThat(good.getBad()).isEqualTo("bad " + raw);
      assertThat(pass.error()).isEqualTo("bad " + raw);
      assertThat(trying.getBad()).hasMessage(raw + " was not a valid PosInt");
    }
  }

  @Test
  void bindingsAreIdentifiedByName() {
    assertThat(positive("Same").build()).isEqualTo(positive("Same").build());
    assertThat(positive("Same").build()).isNotEqualTo(positive("Other").build());
  }
}
