package org.anyvals;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class OrTest {

  @Test
  void goodCarriesTheValue() {
    Or<Integer, String> or = Or.good(42);

    assertThat(or.isGood()).isTrue();
    assertThat(or.isBad()).isFalse();
    assertThat(or.get()).isEqualTo(42);
    assertThat(or.toOptional()).contains(42);
    assertThat(or).hasToString("Good(42)");
    assertThatThrownBy(or::getBad).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void badCarriesTheError() {
    Or<Integer, String> or = Or.bad("nope");

    assertThat(or.isBad()).isTrue();
    assertThat(or.getBad()).isEqualTo("nope");
    assertThat(or.toOptional()).isEmpty();
    assertThat(or.getOrElse(7)).isEqualTo(7);
    assertThat(or).hasToString("Bad(nope)");
    assertThatThrownBy(or::get).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void mapsOnlyTheMatchingSide() {
    Or<Integer, String> good = Or.good(2);
    Or<Integer, String> bad = Or.bad("x");

    assertThat(good.map(v -> v * 10)).isEqualTo(Or.good(20));
    assertThat(bad.map(v -> v * 10)).isEqualTo(Or.bad("x"));
    assertThat(good.badMap(String::length)).isEqualTo(Or.good(2));
    assertThat(bad.badMap(String::length)).isEqualTo(Or.bad(1));
  }

  @Test
  void foldsEitherSide() {
    Or<Integer, String> good = Or.good(2);
    Or<Integer, String> bad = Or.bad("xyz");

    assertThat(good.fold(v -> v + 1, String::length)).isEqualTo(3);
    assertThat(bad.fold(v -> v + 1, String::length)).isEqualTo(3);
  }

  @Test
  void goodAndBadAreNeverEqual() {
    assertThat(Or.<String, String>good("a")).isNotEqualTo(Or.<String, String>bad("a"));
    assertThat(Or.good("a").hashCode()).isEqualTo(Or.good("a").hashCode());
  }
}
