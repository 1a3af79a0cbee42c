package org.anyvals;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class ValidationTest {

  @Test
  void passHasNoError() {
    Validation<String> pass = Validation.pass();

    assertThat(pass.isPass()).isTrue();
    assertThat(pass.toOptional()).isEmpty();
    assertThat(pass).hasToString("Pass");
    assertThatThrownBy(pass::error).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void failCarriesTheError() {
    Validation<String> fail = Validation.fail("too small");

    assertThat(fail.isFail()).isTrue();
    assertThat(fail.error()).isEqualTo("too small");
    assertThat(fail.toOptional()).contains("too small");
    assertThat(fail).hasToString("Fail(too small)");
    assertThat(fail).isEqualTo(Validation.fail("too small"));
  }

  @Test
  void andStopsAtTheFirstFailure() {
    Validation<String> first = Validation.fail("first");

    assertThat(first.and(() -> Validation.fail("second")).error()).isEqualTo("first");
    assertThat(Validation.<String>pass().and(() -> Validation.fail("second")).error()).isEqualTo("second");
    assertThat(Validation.<String>pass().and(Validation::pass).isPass()).isTrue();
  }

  @Test
  void mapsTheError() {
    assertThat(Validation.fail("abc").mapError(String::length).error()).isEqualTo(3);
    assertThat(Validation.<String>pass().mapError(String::length).isPass()).isTrue();
  }
}
