package tsp;

import static com.google.common.truth.Truth.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class ValuesTest {
  @Test
  public void booleans() {
    assertThat(Values.parseBoolean("Yes")).hasValue(true);
    assertThat(Values.parseBoolean(" off ")).hasValue(false);
    assertThat(Values.parseBoolean("maybe")).isEmpty();
  }

  @Test
  public void numbers() {
    assertThat(Values.parseNumber("3")).hasValue(3L);
    assertThat(Values.parseNumber("-2.5")).hasValue(-2.5);
    assertThat(Values.parseNumber(".5")).hasValue(0.5);
    assertThat(Values.parseNumber("1e3")).isEmpty();
    assertThat(Values.isNumeric("12a")).isFalse();
  }

  @Test
  public void primitivesFallBackToText() {
    assertThat(Values.parsePrimitive("on")).isEqualTo(true);
    assertThat(Values.parsePrimitive("7")).isEqualTo(7L);
    assertThat(Values.parsePrimitive("hall")).isEqualTo("hall");
    assertThat(Values.parsePrimitive("")).isEqualTo("");
  }

  @Test
  public void settingsFollowTheDeclaredDefault() {
    assertThat(Values.coerceSetting(Optional.of(false), "yes")).isEqualTo(true);
    assertThat(Values.coerceSetting(Optional.of(false), "loud")).isEqualTo(false);
    assertThat(Values.coerceSetting(Optional.of(1L), "2")).isEqualTo(2L);
    assertThat(Values.coerceSetting(Optional.of(1L), "loud")).isEqualTo("loud");
    assertThat(Values.coerceSetting(Optional.of("x"), "5")).isEqualTo("5");
    assertThat(Values.coerceSetting(Optional.empty(), "5")).isEqualTo(5L);
  }
}
