package tsp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.Sets;

public class GrammarTest {
  @Test
  public void ifIsAStructuredFlowController() {
    Shape shape = Grammar.shapeOf("if").get();

    assertThat(shape.type()).isEqualTo(CommandType.MACRO);
    assertThat(shape.isStructured()).isTrue();
    assertThat(shape.flowController()).isTrue();
    assertThat(shape.leadin()).isTrue();
    assertThat(shape.requires(Property.COND)).isTrue();
    assertThat(Grammar.validOptionTags("if")).containsExactly("elseif", "else").inOrder();
  }

  @Test
  public void optionsAreScopedToTheirParent() {
    Shape intro = Grammar.optionShapeOf("chain", "intro").get();

    assertThat(intro.type()).isEqualTo(CommandType.OPTION);
    assertThat(intro.placement()).hasValue(Placement.FIRST);
    assertThat(intro.isRequiredOption()).isFalse();
    Shape clink = Grammar.optionShapeOf("chain", "clink").get();
    assertThat(clink.placement()).hasValue(Placement.REPEATABLE);
    assertThat(clink.isRequiredOption()).isTrue();
    assertThat(Grammar.optionShapeOf("if", "intro")).isEmpty();
    assertThat(Grammar.shapeOf("intro")).isEmpty();
  }

  @Test
  public void shapeOfPrefersTheParentsOption() {
    assertThat(Grammar.shapeOf("else", Optional.of("if")).get().placement())
        .hasValue(Placement.LAST);
    assertThat(Grammar.shapeOf("description", Optional.of("if")).get().flowOrDefault())
        .isEqualTo(Flow.BLOCK);
    assertThat(Grammar.shapeOf("else", Optional.empty())).isEmpty();
  }

  @Test
  public void unknownTagIsFatal() {
    CompilerException ex =
        assertThrows(
            CompilerException.class, () -> Grammar.requireShape("bogus", SourceFixtures.POS));

    assertThat(ex.errorMsg()).isEqualTo("Undefined command definition: [bogus]");
  }

  @Test
  public void commandAndOptionTagsAreDisjoint() {
    assertThat(Grammar.isOptionTag("else")).isTrue();
    assertThat(Grammar.isOptionTag("if")).isFalse();
    assertThat(Sets.intersection(Grammar.commandTags(), Grammar.optionTags())).isEmpty();
    assertThat(Grammar.validOptionTags("goto")).isEmpty();
  }

  @Test
  public void settingsDefaultsAreTyped() {
    Shape play = Grammar.shapeOf("play").get();

    assertThat(play.settings().get())
        .containsExactly("loop", false, "fade", 0L, "volume", 1L)
        .inOrder();
    assertThat(play.declares(Property.SETTINGS)).isTrue();
    assertThat(Grammar.shapeOf("goto").get().declares(Property.SETTINGS)).isFalse();
  }

  @Test
  public void interactBelongsToNpcs() {
    assertThat(Grammar.shapeOf("interact").get().entityContainer()).hasValue(EntityType.NPC);
    assertThat(Grammar.shapeOf("if").get().entityContainer()).isEmpty();
  }
}
