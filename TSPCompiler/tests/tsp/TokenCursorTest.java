package tsp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TokenCursorTest {
  private static final Tokenizer.Pos POS = SourceFixtures.POS;

  private static TokenCursor cursor() {
    return new TokenCursor(
        ImmutableList.of(
            Token.create(Token.Kind.MACRO_OPEN, "[", POS),
            Token.create(Token.Kind.WORD, "Goto", POS),
            Token.create(Token.Kind.PHRASE, "cellar", POS),
            Token.create(Token.Kind.MACRO_CLOSE, "]", POS),
            Token.create(Token.Kind.EOF, "", POS)));
  }

  @Test
  public void requiresTrailingEof() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new TokenCursor(ImmutableList.of(Token.create(Token.Kind.WORD, "x", POS))));
  }

  @Test
  public void matchAndConsume() throws CompilerException {
    TokenCursor cursor = cursor();

    assertThat(cursor.match(Token.Kind.WORD)).isFalse();
    assertThat(cursor.match(Token.Kind.MACRO_OPEN)).isTrue();
    assertThat(cursor.consume("tag", Token.Kind.WORD).value()).isEqualTo("goto");
    assertThat(cursor.lookBehind().text()).isEqualTo("Goto");
    assertThat(cursor.lookAhead(1).kind()).isEqualTo(Token.Kind.MACRO_CLOSE);
  }

  @Test
  public void consumeReportsWhatWasFound() {
    TokenCursor cursor = cursor();

    CompilerException ex =
        assertThrows(CompilerException.class, () -> cursor.consume("tag", Token.Kind.WORD));

    assertThat(ex.errorMsg()).isEqualTo("Expecting (tag), but found MACRO_OPEN '['");
  }

  @Test
  public void lookAheadStopsAtEof() {
    assertThat(cursor().lookAhead(100).kind()).isEqualTo(Token.Kind.EOF);
  }

  @Test
  public void advanceNeverPassesEof() {
    TokenCursor cursor = cursor();
    for (int i = 0; i < 10; i++) {
      cursor.advance();
    }

    assertThat(cursor.isAtEnd()).isTrue();
    assertThat(cursor.check(Token.Kind.EOF)).isFalse();
  }

  @Test
  public void seekSkipsPastTheToken() throws CompilerException {
    TokenCursor cursor = cursor();

    cursor.seek("header", Token.Kind.MACRO_CLOSE);

    assertThat(cursor.isAtEnd()).isTrue();
    cursor.reset();
    assertThat(cursor.peek().kind()).isEqualTo(Token.Kind.MACRO_OPEN);
  }

  @Test
  public void seekFailsAtEnd() {
    TokenCursor cursor = cursor();

    CompilerException ex =
        assertThrows(
            CompilerException.class, () -> cursor.seek("Unclosed option", Token.Kind.SET_CLOSE));

    assertThat(ex.errorMsg()).isEqualTo("Unclosed option: reached the end of test.tsp");
  }
}
