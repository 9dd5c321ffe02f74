package tsp;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** A read position over a tokenized source unit. */
public class TokenCursor {
  private final ImmutableList<Token> tokens;
  private int index = 0;

  public TokenCursor(List<Token> tokens) {
    Preconditions.checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).is(Token.Kind.EOF),
        "Token stream must end with EOF");
    this.tokens = ImmutableList.copyOf(tokens);
  }

  public void reset() {
    index = 0;
  }

  public Token peek() {
    return tokens.get(index);
  }

  // Clamped to the EOF token.
  public Token lookAhead(int offset) {
    return tokens.get(Math.min(index + offset, tokens.size() - 1));
  }

  public Token lookBehind() {
    Preconditions.checkState(index > 0, "Nothing consumed yet");
    return tokens.get(index - 1);
  }

  public Tokenizer.Pos pos() {
    return peek().pos();
  }

  public boolean isAtEnd() {
    return peek().is(Token.Kind.EOF);
  }

  public boolean check(Token.Kind... kinds) {
    return !isAtEnd() && peek().is(kinds);
  }

  public Token advance() {
    Token token = peek();
    if (!isAtEnd()) {
      index++;
    }
    return token;
  }

  public boolean match(Token.Kind... kinds) {
    if (check(kinds)) {
      advance();
      return true;
    }
    return false;
  }

  public Token consume(String what, Token.Kind... kinds) throws CompilerException {
    if (check(kinds)) {
      return advance();
    }
    throw error(String.format("Expecting (%s), but found %s", what, describe(peek())));
  }

  // Skips to just past the next token of the given kind.
  public Token seek(String what, Token.Kind kind) throws CompilerException {
    while (!isAtEnd()) {
      Token token = advance();
      if (token.is(kind)) {
        return token;
      }
    }
    throw error(String.format("%s: reached the end of %s", what, peek().pos().file()));
  }

  public CompilerException error(String msg) {
    return new CompilerException(pos(), msg);
  }

  static String describe(Token token) {
    return String.format("%s '%s'", token.kind(), token.value());
  }
}
