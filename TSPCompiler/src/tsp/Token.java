package tsp;

import java.util.Locale;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Token {
  public enum Kind {
    ENTITY_START,
    ENTITY_TYPE,
    ENTITY_END,
    ENTITY_PARAM_DELIM,
    ENTITY_PARAM_ASSIGN,
    ENTITY_STATE_DELIM,
    ENTITY_STATE_ASSIGN,
    SET_OPEN,
    SET_CLOSE,
    WORD,
    PHRASE,
    KEYWORD,
    PARAGRAPH,
    NEWLINES,
    WHITESPACE,
    INLINE_DELIM,
    MACRO_OPEN,
    MACRO_CLOSE,
    MACRO_END,
    OPTION_OPEN,
    OPTION_CLOSE,
    MACRO_SETTING,
    MACRO_SETTING_DELIM,
    MACRO_SETTING_ASSIGN,
    MACRO_SETTING_END,
    NUMBER,
    BOOLEAN,
    LOGOP,
    RELOP,
    ASSIGNOP,
    HOTLINK_OPEN,
    HOTLINK_CLOSE,
    ITEM_OPEN,
    ITEM_CLOSE,
    SCENERY_DELIMITER,
    ENTITY_REF_DELIMITER,
    TO_STRING,
    EOF,
  }

  public abstract Kind kind();

  // As written in the source.
  public abstract String text();

  public abstract Tokenizer.Pos pos();

  // Identifiers, tags and operators are case-insensitive; prose keeps its case.
  public String value() {
    return kind() == Kind.PARAGRAPH ? text() : text().toLowerCase(Locale.ROOT);
  }

  public boolean is(Kind... kinds) {
    for (Kind kind : kinds) {
      if (kind() == kind) return true;
    }
    return false;
  }

  public static Token create(Kind kind, String text, Tokenizer.Pos pos) {
    return new AutoValue_Token(kind, text, pos);
  }

  @Override
  public String toString() {
    return String.format("%s '%s'", kind(), text());
  }
}
