package tsp;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/** Produces a tokenization of a TaleSpinner source unit. */
public class Tokenizer {
  private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);

  public static class Pos implements Comparable<Pos> {
    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(Pos::file)
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Pos)) return false;
      Pos other = (Pos) obj;
      return file.equals(other.file) && lineNumber == other.lineNumber && column == other.column;
    }

    @Override
    public int hashCode() {
      return Objects.hash(file, lineNumber, column);
    }

    @Override
    public String toString() {
      return String.format("%s:%d", file, lineNumber + 1);
    }
  }

  static final int MAX_LINK_ID_LENGTH = 50;

  private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
  // Not after ':' so that urls survive.
  private static final Pattern LINE_COMMENT = Pattern.compile("(?<!:)//[^\n]*");
  private static final Pattern BLANK_LINE = Pattern.compile("(?m)^[ \\t]+$");

  private static final Pattern LOGOP = Pattern.compile("(?i)(?:andif|and|or)(?![\\w'])");
  private static final Pattern RELOP =
      Pattern.compile(
          "(?i)(?:(?:is|are)(?:\\s+not)?\\s+(?:>=|<=|>|<)"
              + "|(?:is|are)(?:\\s+not)?(?:\\s+in)?(?![\\w'])"
              + "|has(?:\\s+not)?\\s+been(?![\\w']))");
  private static final Pattern ASSIGNOP = Pattern.compile("(?i)(?:to\\s+not|to|into|in)(?![\\w'])");
  private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?(?![\\w'])");
  private static final Pattern BOOLEAN =
      Pattern.compile("(?i)(?:true|false|on|off|yes|no)(?![\\w'])");

  private final String file;
  private final String text;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

  private int index = 0;
  private int line = 0;
  private int column = 0;

  public Tokenizer(String file, String contents) {
    this.file = file;
    this.text = preprocess(contents);
  }

  static String preprocess(String contents) {
    String result = contents.replace("\r\n", "\n").replace('\r', '\n');

    Matcher comments = BLOCK_COMMENT.matcher(result);
    StringBuilder sb = new StringBuilder();
    while (comments.find()) {
      comments.appendReplacement(sb, comments.group().replaceAll("[^\n]", ""));
    }
    comments.appendTail(sb);

    result = LINE_COMMENT.matcher(sb.toString()).replaceAll("");
    result = BLANK_LINE.matcher(result).replaceAll("");
    return result + "\n";
  }

  public ImmutableList<Token> tokenize() throws CompilerException {
    skipWhitespace(true);
    while (!atEnd()) {
      if (!lookingAt("::")) {
        throw error("Expected an entity declaration '::'");
      }
      entityHeader();
      entityBody();
    }
    emit(Token.Kind.EOF, "", pos());

    ImmutableList<Token> result = tokens.build();
    LOG.debug("Tokenized {} into {} tokens", file, result.size());
    return result;
  }

  private Pos pos() {
    return new Pos(file, line, column);
  }

  private CompilerException error(String msg) {
    return new CompilerException(pos(), msg);
  }

  private boolean atEnd() {
    return index >= text.length();
  }

  private char peekChar() {
    return peekChar(0);
  }

  private char peekChar(int offset) {
    int i = index + offset;
    return i < text.length() ? text.charAt(i) : '\0';
  }

  private boolean lookingAt(String s) {
    return text.startsWith(s, index);
  }

  private void advance(int count) {
    for (int i = 0; i < count && !atEnd(); i++) {
      if (text.charAt(index) == '\n') {
        line++;
        column = 0;
      } else {
        column++;
      }
      index++;
    }
  }

  private void emit(Token.Kind kind, String value, Pos pos) {
    tokens.add(Token.create(kind, value, pos));
  }

  private void emitSymbol(Token.Kind kind, String symbol) {
    emit(kind, symbol, pos());
    advance(symbol.length());
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
  }

  private boolean atWordStart() {
    return index == 0 || !isWordChar(text.charAt(index - 1));
  }

  private void skipWhitespace(boolean newlines) {
    while (!atEnd()) {
      char c = peekChar();
      if (c == ' ' || c == '\t' || (newlines && c == '\n')) {
        advance(1);
      } else {
        break;
      }
    }
  }

  // Returns the match length of the pattern at the cursor, or 0.
  private int matchAt(Pattern pattern) {
    Matcher m = pattern.matcher(text);
    m.region(index, text.length());
    return m.lookingAt() ? m.end() - index : 0;
  }

  private String word() {
    int begin = index;
    while (!atEnd() && isWordChar(peekChar())) {
      advance(1);
    }
    return text.substring(begin, index);
  }

  private String scanUntil(String stops) {
    int begin = index;
    while (!atEnd() && stops.indexOf(peekChar()) < 0) {
      advance(1);
    }
    return text.substring(begin, index);
  }

  // :: id --type (attrs)
  private void entityHeader() throws CompilerException {
    emitSymbol(Token.Kind.ENTITY_START, "::");
    skipWhitespace(false);

    Pos idPos = pos();
    int begin = index;
    while (!atEnd() && peekChar() != '\n' && peekChar() != '(' && !lookingAt("--")) {
      advance(1);
    }
    String id = text.substring(begin, index).trim();
    if (id.isEmpty()) {
      throw error("Missing entity id");
    }
    emit(Token.Kind.PHRASE, id, idPos);

    if (!lookingAt("--")) {
      throw error(String.format("Expected '--<type>' after entity id '%s'", id));
    }
    emitSymbol(Token.Kind.ENTITY_TYPE, "--");
    skipWhitespace(false);
    Pos typePos = pos();
    String type = word();
    if (type.isEmpty()) {
      throw error(String.format("Missing entity type for '%s'", id));
    }
    emit(Token.Kind.WORD, type, typePos);

    skipWhitespace(false);
    if (peekChar() == '(') {
      emitSymbol(Token.Kind.SET_OPEN, "(");
      boolean parameters =
          Grammar.shapeOf(type.toLowerCase(Locale.ROOT))
              .flatMap(shape -> shape.presence(Property.ATTRS))
              .filter(presence -> presence == Presence.PARAMETER)
              .isPresent();
      if (parameters) {
        parameterList();
      } else {
        attributeList();
      }
    }

    skipWhitespace(false);
    if (!atEnd() && peekChar() != '\n') {
      throw error(String.format("Unexpected text after declaration of entity '%s'", id));
    }
    emit(Token.Kind.ENTITY_END, "", pos());
  }

  // key: value | key: `inline` | flags: a, b = 3
  private void attributeList() throws CompilerException {
    boolean key = true;
    String lastKey = "";
    while (true) {
      skipWhitespace(true);
      if (atEnd()) {
        throw error("Unterminated entity attribute list");
      }
      Pos start = pos();
      char c = peekChar();
      if (c == ')') {
        emitSymbol(Token.Kind.SET_CLOSE, ")");
        return;
      } else if (c == '|') {
        emitSymbol(Token.Kind.ENTITY_PARAM_DELIM, "|");
        key = true;
      } else if (c == ':' && key) {
        emitSymbol(Token.Kind.ENTITY_PARAM_ASSIGN, ":");
        key = false;
        if (lastKey.equalsIgnoreCase("flags")) {
          stateList();
          key = true;
        }
      } else if (c == '`') {
        inline();
      } else {
        String phrase = scanUntil(key ? "|:)`\n" : "|)`\n").trim();
        emit(Token.Kind.PHRASE, phrase, start);
        if (key) {
          lastKey = phrase;
        }
      }
    }
  }

  // a, b = 3 up to the closing ')' or the next '|'.
  private void stateList() throws CompilerException {
    while (true) {
      skipWhitespace(true);
      if (atEnd()) {
        throw error("Unterminated entity attribute list");
      }
      Pos start = pos();
      char c = peekChar();
      if (c == ')' || c == '|') {
        return;
      } else if (c == ',') {
        emitSymbol(Token.Kind.ENTITY_STATE_DELIM, ",");
      } else if (c == '=') {
        emitSymbol(Token.Kind.ENTITY_STATE_ASSIGN, "=");
      } else {
        emit(Token.Kind.PHRASE, scanUntil(",=)|\n").trim(), start);
      }
    }
  }

  private void parameterList() throws CompilerException {
    stateList();
    if (peekChar() != ')') {
      throw error("Unexpected '|' in parameter list");
    }
    emitSymbol(Token.Kind.SET_CLOSE, ")");
  }

  private void entityBody() throws CompilerException {
    while (!atEnd()) {
      if (column == 0 && lookingAt("::")) {
        return;
      }
      bodyToken();
    }
  }

  private void bodyToken() throws CompilerException {
    Pos start = pos();
    char c = peekChar();
    if (c == '\n') {
      int begin = index;
      while (peekChar() == '\n') {
        advance(1);
      }
      emit(Token.Kind.NEWLINES, text.substring(begin, index), start);
    } else if (c == '^') {
      link(Token.Kind.SCENERY_DELIMITER, "^", Token.Kind.SCENERY_DELIMITER, "^", "scenery link");
    } else if (c == '~') {
      link(Token.Kind.ENTITY_REF_DELIMITER, "~", Token.Kind.ENTITY_REF_DELIMITER, "~", "npc link");
    } else if (c == '{') {
      link(Token.Kind.ITEM_OPEN, "{", Token.Kind.ITEM_CLOSE, "}", "item link");
    } else if (lookingAt("[[")) {
      link(Token.Kind.HOTLINK_OPEN, "[[", Token.Kind.HOTLINK_CLOSE, "]]", "hotlink");
    } else if (lookingAt("[/")) {
      endTag();
    } else if (c == '[') {
      emitSymbol(Token.Kind.MACRO_OPEN, "[");
      tagAndHeader(']', Token.Kind.MACRO_CLOSE, "macro");
    } else if (toStringAhead()) {
      toStringReference();
    } else if (optionAhead()) {
      emitSymbol(Token.Kind.OPTION_OPEN, "<");
      tagAndHeader('>', Token.Kind.OPTION_CLOSE, "option");
    } else {
      textRun();
    }
  }

  private boolean isTextStop() {
    char c = peekChar();
    return c == '\n' || c == '^' || c == '~' || c == '{' || c == '[' || toStringAhead()
        || optionAhead();
  }

  private void textRun() {
    Pos start = pos();
    int begin = index;
    do {
      advance(1);
    } while (!atEnd() && !isTextStop());
    String run = text.substring(begin, index);

    // Trailing blanks before a line break carry no content.
    if (run.isBlank() && (atEnd() || peekChar() == '\n')) {
      emit(Token.Kind.WHITESPACE, run, start);
    } else {
      emit(Token.Kind.PARAGRAPH, run, start);
    }
  }

  private void link(
      Token.Kind openKind, String open, Token.Kind closeKind, String close, String what)
      throws CompilerException {
    emitSymbol(openKind, open);
    skipWhitespace(false);

    Pos idPos = pos();
    int begin = index;
    while (!atEnd() && !lookingAt(close) && peekChar() != '`' && peekChar() != '\n') {
      advance(1);
    }
    String id = text.substring(begin, index).trim();
    if (id.isEmpty()) {
      throw error(String.format("Missing id in %s", what));
    }
    if (id.length() > MAX_LINK_ID_LENGTH) {
      throw new CompilerException(
          idPos,
          String.format("The %s id '%s' exceeds %d characters", what, id, MAX_LINK_ID_LENGTH));
    }
    emit(Token.Kind.KEYWORD, id, idPos);

    skipWhitespace(false);
    if (peekChar() == '`') {
      inline();
      skipWhitespace(false);
    }
    if (!lookingAt(close)) {
      throw error(String.format("Unterminated %s: expected '%s'", what, close));
    }
    emitSymbol(closeKind, close);
  }

  private boolean toStringAhead() {
    return peekChar() == '$' && (peekChar(1) == '(' || isWordChar(peekChar(1)));
  }

  // $(some id) or $id
  private void toStringReference() throws CompilerException {
    Pos start = pos();
    advance(1);
    String id;
    if (peekChar() == '(') {
      advance(1);
      id = scanUntil(")\n").trim();
      if (peekChar() != ')') {
        throw error("Unterminated $( reference");
      }
      advance(1);
    } else {
      id = word();
    }
    if (id.isEmpty()) {
      throw new CompilerException(start, "Missing id in $() reference");
    }
    emit(Token.Kind.TO_STRING, id, start);
  }

  // Only registered option tags open an option; any other '<' is prose.
  private boolean optionAhead() {
    if (peekChar() != '<' || !Character.isLetter(peekChar(1))) {
      return false;
    }
    int end = index + 1;
    while (end < text.length() && isWordChar(text.charAt(end))) {
      end++;
    }
    String tag = text.substring(index + 1, end).toLowerCase(Locale.ROOT);
    int lineEnd = text.indexOf('\n', end);
    int close = text.indexOf('>', end);
    return Grammar.isOptionTag(tag) && close >= 0 && (lineEnd < 0 || close < lineEnd);
  }

  private void endTag() throws CompilerException {
    emitSymbol(Token.Kind.MACRO_END, "[/");
    skipWhitespace(false);
    Pos tagPos = pos();
    String tag = word();
    if (tag.isEmpty()) {
      throw error("Missing tag in closing macro '[/'");
    }
    emit(Token.Kind.WORD, tag, tagPos);
    skipWhitespace(false);
    if (peekChar() != ']') {
      throw error(String.format("Expected ']' to close [/%s", tag));
    }
    emitSymbol(Token.Kind.MACRO_CLOSE, "]");
  }

  // The tag of a macro or option, followed by ids, operators, conditions, settings and inline text.
  private void tagAndHeader(char close, Token.Kind closeKind, String what)
      throws CompilerException {
    skipWhitespace(false);
    Pos tagPos = pos();
    String tag = word();
    if (tag.isEmpty()) {
      throw error(String.format("Missing %s tag", what));
    }
    emit(Token.Kind.WORD, tag, tagPos);

    String phraseStops = close + "(:`\n";
    while (true) {
      skipWhitespace(true);
      if (atEnd()) {
        throw new CompilerException(
            tagPos, String.format("Unterminated %s '%s': expected '%s'", what, tag, close));
      }
      char c = peekChar();
      if (c == close) {
        emitSymbol(closeKind, String.valueOf(close));
        return;
      } else if (c == '(') {
        condition();
      } else if (c == ':') {
        settings(close);
      } else if (c == '`') {
        inline();
      } else if (!operator(true)) {
        phrase(phraseStops);
      }
    }
  }

  // Emits a logical, relational or assignment operator if one starts at the cursor.
  private boolean operator(boolean assignments) {
    if (!atWordStart()) {
      return false;
    }
    Pos start = pos();
    int length;
    Token.Kind kind;
    if ((length = matchAt(LOGOP)) > 0) {
      kind = Token.Kind.LOGOP;
    } else if ((length = matchAt(RELOP)) > 0) {
      kind = Token.Kind.RELOP;
    } else if (assignments && (length = matchAt(ASSIGNOP)) > 0) {
      kind = Token.Kind.ASSIGNOP;
    } else {
      return false;
    }
    String op = text.substring(index, index + length).replaceAll("\\s+", " ");
    advance(length);
    emit(kind, op, start);
    return true;
  }

  private boolean operatorAhead(boolean assignments) {
    return atWordStart()
        && (matchAt(LOGOP) > 0 || matchAt(RELOP) > 0 || (assignments && matchAt(ASSIGNOP) > 0));
  }

  // Words up to a stop character or the next operator.
  private void phrase(String stops) throws CompilerException {
    phrase(stops, true);
  }

  private void phrase(String stops, boolean assignments) throws CompilerException {
    Pos start = pos();
    int begin = index;
    while (!atEnd() && stops.indexOf(peekChar()) < 0) {
      if (index > begin && operatorAhead(assignments)) {
        break;
      }
      advance(1);
    }
    String phrase = text.substring(begin, index).trim();
    if (phrase.isEmpty()) {
      throw new CompilerException(start, String.format("Unexpected '%s'", peekChar()));
    }
    emit(Token.Kind.PHRASE, phrase, start);
  }

  // (lval op rval [and|or|andif ...])
  private void condition() throws CompilerException {
    Pos open = pos();
    emitSymbol(Token.Kind.SET_OPEN, "(");
    while (true) {
      skipWhitespace(true);
      if (atEnd()) {
        throw new CompilerException(open, "Unterminated conditional expression");
      }
      char c = peekChar();
      if (c == ')') {
        emitSymbol(Token.Kind.SET_CLOSE, ")");
        return;
      } else if (c == '`') {
        inline();
      } else if (!operator(false)) {
        phrase(")`\n", false);
      }
    }
  }

  // : key = value, flag
  private void settings(char close) throws CompilerException {
    emitSymbol(Token.Kind.MACRO_SETTING, ":");
    String stops = ",=" + close + "(`\n";
    boolean value = false;
    while (true) {
      skipWhitespace(false);
      Pos start = pos();
      char c = peekChar();
      if (atEnd() || c == close || c == '(' || c == '`' || c == '\n') {
        emit(Token.Kind.MACRO_SETTING_END, "", start);
        return;
      } else if (c == ',') {
        emitSymbol(Token.Kind.MACRO_SETTING_DELIM, ",");
        value = false;
      } else if (c == '=') {
        emitSymbol(Token.Kind.MACRO_SETTING_ASSIGN, "=");
        value = true;
      } else {
        int length;
        if (value && (length = matchAt(NUMBER)) > 0) {
          emit(Token.Kind.NUMBER, text.substring(index, index + length), start);
          advance(length);
        } else if (value && (length = matchAt(BOOLEAN)) > 0) {
          emit(Token.Kind.BOOLEAN, text.substring(index, index + length), start);
          advance(length);
        } else {
          emit(Token.Kind.PHRASE, scanUntil(stops).trim(), start);
        }
        value = false;
      }
    }
  }

  // `inline text`
  private void inline() throws CompilerException {
    Pos open = pos();
    emitSymbol(Token.Kind.INLINE_DELIM, "`");
    skipWhitespace(false);
    Pos start = pos();
    String inline = scanUntil("`\n").trim();
    if (peekChar() != '`') {
      throw new CompilerException(open, "Unterminated inline text: expected '`'");
    }
    if (!inline.isEmpty()) {
      emit(Token.Kind.PARAGRAPH, inline, start);
    }
    emitSymbol(Token.Kind.INLINE_DELIM, "`");
  }
}
