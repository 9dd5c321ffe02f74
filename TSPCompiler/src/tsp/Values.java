package tsp;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;

/** Typing of the primitive values written in source: flags, variables and settings. */
final class Values {
  private static final ImmutableSet<String> TRUE = ImmutableSet.of("true", "yes", "on");
  private static final ImmutableSet<String> FALSE = ImmutableSet.of("false", "no", "off");
  private static final Pattern NUMERIC = Pattern.compile("-?(?:\\d+\\.?\\d*|\\.\\d+)");

  static boolean isBooleanLiteral(String text) {
    return parseBoolean(text).isPresent();
  }

  static Optional<Boolean> parseBoolean(String text) {
    String key = text.trim().toLowerCase(Locale.ROOT);
    if (TRUE.contains(key)) return Optional.of(true);
    if (FALSE.contains(key)) return Optional.of(false);
    return Optional.empty();
  }

  static boolean isNumeric(String text) {
    return NUMERIC.matcher(text.trim()).matches();
  }

  // Longs for integral text, doubles otherwise.
  static Optional<Number> parseNumber(String text) {
    String trimmed = text.trim();
    if (!isNumeric(trimmed)) return Optional.empty();
    Long asLong = Longs.tryParse(trimmed);
    if (asLong != null) return Optional.of(asLong);
    return Optional.ofNullable(Doubles.tryParse(trimmed));
  }

  // Boolean literal, then number, else the text itself.
  static Object parsePrimitive(String text) {
    Optional<Boolean> bool = parseBoolean(text);
    if (bool.isPresent()) return bool.get();
    Optional<Number> number = parseNumber(text);
    if (number.isPresent()) return number.get();
    return text;
  }

  // Coerces a setting to the type of its declared default.
  static Object coerceSetting(Optional<Object> declaredDefault, String text) {
    if (declaredDefault.isPresent()) {
      Object def = declaredDefault.get();
      if (def instanceof Boolean) {
        return parseBoolean(text).orElse(false);
      } else if (def instanceof Number) {
        return parseNumber(text).<Object>map(n -> n).orElse(text);
      }
      return text;
    }
    return parsePrimitive(text);
  }

  private Values() {}
}
