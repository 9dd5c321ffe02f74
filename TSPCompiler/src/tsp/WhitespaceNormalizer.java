package tsp;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Rewrites the whitespace of verified entity bodies according to the flow of each command.
 *
 * <p>Block commands are separated from their significant siblings by a paragraph break and have
 * their text trimmed, structured commands drop their whitespace-only text, and location bodies are
 * trimmed at both ends. Whitespace-only text never counts as a sibling when deciding whether a
 * command is first or last, and a block's whitespace-only boundary text is reused as its separator,
 * so normalizing a normalized tree gives an equal tree.
 */
public class WhitespaceNormalizer {
  private static final Logger LOG = LoggerFactory.getLogger(WhitespaceNormalizer.class);

  private static final String PARAGRAPH_BREAK = "\n\n";

  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  private final CompilationContext context;

  public WhitespaceNormalizer(CompilationContext context) {
    this.context = context;
  }

  public ImmutableMap<String, Command> normalize(Map<String, Command> entities) {
    ImmutableMap.Builder<String, Command> normalized = ImmutableMap.builder();
    entities.forEach((id, entity) -> normalized.put(id, normalizeEntity(entity)));
    return normalized.build();
  }

  public Command normalizeEntity(Command entity) {
    return normalize(entity, entity.uid(), Optional.empty(), true, true).orElse(entity);
  }

  private Optional<Command> normalize(
      Command node, String entityUid, Optional<String> parentTag, boolean first, boolean last) {
    Flow flow =
        Grammar.shapeOf(node.tag(), parentTag).map(Shape::flowOrDefault).orElse(Flow.INLINE);
    if (flow == Flow.NONE) {
      return Optional.empty();
    }
    if (!node.hasBody()) {
      return Optional.of(node);
    }

    Command.Builder builder = node.toBuilder();
    if (node.hasLeadin()) {
      builder.setLeadin(normalizeChildren(node.leadin(), entityUid, node.tag()));
    }

    switch (flow) {
      case BLOCK:
        builder.setBody(normalizeBlock(node, entityUid, first, last));
        break;
      case STRUCTURED:
        builder.setBody(normalizeStructured(node, entityUid));
        break;
      case LOCATION:
        builder.setBody(
            trimTrailing(trimLeading(normalizeChildren(node.body(), entityUid, node.tag()))));
        break;
      default:
        builder.setBody(normalizeChildren(node.body(), entityUid, node.tag()));
        break;
    }
    return Optional.of(builder.build());
  }

  private ImmutableList<Command> normalizeChildren(
      List<Command> children, String entityUid, String parentTag) {
    ImmutableList.Builder<Command> out = ImmutableList.builder();
    for (int i = 0; i < children.size(); i++) {
      normalize(
              children.get(i),
              entityUid,
              Optional.of(parentTag),
              isFirstSignificant(children, i),
              isLastSignificant(children, i))
          .ifPresent(out::add);
    }
    return out.build();
  }

  private ImmutableList<Command> normalizeBlock(
      Command node, String entityUid, boolean first, boolean last) {
    List<Command> children = node.body();
    int start = 0;
    int end = children.size();
    ImmutableList.Builder<Command> out = ImmutableList.builder();
    if (!first) {
      if (start < end && isWhitespace(children.get(start))) {
        out.add(withText(children.get(start++), PARAGRAPH_BREAK));
      } else {
        out.add(paragraphBreak(entityUid, node.pos()));
      }
    }
    Optional<Command> trailing = Optional.empty();
    if (!last) {
      if (start < end && isWhitespace(children.get(end - 1))) {
        trailing = Optional.of(withText(children.get(--end), PARAGRAPH_BREAK));
      } else {
        trailing = Optional.of(paragraphBreak(entityUid, node.pos()));
      }
    }

    for (int i = start; i < end; i++) {
      Command child = children.get(i);
      if (child.isText()) {
        String text = WHITESPACE.trimFrom(child.text().get());
        if (!text.isEmpty()) {
          out.add(withText(child, text));
        }
        continue;
      }
      normalize(
              child,
              entityUid,
              Optional.of(node.tag()),
              isFirstSignificant(children, i),
              isLastSignificant(children, i))
          .ifPresent(out::add);
    }
    trailing.ifPresent(out::add);
    return out.build();
  }

  private ImmutableList<Command> normalizeStructured(Command node, String entityUid) {
    List<Command> children = node.body();
    ImmutableList.Builder<Command> out = ImmutableList.builder();
    for (int i = 0; i < children.size(); i++) {
      Command child = children.get(i);
      if (child.isText()) {
        if (!isWhitespace(child)) {
          LOG.warn(
              "{}: text inside structured [{}]: \"{}\"",
              child.pos(),
              node.tag(),
              child.text().get());
          out.add(child);
        }
        continue;
      }
      normalize(
              child,
              entityUid,
              Optional.of(node.tag()),
              isFirstSignificant(children, i),
              isLastSignificant(children, i))
          .ifPresent(out::add);
    }
    return out.build();
  }

  // Trims the leading text of a body, descending through a leading command. Text left empty
  // passes the trim on to its next sibling.
  private static ImmutableList<Command> trimLeading(List<Command> body) {
    if (body.isEmpty()) {
      return ImmutableList.copyOf(body);
    }
    Command head = body.get(0);
    List<Command> rest = body.subList(1, body.size());
    if (head.isText()) {
      String text = WHITESPACE.trimLeadingFrom(head.text().get());
      return ImmutableList.<Command>builder()
          .add(withText(head, text))
          .addAll(text.isEmpty() ? trimLeading(rest) : rest)
          .build();
    }
    if (head.body().isEmpty()) {
      return ImmutableList.copyOf(body);
    }
    return ImmutableList.<Command>builder()
        .add(head.toBuilder().setBody(trimLeading(head.body())).build())
        .addAll(rest)
        .build();
  }

  private static ImmutableList<Command> trimTrailing(List<Command> body) {
    if (body.isEmpty()) {
      return ImmutableList.copyOf(body);
    }
    int lastIndex = body.size() - 1;
    Command tail = body.get(lastIndex);
    List<Command> rest = body.subList(0, lastIndex);
    if (tail.isText()) {
      String text = WHITESPACE.trimTrailingFrom(tail.text().get());
      return ImmutableList.<Command>builder()
          .addAll(text.isEmpty() ? trimTrailing(rest) : rest)
          .add(withText(tail, text))
          .build();
    }
    if (tail.body().isEmpty()) {
      return ImmutableList.copyOf(body);
    }
    return ImmutableList.<Command>builder()
        .addAll(rest)
        .add(tail.toBuilder().setBody(trimTrailing(tail.body())).build())
        .build();
  }

  private static boolean isFirstSignificant(List<Command> siblings, int index) {
    return siblings.subList(0, index).stream().allMatch(WhitespaceNormalizer::isWhitespace);
  }

  private static boolean isLastSignificant(List<Command> siblings, int index) {
    return siblings.subList(index + 1, siblings.size()).stream()
        .allMatch(WhitespaceNormalizer::isWhitespace);
  }

  static boolean isWhitespace(Command node) {
    return node.isText() && WHITESPACE.matchesAllOf(node.text().get());
  }

  private static Command withText(Command node, String text) {
    return node.toBuilder().clear(Property.BODY).setText(text).build();
  }

  private Command paragraphBreak(String entityUid, Tokenizer.Pos pos) {
    return Command.text(context.nextUid(entityUid), PARAGRAPH_BREAK, pos);
  }
}
