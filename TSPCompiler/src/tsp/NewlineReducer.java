package tsp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Drops the source newlines that only end the line of a command producing no running text.
 *
 * <p>Bodies of entities and of block, location and silent commands lose a newline run at either
 * end. Inside any body, a newline run between a command and a following block, structured, silent
 * or flowless node gives up one newline: a single newline is removed, a run of three or more is
 * shortened, and a paragraph break of exactly two is kept. A run that follows text is left alone,
 * so blank lines written after prose survive.
 */
public final class NewlineReducer {
  private static final Logger LOG = LoggerFactory.getLogger(NewlineReducer.class);

  private static final String NEWLINE_TAG = "newline";

  public static ImmutableMap<String, Command> reduceAll(Map<String, Command> entities) {
    ImmutableMap.Builder<String, Command> reduced = ImmutableMap.builder();
    entities.forEach((id, entity) -> reduced.put(id, reduce(entity)));
    return reduced.build();
  }

  public static Command reduce(Command entity) {
    return reduce(entity, Optional.empty());
  }

  private static Command reduce(Command node, Optional<String> parentTag) {
    if (node.isText() || !(node.hasBody() || node.hasLeadin())) {
      return node;
    }
    Optional<Flow> flow = Grammar.shapeOf(node.tag(), parentTag).flatMap(Shape::flow);
    Command.Builder builder = node.toBuilder();
    if (node.hasBody()) {
      builder.setBody(reduceChildren(node, node.body(), flow));
    }
    if (node.hasLeadin()) {
      builder.setLeadin(reduceChildren(node, node.leadin(), flow));
    }
    return builder.build();
  }

  private static ImmutableList<Command> reduceChildren(
      Command node, List<Command> original, Optional<Flow> flow) {
    List<Command> children = new ArrayList<>(original);
    if (trimsEnds(flow)) {
      if (!children.isEmpty() && isNewline(children.get(0))) {
        LOG.debug("{}: removed leading newline in [{}]", node.pos(), node.tag());
        children.remove(0);
      }
      if (!children.isEmpty() && isNewline(children.get(children.size() - 1))) {
        LOG.debug("{}: removed trailing newline in [{}]", node.pos(), node.tag());
        children.remove(children.size() - 1);
      }
    }

    boolean[] removed = new boolean[children.size()];
    for (int i = 0; i < children.size(); i++) {
      Command child = children.get(i);
      if (i > 0 && eatsNewline(child, node.tag()) && isNewline(children.get(i - 1))) {
        if (i < 2 || children.get(i - 2).type() != CommandType.TEXT) {
          Command newline = children.get(i - 1);
          String text = newline.text().get();
          if (text.length() == 1) {
            removed[i - 1] = true;
          } else if (text.length() > 2) {
            children.set(
                i - 1,
                newline.toBuilder().setText(text.substring(0, text.length() - 1)).build());
          }
        }
      }
      children.set(i, reduce(child, Optional.of(node.tag())));
    }

    ImmutableList.Builder<Command> out = ImmutableList.builder();
    for (int i = 0; i < children.size(); i++) {
      if (!removed[i]) {
        out.add(children.get(i));
      }
    }
    return out.build();
  }

  private static boolean trimsEnds(Optional<Flow> flow) {
    return !flow.isPresent()
        || flow.get() == Flow.NONE
        || flow.get() == Flow.BLOCK
        || flow.get() == Flow.LOCATION;
  }

  private static boolean eatsNewline(Command child, String parentTag) {
    Optional<Flow> flow =
        Grammar.shapeOf(child.tag(), Optional.of(parentTag)).flatMap(Shape::flow);
    return !flow.isPresent()
        || flow.get() == Flow.NONE
        || flow.get() == Flow.STRUCTURED
        || flow.get() == Flow.BLOCK;
  }

  private static boolean isNewline(Command node) {
    return node.isText() && node.tag().equals(NEWLINE_TAG);
  }

  private NewlineReducer() {}
}
