package tsp;

import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** Replaces the spaces after a sentence with an en space, so the runtime keeps them visible. */
public class SentenceSpacing {
  private static final Logger LOG = LoggerFactory.getLogger(SentenceSpacing.class);

  private static final Pattern SENTENCE_END = Pattern.compile("(?<!Mrs|Mr|Ms|Dr|St)([.!?]\"?) +");
  private static final String EN_SPACE = "&ensp;";

  private SentenceSpacing() {}

  public static String correct(String text) {
    String result = SENTENCE_END.matcher(text).replaceAll("$1" + EN_SPACE);
    if (!result.equals(text)) {
      LOG.debug("Corrected sentence spacing in: {}", text);
    }
    return result;
  }

  public static ImmutableMap<String, Command> correctAll(Map<String, Command> entities) {
    ImmutableMap.Builder<String, Command> corrected = ImmutableMap.builder();
    entities.forEach((id, entity) -> corrected.put(id, correct(entity)));
    return corrected.build();
  }

  public static Command correct(Command node) {
    if (node.isText()) {
      return node.toBuilder().clear(Property.BODY).setText(correct(node.text().get())).build();
    }
    if (!node.hasBody() && !node.hasLeadin()) {
      return node;
    }

    Command.Builder builder = node.toBuilder();
    if (node.hasLeadin()) {
      builder.setLeadin(correctEach(node.leadin()));
    }
    if (node.hasBody()) {
      builder.setBody(correctEach(node.body()));
    }
    return builder.build();
  }

  private static ImmutableList<Command> correctEach(ImmutableList<Command> nodes) {
    return nodes.stream().map(SentenceSpacing::correct).collect(ImmutableList.toImmutableList());
  }
}
