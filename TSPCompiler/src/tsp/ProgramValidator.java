package tsp;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Checks that need every source unit: system and settings singularity, conditional expressions,
 * and the global variables left unresolved while parsing.
 */
public class ProgramValidator extends ErrorCollectingValidator {
  // Options of [settings] that may be given once per program.
  static final ImmutableSet<String> SINGULAR_SETTINGS =
      ImmutableSet.of(
          "start",
          "ifid",
          "tsp_version",
          "app_version",
          "author",
          "language",
          "title",
          "subtitle",
          "summary",
          "copyright");

  static final String DEFAULT_GAME_TITLE = "Game";

  private final CompilationContext context;
  private final ImmutableMap<String, Command> entities;

  private Optional<String> gameTitle = Optional.empty();

  public ProgramValidator(CompilationContext context, Map<String, Command> entities) {
    this.context = context;
    this.entities = ImmutableMap.copyOf(entities);
  }

  public String gameTitle() {
    return gameTitle.orElse(DEFAULT_GAME_TITLE);
  }

  public ImmutableList<Diagnostic> computeErrors() throws CompilerException {
    verifySystemSingularity();
    verifySettings();

    acceptAll(new ConditionalValidator(new Verifier(context)));
    verifyGlobals();

    return errors();
  }

  private void verifySystemSingularity() throws CompilerException {
    boolean found = false;
    for (Command entity : entities.values()) {
      if (!entity.entityType().equals(Optional.of(EntityType.SYSTEM))) continue;
      if (found) {
        throw new CompilerException(
            entity.pos(),
            String.format(
                "There may only be one entity of type 'system': \"%s\" is redundant",
                entity.id().get()));
      }
      found = true;
    }
  }

  private void verifySettings() throws CompilerException {
    Set<String> found = new HashSet<>();
    for (Command entity : entities.values()) {
      for (Command settings : entity.body()) {
        if (settings.type() != CommandType.MACRO || !settings.tag().equals("settings")) continue;

        for (Command setting : settings.body()) {
          if (SINGULAR_SETTINGS.contains(setting.tag()) && !found.add(setting.tag())) {
            throw new CompilerException(
                setting.pos(),
                String.format(
                    "Duplicate setting \"%s\": only one setting of each type permitted",
                    setting.tag()));
          }
          if (setting.tag().equals("title")) {
            gameTitle =
                setting.body().stream()
                    .filter(Command::isText)
                    .map(text -> text.text().get().trim())
                    .filter(text -> !text.isEmpty())
                    .findFirst();
          }
        }
      }
    }
  }

  private void verifyGlobals() {
    for (GlobalVariableRecord global : context.globals()) {
      String id = global.id();
      if (id.equals("this")
          || Verifier.BUILT_IN_ENTITIES.contains(id)
          || Values.isNumeric(id)
          || context.reference(id).isPresent()) {
        continue;
      }

      for (GlobalVariableRecord.Usage usage : global.usages()) {
        if (isParameter(id, usage.entity())) continue;
        logError(
            usage.pos(), String.format("Global Variable \"%s\" is not declared anywhere", id));
      }
    }
  }

  // Function parameters are local variables of the function's body.
  private boolean isParameter(String id, Optional<String> entity) {
    return entity
        .flatMap(context::reference)
        .flatMap(Command::parameters)
        .filter(parameters -> parameters.containsKey(id))
        .isPresent();
  }

  private boolean acceptAll(ErrorCollectingValidator visitor) {
    entities.values().forEach(entity -> entity.accept(visitor, null));
    takeErrors(visitor);
    return !visitor.hasErrors();
  }
}
