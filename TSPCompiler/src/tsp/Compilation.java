package tsp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * One compilation of a program: source units are added in order, then {@link #finish()} runs the
 * whole-program checks and produces the entities to emit.
 *
 * <p>A fatal error aborts only the unit it occurs in. Entity headers of an aborted unit that were
 * already merged stay visible to later units, but none of its entities are emitted.
 */
public class Compilation {
  private static final Logger LOG = LoggerFactory.getLogger(Compilation.class);

  private final CompilerOptions options;
  private final CompilationContext context = new CompilationContext();
  private final Map<String, Command> entities = new LinkedHashMap<>();
  private final List<String> failedUnits = new ArrayList<>();

  private ImmutableMap<String, Command> result;
  private String gameTitle = ProgramValidator.DEFAULT_GAME_TITLE;

  public Compilation(CompilerOptions options) {
    this.options = options;
  }

  /** Compiles one source unit, returning the diagnostics it produced. */
  public ImmutableList<Diagnostic> addUnit(String name, String source) {
    Preconditions.checkState(result == null, "Compilation already finished");
    int mark = context.diagnostics().size();
    context.diagnostics().addUnit(name);
    try {
      ImmutableList<Token> tokens = new Tokenizer(name, source).tokenize();
      Parser parser = new Parser(context, name, tokens);

      ImmutableMap<String, Command> references = parser.buildReferences();
      context.addReferences(references);
      ImmutableMap<String, Command> parsed = parser.parse(references);

      entities.putAll(
          new WhitespaceNormalizer(context).normalize(NewlineReducer.reduceAll(parsed)));
      LOG.info(
          "{}: {} entities, {} diagnostics",
          name,
          parsed.size(),
          context.diagnostics().size() - mark);
    } catch (CompilerException ex) {
      context.diagnostics().add(ex.toDiagnostic());
      failedUnits.add(name);
      LOG.info("{}: aborted at {}", name, ex.pos());
    }
    return context.diagnostics().since(mark);
  }

  /** Runs the whole-program checks, returning the diagnostics they produced. */
  public ImmutableList<Diagnostic> finish() {
    Preconditions.checkState(result == null, "Compilation already finished");
    int mark = context.diagnostics().size();

    ProgramValidator validator = new ProgramValidator(context, entities);
    try {
      context.diagnostics().addAll(validator.computeErrors());
    } catch (CompilerException ex) {
      context.diagnostics().add(ex.toDiagnostic());
    }
    gameTitle = validator.gameTitle();

    result =
        options.correctSentenceSpacing()
            ? SentenceSpacing.correctAll(entities)
            : ImmutableMap.copyOf(entities);
    LOG.info("Compiled {} entities from '{}'", result.size(), gameTitle);
    return context.diagnostics().since(mark);
  }

  public ImmutableMap<String, Command> entities() {
    Preconditions.checkState(result != null, "Compilation not finished");
    return result;
  }

  public String gameTitle() {
    return gameTitle;
  }

  public Diagnostics diagnostics() {
    return context.diagnostics();
  }

  public ImmutableList<String> failedUnits() {
    return ImmutableList.copyOf(failedUnits);
  }

  public boolean succeeded() {
    return result != null && failedUnits.isEmpty() && !context.diagnostics().hasErrors();
  }

  public String toJson() {
    return new GameFileWriter(options.prettyPrint()).toJson(entities());
  }
}
