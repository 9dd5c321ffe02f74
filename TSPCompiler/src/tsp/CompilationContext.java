package tsp;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * State shared by every stage of one compilation: synthetic ids, diagnostics, the program-wide
 * reference map and the deferred global variable records. Create one per compilation.
 */
public class CompilationContext {
  private final Diagnostics diagnostics = new Diagnostics();
  private final Map<String, Command> references = new LinkedHashMap<>();
  private final Map<String, GlobalVariableRecord> globals = new LinkedHashMap<>();
  private int uidCounter = 0;

  public Diagnostics diagnostics() {
    return diagnostics;
  }

  public String nextUid() {
    return String.format("%05d", uidCounter++);
  }

  // Nodes inside an entity carry its uid as a prefix.
  public String nextUid(String prefix) {
    return prefix + "." + nextUid();
  }

  // Adds one unit's entity headers to the program's references; ids are unique program-wide.
  public void addReferences(Map<String, Command> unitReferences) throws CompilerException {
    for (Map.Entry<String, Command> entry : unitReferences.entrySet()) {
      Command original = references.get(entry.getKey());
      if (original != null) {
        throw duplicateEntity(entry.getKey(), original, entry.getValue());
      }
    }
    references.putAll(unitReferences);
  }

  static CompilerException duplicateEntity(String id, Command original, Command duplicate) {
    return new CompilerException(
        duplicate.pos(),
        String.format(
            "Duplicate key \"%s\" encountered. Original located at %s. Decide which to keep or"
                + " change.",
            id, original.pos()));
  }

  public Optional<Command> reference(String id) {
    return Optional.ofNullable(references.get(id));
  }

  public void recordGlobal(String id, Tokenizer.Pos pos, Optional<String> entity) {
    globals
        .computeIfAbsent(id, GlobalVariableRecord::new)
        .addUsage(GlobalVariableRecord.Usage.create(pos, entity));
  }

  public boolean isGlobal(String id) {
    return globals.containsKey(id);
  }

  public ImmutableList<GlobalVariableRecord> globals() {
    return ImmutableList.copyOf(globals.values());
  }
}
