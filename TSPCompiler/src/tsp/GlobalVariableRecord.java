package tsp;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * An identifier used as an id or lval that did not name a known entity when it was first seen.
 * Resolution is deferred until every source unit has been parsed.
 */
public class GlobalVariableRecord {
  @AutoValue
  public abstract static class Usage {
    public abstract Tokenizer.Pos pos();

    // The entity whose body holds the usage, for function parameter lookups.
    public abstract Optional<String> entity();

    public static Usage create(Tokenizer.Pos pos, Optional<String> entity) {
      return new AutoValue_GlobalVariableRecord_Usage(pos, entity);
    }
  }

  private final String id;
  private final List<Usage> usages = new ArrayList<>();

  GlobalVariableRecord(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public Tokenizer.Pos firstSeen() {
    return usages.get(0).pos();
  }

  public ImmutableList<Usage> usages() {
    return ImmutableList.copyOf(usages);
  }

  void addUsage(Usage usage) {
    usages.add(usage);
  }
}
