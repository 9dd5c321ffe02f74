package tsp;

import com.google.auto.value.AutoValue;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/** Compiler settings, read from the {@code tsp.compiler} section of the configuration. */
@AutoValue
public abstract class CompilerOptions {
  private static final String ROOT = "tsp.compiler";

  // Files with this extension are compiled when a directory is given.
  public abstract String sourceExtension();

  public abstract int maxReportedDiagnostics();

  public abstract boolean correctSentenceSpacing();

  public abstract boolean prettyPrint();

  public static CompilerOptions load() {
    return from(ConfigFactory.load());
  }

  public static CompilerOptions from(Config config) {
    Config compiler = config.getConfig(ROOT);
    return new AutoValue_CompilerOptions(
        compiler.getString("source-extension"),
        compiler.getInt("max-reported-diagnostics"),
        compiler.getBoolean("correct-sentence-spacing"),
        compiler.getBoolean("pretty-print"));
  }
}
