package tsp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

public class CompilerOptionsTest {
  @Test
  public void defaultsComeFromReferenceConf() {
    CompilerOptions options = CompilerOptions.load();

    assertThat(options.sourceExtension()).isEqualTo(".tsp");
    assertThat(options.maxReportedDiagnostics()).isEqualTo(40);
    assertThat(options.correctSentenceSpacing()).isTrue();
    assertThat(options.prettyPrint()).isTrue();
  }

  @Test
  public void overridesFallBackToDefaults() {
    CompilerOptions options =
        CompilerOptions.from(
            ConfigFactory.parseString("tsp.compiler { max-reported-diagnostics = 5 }")
                .withFallback(ConfigFactory.defaultReference()));

    assertThat(options.maxReportedDiagnostics()).isEqualTo(5);
    assertThat(options.sourceExtension()).isEqualTo(".tsp");
  }

  @Test
  public void missingSectionIsRejected() {
    assertThrows(ConfigException.Missing.class, () -> CompilerOptions.from(ConfigFactory.empty()));
  }
}
