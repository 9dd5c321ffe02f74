package tsp;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class CompilerMain {

  public static void main(String[] args) throws IOException {
    if (args.length < 1) {
      System.err.println("Usage: $COMPILER (source_dir | tsp_file...) [game_file.json]");
      System.exit(1);
    }

    // Without an explicit game file, the file is named after the game's title.
    List<String> inputs = Arrays.asList(args);
    Optional<File> gameFile = Optional.empty();
    if (args.length > 1 && args[args.length - 1].endsWith(".json")) {
      inputs = inputs.subList(0, args.length - 1);
      gameFile = Optional.of(new File(args[args.length - 1]));
    }

    CompilerOptions options = CompilerOptions.load();
    List<File> files = ImmutableList.of();
    try {
      files = sourceFiles(inputs, options.sourceExtension(), File::listFiles);
    } catch (CompilerException ex) {
      System.out.println(ex.toDiagnostic().format());
      System.exit(1);
    }
    if (files.isEmpty()) {
      System.out.println("No source files found.");
      System.exit(1);
    }

    Compilation compilation = new Compilation(options);
    for (File f : files) {
      ImmutableList<Diagnostic> unitDiagnostics = compilation.addUnit(f.getName(), read(f));
      unitDiagnostics.stream().map(Diagnostic::format).forEach(System.out::println);
    }
    compilation.finish();

    System.out.println();
    compilation.diagnostics().print(options.maxReportedDiagnostics());
    if (!compilation.failedUnits().isEmpty()) {
      System.out.println("Not compiled: " + String.join(", ", compilation.failedUnits()));
    }

    File out = gameFile.orElse(new File(GameFileWriter.fileNameFor(compilation.gameTitle())));
    new GameFileWriter(options.prettyPrint()).write(compilation.entities(), out);

    if (!compilation.succeeded()) {
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
    }
    System.out.println(
        String.format("Compilation of '%s' succeeded!  Wrote %s", compilation.gameTitle(), out));
  }

  // The lister returns null for a directory it cannot read, as File.listFiles() does.
  static ImmutableList<File> sourceFiles(
      List<String> inputs, String extension, Function<File, File[]> lister)
      throws CompilerException {
    ImmutableList.Builder<File> files = ImmutableList.builder();
    for (String input : inputs) {
      File f = new File(input);
      if (!f.isDirectory()) {
        files.add(f);
        continue;
      }
      File[] children = lister.apply(f);
      if (children == null) {
        throw new CompilerException(
            new Tokenizer.Pos(f.getPath(), 0, 0), "Cannot read source directory");
      }
      Arrays.stream(children)
          .filter(child -> child.isFile() && child.getName().endsWith(extension))
          .sorted(Comparator.comparing(File::getName))
          .forEach(files::add);
    }
    return files.build();
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}
