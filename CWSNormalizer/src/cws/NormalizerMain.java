package cws;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** Normalizes a script file, or every {@code .txt} file of a directory, into an output dir. */
@Command(
    name = "cws-normalize",
    mixinStandardHelpOptions = true,
    description = "Rewrites Clausewitz script files in canonical form.")
public class NormalizerMain implements Callable<Integer> {
  private static final Logger LOG = LoggerFactory.getLogger(NormalizerMain.class);

  static final int EXIT_FAILED = 1;

  @Spec CommandSpec spec;

  @Parameters(
      index = "0",
      arity = "0..1",
      defaultValue = "docs/millennium-dawn/common/technologies",
      description = "Script file or directory of .txt files (default: ${DEFAULT-VALUE}).")
  File input;

  @Option(
      names = {"-o", "--output-dir"},
      defaultValue = "out/",
      description = "Directory the normalized files are written to (default: ${DEFAULT-VALUE}).")
  File outputDir;

  @Option(
      names = "--indent",
      defaultValue = "\\t",
      description = "Indentation per nesting level; \\t is accepted for a tab (default: tab).")
  String indent;

  @Option(
      names = "--inline-braces",
      negatable = true,
      defaultValue = "true",
      fallbackValue = "true",
      description = "Write short blocks and lists on one line (default: ${DEFAULT-VALUE}).")
  boolean inlineBraces;

  @Option(
      names = "--schema",
      defaultValue = "technologies",
      description = "Document schema: technologies or default (default: ${DEFAULT-VALUE}).")
  String schemaName;

  @Option(names = "--base-vocabulary", description = "Base vocabulary JSON (keywords, triggers).")
  File baseVocabulary;

  @Option(
      names = "--game-vocabulary",
      description = "Game vocabulary JSON (modifiers, effects, triggers, repeatable_keys).")
  File gameVocabulary;

  @Option(names = "--json", description = "Also write the normalized tree as <name>.json.")
  boolean json;

  @Option(names = "--dump-tree", description = "Also write the parse tree as <name>.tree.")
  boolean dumpTree;

  public static void main(String[] args) {
    System.exit(new CommandLine(new NormalizerMain()).execute(args));
  }

  @Override
  public Integer call() {
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();

    DocumentSchema schema =
        Schemas.byName(schemaName)
            .orElseThrow(
                () ->
                    new ParameterException(
                        spec.commandLine(),
                        String.format(
                            "Unknown schema '%s'; expected one of %s",
                            schemaName,
                            Schemas.all().keySet())));
    ImmutableList<File> files = inputFiles();
    FormatterOptions formatterOptions = formatterOptions();

    Vocabulary vocabulary;
    try {
      vocabulary = loadVocabulary();
    } catch (IOException ex) {
      LOG.debug("Could not load vocabulary", ex);
      err.println("ERROR: could not load vocabulary: " + ex.getMessage());
      return EXIT_FAILED;
    }

    if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
      err.println("ERROR: could not create output directory " + outputDir);
      return EXIT_FAILED;
    }

    ScriptPipeline pipeline = new ScriptPipeline(vocabulary, schema, formatterOptions);

    int failed = 0;
    for (File file : files) {
      LOG.info("Normalizing {}", file);
      try {
        for (File written : process(pipeline, file)) {
          out.println("Wrote " + written);
        }
      } catch (ScriptException ex) {
        // Reported once, on the command's error stream.
        LOG.debug("Failed to normalize {}", file, ex);
        err.println(ex.describe());
        failed++;
      } catch (IOException ex) {
        LOG.debug("Failed to normalize {}", file, ex);
        err.println(String.format("ERROR: %s: %s", file, ex.getMessage()));
        failed++;
      }
    }
    out.flush();

    if (failed > 0) {
      err.println(String.format("%d of %d files failed.", failed, files.size()));
      return EXIT_FAILED;
    }
    LOG.info("Normalized {} files into {}", files.size(), outputDir);
    return 0;
  }

  private ImmutableList<File> inputFiles() {
    if (input.isFile()) {
      return ImmutableList.of(input);
    } else if (!input.isDirectory()) {
      throw new ParameterException(spec.commandLine(), "Input does not exist: " + input);
    }

    File[] children = input.listFiles();
    List<File> files =
        children == null
            ? ImmutableList.of()
            : Arrays.stream(children)
                .filter(f -> f.isFile() && f.getName().endsWith(".txt"))
                .sorted(Comparator.comparing(File::getName))
                .collect(Collectors.toList());
    if (files.isEmpty()) {
      throw new ParameterException(
          spec.commandLine(), "No .txt files found in directory " + input);
    }
    return ImmutableList.copyOf(files);
  }

  private FormatterOptions formatterOptions() {
    try {
      return FormatterOptions.builder()
          .setIndent(indent.replace("\\t", "\t"))
          .setInlineBraces(inlineBraces)
          .build();
    } catch (IllegalArgumentException ex) {
      throw new ParameterException(
          spec.commandLine(), "Invalid value for option '--indent': " + ex.getMessage(), ex);
    }
  }

  private Vocabulary loadVocabulary() throws IOException {
    if (baseVocabulary == null && gameVocabulary == null) {
      return VocabularyLoader.loadDefaults();
    } else if (baseVocabulary == null || gameVocabulary == null) {
      throw new ParameterException(
          spec.commandLine(), "--base-vocabulary and --game-vocabulary must be given together");
    }
    return VocabularyLoader.load(baseVocabulary, gameVocabulary);
  }

  // Everything is rendered before anything is written, so a failing file leaves no output.
  private ImmutableList<File> process(ScriptPipeline pipeline, File file)
      throws ScriptException, IOException {
    String text = Files.asCharSource(file, StandardCharsets.UTF_8).read();
    ScriptPipeline.Result result = pipeline.run(file.toString(), text);

    String baseName = Files.getNameWithoutExtension(file.getName());
    ImmutableMap.Builder<File, String> outputs = ImmutableMap.builder();
    outputs.put(new File(outputDir, file.getName()), result.text());
    if (json) {
      outputs.put(
          new File(outputDir, baseName + ".json"), NormalizedJsonWriter.write(result.document()));
    }
    if (dumpTree) {
      outputs.put(
          new File(outputDir, baseName + ".tree"), ParseTreePrinter.print(result.parseTree()));
    }

    ImmutableList.Builder<File> written = ImmutableList.builder();
    for (Map.Entry<File, String> output : outputs.build().entrySet()) {
      Files.asCharSink(output.getKey(), StandardCharsets.UTF_8).write(output.getValue());
      written.add(output.getKey());
    }
    return written.build();
  }
}
