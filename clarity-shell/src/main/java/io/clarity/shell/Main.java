package io.clarity.shell;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.clarity.core.config.TranslatorConfig;
import io.clarity.core.error.ClarityException;
import io.clarity.core.interpreter.Interpreter;
import io.clarity.core.interpreter.Output;
import io.clarity.core.interpreter.Value;
import io.clarity.core.knowledge.KnowledgeParser;
import io.clarity.core.knowledge.KnowledgeWriter;
import io.clarity.core.lexer.Flavor;
import io.clarity.core.lexer.Lexer;
import io.clarity.core.lexer.Token;
import io.clarity.core.translator.ClarityToKnowledgeTranslator;
import io.clarity.core.translator.KnowledgeToClarityTranslator;
import io.clarity.core.translator.ReverseTranslationResult;
import io.clarity.core.translator.TranslationProof;
import io.clarity.core.translator.TranslationResult;
import io.clarity.core.translator.VerificationReport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "clarity",
    description = "Clarity interpreter, knowledge dialect tools and translator",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {
      Main.RunCommand.class,
      Main.TokensCommand.class,
      Main.TranslateCommand.class,
      Main.ReverseCommand.class,
      Main.KnowledgeCommand.class,
      Main.ReplCommand.class
    })
public final class Main implements Callable<Integer> {

  static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping().create();

  @CommandLine.Option(
      names = {"-v", "--verbose"},
      description = "Log translator and interpreter activity to stderr")
  private boolean verbose;

  public static void main(String[] args) {
    for (String arg : args) {
      if ("-v".equals(arg) || "--verbose".equals(arg)) {
        // must be set before the first logger is created
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
      }
    }
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  /** Without a subcommand, start the REPL. */
  @Override
  public Integer call() throws Exception {
    return new ReplCommand().call();
  }

  static String readSource(Path path) throws IOException {
    return Files.readString(path, StandardCharsets.UTF_8);
  }

  static JsonObject readJsonObject(Path path) throws IOException {
    JsonElement element = JsonParser.parseString(readSource(path));
    if (!element.isJsonObject()) {
      throw new JsonParseException("Expected a JSON object in " + path);
    }
    return element.getAsJsonObject();
  }

  /** Runs {@code body}, mapping failures to a message on stderr and exit code 1. */
  static int guarded(Callable<Integer> body) {
    try {
      return body.call();
    } catch (NoSuchFileException e) {
      System.err.println("Error: File not found: " + e.getFile());
    } catch (ClarityException e) {
      System.err.println(e.getMessage());
    } catch (JsonParseException | IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
    } catch (IOException e) {
      System.err.println("Error: " + e.getMessage());
    } catch (Exception e) {
      System.err.println("Error: " + e);
    }
    return 1;
  }

  @CommandLine.Command(name = "run", description = "Parse and execute a Clarity program")
  static final class RunCommand implements Callable<Integer> {
    @CommandLine.Parameters(index = "0", description = "Clarity source file")
    private Path file;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Do not print the program's return value")
    private boolean quiet;

    @Override
    public Integer call() {
      return guarded(
          () -> {
            Interpreter interpreter = new Interpreter(Output.of(System.out));
            Value result = interpreter.run(readSource(file));
            if (!quiet) {
              System.out.println("Program returned: " + result.describe());
            }
            return 0;
          });
    }
  }

  @CommandLine.Command(name = "tokens", description = "Print the token stream of a file")
  static final class TokensCommand implements Callable<Integer> {
    @CommandLine.Parameters(index = "0", description = "Source file")
    private Path file;

    @CommandLine.Option(
        names = {"-k", "--knowledge"},
        description = "Use the knowledge dialect lexer")
    private boolean knowledge;

    @Override
    public Integer call() {
      return guarded(
          () -> {
            Lexer lexer =
                new Lexer(readSource(file), knowledge ? Flavor.KNOWLEDGE : Flavor.SOURCE);
            for (Token token : lexer.tokenize()) {
              System.out.println(token);
            }
            return 0;
          });
    }
  }

  @CommandLine.Command(
      name = "translate",
      description = "Translate a Clarity program into a knowledge document with proof")
  static final class TranslateCommand implements Callable<Integer> {
    @CommandLine.Parameters(index = "0", description = "Clarity source file")
    private Path file;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the JSON envelope to this file instead of stdout")
    private Path output;

    @CommandLine.Option(
        names = {"-d", "--dialect"},
        description = "Print the document as knowledge dialect text")
    private boolean dialect;

    @Override
    public Integer call() {
      return guarded(
          () -> {
            ClarityToKnowledgeTranslator translator =
                new ClarityToKnowledgeTranslator(TranslatorConfig.fromEnvironment());
            TranslationResult result = translator.translate(readSource(file));
            String text =
                dialect ? KnowledgeWriter.write(result.document()) : GSON.toJson(result.toJson());
            if (output != null) {
              Files.writeString(output, text, StandardCharsets.UTF_8);
              System.out.println(
                  "Wrote " + output + " (proof " + result.proof().proofHash() + ")");
            } else {
              System.out.println(text);
            }
            return 0;
          });
    }
  }

  @CommandLine.Command(
      name = "reverse",
      description = "Reconstruct Clarity text from a knowledge document and verify its proof")
  static final class ReverseCommand implements Callable<Integer> {
    @CommandLine.Parameters(
        index = "0",
        description = "Knowledge document, or an envelope written by 'translate'")
    private Path document;

    @CommandLine.Option(
        names = {"-p", "--proof"},
        description = "Proof JSON; defaults to the proof inside an envelope")
    private Path proof;

    @CommandLine.Option(
        names = {"-s", "--source"},
        description = "Original Clarity source, to check its hash and structure")
    private Path source;

    @CommandLine.Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Override
    public Integer call() {
      return guarded(
          () -> {
            JsonObject input = readJsonObject(document);
            JsonObject doc = input;
            TranslationProof p = null;
            if (input.has("boc_representation") && input.get("boc_representation").isJsonObject()) {
              doc = input.getAsJsonObject("boc_representation");
              if (input.has("proof") && input.get("proof").isJsonObject()) {
                p = TranslationProof.fromJson(input.getAsJsonObject("proof"));
              }
            }
            if (proof != null) {
              p = TranslationProof.fromJson(readJsonObject(proof));
            }
            String sourceText = source == null ? null : readSource(source);

            KnowledgeToClarityTranslator translator =
                new KnowledgeToClarityTranslator(TranslatorConfig.fromEnvironment());
            ReverseTranslationResult result = translator.reverse(doc, p, sourceText);
            if (json) {
              System.out.println(GSON.toJson(result.toJson()));
            } else {
              System.out.print(result.reconstructedText());
              result.verification().ifPresent(ReverseCommand::printReport);
            }
            return result.verification().map(r -> r.passed() ? 0 : 1).orElse(0);
          });
    }

    private static void printReport(VerificationReport report) {
      System.out.println();
      System.out.println("Verification passed: " + report.passed());
      System.out.println("Confidence level: " + report.confidenceLevel());
      report.failures().forEach(f -> System.out.println("  failure: " + f));
      report.differences().forEach(d -> System.out.println("  difference: " + d));
    }
  }

  @CommandLine.Command(
      name = "knowledge",
      description = "Parse knowledge dialect text and print it in canonical form")
  static final class KnowledgeCommand implements Callable<Integer> {
    @CommandLine.Parameters(index = "0", description = "Knowledge dialect file")
    private Path file;

    @Override
    public Integer call() {
      return guarded(
          () -> {
            System.out.print(KnowledgeWriter.write(KnowledgeParser.parse(readSource(file))));
            return 0;
          });
    }
  }

  @CommandLine.Command(name = "repl", description = "Interactive Clarity session")
  static final class ReplCommand implements Callable<Integer> {
    @Override
    public Integer call() throws Exception {
      try (Repl repl = new Repl()) {
        repl.run();
        return 0;
      }
    }
  }
}
