package io.clarity.shell;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

/** Tests for the non-interactive subcommands. */
class MainTest {

  private static final String PROGRAM =
      "fn add(a: Int, b: Int) -> Int {\n"
          + "  return a + b\n"
          + "}\n"
          + "let total = add(2, 3)\n"
          + "if total > 4 { println(\"big\") } else { println(\"small\") }\n"
          + "total\n";

  @TempDir Path tempDir;

  private ByteArrayOutputStream outContent;
  private ByteArrayOutputStream errContent;
  private PrintStream originalOut;
  private PrintStream originalErr;

  @BeforeEach
  void setUp() {
    outContent = new ByteArrayOutputStream();
    errContent = new ByteArrayOutputStream();
    originalOut = System.out;
    originalErr = System.err;
    System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
    System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
  }

  @AfterEach
  void tearDown() {
    System.setOut(originalOut);
    System.setErr(originalErr);
  }

  private int execute(String... args) {
    return new CommandLine(new Main()).execute(args);
  }

  private String getOutput() {
    return outContent.toString(StandardCharsets.UTF_8);
  }

  private String getError() {
    return errContent.toString(StandardCharsets.UTF_8);
  }

  private Path write(String name, String content) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  // ==================== run ====================

  @Test
  void runPrintsOutputAndResult() throws IOException {
    Path file = write("prog.clarity", PROGRAM);

    int exitCode = execute("run", file.toString());

    assertEquals(0, exitCode, getError());
    String output = getOutput();
    assertTrue(output.contains("big"), output);
    assertTrue(output.contains("Program returned: 5"), output);
  }

  @Test
  void runQuietSuppressesResult() throws IOException {
    Path file = write("quiet.clarity", "let x = 1");

    assertEquals(0, execute("run", "-q", file.toString()));
    assertFalse(getOutput().contains("Program returned"));
  }

  @Test
  void runReportsRuntimeErrors() throws IOException {
    Path file = write("div.clarity", "10 / 0");

    int exitCode = execute("run", file.toString());

    assertEquals(1, exitCode);
    assertTrue(getError().contains("ArithmeticError: Division by zero at 1:0"), getError());
  }

  @Test
  void runReportsSyntaxErrors() throws IOException {
    Path file = write("bad.clarity", "let = 1");

    assertEquals(1, execute("run", file.toString()));
    assertTrue(getError().contains("SyntaxError: Expected IDENTIFIER"), getError());
  }

  @Test
  void missingFileIsReported() {
    Path missing = tempDir.resolve("nope.clarity");

    assertEquals(1, execute("run", missing.toString()));
    assertTrue(getError().contains("Error: File not found: " + missing), getError());
  }

  // ==================== tokens / knowledge ====================

  @Test
  void tokensListsTheTokenStream() throws IOException {
    Path file = write("t.clarity", "let x = 1");

    assertEquals(0, execute("tokens", file.toString()));
    String output = getOutput();
    assertTrue(output.contains("LET 'let' 1:0"), output);
    assertTrue(output.contains("EOF '' 1:9"), output);
  }

  @Test
  void tokensInKnowledgeFlavor() throws IOException {
    Path file = write("t.boc", "belief confidence=0.9 {}");

    assertEquals(0, execute("tokens", "--knowledge", file.toString()));
    assertTrue(getOutput().contains("NUMBER '0.9' 1:18"), getOutput());
  }

  @Test
  void knowledgePrintsCanonicalForm() throws IOException {
    Path file = write("k.boc", "intent to_perform: \"ship\" @urgent(true) {owner: a, 'x'}");

    assertEquals(0, execute("knowledge", file.toString()));
    assertEquals(
        "intent to_perform: \"ship\" @urgent {\n    owner: a\n    \"x\"\n}\n",
        getOutput().replace("\r\n", "\n"));
  }

  @Test
  void knowledgeSyntaxErrorExitsWithOne() throws IOException {
    Path file = write("k.boc", "belief {");

    assertEquals(1, execute("knowledge", file.toString()));
    assertTrue(getError().contains("SyntaxError"), getError());
  }

  // ==================== translate / reverse ====================

  @Test
  void translatePrintsEnvelope() throws IOException {
    Path file = write("prog.clarity", PROGRAM);

    assertEquals(0, execute("translate", file.toString()));
    JsonObject envelope = JsonParser.parseString(getOutput()).getAsJsonObject();
    assertTrue(envelope.has("boc_representation"));
    assertTrue(envelope.getAsJsonObject("proof").has("proof_hash"));
    assertEquals(
        "structured_knowledge.components[0]",
        envelope.getAsJsonObject("source_map").get("1:0").getAsString());
  }

  @Test
  void translateAsDialectText() throws IOException {
    Path file = write("prog.clarity", PROGRAM);

    assertEquals(0, execute("translate", "--dialect", file.toString()));
    assertTrue(getOutput().startsWith("structured_knowledge @program {"), getOutput());
    assertTrue(getOutput().contains("belief confidence=0.95 @component(1) {"), getOutput());
  }

  @Test
  void translateThenReverseVerifies() throws IOException {
    Path source = write("prog.clarity", PROGRAM);
    Path envelope = tempDir.resolve("prog.json");

    assertEquals(0, execute("translate", source.toString(), "-o", envelope.toString()));
    assertTrue(Files.exists(envelope));
    assertTrue(getOutput().contains("Wrote " + envelope), getOutput());

    outContent.reset();
    int exitCode = execute("reverse", envelope.toString(), "--source", source.toString());

    assertEquals(0, exitCode, getError());
    String output = getOutput();
    assertTrue(output.contains("fn add(a: Int, b: Int) -> Int {"), output);
    assertTrue(output.contains("Verification passed: true"), output);
    assertTrue(output.contains("Confidence level: 0.95"), output);
  }

  @Test
  void reverseWithSeparateProofFileAsJson() throws IOException {
    Path source = write("prog.clarity", PROGRAM);
    Path envelopePath = tempDir.resolve("prog.json");
    assertEquals(0, execute("translate", source.toString(), "-o", envelopePath.toString()));
    JsonObject envelope =
        JsonParser.parseString(Files.readString(envelopePath)).getAsJsonObject();
    Path doc = write("doc.json", Main.GSON.toJson(envelope.get("boc_representation")));
    Path proof = write("proof.json", Main.GSON.toJson(envelope.get("proof")));

    outContent.reset();
    assertEquals(0, execute("reverse", doc.toString(), "-p", proof.toString(), "--json"));

    JsonObject result = JsonParser.parseString(getOutput()).getAsJsonObject();
    assertTrue(
        result.getAsJsonObject("verification_result").get("verification_passed").getAsBoolean());
    assertTrue(result.get("clarity_code").getAsString().contains("fn add("));
  }

  @Test
  void reverseOfTamperedEnvelopeFails() throws IOException {
    Path source = write("prog.clarity", PROGRAM);
    Path envelopePath = tempDir.resolve("prog.json");
    assertEquals(0, execute("translate", source.toString(), "-o", envelopePath.toString()));
    JsonObject envelope =
        JsonParser.parseString(Files.readString(envelopePath)).getAsJsonObject();
    envelope.getAsJsonObject("boc_representation").getAsJsonObject("intent")
        .addProperty("deadline", "now");
    Files.writeString(envelopePath, Main.GSON.toJson(envelope));

    outContent.reset();
    assertEquals(1, execute("reverse", envelopePath.toString()));
    assertTrue(getOutput().contains("Verification passed: false"), getOutput());
    assertTrue(getOutput().contains("failure: target hash mismatch"), getOutput());
  }

  @Test
  void reverseWithoutProofSkipsVerification() throws IOException {
    Path source = write("prog.clarity", "let a = 1");
    Path envelopePath = tempDir.resolve("a.json");
    assertEquals(0, execute("translate", source.toString(), "-o", envelopePath.toString()));
    JsonObject envelope =
        JsonParser.parseString(Files.readString(envelopePath)).getAsJsonObject();
    Path doc = write("doc.json", Main.GSON.toJson(envelope.get("boc_representation")));

    outContent.reset();
    assertEquals(0, execute("reverse", doc.toString()));
    assertFalse(getOutput().contains("Verification passed"));
    assertTrue(getOutput().contains("confidence that variable_a_initialized = 1"), getOutput());
  }

  @Test
  void reverseRejectsNonObjectJson() throws IOException {
    Path doc = write("list.json", "[1, 2]");

    assertEquals(1, execute("reverse", doc.toString()));
    assertTrue(getError().contains("Expected a JSON object"), getError());
  }

  @Test
  void unknownSubcommandIsAUsageError() {
    assertNotEquals(0, execute("frobnicate"));
  }
}
