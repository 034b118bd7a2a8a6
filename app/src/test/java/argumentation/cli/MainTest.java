package argumentation.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {
  @TempDir Path dir;

  private Path mutualAttack;
  private Path oneWayAttack;
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  @BeforeEach
  void writeFrameworks() throws IOException {
    mutualAttack = dir.resolve("mutual.apx");
    Files.writeString(mutualAttack, "arg(a).\narg(b).\natt(a,b).\natt(b,a).\n");
    oneWayAttack = dir.resolve("oneway.apx");
    Files.writeString(oneWayAttack, "arg(a).\narg(b).\natt(a,b).\n");
  }

  @Test
  void answersCredulousAndSkepticalQueries() {
    assertEquals(0, run("-f", mutualAttack.toString(), "-p", "DC-CO", "-a", "a"));
    assertEquals(0, run("solve", "--file", mutualAttack.toString(), "--problem=DS-CO", "-a", "a"));

    assertEquals("YES\nNO\n", stdout());
  }

  @Test
  void missingArgumentValueMeansEmptySet() {
    assertEquals(0, run("-f", oneWayAttack.toString(), "-p", "VE-ST", "-a"));
    assertEquals(0, run("-f", oneWayAttack.toString(), "-p", "VE-ST", "-a", "a"));
    assertEquals(0, run("-p", "VE-CO", "-f", oneWayAttack.toString()));

    assertEquals("NO\nYES\nNO\n", stdout());
  }

  @Test
  void undeclaredArgumentIsAnsweredNo() {
    assertEquals(0, run("-f", oneWayAttack.toString(), "-p", "DS-ST", "-a", "zz"));

    assertEquals("NO\n", stdout());
  }

  @Test
  void unknownProblemIsAnError() {
    assertEquals(Main.EXIT_ERROR, run("-f", oneWayAttack.toString(), "-p", "DC-PR", "-a", "a"));

    assertTrue(stderr().startsWith("Error: Unknown problem: DC-PR"));
    assertEquals("", stdout());
  }

  @Test
  void userErrorsArePrintedOnceOnStandardError() {
    ByteArrayOutputStream logged = new ByteArrayOutputStream();
    PrintStream original = System.err;
    System.setErr(new PrintStream(logged, true, StandardCharsets.UTF_8));
    try {
      assertEquals(Main.EXIT_ERROR, run("-f", oneWayAttack.toString(), "-p", "XX", "-a", "a"));
    } finally {
      System.setErr(original);
    }

    assertTrue(stderr().startsWith("Error: Unknown problem: XX"));
    String log = logged.toString(StandardCharsets.UTF_8);
    assertFalse(log.contains("Unknown problem"), log);
    assertFalse(log.contains("ERROR"), log);
  }

  @Test
  void decisionProblemsTakeOneArgument() {
    assertEquals(Main.EXIT_ERROR, run("-f", mutualAttack.toString(), "-p", "DC-ST", "-a", "a,b"));

    assertTrue(stderr().contains("Only one argument should be specified for the DC-XX problems."));
  }

  @Test
  void reservedArgumentNamesAreRejected() {
    assertEquals(Main.EXIT_ERROR, run("-f", mutualAttack.toString(), "-p", "VE-CO", "-a", "arg"));

    assertTrue(stderr().contains("Unaccepted argument 'arg'"));
  }

  @Test
  void malformedFrameworkIsAnError() throws IOException {
    Path broken = dir.resolve("broken.apx");
    Files.writeString(broken, "arg(a).\natt(a,b).\n");

    assertEquals(Main.EXIT_ERROR, run("-f", broken.toString(), "-p", "VE-CO", "-a", "a"));
    assertTrue(stderr().contains("Line 2"));
  }

  @Test
  void missingFileIsAnError() {
    assertEquals(
        Main.EXIT_ERROR, run("-f", dir.resolve("nope.apx").toString(), "-p", "VE-CO", "-a", "a"));
    assertTrue(stderr().startsWith("Error: "));
  }

  @Test
  void jsonReportCarriesTheAnswer() {
    assertEquals(
        0, run("-f", mutualAttack.toString(), "-p", "DC-ST", "-a", "b", "--json", "--parallel"));

    JsonObject report = JsonParser.parseString(stdout()).getAsJsonObject();
    assertEquals("YES", report.get("answer").getAsString());
    assertEquals("DC-ST", report.get("problem").getAsString());
    assertEquals(2, report.getAsJsonObject("meta").get("argument_count").getAsInt());
  }

  @Test
  void listsExtensions() {
    assertEquals(0, run("extensions", "-f", mutualAttack.toString(), "-s", "complete"));

    assertEquals("{}\n{a}\n{b}\n", stdout());
  }

  @Test
  void listsExtensionsAsJson() {
    assertEquals(
        0, run("extensions", "-f", oneWayAttack.toString(), "--semantics=stable", "--json"));

    JsonObject report = JsonParser.parseString(stdout()).getAsJsonObject();
    assertEquals(1, report.get("count").getAsInt());
    JsonArray first = report.getAsJsonArray("extensions").get(0).getAsJsonArray();
    assertEquals("a", first.get(0).getAsString());
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(0, run("--help"));

    assertTrue(stdout().contains("VE-CO, DC-CO, DS-CO, VE-ST, DC-ST and DS-ST"));
  }

  @Test
  void unknownOptionIsAnError() {
    assertEquals(Main.EXIT_ERROR, run("-f", mutualAttack.toString(), "--bogus"));

    assertTrue(stderr().contains("Unknown option: --bogus"));
  }

  private int run(String... args) {
    PrintStream stdout = new PrintStream(out, true, StandardCharsets.UTF_8);
    PrintStream stderr = new PrintStream(err, true, StandardCharsets.UTF_8);
    return Main.run(args, stdout, stderr);
  }

  private String stdout() {
    return out.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
  }

  private String stderr() {
    return err.toString(StandardCharsets.UTF_8);
  }
}
