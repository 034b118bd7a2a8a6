package argumentation.io;

import argumentation.model.ArgumentationFramework;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads argumentation frameworks in the ASPARTIX {@code .apx} format.
 *
 * <p>Each non-blank line is either {@code arg(name).} or {@code att(attacker,attacked).}; names
 * are word characters. An attack may only mention arguments declared on earlier lines.
 */
public final class ApxParser {
  private static final Logger LOG = LoggerFactory.getLogger(ApxParser.class);

  private static final Pattern ARGUMENT = Pattern.compile("^arg\\((\\w+)\\)\\.$");
  private static final Pattern ATTACK = Pattern.compile("^att\\((\\w+),(\\w+)\\)\\.$");

  private ApxParser() {}

  public static ArgumentationFramework parse(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString(), null, "The file does not exist");
    }
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      ArgumentationFramework af = parse(reader);
      LOG.debug(
          "Loaded {} argument(s) and {} attack(s) from {}", af.size(), af.attackCount(), path);
      return af;
    }
  }

  public static ArgumentationFramework parseString(String content) throws ApxFormatException {
    try {
      return parse(new StringReader(content));
    } catch (ApxFormatException ex) {
      throw ex;
    } catch (IOException ex) {
      throw new IllegalStateException("StringReader failed", ex);
    }
  }

  public static ArgumentationFramework parse(Reader source) throws IOException {
    BufferedReader reader =
        source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
    ArgumentationFramework.Builder builder = ArgumentationFramework.builder();
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      Matcher argument = ARGUMENT.matcher(trimmed);
      if (argument.matches()) {
        builder.addArgument(argument.group(1));
        continue;
      }
      Matcher attack = ATTACK.matcher(trimmed);
      if (attack.matches()) {
        String attacker = attack.group(1);
        String attacked = attack.group(2);
        requireDeclared(builder, attacker, lineNumber);
        requireDeclared(builder, attacked, lineNumber);
        builder.addAttack(attacker, attacked);
        continue;
      }
      throw new ApxFormatException(
          lineNumber,
          "unaccepted statement '"
              + trimmed
              + "'. Each argument must be defined as 'arg(name).' and each attack as"
              + " 'att(name1,name2).'");
    }
    return builder.build();
  }

  private static void requireDeclared(
      ArgumentationFramework.Builder builder, String argument, int lineNumber)
      throws ApxFormatException {
    if (!builder.isDeclared(argument)) {
      throw new ApxFormatException(
          lineNumber,
          "attack references '"
              + argument
              + "', which is not a declared argument. All arguments must be defined before"
              + " attacks.");
    }
  }
}
