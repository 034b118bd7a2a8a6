package argumentation.cli;

import argumentation.solver.ProblemCode;
import com.google.common.base.Splitter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/** Shared helpers for CLI argument parsing and validation. */
final class CliParsers {
  /** Word characters, excluding the reserved statement names {@code arg} and {@code att}. */
  static final Pattern ARGUMENT_NAME = Pattern.compile("^(?!att$|arg$)\\w+$");

  private static final Splitter ARGUMENT_SPLITTER = Splitter.on(',');

  private CliParsers() {}

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  /**
   * Splits {@code A1,A2,...} into a set of argument names. A missing or blank value is the empty
   * set; every name must match {@link #ARGUMENT_NAME}.
   */
  static Set<String> parseArgumentList(String raw) {
    if (raw == null || raw.isEmpty()) {
      return Set.of();
    }
    List<String> tokens = ARGUMENT_SPLITTER.splitToList(raw);
    Set<String> arguments = new LinkedHashSet<>();
    for (String token : tokens) {
      if (!ARGUMENT_NAME.matcher(token).matches()) {
        throw new IllegalArgumentException(
            "Unaccepted argument '"
                + token
                + "'. The name of an argument can be any sequence of letters (upper case or lower"
                + " case), numbers, or the underscore symbol _, except the words 'arg' and 'att'"
                + " which are reserved for defining the lines.");
      }
      arguments.add(token);
    }
    return arguments;
  }

  /** DC-* and DS-* problems take exactly one argument. */
  static void requireArity(ProblemCode problem, Set<String> arguments) {
    if (problem.isDecision() && arguments.size() != 1) {
      throw new IllegalArgumentException(
          "Only one argument should be specified for the "
              + problem.task().prefix()
              + "-XX problems.");
    }
  }

  /** Applies {@code args} to {@code target} using the given option table. */
  static <T> void applyOptions(String[] args, Map<String, OptionSpec<T>> specs, T target) {
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec<T> spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }

      String value = parsed.value();
      switch (spec.arity()) {
        case FLAG -> {
          if (value != null) {
            throw new IllegalArgumentException(parsed.option() + " does not take a value");
          }
        }
        case REQUIRED -> {
          if (value == null || value.isBlank()) {
            if (i + 1 >= args.length) {
              throw new IllegalArgumentException("Missing value for " + parsed.option());
            }
            value = args[++i];
          }
        }
        case OPTIONAL -> {
          if (value == null && i + 1 < args.length && !args[i + 1].startsWith("-")) {
            value = args[++i];
          }
        }
      }
      spec.apply(target, value);
    }
  }

  record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  enum Arity {
    FLAG,
    REQUIRED,
    OPTIONAL
  }

  record OptionSpec<T>(Arity arity, BiConsumer<T, String> apply) {
    static <T> OptionSpec<T> withValue(BiConsumer<T, String> consumer) {
      return new OptionSpec<>(Arity.REQUIRED, consumer);
    }

    static <T> OptionSpec<T> optionalValue(BiConsumer<T, String> consumer) {
      return new OptionSpec<>(Arity.OPTIONAL, consumer);
    }

    static <T> OptionSpec<T> flag(Consumer<T> consumer) {
      return new OptionSpec<>(Arity.FLAG, (target, ignored) -> consumer.accept(target));
    }

    void apply(T target, String value) {
      apply.accept(target, value);
    }
  }
}
