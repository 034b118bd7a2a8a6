package argumentation.cli;

/** Text rendering of solver answers. */
final class ResultFormatter {
  private ResultFormatter() {}

  static String yesNo(boolean answer) {
    return answer ? "YES" : "NO";
  }
}
