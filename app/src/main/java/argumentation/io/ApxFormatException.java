package argumentation.io;

import java.io.IOException;

/** Malformed line in an {@code .apx} framework description. */
public final class ApxFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int lineNumber;

  public ApxFormatException(int lineNumber, String message) {
    super("Line " + lineNumber + ": " + message);
    this.lineNumber = lineNumber;
  }

  /** 1-based line of the offending statement. */
  public int lineNumber() {
    return lineNumber;
  }
}
