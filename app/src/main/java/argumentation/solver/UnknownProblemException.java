package argumentation.solver;

import java.util.Arrays;
import java.util.stream.Collectors;

/** The requested problem code is not one the solver understands. */
public final class UnknownProblemException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String problemCode;

  public UnknownProblemException(String problemCode) {
    super(
        "Unknown problem: "
            + problemCode
            + ". Please choose one of these: "
            + Arrays.stream(ProblemCode.values())
                .map(ProblemCode::code)
                .collect(Collectors.joining(", ")));
    this.problemCode = problemCode;
  }

  public String problemCode() {
    return problemCode;
  }
}
