package chalk.chc.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class ChcFatal extends RuntimeException {
  public final int exitCode;

  public ChcFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
