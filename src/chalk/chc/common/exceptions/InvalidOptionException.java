package chalk.chc.common.exceptions;

/**
 * A configuration property had a missing or malformed value
 */
public class InvalidOptionException extends Exception {

  public InvalidOptionException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
