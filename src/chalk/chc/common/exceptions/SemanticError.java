package chalk.chc.common.exceptions;

import chalk.chc.ast.Node;

/**
 * Raised for every violation of the static rules of the language:
 * undefined names, immutability, type mismatches, arity.  Only the first
 * violation in a program is ever reported.
 */
public class SemanticError
extends UserException
{
  private final String description;

  /** Source line, null if unknown */
  private final Integer line;

  public SemanticError(String description, Integer line)
  {
    super(line != null ? "[line #" + line + "]: " + description
                       : description);
    this.description = description;
    this.line = line;
  }

  public static SemanticError at(Node node, String description) {
    return new SemanticError(description, node.getLine());
  }

  /**
   * @return the message without line information
   */
  public String getDescription() {
    return description;
  }

  public Integer getLine() {
    return line;
  }

  private static final long serialVersionUID = 1L;
}
