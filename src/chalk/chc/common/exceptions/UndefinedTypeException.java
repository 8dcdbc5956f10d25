package chalk.chc.common.exceptions;

public class UndefinedTypeException
extends UserException
{

  public UndefinedTypeException(String file, int line, String typeName)
  {
    super(file, line, 0, "unknown type '" + typeName + "', expected one of: " +
          "int, float, string, bool, void");
  }

  private static final long serialVersionUID = 1L;
}
