package cfix.hir;


/**
 * Thrown when a token range does not have the shape an operation needs, for
 * example a declaration without base type or a signature without parameter
 * list. Callers recover by leaving the affected code untouched.
 */
public class UnsupportedInput extends RuntimeException
{
  private static final long serialVersionUID = 1;

  public UnsupportedInput()
  {
    super();
  }

  public UnsupportedInput(String message)
  {
    super(message);
  }
}
