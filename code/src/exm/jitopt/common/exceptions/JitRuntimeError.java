package exm.jitopt.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a compiler bug (or inconsistent input from
 * an earlier compiler stage), never a problem with user code.
 * */
public class JitRuntimeError extends RuntimeException
{
  public JitRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
