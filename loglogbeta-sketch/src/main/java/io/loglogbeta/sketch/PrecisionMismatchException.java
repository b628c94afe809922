package io.loglogbeta.sketch;

/**
 * Thrown when sketches of different precision are merged. The sketches involved are left untouched.
 */
public class PrecisionMismatchException extends IllegalArgumentException
{
  private final int expected;
  private final int actual;

  public PrecisionMismatchException(int expected, int actual)
  {
    super(String.format("cannot merge sketch of precision [%d] into sketch of precision [%d]", actual, expected));
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected()
  {
    return expected;
  }

  public int getActual()
  {
    return actual;
  }
}
