package io.loglogbeta.sketch;

public class InvalidPrecisionException extends IllegalArgumentException
{
  private final int precision;

  public InvalidPrecisionException(int precision)
  {
    super(String.format(
        "invalid precision [%d] : should be in [%d, %d]",
        precision,
        LogLogBeta.MIN_PRECISION,
        LogLogBeta.MAX_PRECISION
    ));
    this.precision = precision;
  }

  public int getPrecision()
  {
    return precision;
  }
}
