package io.loglogbeta.sketch;

/**
 * Thrown when a sketch is requested for an error rate outside {@code (0, 1)}, or for one whose
 * derived precision is not supported.
 */
public class InvalidErrorRateException extends IllegalArgumentException
{
  private final double errorRate;

  public InvalidErrorRateException(double errorRate, String message)
  {
    super(message);
    this.errorRate = errorRate;
  }

  public double getErrorRate()
  {
    return errorRate;
  }
}
