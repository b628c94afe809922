package io.loglogbeta.sketch;

import com.google.common.base.Supplier;

/**
 * Builds estimators from short names, as accepted by the command line tools:
 * <ul>
 *   <li>{@code llb}, {@code llb<p>}, {@code llb@<errorRate>} for {@link LogLogBeta}
 *   <li>{@code llbsync}, {@code llbsync<p>}, {@code llbsync@<errorRate>} for {@link SynchronizedLogLogBeta}
 * </ul>
 * A name without a suffix uses precision {@value LogLogBeta#DEFAULT_PRECISION}.
 */
public final class CardinalityEstimators
{
  private CardinalityEstimators()
  {
  }

  public static CardinalityEstimator<LogLogBeta> get(String name)
  {
    if (name.startsWith("llbsync")) {
      String suffix = name.substring("llbsync".length());
      if (suffix.startsWith("@")) {
        return SynchronizedLogLogBeta.withErrorRate(parseErrorRate(name, suffix.substring(1)));
      }
      return SynchronizedLogLogBeta.withPrecision(parsePrecision(name, suffix));
    }
    if (name.startsWith("llb")) {
      String suffix = name.substring("llb".length());
      if (suffix.startsWith("@")) {
        return LogLogBeta.withErrorRate(parseErrorRate(name, suffix.substring(1)));
      }
      return LogLogBeta.withPrecision(parsePrecision(name, suffix));
    }
    throw new IllegalArgumentException("Unknown estimator : " + name);
  }

  public static Supplier<CardinalityEstimator<LogLogBeta>> lazyGet(String name)
  {
    // fail fast on a bad name instead of on first use
    get(name);
    return () -> get(name);
  }

  private static int parsePrecision(String name, String pStr)
  {
    if (pStr.isEmpty()) {
      return LogLogBeta.DEFAULT_PRECISION;
    }
    try {
      return Integer.parseInt(pStr);
    }
    catch (NumberFormatException e) {
      throw new IllegalArgumentException("Unknown estimator : " + name, e);
    }
  }

  private static double parseErrorRate(String name, String rateStr)
  {
    try {
      return Double.parseDouble(rateStr);
    }
    catch (NumberFormatException e) {
      throw new IllegalArgumentException("Unknown estimator : " + name, e);
    }
  }
}
