package io.loglogbeta.sketch;

import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Measures the relative error of an estimator over growing cardinalities and writes min, median and
 * max error per cardinality as a TSV file.
 */
public class CardinalityEstimatorAccuracy
{
  private static final Logger LOG = LoggerFactory.getLogger(CardinalityEstimatorAccuracy.class);

  // above this cardinality the distinct values no longer fit comfortably in a HashSet
  private static final int MAX_SET_CARDINALITY = 100_000;

  /**
   * Run estimation on random generated data set of cardinality {1*fromCard, 2*fromCard, 3*fromCard, .., toCard}.
   * `numRuns` experiments will be run for each cardinality.
   *
   * @return errors for each experiment, errors[i][j] = errors of cardinality i of the j-th run.
   */
  static double[][] testDifferentCardinalities(
      Supplier<? extends CardinalityEstimator<?>> estimatorSupplier,
      final int fromCard,
      final int toCard,
      final int numRuns
  )
  {
    checkRange(fromCard, toCard);
    final int numCard = toCard / fromCard;

    double[][] errors = new double[numCard][];
    for (int i = 0; i < numCard; i++) {
      errors[i] = new double[numRuns];
    }

    for (int run = 0; run < numRuns; run++) {
      // reset estimator and data source at the beginning of each run
      CardinalityEstimator<?> estimator = estimatorSupplier.get();
      ValueSource source = toCard <= MAX_SET_CARDINALITY ? new RandomLongSource() : new RandomIdSource();
      final long start = System.currentTimeMillis();

      // estimate cardinality of 1*fromCard, 2*fromCard, 3*fromCard, .., toCard
      for (int card = 1; card <= toCard; card++) {
        source.insertNext(estimator);

        if (card % fromCard == 0) {
          double est = estimator.estimate();
          double error = 100.0 * (est - card) / card;
          errors[card / fromCard - 1][run] = Math.abs(error);
        }
      }
      LOG.info("Finish run #{} of {} in {} ms", run, estimator.name(), System.currentTimeMillis() - start);
    }

    return errors;
  }

  private static void checkRange(int fromCard, int toCard)
  {
    if (fromCard <= 0 || toCard <= fromCard || toCard % fromCard != 0) {
      throw new IllegalArgumentException("illegal from \"" + fromCard + "\" and to \"" + toCard + "\"");
    }
  }

  private interface ValueSource
  {
    void insertNext(CardinalityEstimator<?> estimator);
  }

  // for low cardinality tests, generate random integer set
  private static final class RandomLongSource implements ValueSource
  {
    private final ThreadLocalRandom random = ThreadLocalRandom.current();
    private final Set<Long> set = new HashSet<>();

    @Override
    public void insertNext(CardinalityEstimator<?> estimator)
    {
      long value;
      do {
        value = random.nextLong();
      } while (!set.add(value));
      estimator.insert(value);
    }
  }

  // for high cardinality tests, we can't generate data using set due to limited memory,
  // use a random id generator instead
  private static final class RandomIdSource implements ValueSource
  {
    private final FastRandomIdGenerator generator = new FastRandomIdGenerator();

    @Override
    public void insertNext(CardinalityEstimator<?> estimator)
    {
      estimator.insert(generator.generate());
    }
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 4 || args.length > 5) {
      System.err.println("Arguments: <estimator> <from> <to> <runs> [<outFile>]");
      System.exit(1);
    }

    final int fromCard;
    final int toCard;
    final int numRuns;
    final Supplier<CardinalityEstimator<LogLogBeta>> estimatorSupplier;
    try {
      estimatorSupplier = CardinalityEstimators.lazyGet(args[0]);
      fromCard = Integer.parseInt(args[1]);
      toCard = Integer.parseInt(args[2]);
      numRuns = Integer.parseInt(args[3]);
      checkRange(fromCard, toCard);
    }
    catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.exit(1);
      return;
    }

    Path outFile;
    if (args.length == 5) {
      outFile = Paths.get(args[4]);
    } else {
      outFile = Paths.get(String.format("%s_%d_%d_%d.tsv", args[0], fromCard, toCard, numRuns));
    }

    final double[][] errors = testDifferentCardinalities(estimatorSupplier, fromCard, toCard, numRuns);
    // compute min, 50%, max error for each cardinality
    List<OneResult> results = new ArrayList<>(errors.length);
    for (int i = 0; i < errors.length; i++) {
      long cardinality = (long) (i + 1) * fromCard;
      results.add(OneResult.from(cardinality, errors[i]));
    }

    LOG.info("Writing results to {}", outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\tMin\tMedian\tMax\n");
      for (OneResult result : results) {
        writer.write(String.format(
            "%d\t%.3f\t%.3f\t%.3f\n",
            result.cardinality,
            result.minError,
            result.medianError,
            result.maxError
        ));
      }
    }
  }

  static class OneResult
  {
    final long cardinality;
    final double minError;
    final double medianError;
    final double maxError;

    OneResult(long cardinality, double minError, double medianError, double maxError)
    {
      this.cardinality = cardinality;
      this.minError = minError;
      this.medianError = medianError;
      this.maxError = maxError;
    }

    static OneResult from(long cardinality, double[] errors)
    {
      double[] sorted = errors.clone();
      Arrays.sort(sorted);
      return new OneResult(
          cardinality,
          sorted[0],
          sorted[sorted.length / 2],
          sorted[sorted.length - 1]
      );
    }
  }
}
