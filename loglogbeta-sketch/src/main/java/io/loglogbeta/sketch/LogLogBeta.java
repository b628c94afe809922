package io.loglogbeta.sketch;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.hash.Funnel;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.math.DoubleMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Implements LogLog-Beta described in https://arxiv.org/abs/1612.02284.
 *
 * <p>Like HyperLogLog it keeps {@code m = 2^p} registers, each holding the maximum rank seen for the
 * items hashed to it. Instead of HyperLogLog's piecewise small and large range corrections, the raw
 * estimate is corrected by a single polynomial {@code beta} of the number of empty registers:
 * <pre>
 * E = alpha_inf * m * (m - zeros) / (beta(zeros) + sum(2^-register[i]))
 * beta(z) = b0 * z + b1 * x + b2 * x^2 + ... + b7 * x^7, where x = ln(z + 1)
 * </pre>
 *
 * <p>Items are hashed with a 64-bit {@link HashFunction}, murmur3_128 unless another one is given.
 * The top {@code p} bits of the hash select the register, the rank is the number of leading zeros
 * in the remaining {@code 64 - p} bits plus one. Changing the hash function changes the estimate
 * reported for a given input, not its expected error.
 *
 * <p>Expected relative error for each precision:
 * <pre>
 * for (int p = MIN_PRECISION; p &lt;= MAX_PRECISION; p++) {
 *   System.out.printf("p[%d], m[%,d] =&gt; error[%f%%]%n", p, 1 &lt;&lt; p, 104 / Math.sqrt(1 &lt;&lt; p));
 * }
 * </pre>
 *
 * <p>Instances are not thread-safe. Use one sketch per writer and {@link #union(Iterable)} the
 * results, or use {@link SynchronizedLogLogBeta}.
 */
public class LogLogBeta implements CardinalityEstimator<LogLogBeta>
{
  private static final Logger LOG = LoggerFactory.getLogger(LogLogBeta.class);

  public static final int MIN_PRECISION = 4;
  public static final int MAX_PRECISION = 18;
  public static final int DEFAULT_PRECISION = 14;

  static final double ALPHA_INF = 0.5 / Math.log(2);

  // bias correction coefficients from the paper
  private static final double BETA_0 = -0.370393911;
  private static final double BETA_1 = 0.070471823;
  private static final double BETA_2 = 0.17393686;
  private static final double BETA_3 = 0.16339839;
  private static final double BETA_4 = -0.09237745;
  private static final double BETA_5 = 0.03738027;
  private static final double BETA_6 = -0.005384159;
  private static final double BETA_7 = 0.00042419;

  private static final AtomicLong constructionIdentityCount = new AtomicLong();

  // used to order locks when merging synchronized sketches
  final long identity = constructionIdentityCount.getAndIncrement();

  private final int p;
  private final int maxRank;
  private final HashFunction hashFunction;
  final RegisterArray registers;

  protected LogLogBeta(int precision, HashFunction hashFunction)
  {
    this(precision, hashFunction, null);
  }

  LogLogBeta(int precision, HashFunction hashFunction, RegisterArray registers)
  {
    checkPrecision(precision);
    Preconditions.checkNotNull(hashFunction, "hashFunction");
    Preconditions.checkArgument(
        hashFunction.bits() >= Long.SIZE,
        "hash function [%s] produces [%s] bits, need at least 64",
        hashFunction,
        hashFunction.bits()
    );
    this.p = precision;
    this.maxRank = Long.SIZE - precision + 1;
    this.hashFunction = hashFunction;
    this.registers = registers == null ? new RegisterArray(1 << precision) : registers;
  }

  public static LogLogBeta withErrorRate(double errorRate)
  {
    return withErrorRate(errorRate, Hashing.murmur3_128());
  }

  public static LogLogBeta withErrorRate(double errorRate, HashFunction hashFunction)
  {
    return new LogLogBeta(precisionFor(errorRate), hashFunction);
  }

  public static LogLogBeta withPrecision(int precision)
  {
    return withPrecision(precision, Hashing.murmur3_128());
  }

  public static LogLogBeta withPrecision(int precision, HashFunction hashFunction)
  {
    return new LogLogBeta(precision, hashFunction);
  }

  /**
   * Derives the precision needed for a target relative error: {@code p = ceil(log2((1.04 / errorRate)^2))}.
   *
   * @throws InvalidErrorRateException if {@code errorRate} is not in (0, 1) or needs an unsupported precision
   */
  public static int precisionFor(double errorRate)
  {
    if (!(errorRate > 0 && errorRate < 1)) {
      throw new InvalidErrorRateException(
          errorRate,
          String.format("invalid error rate [%s] : should be in (0, 1)", errorRate)
      );
    }
    final double registersNeeded = Math.pow(1.04 / errorRate, 2);
    if (Double.isInfinite(registersNeeded)) {
      throw new InvalidErrorRateException(
          errorRate,
          String.format("error rate [%s] is too small to be supported", errorRate)
      );
    }
    final int precision = DoubleMath.log2(registersNeeded, RoundingMode.CEILING);
    if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
      throw new InvalidErrorRateException(
          errorRate,
          String.format(
              "error rate [%s] needs precision [%d], supported precision is [%d, %d]",
              errorRate,
              precision,
              MIN_PRECISION,
              MAX_PRECISION
          )
      );
    }
    return precision;
  }

  static void checkPrecision(int precision)
  {
    if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
      throw new InvalidPrecisionException(precision);
    }
  }

  @Override
  public void insert(byte[] value)
  {
    insertHash(hashFunction.hashBytes(value).asLong());
  }

  @Override
  public void insert(long value)
  {
    insertHash(hashFunction.hashLong(value).asLong());
  }

  public void insert(CharSequence value)
  {
    insertHash(hashFunction.hashString(value, StandardCharsets.UTF_8).asLong());
  }

  public <T> void insert(T item, Funnel<? super T> funnel)
  {
    insertHash(hashFunction.hashObject(item, funnel).asLong());
  }

  /**
   * Records an already hashed item. The hash must be uniformly distributed over all 64 bits.
   *
   * <p>A hash whose low {@code 64 - p} bits are all zero gets the largest rank {@code 64 - p + 1}.
   */
  public void insertHash(long hash)
  {
    final int index = (int) (hash >>> (Long.SIZE - p));
    final int rank = Math.min(Long.numberOfLeadingZeros(hash << p) + 1, maxRank);
    registers.raise(index, rank);
  }

  @Override
  public double estimate()
  {
    final int m = registers.size();
    final int zeros = registers.zeroCount();
    if (zeros == m) {
      return 0.0;
    }
    final double registerSum = registers.harmonicSum();
    final double e = ALPHA_INF * m * (m - zeros) / (beta(zeros) + registerSum);
    return Math.max(e, 0.0);
  }

  static double beta(int zeros)
  {
    final double x = Math.log(zeros + 1);
    return BETA_0 * zeros
           + x * (BETA_1 + x * (BETA_2 + x * (BETA_3 + x * (BETA_4 + x * (BETA_5 + x * (BETA_6 + x * BETA_7))))));
  }

  @Override
  public long cardinality()
  {
    return Math.round(estimate());
  }

  /**
   * Folds {@code that} into this sketch, which then estimates the union of both inputs.
   * {@code that} is not modified.
   *
   * <p>Both sketches must use the same hash function. This is not checked, a union of sketches
   * built with different hash functions is meaningless.
   *
   * @throws PrecisionMismatchException if the precisions differ, in which case nothing is modified
   */
  @Override
  public void merge(LogLogBeta that)
  {
    Preconditions.checkNotNull(that, "that");
    if (that.p != p) {
      throw new PrecisionMismatchException(p, that.p);
    }
    registers.raiseAll(that.registers);
  }

  /**
   * Non-mutating merge: returns a new sketch estimating the union of all the given sketches.
   * The result uses the precision and hash function of the first sketch.
   *
   * @throws PrecisionMismatchException if the sketches do not all share one precision
   */
  public static LogLogBeta union(Iterable<? extends LogLogBeta> sketches)
  {
    Iterator<? extends LogLogBeta> it = sketches.iterator();
    Preconditions.checkArgument(it.hasNext(), "nothing to union");
    LogLogBeta first = it.next();
    LogLogBeta result = new LogLogBeta(first.p, first.hashFunction, first.registers());
    int merged = 1;
    while (it.hasNext()) {
      LogLogBeta next = it.next();
      if (next.p != result.p) {
        throw new PrecisionMismatchException(result.p, next.p);
      }
      result.registers.raiseAll(next.registers());
      merged++;
    }
    LOG.debug("Merged {} sketches of precision {}", merged, result.p);
    return result;
  }

  public static LogLogBeta union(LogLogBeta first, LogLogBeta... rest)
  {
    LogLogBeta[] all = new LogLogBeta[rest.length + 1];
    all[0] = first;
    System.arraycopy(rest, 0, all, 1, rest.length);
    return union(Arrays.asList(all));
  }

  /**
   * @return a copy of the registers
   */
  RegisterArray registers()
  {
    return registers.copy();
  }

  public int precision()
  {
    return p;
  }

  public int registerCount()
  {
    return 1 << p;
  }

  /**
   * @return the value of register {@code index}
   */
  public int registerAt(int index)
  {
    return registers.get(index);
  }

  public HashFunction hashFunction()
  {
    return hashFunction;
  }

  /**
   * Writes the precision as one byte followed by the {@code 2^p} registers packed as 6-bit fields,
   * most significant bit first.
   */
  public byte[] toByteArray()
  {
    byte[] bytes = new byte[1 + RegisterArray.packedLength(registers.size())];
    bytes[0] = (byte) p;
    registers.toPackedBytes(bytes, 1);
    return bytes;
  }

  public static LogLogBeta fromByteArray(byte[] bytes)
  {
    return fromByteArray(bytes, Hashing.murmur3_128());
  }

  /**
   * Reads a sketch written by {@link #toByteArray()}. The hash function must be the one the
   * sketch was built with for further inserts to be meaningful.
   *
   * @throws InvalidPrecisionException if the header holds an unsupported precision
   * @throws IllegalArgumentException if the length does not match the precision, or a register is out of range
   */
  public static LogLogBeta fromByteArray(byte[] bytes, HashFunction hashFunction)
  {
    Preconditions.checkArgument(bytes.length > 0, "empty sketch");
    final int precision = bytes[0];
    checkPrecision(precision);
    RegisterArray registers = RegisterArray.fromPackedBytes(bytes, 1, 1 << precision, Long.SIZE - precision + 1);
    return new LogLogBeta(precision, hashFunction, registers);
  }

  @Override
  public long memoryFootprint()
  {
    return registers.size(); // not counting object headers, `p`, `hashFunction` reference
  }

  @Override
  public String name()
  {
    return "llb" + p;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("precision", p)
                      .add("hashFunction", hashFunction)
                      .toString();
  }
}
