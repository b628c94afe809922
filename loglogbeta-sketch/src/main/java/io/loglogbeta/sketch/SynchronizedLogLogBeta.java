package io.loglogbeta.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * A {@link LogLogBeta} that is synchronized as a whole, such that inserts, merges and estimates are
 * atomic with relation to each other. Callers that synchronize on the sketch instance can assume no
 * register changes within their synchronized block.
 *
 * <p>Every insert contends on one monitor. When inserts come from many threads, building one
 * {@link LogLogBeta} per thread and combining them with {@link LogLogBeta#union(Iterable)} scales better.
 */
public class SynchronizedLogLogBeta extends LogLogBeta
{
  protected SynchronizedLogLogBeta(int precision, HashFunction hashFunction)
  {
    super(precision, hashFunction);
  }

  public static SynchronizedLogLogBeta withErrorRate(double errorRate)
  {
    return withErrorRate(errorRate, Hashing.murmur3_128());
  }

  public static SynchronizedLogLogBeta withErrorRate(double errorRate, HashFunction hashFunction)
  {
    return new SynchronizedLogLogBeta(precisionFor(errorRate), hashFunction);
  }

  public static SynchronizedLogLogBeta withPrecision(int precision)
  {
    return withPrecision(precision, Hashing.murmur3_128());
  }

  public static SynchronizedLogLogBeta withPrecision(int precision, HashFunction hashFunction)
  {
    return new SynchronizedLogLogBeta(precision, hashFunction);
  }

  // hashing happens in the caller's thread, only the register update is done under the lock
  @Override
  public synchronized void insertHash(long hash)
  {
    super.insertHash(hash);
  }

  @Override
  public synchronized double estimate()
  {
    return super.estimate();
  }

  @Override
  public void merge(LogLogBeta that)
  {
    Preconditions.checkNotNull(that, "that");
    if (that == this) {
      return;
    }
    // Avoid deadlocks by synchronizing in order of construction identity count.
    if (identity < that.identity) {
      synchronized (this) {
        synchronized (that) {
          super.merge(that);
        }
      }
    } else {
      synchronized (that) {
        synchronized (this) {
          super.merge(that);
        }
      }
    }
  }

  @Override
  synchronized RegisterArray registers()
  {
    return super.registers();
  }

  @Override
  public synchronized int registerAt(int index)
  {
    return super.registerAt(index);
  }

  @Override
  public synchronized byte[] toByteArray()
  {
    return super.toByteArray();
  }

  @Override
  public String name()
  {
    return "llbsync" + precision();
  }
}
