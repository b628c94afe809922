package io.loglogbeta.sketch;

public interface CardinalityEstimator<T>
{
  void insert(byte[] value);
  void insert(long value);

  void merge(T that);
  double estimate();
  long cardinality();
  long memoryFootprint();

  String name();
}
