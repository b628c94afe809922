package io.loglogbeta.sketch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Estimates the number of distinct lines in the given files, or in stdin when no file is given.
 *
 * <p>Each file is counted into its own sketch, the sketches are then merged for the total.
 */
public class DistinctCount
{
  private static final Logger LOG = LoggerFactory.getLogger(DistinctCount.class);

  static LogLogBeta count(double errorRate, BufferedReader reader) throws IOException
  {
    LogLogBeta sketch = LogLogBeta.withErrorRate(errorRate);
    String line;
    while ((line = reader.readLine()) != null) {
      sketch.insert(line);
    }
    return sketch;
  }

  static LogLogBeta count(double errorRate, List<Path> files) throws IOException
  {
    List<LogLogBeta> sketches = new ArrayList<>(files.size());
    for (Path file : files) {
      final long start = System.currentTimeMillis();
      try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        LogLogBeta sketch = count(errorRate, reader);
        LOG.info("{}: ~{} distinct lines in {} ms", file, sketch.cardinality(), System.currentTimeMillis() - start);
        sketches.add(sketch);
      }
    }
    return LogLogBeta.union(sketches);
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 1) {
      System.err.println("Arguments: <errorRate> [<file>..]");
      System.exit(1);
    }

    final double errorRate;
    try {
      errorRate = Double.parseDouble(args[0]);
      LogLogBeta.precisionFor(errorRate);
    }
    catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.exit(1);
      return;
    }

    LogLogBeta sketch;
    if (args.length == 1) {
      sketch = count(errorRate, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    } else {
      List<Path> files = new ArrayList<>(args.length - 1);
      for (int i = 1; i < args.length; i++) {
        files.add(Paths.get(args[i]));
      }
      sketch = count(errorRate, files);
    }
    System.out.println(sketch.cardinality());
  }
}
