package com.consullo.errorjournal.demo;

import com.consullo.errorjournal.core.ErrorJournal;
import com.consullo.errorjournal.core.ErrorOrigin;
import com.consullo.errorjournal.core.StandardErrorCode;
import java.util.List;

/**
 * Toy error producer for the demo: statistics over numeric samples that report failures through the
 * journal instead of throwing.
 *
 * @since 1.0
 */
public final class SampleStatistics {

  private final ErrorJournal journal;

  public SampleStatistics(ErrorJournal journal) {
    if (journal == null) {
      throw new IllegalArgumentException("journal must not be null.");
    }
    this.journal = journal;
  }

  /**
   * Arithmetic mean of the samples.
   *
   * @param samples samples
   * @param <T> numeric element type
   * @return mean, or NaN after raising NULL_INPUT / DATA_NOT_FOUND
   */
  public <T extends Number> double mean(List<T> samples) {
    if (samples == null) {
      journal.raise(StandardErrorCode.NULL_INPUT, "samples is null");
      return Double.NaN;
    }
    if (samples.isEmpty()) {
      journal.raise(StandardErrorCode.DATA_NOT_FOUND, "no samples");
      return Double.NaN;
    }
    double sum = 0.0;
    for (int i = 0; i < samples.size(); i++) {
      T v = samples.get(i);
      if (v == null) {
        journal.raise(StandardErrorCode.NULL_INPUT, "sample %d is null", i);
        return Double.NaN;
      }
      sum += v.doubleValue();
    }
    return sum / samples.size();
  }

  /**
   * Ratio of the means of two sample sets.
   *
   * @param numerator numerator samples
   * @param denominator denominator samples
   * @param <T> numeric element type
   * @return ratio, or NaN after raising DIVISION_BY_ZERO or propagating an error from {@link #mean}
   */
  public <T extends Number> double ratioOfMeans(List<T> numerator, List<T> denominator) {
    double a = mean(numerator);
    if (Double.isNaN(a)) {
      journal.propagate(ErrorOrigin.of("SampleStatistics.java", 0, "ratioOfMeans"));
      return Double.NaN;
    }
    double b = mean(denominator);
    if (Double.isNaN(b)) {
      journal.propagate();
      return Double.NaN;
    }
    if (b == 0.0) {
      journal.raise(StandardErrorCode.DIVISION_BY_ZERO, "mean of denominator is 0");
      return Double.NaN;
    }
    return a / b;
  }
}
