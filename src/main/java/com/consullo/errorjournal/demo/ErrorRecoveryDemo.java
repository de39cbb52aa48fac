package com.consullo.errorjournal.demo;

import com.consullo.errorjournal.core.ErrorJournal;
import com.consullo.errorjournal.core.ErrorState;
import com.consullo.errorjournal.dump.DumpConfig;
import com.consullo.errorjournal.dump.LoggingDumpVisitor;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Minimal demo of the capture / attempt / dump / restore pattern against the global journal.
 *
 * @since 1.0
 */
public final class ErrorRecoveryDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(ErrorRecoveryDemo.class);

  private ErrorRecoveryDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   */
  public static void main(final String[] args) {
    int discarded = run(ErrorJournal.global());
    LOGGER.info("Demo completed, {} error(s) discarded", discarded);
  }

  /**
   * Runs a failing computation, reports its errors, rolls them back and runs a fallback.
   *
   * @param journal journal to use
   * @return number of errors discarded by the rollback
   */
  static int run(final ErrorJournal journal) {
    final SampleStatistics stats = new SampleStatistics(journal);
    final ErrorState before = journal.capture();

    double ratio = stats.ratioOfMeans(List.of(1, 2, 3), List.of());
    if (journal.isEqual(before)) {
      LOGGER.info("ratio = {}", ratio);
      return 0;
    }

    int discarded = (int) (journal.capture().position() - before.position());
    journal.dump(before, false, new LoggingDumpVisitor(journal, DumpConfig.defaults().withLevel(Level.WARN)));
    journal.restore(before);

    // Fallback: a neutral ratio.
    ratio = stats.ratioOfMeans(List.of(1, 2, 3), List.of(1, 2, 3));
    LOGGER.info("fallback ratio = {} (current error: {})", ratio, journal.code().name());
    return discarded;
  }
}
