package com.consullo.errorjournal.dump;

import com.consullo.errorjournal.core.ErrorJournal;
import com.consullo.errorjournal.core.ErrorRecord;
import com.consullo.errorjournal.core.events.DumpVisitor;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dump visitor that writes one log line per error.
 *
 * <p>
 * Output shape:
 * <ul>
 * <li>empty range: {@code No error(s) to dump}</li>
 * <li>header on the first position, naming how many errors follow and whether the order is reversed</li>
 * <li>{@code [self/newest] 'message' (CODE) at function:file:line} for each retained error</li>
 * <li>runs of evicted positions collapsed into a single {@code Lost N error(s)} line, so an evicted record
 * never reads like a real failure</li>
 * </ul>
 * </p>
 *
 * <p>An instance keeps the lost-count across calls of one traversal; use a fresh instance per dump, or at
 * least never share one between concurrent dumps.
 */
public final class LoggingDumpVisitor implements DumpVisitor {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDumpVisitor.class);

  private final ErrorJournal journal;
  private final DumpConfig config;
  private final Logger logger;

  private long lost;

  public LoggingDumpVisitor(ErrorJournal journal, DumpConfig config) {
    this(journal, config, LOGGER);
  }

  /**
   * Creates a visitor writing to {@code logger}.
   *
   * @param journal journal being dumped; queried for the record at each visited position
   * @param config level and indentation
   * @param logger destination logger
   */
  public LoggingDumpVisitor(ErrorJournal journal, DumpConfig config, Logger logger) {
    Validate.notNull(journal, "journal must not be null");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(logger, "logger must not be null");
    this.journal = journal;
    this.config = config;
    this.logger = logger;
  }

  @Override
  public void visit(long self, long first, long last) {
    final boolean reverse = first > last;
    final long newest = reverse ? first : last;
    final long oldest = reverse ? last : first;

    if (newest == 0) {
      log("No error(s) to dump");
      return;
    }

    if (self == first) {
      lost = 0;
      String order = reverse ? " in reverse order" : "";
      if (oldest == 1) {
        log("Dumping all {} error(s){}:", newest, order);
      } else {
        log("Dumping the {} most recent error(s) out of a total of {} errors{}:",
            newest - oldest + 1, newest, order);
      }
    }

    ErrorRecord record = journal.current();
    if (record.isHistoryLost()) {
      lost++;
    } else {
      flushLost();
      log("{}[{}/{}] '{}' ({}) at {}", config.indent(), self, newest, record.message(),
          record.code().name(), record.where());
    }

    if (self == last) {
      flushLost();
    }
  }

  private void flushLost() {
    if (lost > 0) {
      log("{}Lost {} error(s)", config.indent(), lost);
      lost = 0;
    }
  }

  private void log(String format, Object... args) {
    logger.atLevel(config.level()).log(format, args);
  }
}
