package com.consullo.errorjournal.core;

import java.util.Arrays;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-capacity ring of the most recent error records together with the position counter.
 *
 * <p>Record {@code p} lives in slot {@code p % CAPACITY}. It is retained while fewer than {@code CAPACITY}
 * newer positions have been appended; after that its slot has been reused and only the fact that position
 * {@code p} existed is known (through {@link #total()}).
 *
 * <p>Not thread-safe. {@link ErrorJournal} serializes access.
 *
 * @since 1.0
 */
public final class ErrorHistory {

  private static final Logger LOGGER = LoggerFactory.getLogger(ErrorHistory.class);

  /** Number of records whose detail is retained. */
  public static final int CAPACITY = 20;

  private final ErrorRecord[] slots;
  private long total;

  ErrorHistory() {
    this.slots = new ErrorRecord[CAPACITY];
    this.total = 0L;
  }

  private ErrorHistory(ErrorHistory source) {
    this.slots = Arrays.copyOf(source.slots, CAPACITY);
    this.total = source.total;
  }

  /**
   * Returns the number of records appended since creation or the last {@link #clear()}.
   *
   * @return highest position appended, 0 when empty
   */
  public long total() {
    return total;
  }

  /**
   * Returns the number of records whose detail is still held.
   *
   * @return retained count, at most {@link #CAPACITY}
   */
  public int retainedCount() {
    return (int) Math.min(total, CAPACITY);
  }

  /**
   * Returns true iff the detail for {@code position} is still held.
   *
   * @param position position to test
   * @return true if retained
   */
  public boolean isRetained(long position) {
    return position >= 1 && position <= total && total - position < CAPACITY;
  }

  ErrorRecord append(ErrorCode code, ErrorOrigin origin, String userText) {
    long position = total + 1;
    int slot = slotOf(position);
    ErrorRecord evicted = slots[slot];
    if (evicted != null) {
      LOGGER.debug("append: position {} overwrites position {}", position, evicted.position());
    }
    ErrorRecord record = ErrorRecord.raised(position, code, origin, userText);
    slots[slot] = record;
    total = position;
    return record;
  }

  /**
   * Resolves the record at {@code position}.
   *
   * @param position position, not negative
   * @return the retained record; the NONE sentinel for 0 or a position never reached; the HISTORY_LOST
   *     sentinel for an evicted position
   */
  ErrorRecord lookup(long position) {
    Validate.isTrue(position >= 0, "position must not be negative: %d", position);
    if (position == 0 || position > total) {
      return ErrorRecord.none();
    }
    if (!isRetained(position)) {
      return ErrorRecord.historyLost(position);
    }
    ErrorRecord record = slots[slotOf(position)];
    if (record == null || record.position() != position) {
      throw new IllegalStateException("History slot for position " + position + " holds "
          + (record == null ? "nothing" : "position " + record.position()));
    }
    return record;
  }

  ErrorHistory copy() {
    return new ErrorHistory(this);
  }

  void clear() {
    Arrays.fill(slots, null);
    total = 0L;
  }

  private static int slotOf(long position) {
    return (int) (position % CAPACITY);
  }
}
