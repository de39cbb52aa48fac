package com.consullo.errorjournal.core;

import org.apache.commons.lang3.Validate;

/**
 * Saved position in the error journal.
 *
 * <p>Obtained from {@link ErrorJournal#capture()} and later passed to {@link ErrorJournal#restore},
 * {@link ErrorJournal#isEqual} or {@link ErrorJournal#dump}. An error state holds no reference to the
 * journal; two states are equal iff their positions are equal.
 *
 * <p>Typical use:
 * <pre>{@code
 * ErrorState before = journal.capture();
 * doSomething();
 * if (!journal.isEqual(before)) {
 *   journal.dump(before, false);
 *   journal.restore(before);
 * }
 * }</pre>
 *
 * @since 1.0
 */
public final class ErrorState implements Comparable<ErrorState> {

  /** State with no current error. Restoring it is always allowed. */
  public static final ErrorState NONE = new ErrorState(0L);

  private final long position;

  private ErrorState(long position) {
    this.position = position;
  }

  static ErrorState at(long position) {
    Validate.isTrue(position >= 0, "position must not be negative: %d", position);
    return position == 0 ? NONE : new ErrorState(position);
  }

  /**
   * Returns the journal position captured by this state.
   *
   * @return captured position, 0 for {@link #NONE}
   */
  public long position() {
    return position;
  }

  @Override
  public int compareTo(ErrorState o) {
    return Long.compare(position, o.position);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ErrorState)) {
      return false;
    }
    return position == ((ErrorState) other).position;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(position);
  }

  @Override
  public String toString() {
    return "ErrorState[" + position + "]";
  }
}
