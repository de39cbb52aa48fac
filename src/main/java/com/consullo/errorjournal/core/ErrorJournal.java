package com.consullo.errorjournal.core;

import com.consullo.errorjournal.core.events.DumpEntry;
import com.consullo.errorjournal.core.events.DumpVisitor;
import com.consullo.errorjournal.dump.DumpConfig;
import com.consullo.errorjournal.dump.LoggingDumpVisitor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only journal of raised errors with snapshot and rollback of the visible error state.
 *
 * <p>
 * The journal keeps:
 * <ul>
 * <li>an {@link ErrorHistory}: the last {@link ErrorHistory#CAPACITY} records and the count of all raises</li>
 * <li>a view position: the error currently presented by {@link #current()}; equal to the total except after
 * {@link #restore} or {@link #reset} moved it back</li>
 * </ul>
 * </p>
 *
 * <p>
 * The view only moves forward through {@link #raise}. {@link #restore} never advances it, so a stale
 * {@link ErrorState} cannot resurrect errors that were discarded in the meantime.
 * </p>
 *
 * <p>
 * All operations hold the journal's monitor. A visitor running inside {@link #dump} executes on the dumping
 * thread while the monitor is held and may call back into the journal.
 * </p>
 */
public final class ErrorJournal {

  private static final Logger LOGGER = LoggerFactory.getLogger(ErrorJournal.class);

  private final Object lock = new Object();

  private ErrorHistory history;
  private long view;

  // Non-null while a dump is running; reads are served from it.
  private Replay replay;

  /**
   * Read-only copy of the journal taken when a dump starts.
   */
  private static final class Replay {
    final ErrorHistory history;
    long cursor;

    Replay(ErrorHistory history, long cursor) {
      this.history = history;
      this.cursor = cursor;
    }
  }

  private static final class GlobalHolder {
    static final ErrorJournal INSTANCE = new ErrorJournal();
  }

  /**
   * Creates an empty journal, independent of {@link #global()}.
   */
  public ErrorJournal() {
    this.history = new ErrorHistory();
    this.view = 0L;
  }

  /**
   * Returns the process-wide journal. It is created empty on first use and lives as long as the process.
   *
   * @return global journal
   */
  public static ErrorJournal global() {
    return GlobalHolder.INSTANCE;
  }

  // ---------------------------------------------------------------- raise

  /**
   * Raises an error without a message, attributed to the calling method.
   *
   * @param code error code
   * @return the new record
   */
  public ErrorRecord raise(ErrorCode code) {
    return raise(code, ErrorOrigin.caller(), (String) null);
  }

  /**
   * Raises an error attributed to the calling method.
   *
   * @param code error code
   * @param format message, or a {@link String#format} pattern when {@code args} are given
   * @param args format arguments
   * @return the new record
   */
  public ErrorRecord raise(ErrorCode code, String format, Object... args) {
    return raise(code, ErrorOrigin.caller(), format(format, args));
  }

  /**
   * Raises an error with a formatted message.
   *
   * @param code error code
   * @param origin where the error was detected
   * @param format {@link String#format} pattern
   * @param args format arguments
   * @return the new record
   */
  public ErrorRecord raise(ErrorCode code, ErrorOrigin origin, String format, Object... args) {
    return raise(code, origin, format(format, args));
  }

  /**
   * Appends a new record at position {@code total + 1} and makes it current.
   *
   * <p>If the history is full the oldest record is overwritten. Raising {@code NONE} records nothing and
   * returns the NONE sentinel. Raising {@code HISTORY_LOST} records {@code UNSPECIFIED} instead.
   *
   * @param code error code
   * @param origin where the error was detected
   * @param message caller message, may be null
   * @return the new record
   */
  public ErrorRecord raise(ErrorCode code, ErrorOrigin origin, String message) {
    Validate.notNull(code, "code must not be null");
    Validate.notNull(origin, "origin must not be null");
    if (code == StandardErrorCode.NONE) {
      LOGGER.debug("raise: ignoring NONE from {}", origin.where());
      return ErrorRecord.none();
    }
    ErrorCode stored = code == StandardErrorCode.HISTORY_LOST ? StandardErrorCode.UNSPECIFIED : code;
    synchronized (lock) {
      ErrorRecord record = history.append(stored, origin, message);
      view = record.position();
      return record;
    }
  }

  /**
   * Raises the current error code again at the calling method, recording how the error travelled.
   *
   * @return the new record, or the NONE sentinel if no error is current
   */
  public ErrorRecord propagate() {
    return propagate(ErrorOrigin.caller());
  }

  /**
   * Raises the current error code again at {@code origin}, without a message.
   *
   * @param origin new location
   * @return the new record, or the NONE sentinel if no error is current
   */
  public ErrorRecord propagate(ErrorOrigin origin) {
    Validate.notNull(origin, "origin must not be null");
    synchronized (lock) {
      ErrorCode code = current().code();
      if (code == StandardErrorCode.NONE) {
        return ErrorRecord.none();
      }
      return raise(code, origin, (String) null);
    }
  }

  // ---------------------------------------------------------------- queries

  /**
   * Returns the current error.
   *
   * @return the record at the view position; the NONE sentinel when no error is current; the HISTORY_LOST
   *     sentinel when the view points at an evicted position
   */
  public ErrorRecord current() {
    synchronized (lock) {
      return readHistory().lookup(readView());
    }
  }

  /**
   * Returns the code of the current error.
   *
   * @return current code, {@code NONE} when no error is current
   */
  public ErrorCode code() {
    return current().code();
  }

  /**
   * Returns true iff an error is current.
   *
   * @return true when the view position is above 0
   */
  public boolean isSet() {
    synchronized (lock) {
      return readView() > 0;
    }
  }

  /**
   * Returns the record at an arbitrary position.
   *
   * @param position position, not negative
   * @return the retained record, the HISTORY_LOST sentinel if evicted, the NONE sentinel for 0 or a
   *     position never raised
   */
  public ErrorRecord recordAt(long position) {
    synchronized (lock) {
      return readHistory().lookup(position);
    }
  }

  /**
   * Returns the number of errors raised since creation or the last {@link #clear()}.
   *
   * @return total raises
   */
  public long total() {
    synchronized (lock) {
      return readHistory().total();
    }
  }

  // ---------------------------------------------------------------- snapshots

  /**
   * Captures the current view position.
   *
   * @return error state for later {@link #restore} / {@link #isEqual} / {@link #dump}
   */
  public ErrorState capture() {
    synchronized (lock) {
      return ErrorState.at(readView());
    }
  }

  /**
   * Moves the view back to {@code state}.
   *
   * <p>A state ahead of the current view is ignored: the view never moves forward here. Neither the total
   * nor the history is touched, so restoring only changes what {@link #current()} presents.
   *
   * @param state previously captured state
   */
  public void restore(ErrorState state) {
    Validate.notNull(state, "state must not be null");
    synchronized (lock) {
      if (state.position() > view) {
        LOGGER.debug("restore: ignoring {} ahead of view {}", state, view);
        return;
      }
      view = state.position();
    }
  }

  /**
   * Returns true iff the view is at the position captured by {@code state}, i.e. no error has been raised
   * since (or the journal was restored to it).
   *
   * @param state previously captured state
   * @return true if positions are equal
   */
  public boolean isEqual(ErrorState state) {
    Validate.notNull(state, "state must not be null");
    synchronized (lock) {
      return state.position() == readView();
    }
  }

  /**
   * Clears the current error. Equivalent to restoring {@link ErrorState#NONE}; history and total are kept.
   */
  public void reset() {
    synchronized (lock) {
      view = 0L;
    }
  }

  /**
   * Discards the whole journal: the view and the total return to 0 and all retained records are dropped.
   */
  public void clear() {
    synchronized (lock) {
      history.clear();
      view = 0L;
    }
  }

  // ---------------------------------------------------------------- dump

  /**
   * Dumps the errors raised after {@code from} to the log at ERROR level.
   *
   * @param from dump errors more recent than this state
   * @param reverse true for newest first
   */
  public void dump(ErrorState from, boolean reverse) {
    dump(from, reverse, new LoggingDumpVisitor(this, DumpConfig.defaults()));
  }

  /**
   * Replays the positions after {@code from} up to the view through {@code visitor}.
   *
   * <p>The range is fixed before the first call. When it is empty the visitor is called once with
   * {@code (0, 0, 0)}. During each call {@link #current()} presents the visited record. Whatever the visitor
   * does to the journal is undone before this method returns, also when the visitor throws. A dump started
   * from within a visitor is ignored.
   *
   * @param from dump errors more recent than this state
   * @param reverse true for newest first
   * @param visitor visitor
   */
  public void dump(ErrorState from, boolean reverse, DumpVisitor visitor) {
    Validate.notNull(from, "from must not be null");
    Validate.notNull(visitor, "visitor must not be null");
    synchronized (lock) {
      if (replay != null) {
        LOGGER.debug("dump: ignoring nested dump from {}", from);
        return;
      }
      final ErrorHistory savedHistory = history.copy();
      final long savedView = view;
      final long oldest = from.position() + 1;
      final long newest = savedView;

      replay = new Replay(savedHistory, savedView);
      try {
        if (oldest > newest) {
          visitor.visit(0L, 0L, 0L);
        } else {
          final long first = reverse ? newest : oldest;
          final long last = reverse ? oldest : newest;
          final long step = reverse ? -1L : 1L;
          for (long self = first; ; self += step) {
            replay.cursor = self;
            visitor.visit(self, first, last);
            if (self == last) {
              break;
            }
          }
        }
      } finally {
        replay = null;
        history = savedHistory;
        view = savedView;
      }
    }
  }

  /**
   * Returns the positions after {@code from} up to the view, with their records, as a list computed up front.
   *
   * @param from list errors more recent than this state
   * @param reverse true for newest first
   * @return immutable entries; a single {@link DumpEntry#nothingToReport()} entry when the range is empty
   */
  public List<DumpEntry> entriesSince(ErrorState from, boolean reverse) {
    Validate.notNull(from, "from must not be null");
    synchronized (lock) {
      final ErrorHistory h = readHistory();
      final long oldest = from.position() + 1;
      final long newest = readView();
      if (oldest > newest) {
        return List.of(DumpEntry.nothingToReport());
      }
      final long first = reverse ? newest : oldest;
      final long last = reverse ? oldest : newest;
      final long step = reverse ? -1L : 1L;
      List<DumpEntry> out = new ArrayList<>((int) Math.min(newest - oldest + 1, 1024));
      for (long self = first; ; self += step) {
        out.add(new DumpEntry(self, first, last, h.lookup(self)));
        if (self == last) {
          break;
        }
      }
      return Collections.unmodifiableList(out);
    }
  }

  private ErrorHistory readHistory() {
    return replay != null ? replay.history : history;
  }

  private long readView() {
    return replay != null ? replay.cursor : view;
  }

  private static String format(String format, Object... args) {
    if (format == null || args == null || args.length == 0) {
      return format;
    }
    try {
      return String.format(format, args);
    } catch (IllegalFormatException e) {
      LOGGER.warn("raise: unusable message format '{}': {}", format, e.getMessage());
      return format;
    }
  }
}
