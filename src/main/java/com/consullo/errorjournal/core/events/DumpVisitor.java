package com.consullo.errorjournal.core.events;

/**
 * Callback driven by {@link com.consullo.errorjournal.core.ErrorJournal#dump}.
 *
 * <p>Called once per position in the dumped range, with {@code first} and {@code last} fixed for the whole
 * traversal, so direction and bounds can be read from any single call ({@code first > last} means reverse
 * order). When the range is empty the visitor is called exactly once with {@code (0, 0, 0)}.
 *
 * <p>During a call, {@link com.consullo.errorjournal.core.ErrorJournal#current()} returns the record at
 * {@code self}. Changes the visitor makes to the journal are undone when the dump returns.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface DumpVisitor {

  /**
   * Visits one position.
   *
   * @param self position being visited, 0 when there is nothing to report
   * @param first first position of the traversal
   * @param last last position of the traversal
   */
  void visit(long self, long first, long last);
}
