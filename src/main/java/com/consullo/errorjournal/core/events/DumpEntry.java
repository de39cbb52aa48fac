package com.consullo.errorjournal.core.events;

import com.consullo.errorjournal.core.ErrorRecord;

/**
 * One step of a pull-style traversal, see
 * {@link com.consullo.errorjournal.core.ErrorJournal#entriesSince}.
 *
 * @param self position of this step, 0 for the single "nothing to report" entry
 * @param first first position of the traversal
 * @param last last position of the traversal
 * @param record record at {@code self}, resolved when the traversal was computed
 * @since 1.0
 */
public record DumpEntry(
    long self,
    long first,
    long last,
    ErrorRecord record) {

  /**
   * Creates the entry reported for an empty range.
   *
   * @return entry with all positions 0 and the NONE record
   */
  public static DumpEntry nothingToReport() {
    return new DumpEntry(0L, 0L, 0L, ErrorRecord.none());
  }

  public boolean isReverse() {
    return first > last;
  }
}
