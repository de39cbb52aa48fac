package com.consullo.errorjournal.core;

/**
 * Kind of error stored in the journal.
 *
 * <p>The journal treats codes as opaque values: it stores and returns them without interpreting them, except
 * for the two reserved constants {@link StandardErrorCode#NONE} and {@link StandardErrorCode#HISTORY_LOST}.
 * Applications that need their own kinds implement this interface (typically with an enum).
 *
 * @since 1.0
 */
public interface ErrorCode {

  /**
   * Returns the symbolic name of the code, used in dumps.
   *
   * @return code name
   */
  String name();

  /**
   * Returns the standard message for this code. Used as the record message when the caller supplied none,
   * and as the prefix of a caller-supplied message.
   *
   * @return default message, never null
   */
  String defaultMessage();
}
