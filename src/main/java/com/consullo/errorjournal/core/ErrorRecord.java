package com.consullo.errorjournal.core;

import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Immutable description of one raised error.
 *
 * <p>Records are created by {@link ErrorJournal#raise} and never change afterwards. The journal also hands
 * out two sentinels that were never raised: {@link #none()} when no error is current, and
 * {@link #historyLost(long)} when a position exists but its detail has been evicted.
 */
public final class ErrorRecord {

  /** Size of the message buffer; stored messages hold at most one character less. */
  public static final int MAX_MESSAGE_LENGTH = 256;

  private static final ErrorRecord NONE =
      new ErrorRecord(0L, StandardErrorCode.NONE, ErrorOrigin.EMPTY, "");

  private final long position;
  private final ErrorCode code;
  private final ErrorOrigin origin;
  // Empty when the caller supplied no text.
  private final String text;

  private ErrorRecord(long position, ErrorCode code, ErrorOrigin origin, String text) {
    this.position = position;
    this.code = code;
    this.origin = origin;
    this.text = text;
  }

  /**
   * Creates a record for a raised error, composing the stored message from the code's default message and
   * the caller text.
   *
   * @param position journal position, at least 1
   * @param code error code
   * @param origin origin
   * @param userText caller text, may be null
   * @return record
   */
  static ErrorRecord raised(long position, ErrorCode code, ErrorOrigin origin, String userText) {
    Validate.isTrue(position > 0, "position must be positive: %d", position);
    return new ErrorRecord(position, code, origin, composeMessage(code, userText));
  }

  /**
   * Returns the sentinel presented when no error is current.
   *
   * @return NONE record at position 0
   */
  public static ErrorRecord none() {
    return NONE;
  }

  /**
   * Returns the sentinel for a position whose detail has been evicted from the history.
   *
   * @param position the evicted position
   * @return HISTORY_LOST record with empty origin and message
   */
  public static ErrorRecord historyLost(long position) {
    return new ErrorRecord(position, StandardErrorCode.HISTORY_LOST, ErrorOrigin.EMPTY, "");
  }

  static boolean hasUserText(String text) {
    // A lone space is the conventional "no message" marker.
    return text != null && !text.isEmpty() && !" ".equals(text);
  }

  private static String composeMessage(ErrorCode code, String userText) {
    if (!hasUserText(userText)) {
      return "";
    }
    return StringUtils.truncate(code.defaultMessage() + ": " + userText, MAX_MESSAGE_LENGTH - 1);
  }

  public long position() {
    return position;
  }

  public ErrorCode code() {
    return code;
  }

  public ErrorOrigin origin() {
    return origin;
  }

  /**
   * Returns the message of this error: the composed caller message if one was given, otherwise the default
   * message of the code.
   *
   * @return message, never null
   */
  public String message() {
    return text.isEmpty() ? code.defaultMessage() : text;
  }

  public boolean hasUserMessage() {
    return !text.isEmpty();
  }

  public String where() {
    return origin.where();
  }

  public boolean isNone() {
    return code == StandardErrorCode.NONE;
  }

  public boolean isHistoryLost() {
    return code == StandardErrorCode.HISTORY_LOST;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ErrorRecord)) {
      return false;
    }
    ErrorRecord that = (ErrorRecord) other;
    return position == that.position
        && code.equals(that.code)
        && origin.equals(that.origin)
        && text.equals(that.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(position, code, origin, text);
  }

  @Override
  public String toString() {
    return "ErrorRecord[" + position + " " + code.name() + " '" + message() + "' at " + where() + "]";
  }
}
