package com.consullo.errorjournal.core;

/**
 * Error kinds raised by the library itself, plus the two reserved journal values.
 *
 * @since 1.0
 */
public enum StandardErrorCode implements ErrorCode {

  /** No error is current. */
  NONE(""),
  UNSPECIFIED("An unspecified error"),
  /** Synthesized by the journal for a position whose detail was evicted. Never stored. */
  HISTORY_LOST("The actual error was lost"),
  DUPLICATING_STREAM("Cannot duplicate output stream"),
  ASSIGNING_STREAM("Cannot associate a stream with a file descriptor"),
  FILE_IO("File read/write error"),
  BAD_FILE_FORMAT("Bad file format"),
  FILE_ALREADY_OPEN("File already open"),
  FILE_NOT_CREATED("File cannot be created"),
  FILE_NOT_FOUND("File not found"),
  DATA_NOT_FOUND("Data not found"),
  ACCESS_OUT_OF_RANGE("Access beyond boundaries"),
  NULL_INPUT("Null input data"),
  INCOMPATIBLE_INPUT("Input data do not match"),
  ILLEGAL_INPUT("Illegal input"),
  ILLEGAL_OUTPUT("Illegal output"),
  UNSUPPORTED_MODE("Unsupported mode"),
  SINGULAR_MATRIX("Singular matrix"),
  DIVISION_BY_ZERO("Division by zero"),
  TYPE_MISMATCH("Type mismatch"),
  INVALID_TYPE("Invalid type"),
  CONTINUE("The iterative process did not converge"),
  NO_WCS("The WCS functionalities are missing");

  private final String defaultMessage;

  StandardErrorCode(String defaultMessage) {
    this.defaultMessage = defaultMessage;
  }

  @Override
  public String defaultMessage() {
    return defaultMessage;
  }
}
