package com.consullo.errorjournal.core;

import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Source location an error was raised from.
 *
 * <p>Null names are stored as empty strings. Overlong names are truncated, never rejected.
 *
 * @param file source file name (may be empty)
 * @param line source line, 0 when unknown
 * @param function function or method name (may be empty)
 * @since 1.0
 */
public record ErrorOrigin(String file, int line, String function) {

  /** Maximum stored length of a file name. */
  public static final int MAX_FILE_LENGTH = 4096;

  /** Maximum stored length of a function name. */
  public static final int MAX_FUNCTION_LENGTH = 50;

  /** Origin with no location information. */
  public static final ErrorOrigin EMPTY = new ErrorOrigin("", 0, "");

  // Frames belonging to the journal itself are skipped when resolving the caller.
  private static final Set<String> INTERNAL_CLASSES = Set.of(
      ErrorOrigin.class.getName(),
      ErrorJournal.class.getName());

  public ErrorOrigin {
    Validate.isTrue(line >= 0, "line must not be negative: %d", line);
    file = StringUtils.truncate(StringUtils.defaultString(file), MAX_FILE_LENGTH);
    function = StringUtils.truncate(StringUtils.defaultString(function), MAX_FUNCTION_LENGTH);
  }

  /**
   * Creates an origin for the given location.
   *
   * @param file source file
   * @param line source line
   * @param function function name
   * @return origin
   */
  public static ErrorOrigin of(String file, int line, String function) {
    return new ErrorOrigin(file, line, function);
  }

  /**
   * Resolves the origin of the code that called into the journal, skipping the journal's own frames.
   *
   * @return caller origin, or {@link #EMPTY} if the stack cannot be inspected
   */
  public static ErrorOrigin caller() {
    return StackWalker.getInstance().walk(frames -> frames
        .filter(f -> !INTERNAL_CLASSES.contains(f.getClassName()))
        .findFirst()
        .map(f -> new ErrorOrigin(f.getFileName(), Math.max(0, f.getLineNumber()), f.getMethodName()))
        .orElse(EMPTY));
  }

  /**
   * Renders the location as {@code function:file:line}.
   *
   * @return location text
   */
  public String where() {
    return function + ":" + file + ":" + line;
  }

  public boolean isEmpty() {
    return file.isEmpty() && function.isEmpty() && line == 0;
  }
}
