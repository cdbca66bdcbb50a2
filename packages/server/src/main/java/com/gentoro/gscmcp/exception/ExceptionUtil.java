package com.gentoro.gscmcp.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Describe {@code t} for a tool error result. Future wrappers are removed first, so a failed
   * period query reports the Search Console error rather than a {@link CompletionException}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    Throwable cause = unwrap(t);
    String message = cause.getMessage() == null ? "" : cause.getMessage();
    if (cause instanceof GscMcpException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          ex.getCode(),
          message,
          ex.getContext().isEmpty() ? null : ex.getContext());
    }
    return new ErrorDetails(
        cause.getClass().getSimpleName(), GscMcpErrorCode.UNKNOWN, message, null);
  }

  /** Strips {@link CompletionException} and {@link ExecutionException} layers. */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** {@code t} itself when it already is a {@link GscMcpException}, otherwise {@code wrapper(t)}. */
  public static GscMcpException rethrowIfUnchecked(
      Throwable t, Function<Throwable, GscMcpException> wrapper) {
    if (t instanceof GscMcpException ex) {
      return ex;
    }
    return wrapper.apply(t);
  }
}
