package io.intellixity.slicequery.query;

/**
 * Base type for caller misuse detected while rendering fragments or compiling a query.
 * <p>
 * Raised synchronously from {@code render()} / {@code compile()}; never caught internally.
 */
public class QueryAssemblyException extends RuntimeException {
  public QueryAssemblyException(String message) {
    super(message);
  }

  public QueryAssemblyException(String message, Throwable cause) {
    super(message, cause);
  }
}
