package io.intellixity.slicequery.query;

/** A list filter's value is not a list of strings. */
public final class InvalidFilterValueException extends QueryAssemblyException {
  public InvalidFilterValueException(String message) {
    super(message);
  }
}
