package io.intellixity.slicequery.query;

public final class MissingExpressionException extends QueryAssemblyException {
  public MissingExpressionException(String message) {
    super(message);
  }
}
