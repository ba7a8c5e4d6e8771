package io.intellixity.slicequery.query;

/** {@link QueryAssembler#compile()} needs a time grain: SELECT position 1 is always the time bucket. */
public final class MissingTimeGrainException extends QueryAssemblyException {
  public MissingTimeGrainException(String message) {
    super(message);
  }
}
