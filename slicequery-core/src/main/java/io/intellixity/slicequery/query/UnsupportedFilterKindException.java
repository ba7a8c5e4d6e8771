package io.intellixity.slicequery.query;

public final class UnsupportedFilterKindException extends QueryAssemblyException {
  private final String kind;

  public UnsupportedFilterKindException(String kind) {
    super("Unsupported filter kind: " + kind);
    this.kind = kind;
  }

  public String kind() { return kind; }
}
