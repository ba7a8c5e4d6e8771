package io.intellixity.slicequery.query.fragment;

import io.intellixity.slicequery.query.UnsupportedFilterKindException;

public enum FilterKind {
  /** {@code column IN ('a', 'b')} over a list of string values. */
  LIST("list"),
  /** Caller-supplied predicate emitted verbatim. */
  CUSTOM("custom");

  private final String id;

  FilterKind(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /** Exact, case-sensitive lookup by id. */
  public static FilterKind fromId(String id) {
    for (FilterKind k : values()) {
      if (k.id.equals(id)) return k;
    }
    throw new UnsupportedFilterKindException(id);
  }
}
