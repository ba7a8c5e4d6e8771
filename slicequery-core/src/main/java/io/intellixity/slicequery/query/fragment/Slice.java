package io.intellixity.slicequery.query.fragment;

import java.util.Objects;

/** Dimension column; selected and grouped by. The label defaults to the column name. */
public record Slice(String column, String label) implements LabeledFragment {
  public Slice {
    Objects.requireNonNull(column, "column");
    label = (label == null) ? column : label;
  }

  public Slice(String column) {
    this(column, null);
  }

  @Override
  public String render() {
    return column + " AS \"" + label + "\"";
  }
}
