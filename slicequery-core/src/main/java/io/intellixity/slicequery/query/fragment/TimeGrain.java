package io.intellixity.slicequery.query.fragment;

import java.util.Objects;

/** Time bucket: truncates {@code column} to {@code grain} (day, week, month, ...). */
public record TimeGrain(String column, String grain, String label) implements LabeledFragment {
  public TimeGrain {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(grain, "grain");
    Objects.requireNonNull(label, "label");
  }

  @Override
  public String render() {
    return "date_trunc('" + grain + "', " + column + ") AS \"" + label + "\"";
  }
}
