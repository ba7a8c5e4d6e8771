package io.intellixity.slicequery.query.fragment;

import java.util.Objects;

/** Aggregate expression, e.g. {@code count(*)} or {@code sum(amount)}. Never grouped by. */
public record Measure(String expression, String label) implements LabeledFragment {
  public Measure {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(label, "label");
  }

  @Override
  public String render() {
    return expression + " AS \"" + label + "\"";
  }
}
