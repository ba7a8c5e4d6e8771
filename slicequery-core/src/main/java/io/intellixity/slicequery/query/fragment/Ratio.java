package io.intellixity.slicequery.query.fragment;

import java.util.Objects;

/**
 * Derived measure dividing two expressions.
 *
 * <p>The denominator is wrapped in {@code NULLIF(.., 0)} so a zero denominator yields NULL
 * instead of a division error.</p>
 */
public record Ratio(String numerator, String denominator, String label) implements LabeledFragment {
  public Ratio {
    Objects.requireNonNull(numerator, "numerator");
    Objects.requireNonNull(denominator, "denominator");
    Objects.requireNonNull(label, "label");
  }

  @Override
  public String render() {
    return "(" + numerator + ") / NULLIF(" + denominator + ", 0) AS \"" + label + "\"";
  }
}
