package io.intellixity.slicequery.query.fragment;

import java.util.List;

public final class QueryFragments {
  private QueryFragments() {}

  public static TimeGrain timeGrain(String column, String grain, String label) { return new TimeGrain(column, grain, label); }

  public static Slice slice(String column) { return new Slice(column); }
  public static Slice slice(String column, String label) { return new Slice(column, label); }

  public static Measure measure(String expression, String label) { return new Measure(expression, label); }

  /** {@code (numerator) / NULLIF(denominator, 0)}. */
  public static Ratio ratio(String numerator, String denominator, String label) { return new Ratio(numerator, denominator, label); }

  public static Filter in(String column, String... values) { return Filter.list(column, List.of(values)); }
  public static Filter in(String column, List<String> values) { return Filter.list(column, values); }

  public static Filter custom(String column, String expression) { return Filter.custom(column, expression); }
}
