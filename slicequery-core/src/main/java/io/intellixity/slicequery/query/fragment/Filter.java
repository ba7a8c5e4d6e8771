package io.intellixity.slicequery.query.fragment;

import io.intellixity.slicequery.query.InvalidFilterValueException;
import io.intellixity.slicequery.query.MissingExpressionException;

import java.util.*;

/**
 * WHERE predicate.
 *
 * <p>{@code kind} is kept as the raw id and only interpreted by {@link #render()}, so a filter
 * read from a query definition with an unknown kind or a malformed value fails when rendered.
 * A null kind means {@code list}.</p>
 *
 * <p>List values are interpolated into single-quoted literals without escaping.</p>
 */
public record Filter(String column, String kind, Object value, String customExpression) implements Fragment {
  public Filter {
    Objects.requireNonNull(column, "column");
    kind = (kind == null) ? FilterKind.LIST.id() : kind;
    // Copied as-is; nulls and non-strings are rejected by render(), not here.
    if (value instanceof List<?> l) value = Collections.unmodifiableList(new ArrayList<>(l));
  }

  public static Filter list(String column, List<String> values) {
    return new Filter(column, FilterKind.LIST.id(), values, null);
  }

  public static Filter custom(String column, String expression) {
    return new Filter(column, FilterKind.CUSTOM.id(), null, expression);
  }

  @Override
  public String render() {
    return switch (FilterKind.fromId(kind)) {
      case LIST -> renderList();
      case CUSTOM -> renderCustom();
    };
  }

  private String renderList() {
    if (!(value instanceof List<?> values)) {
      throw new InvalidFilterValueException("Value must be a list for 'list' filter on column '" + column + "'");
    }
    List<String> literals = new ArrayList<>(values.size());
    for (Object v : values) {
      if (!(v instanceof String s)) {
        throw new InvalidFilterValueException(
            "List filter on column '" + column + "' requires string values, got: " + (v == null ? "null" : v.getClass().getName()));
      }
      literals.add("'" + s + "'");
    }
    return column + " IN (" + String.join(", ", literals) + ")\n";
  }

  private String renderCustom() {
    if (customExpression == null || customExpression.isEmpty()) {
      throw new MissingExpressionException("Custom filter on column '" + column + "' requires an expression");
    }
    return customExpression;
  }
}
