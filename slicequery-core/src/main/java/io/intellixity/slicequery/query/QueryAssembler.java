package io.intellixity.slicequery.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.slicequery.query.fragment.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Accumulates fragments for a single table and renders them into one SELECT statement.
 *
 * <p>Rendered layout (five clauses joined by newlines):</p>
 * <pre>
 * SELECT
 *   &lt;time grain&gt;,
 *   &lt;slices&gt;, &lt;measures&gt;, &lt;ratios&gt;
 * FROM &lt;table&gt;
 * WHERE TRUE AND
 *   &lt;filters&gt;
 * GROUP BY 1, 2, ..
 * ORDER BY 1 DESC, 2, ..
 * </pre>
 *
 * GROUP BY / ORDER BY are positional: 1 is the time grain, 2..N+1 are the N slices. Measures and
 * ratios follow the slices in the SELECT list and are never grouped.
 *
 * <p>Not thread-safe. {@link #compile()} does not modify state and may be called repeatedly.</p>
 */
@JsonSerialize(using = QueryAssemblerJsonSerializer.class)
@JsonDeserialize(using = QueryAssemblerJsonDeserializer.class)
public final class QueryAssembler {
  private static final Logger log = LoggerFactory.getLogger(QueryAssembler.class);

  private String table;
  private TimeGrain timeGrain;
  private final List<Slice> slices = new ArrayList<>();
  private final List<Measure> measures = new ArrayList<>();
  private final List<Ratio> ratios = new ArrayList<>();
  private List<Filter> filters = new ArrayList<>();

  public QueryAssembler() {}

  public QueryAssembler(String table) {
    this.table = table;
  }

  public String table() { return table; }
  /** Null until {@link #setTimeGrain(TimeGrain)} is called. */
  public TimeGrain timeGrain() { return timeGrain; }
  public List<Slice> slices() { return Collections.unmodifiableList(slices); }
  public List<Measure> measures() { return Collections.unmodifiableList(measures); }
  public List<Ratio> ratios() { return Collections.unmodifiableList(ratios); }
  public List<Filter> filters() { return Collections.unmodifiableList(filters); }

  public QueryAssembler setTable(String table) { this.table = table; return this; }

  public QueryAssembler setTimeGrain(TimeGrain timeGrain) {
    this.timeGrain = Objects.requireNonNull(timeGrain, "timeGrain");
    return this;
  }

  public QueryAssembler addSlice(Slice slice) { slices.add(Objects.requireNonNull(slice, "slice")); return this; }
  public QueryAssembler addMeasure(Measure measure) { measures.add(Objects.requireNonNull(measure, "measure")); return this; }
  public QueryAssembler addRatio(Ratio ratio) { ratios.add(Objects.requireNonNull(ratio, "ratio")); return this; }
  public QueryAssembler addFilter(Filter filter) { filters.add(Objects.requireNonNull(filter, "filter")); return this; }

  /** Replaces the filter sequence. Filters carry no label, so this is how they are removed. */
  public QueryAssembler withFilters(List<Filter> filters) {
    List<Filter> copy = new ArrayList<>(filters == null ? List.of() : filters);
    copy.forEach(f -> Objects.requireNonNull(f, "filter"));
    this.filters = copy;
    return this;
  }

  /**
   * Drops the time grain if its label matches and, independently, every slice, measure and ratio
   * with that label. Filters are untouched. No match is a no-op.
   */
  public QueryAssembler removeByLabel(String label) {
    boolean removed = false;
    if (timeGrain != null && timeGrain.label().equals(label)) {
      timeGrain = null;
      removed = true;
    }
    removed |= removeLabeled(slices, label);
    removed |= removeLabeled(measures, label);
    removed |= removeLabeled(ratios, label);

    if (!removed && log.isDebugEnabled()) {
      log.debug("slicequery.remove label={} matched=none", label);
    }
    return this;
  }

  public String compile() {
    if (timeGrain == null) {
      throw new MissingTimeGrainException("Cannot compile query on table '" + table + "': no time grain set");
    }
    if (log.isDebugEnabled()) {
      log.debug("slicequery.compile table={} timeGrain={} slices={} measures={} ratios={} filters={}",
          table, timeGrain.label(), slices.size(), measures.size(), ratios.size(), filters.size());
    }

    List<String> selectParts = new ArrayList<>();
    selectParts.add(timeGrain.render());
    renderAll(slices, selectParts);
    renderAll(measures, selectParts);
    renderAll(ratios, selectParts);

    List<String> whereParts = new ArrayList<>();
    whereParts.add("TRUE");
    renderAll(filters, whereParts);

    List<String> groupByParts = new ArrayList<>();
    groupByParts.add("1");
    groupByParts.addAll(slicePositions());

    List<String> orderByParts = new ArrayList<>();
    orderByParts.add("1 DESC");
    orderByParts.addAll(slicePositions());

    String sql = String.join("\n",
        "SELECT\n  " + String.join(",\n  ", selectParts),
        "FROM " + table,
        "WHERE " + String.join(" AND\n  ", whereParts),
        "GROUP BY " + String.join(", ", groupByParts),
        "ORDER BY " + String.join(", ", orderByParts));

    if (log.isTraceEnabled()) {
      log.trace("slicequery.compile_done sql={}", sql);
    }
    return sql;
  }

  // Slices occupy SELECT positions 2..N+1, right after the time grain.
  private List<String> slicePositions() {
    List<String> out = new ArrayList<>(slices.size());
    for (int i = 0; i < slices.size(); i++) {
      out.add(String.valueOf(i + 2));
    }
    return out;
  }

  private static boolean removeLabeled(List<? extends LabeledFragment> fragments, String label) {
    return fragments.removeIf(f -> f.label().equals(label));
  }

  private static void renderAll(List<? extends Fragment> fragments, List<String> out) {
    for (Fragment f : fragments) {
      out.add(f.render());
    }
  }
}
