package io.intellixity.slicequery.query.fragment;

/** A self-rendering piece of a SQL clause. Implementations are immutable and render without side effects. */
public interface Fragment {
  String render();
}
