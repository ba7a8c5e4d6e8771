package io.intellixity.slicequery.query.fragment;

/** Fragment that appears in the SELECT list under an output column label. */
public interface LabeledFragment extends Fragment {
  String label();
}
