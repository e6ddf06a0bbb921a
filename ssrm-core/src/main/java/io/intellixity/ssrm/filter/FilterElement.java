package io.intellixity.ssrm.filter;

/** Node of a parsed grid filter model: either a {@link Condition} or a {@link LogicalGroup}. */
public interface FilterElement {
}
