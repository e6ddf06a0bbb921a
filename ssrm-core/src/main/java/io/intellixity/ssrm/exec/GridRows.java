package io.intellixity.ssrm.exec;

/** Keys the engine writes into non-leaf grid rows. */
public final class GridRows {
  public static final String ID = "_id";
  public static final String GROUP = "group";
  public static final String CHILD_COUNT = "childCount";
  public static final String PIVOT = "pivot";

  private GridRows() {}
}
