package io.intellixity.arbor.compile;

/**
 * Hands out table aliases for one plan. Query levels are named after their node id ({@code t0}, {@code d1},
 * {@code j2}); tables inside filter subqueries get {@code f1}, {@code f2}, ... so nested relation filters never
 * collide with each other or with the levels around them.
 */
public final class AliasAllocator {
  private int filters;

  public static String table(int nodeId) { return "t" + nodeId; }

  public static String derived(int nodeId) { return "d" + nodeId; }

  public static String junction(int nodeId) { return "j" + nodeId; }

  public String filter() {
    return "f" + (++filters);
  }
}
