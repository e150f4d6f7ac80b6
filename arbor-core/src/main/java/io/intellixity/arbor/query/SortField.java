package io.intellixity.arbor.query;

import java.util.Objects;

public record SortField(String column, Direction direction) {
  public SortField {
    Objects.requireNonNull(column, "column");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String column) { return new SortField(column, Direction.ASC); }
  public static SortField desc(String column) { return new SortField(column, Direction.DESC); }

  public enum Direction { ASC, DESC }
}
