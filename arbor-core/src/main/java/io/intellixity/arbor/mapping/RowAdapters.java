package io.intellixity.arbor.mapping;

import io.intellixity.arbor.error.ReconstructionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class RowAdapters {
  private RowAdapters() {}

  public static RowAdapter fromMap(Map<String, Object> row) {
    return new MapRowAdapter(row);
  }

  public static List<RowAdapter> fromMaps(List<Map<String, Object>> rows) {
    List<RowAdapter> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) out.add(fromMap(r));
    return out;
  }

  static final class MapRowAdapter implements RowAdapter {
    private final Map<String, Object> row;

    MapRowAdapter(Map<String, Object> row) {
      this.row = row;
    }

    @Override public boolean has(String label) { return row.containsKey(label); }

    @Override
    public Object raw(String label) {
      Object v = row.get(label);
      if (v == null && !row.containsKey(label)) throw new ReconstructionException("Row has no column labelled '" + label + "'");
      return v;
    }
  }
}
