package io.intellixity.arbor.jdbc;

import io.intellixity.arbor.catalog.SchemaCatalog;
import io.intellixity.arbor.compile.Bind;
import io.intellixity.arbor.error.TransportException;
import io.intellixity.arbor.exec.Propagation;
import io.intellixity.arbor.exec.TxHandle;
import io.intellixity.arbor.jdbc.dialect.JdbcDialect;
import io.intellixity.arbor.spi.exec.AbstractQueryEngine;
import io.intellixity.arbor.spi.exec.EngineOptions;
import io.intellixity.arbor.spi.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class JdbcQueryEngine extends AbstractQueryEngine<JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryEngine.class);
  private final DataSource ds;

  public JdbcQueryEngine(JdbcHandle handle,
                         JdbcDialect dialect,
                         SchemaCatalog catalog,
                         EngineOptions options,
                         Propagation defaultPropagation) {
    super(Objects.requireNonNull(dialect, "dialect"),
        Objects.requireNonNull(handle, "handle"),
        Objects.requireNonNull(catalog, "catalog"),
        options,
        defaultPropagation);
    this.ds = handle.client();
  }

  public JdbcQueryEngine(JdbcHandle handle, JdbcDialect dialect, SchemaCatalog catalog) {
    this(handle, dialect, catalog, EngineOptions.defaults(), Propagation.REQUIRED);
  }

  @Override
  protected TxHandle begin() {
    try {
      Connection c = ds.getConnection();
      try {
        c.setAutoCommit(false);
        Integer isolation = handle().isolationLevel();
        if (isolation != null) c.setTransactionIsolation(isolation);
      } catch (SQLException e) {
        c.close();
        throw e;
      }
      return new JdbcTxHandle(c);
    } catch (SQLException e) {
      throw new TransportException("Failed to open transaction on handle " + handle().id(), e);
    }
  }

  @Override
  protected void commit(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try (Connection c = j.conn()) {
      c.commit();
    } catch (SQLException e) {
      throw new TransportException("Commit failed on handle " + handle().id(), e);
    }
  }

  @Override
  protected void rollback(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try (Connection c = j.conn()) {
      c.rollback();
    } catch (SQLException e) {
      throw new TransportException("Rollback failed on handle " + handle().id(), e);
    }
  }

  @Override
  protected List<Map<String, Object>> executeSelect(TxHandle txOrNull, SqlStatement ss, List<Object> params) {
    try {
      Connection c = (txOrNull == null) ? ds.getConnection() : ((JdbcTxHandle) txOrNull).conn();
      try {
        String jdbcSql = NamedParamSql.toJdbcSql(ss.sql());
        long start = System.nanoTime();
        debugSql("SELECT", ss, jdbcSql, params);
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          for (int i = 0; i < params.size(); i++) ps.setObject(i + 1, params.get(i));
          try (ResultSet rs = ps.executeQuery()) {
            List<Map<String, Object>> out = readRows(rs);
            debugDone("SELECT", out.size(), System.nanoTime() - start);
            return out;
          }
        }
      } finally {
        if (txOrNull == null) c.close();
      }
    } catch (SQLException e) {
      throw new TransportException("SELECT failed on handle " + handle().id() + ": " + e.getMessage(), e);
    }
  }

  private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 0; i < n; i++) labels[i] = md.getColumnLabel(i + 1);
    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(n * 2);
      for (int i = 0; i < n; i++) row.put(labels[i], rs.getObject(i + 1));
      out.add(row);
    }
    return out;
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql, List<Object> params) {
    if (!log.isDebugEnabled()) return;
    JdbcHandle h = handle();
    log.debug("arbor.jdbc op={} bindCount={} handleId={} schema={} sql={}",
        op, params.size(), h.id(), h.schema(), jdbcSql);

    // values stay out of the log
    if (log.isTraceEnabled()) {
      for (int i = 0; i < params.size(); i++) {
        Object v = params.get(i);
        Bind b = i < ss.binds().size() ? ss.binds().get(i) : null;
        log.trace("arbor.jdbc bind index={} logicalType={} valueType={} valueLen={}",
            i + 1,
            b == null ? "null" : b.logicalType(),
            v == null ? "null" : v.getClass().getName(),
            (v instanceof CharSequence cs) ? cs.length() : -1);
      }
    }
  }

  private static void debugDone(String op, int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("arbor.jdbc_done op={} durationMs={} rows={}", op, durationNanos / 1_000_000.0, rows);
  }

  record JdbcTxHandle(Connection conn) implements TxHandle {}
}
