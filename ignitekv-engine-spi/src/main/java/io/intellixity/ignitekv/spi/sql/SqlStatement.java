package io.intellixity.ignitekv.spi.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Statement text with positional ({@code ?}) arguments. */
public record SqlStatement(String sql, List<Object> args, ExecKind execKind) {
  public enum ExecKind {
    /** Returns rows (SELECT). */
    QUERY,
    /** Returns an update count (DDL/DML). */
    UPDATE
  }

  public SqlStatement {
    // args may hold nulls
    args = (args == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public static SqlStatement query(String sql, List<Object> args) {
    return new SqlStatement(sql, args, ExecKind.QUERY);
  }

  public static SqlStatement update(String sql, List<Object> args) {
    return new SqlStatement(sql, args, ExecKind.UPDATE);
  }
}
