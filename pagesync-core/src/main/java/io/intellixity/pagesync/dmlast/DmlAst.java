package io.intellixity.pagesync.dmlast;

/** Marker for the DML shapes the dialects render. */
public interface DmlAst {
  String schema();
  String table();
}
