package io.intellixity.pagesync.sync;

import java.util.Objects;
import java.util.Properties;

/**
 * Relation sync settings, loadable from {@code pagesync.sync.*} properties:
 * <pre>
 * pagesync.sync.joinSchema=Join
 * pagesync.sync.metaSchema=meta
 * pagesync.sync.nameMapTable=notion_table_namemap
 * pagesync.sync.primaryKeyColumn=primary_key_id
 * pagesync.sync.insertBatchSize=100
 * </pre>
 */
public final class SyncConfig {
  public static final String DEFAULT_PREFIX = "pagesync.sync.";

  private String joinSchema = "Join";
  private String metaSchema = "meta";
  private String nameMapTable = "notion_table_namemap";
  private String primaryKeyColumn = "primary_key_id";
  private int insertBatchSize = 100;

  public String getJoinSchema() { return joinSchema; }
  public void setJoinSchema(String joinSchema) { this.joinSchema = joinSchema; }
  public String getMetaSchema() { return metaSchema; }
  public void setMetaSchema(String metaSchema) { this.metaSchema = metaSchema; }
  public String getNameMapTable() { return nameMapTable; }
  public void setNameMapTable(String nameMapTable) { this.nameMapTable = nameMapTable; }
  public String getPrimaryKeyColumn() { return primaryKeyColumn; }
  public void setPrimaryKeyColumn(String primaryKeyColumn) { this.primaryKeyColumn = primaryKeyColumn; }
  public int getInsertBatchSize() { return insertBatchSize; }

  public void setInsertBatchSize(int insertBatchSize) {
    if (insertBatchSize <= 0) throw new IllegalArgumentException("insertBatchSize must be > 0");
    this.insertBatchSize = insertBatchSize;
  }

  public static SyncConfig fromProperties(Properties p, String prefix) {
    Objects.requireNonNull(p, "properties");
    String pre = (prefix == null) ? DEFAULT_PREFIX : prefix;
    SyncConfig c = new SyncConfig();
    String v;
    if ((v = trimToNull(p.getProperty(pre + "joinSchema"))) != null) c.setJoinSchema(v);
    if ((v = trimToNull(p.getProperty(pre + "metaSchema"))) != null) c.setMetaSchema(v);
    if ((v = trimToNull(p.getProperty(pre + "nameMapTable"))) != null) c.setNameMapTable(v);
    if ((v = trimToNull(p.getProperty(pre + "primaryKeyColumn"))) != null) c.setPrimaryKeyColumn(v);
    if ((v = trimToNull(p.getProperty(pre + "insertBatchSize"))) != null) {
      try {
        c.setInsertBatchSize(Integer.parseInt(v));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Property " + pre + "insertBatchSize is not a number: " + v, e);
      }
    }
    return c;
  }

  private static String trimToNull(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }
}
