package eventrelay.jdbc;

import java.util.Objects;

/**
 * Default table names and identifier validation for the JDBC stores. Table names are
 * concatenated into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String OUTBOX_EVENT = "outbox_event";
  public static final String WEBHOOK_ENDPOINT = "webhook_endpoint";
  public static final String WEBHOOK_DELIVERY = "webhook_delivery";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
