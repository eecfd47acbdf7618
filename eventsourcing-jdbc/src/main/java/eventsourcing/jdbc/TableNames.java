package eventsourcing.jdbc;

import java.util.Locale;
import java.util.Objects;

/**
 * Table name validation and the naming scheme used by {@link JdbcRecorderFactory}.
 *
 * <p>Names are concatenated into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_EVENTS_PREFIX = "stored";
  public static final String DEFAULT_TRACKING_PREFIX = "notification";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /**
   * Returns {@code <application>_<purpose>}, lower-cased, or {@code stored_<purpose>}
   * when the application name is empty.
   */
  public static String eventsTable(String applicationName, String purpose) {
    Objects.requireNonNull(purpose, "purpose");
    return validate(prefix(applicationName, DEFAULT_EVENTS_PREFIX) + "_" + purpose);
  }

  /**
   * Returns {@code <application>_tracking}, lower-cased, or {@code notification_tracking}
   * when the application name is empty.
   */
  public static String trackingTable(String applicationName) {
    return validate(prefix(applicationName, DEFAULT_TRACKING_PREFIX) + "_tracking");
  }

  private static String prefix(String applicationName, String fallback) {
    Objects.requireNonNull(applicationName, "applicationName");
    String prefix = applicationName.toLowerCase(Locale.ROOT);
    return prefix.isEmpty() ? fallback : prefix;
  }
}
