package eventsourcing.jdbc.dialect;

import java.util.ArrayList;
import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 *
 * <p>H2 hands out identity values at insert time, so two writers could commit their
 * notification ids out of order. Writers therefore serialize on the single row of a
 * companion {@code <table>_lock} table, taken with {@code SELECT ... FOR UPDATE} and
 * held until commit.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String uuidType() {
    return "UUID";
  }

  @Override
  protected String textType() {
    return "VARCHAR";
  }

  @Override
  protected String bytesType() {
    return "VARBINARY";
  }

  @Override
  protected String notificationIdColumn() {
    return "BIGINT GENERATED BY DEFAULT AS IDENTITY";
  }

  @Override
  public List<String> createNotificationEventsTableSql(String table) {
    List<String> ddl = new ArrayList<>(super.createNotificationEventsTableSql(table));
    ddl.add("CREATE TABLE IF NOT EXISTS " + lockTable(table) + " (id INTEGER PRIMARY KEY)");
    ddl.add("MERGE INTO " + lockTable(table) + " (id) KEY (id) VALUES (1)");
    return List.copyOf(ddl);
  }

  @Override
  public List<String> lockEventsTableSql(String table) {
    return List.of("SELECT id FROM " + lockTable(table) + " WHERE id = 1 FOR UPDATE");
  }

  private static String lockTable(String table) {
    return table + "_lock";
  }
}
