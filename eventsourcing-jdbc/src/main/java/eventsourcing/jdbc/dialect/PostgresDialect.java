package eventsourcing.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 *
 * <p>Notification ids come from a {@code BIGSERIAL}. Inserts take an
 * {@code EXCLUSIVE} table lock first so that ids are assigned and committed in the
 * same order; readers are not blocked by it.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String uuidType() {
    return "uuid";
  }

  @Override
  protected String textType() {
    return "text";
  }

  @Override
  protected String bytesType() {
    return "bytea";
  }

  @Override
  protected String notificationIdColumn() {
    return "bigserial";
  }

  @Override
  public List<String> lockEventsTableSql(String table) {
    return List.of("LOCK TABLE " + table + " IN EXCLUSIVE MODE");
  }
}
