package eventsourcing.jdbc.dialect;

import eventsourcing.ConfigurationException;
import eventsourcing.OperationalException;
import eventsourcing.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Chooses the {@link Dialect} a datastore runs with.
 *
 * <p>Dialects are discovered once through {@link ServiceLoader}
 * ({@code META-INF/services/eventsourcing.jdbc.spi.Dialect}). The recorder factory
 * resolves its dialect from the JDBC URL it connects to; callers that bring their own
 * {@link DataSource} can resolve from the URL the driver reports.
 */
public final class Dialects {

  private Dialects() {
  }

  /**
   * The dialect registered under {@code name}, ignoring case.
   *
   * @throws ConfigurationException if no dialect has that name
   */
  public static Dialect named(String name) {
    if (name != null) {
      Dialect dialect = Registry.BY_NAME.get(name.toLowerCase(Locale.ROOT));
      if (dialect != null) {
        return dialect;
      }
    }
    throw new ConfigurationException("Unknown dialect '" + name + "', registered: "
        + Registry.BY_NAME.keySet());
  }

  /**
   * The dialect whose URL prefix matches {@code jdbcUrl}.
   *
   * @throws ConfigurationException if the URL is blank or no dialect handles it
   */
  public static Dialect forUrl(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      throw new ConfigurationException("JDBC URL is required to choose a dialect");
    }
    for (Map.Entry<String, Dialect> entry : Registry.BY_PREFIX.entrySet()) {
      if (jdbcUrl.startsWith(entry.getKey())) {
        return entry.getValue();
      }
    }
    throw new ConfigurationException("No dialect handles " + jdbcUrl
        + ", supported prefixes: " + Registry.BY_PREFIX.keySet());
  }

  /**
   * The dialect for the database behind {@code dataSource}, read from the URL in its
   * connection metadata.
   *
   * @throws OperationalException if no connection can be opened
   * @throws ConfigurationException if no dialect handles the reported URL
   */
  public static Dialect forDataSource(DataSource dataSource) {
    String url;
    try (Connection connection = dataSource.getConnection()) {
      url = connection.getMetaData().getURL();
    } catch (SQLException e) {
      throw new OperationalException("Could not read the JDBC URL from the data source", e);
    }
    return forUrl(url);
  }

  static List<Dialect> registered() {
    return List.copyOf(Registry.BY_NAME.values());
  }

  private static final class Registry {
    static final Map<String, Dialect> BY_NAME = new LinkedHashMap<>();
    static final Map<String, Dialect> BY_PREFIX = new LinkedHashMap<>();

    static {
      for (Dialect dialect : ServiceLoader.load(Dialect.class)) {
        BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
        for (String prefix : dialect.jdbcUrlPrefixes()) {
          BY_PREFIX.putIfAbsent(prefix, dialect);
        }
      }
    }
  }
}
