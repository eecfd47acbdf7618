package eventsourcing.jdbc;

import eventsourcing.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} opening a new physical session through
 * {@link DriverManager} on every call.
 */
public final class DriverManagerConnectionProvider implements ConnectionProvider {
  private final String url;
  private final String user;
  private final String password;

  public DriverManagerConnectionProvider(String url, String user, String password) {
    this.url = Objects.requireNonNull(url, "url");
    this.user = user;
    this.password = password;
  }

  @Override
  public Connection getConnection() throws SQLException {
    return DriverManager.getConnection(url, user, password);
  }

  public String url() {
    return url;
  }

  @Override
  public String toString() {
    return "DriverManagerConnectionProvider[url=" + url + ", user=" + user + "]";
  }
}
