package eventsourcing.jdbc;

import eventsourcing.ConfigurationException;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Connection settings for a PostgreSQL datastore.
 *
 * <p>Build directly, or read from an environment map with
 * {@link #fromEnvironment(String, Map)}. Each key is looked up first with the
 * upper-cased application name as prefix ({@code ORDERS_POSTGRES_HOST}) and then
 * without it ({@code POSTGRES_HOST}).
 */
public final class DatastoreSettings {
  public static final String DBNAME = "POSTGRES_DBNAME";
  public static final String HOST = "POSTGRES_HOST";
  public static final String PORT = "POSTGRES_PORT";
  public static final String USER = "POSTGRES_USER";
  public static final String PASSWORD = "POSTGRES_PASSWORD";
  public static final String CONN_MAX_AGE = "POSTGRES_CONN_MAX_AGE";
  public static final String PRE_PING = "POSTGRES_PRE_PING";
  public static final String CREATE_TABLE = "CREATE_TABLE";

  public static final int DEFAULT_PORT = 5432;

  private static final Set<String> TRUE_WORDS = Set.of("y", "yes", "t", "true", "on", "1");
  private static final Set<String> FALSE_WORDS = Set.of("n", "no", "f", "false", "off", "0");

  private final String dbname;
  private final String host;
  private final int port;
  private final String user;
  private final String password;
  private final Duration connMaxAge;
  private final boolean prePing;
  private final boolean createTable;

  private DatastoreSettings(Builder builder) {
    this.dbname = Objects.requireNonNull(builder.dbname, "dbname");
    this.host = Objects.requireNonNull(builder.host, "host");
    this.user = Objects.requireNonNull(builder.user, "user");
    this.password = Objects.requireNonNull(builder.password, "password");
    if (builder.port < 1 || builder.port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
    if (builder.connMaxAge != null && (builder.connMaxAge.isNegative() || builder.connMaxAge.isZero())) {
      throw new IllegalArgumentException("connMaxAge must be > 0");
    }
    this.port = builder.port;
    this.connMaxAge = builder.connMaxAge;
    this.prePing = builder.prePing;
    this.createTable = builder.createTable;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads settings from an environment map such as {@link System#getenv()}.
   *
   * @param applicationName prefix for application-specific keys; may be empty
   * @param env             the environment
   * @throws ConfigurationException if a required key is missing or a value is malformed
   */
  public static DatastoreSettings fromEnvironment(String applicationName, Map<String, String> env) {
    Objects.requireNonNull(applicationName, "applicationName");
    Objects.requireNonNull(env, "env");
    Lookup lookup = new Lookup(applicationName, env);

    Builder builder = builder()
        .dbname(lookup.required(DBNAME))
        .host(lookup.required(HOST))
        .user(lookup.required(USER))
        .password(lookup.required(PASSWORD));

    String port = lookup.optional(PORT);
    if (port != null && !port.isEmpty()) {
      builder.port(parsePort(port));
    }
    String maxAge = lookup.optional(CONN_MAX_AGE);
    if (maxAge != null && !maxAge.trim().isEmpty()) {
      builder.connMaxAge(parseSeconds(CONN_MAX_AGE, maxAge));
    }
    String prePing = lookup.optional(PRE_PING);
    if (prePing != null) {
      builder.prePing(parseBoolean(PRE_PING, prePing));
    }
    String createTable = lookup.optional(CREATE_TABLE);
    if (createTable != null) {
      builder.createTable(parseBoolean(CREATE_TABLE, createTable));
    }
    return builder.build();
  }

  /**
   * Parses a boolean word: {@code y yes t true on 1} or {@code n no f false off 0},
   * case-insensitively.
   *
   * @throws ConfigurationException for anything else
   */
  static boolean parseBoolean(String key, String value) {
    String word = value.trim().toLowerCase(Locale.ROOT);
    if (TRUE_WORDS.contains(word)) {
      return true;
    }
    if (FALSE_WORDS.contains(word)) {
      return false;
    }
    throw new ConfigurationException("Invalid boolean for " + key + ": '" + value + "'");
  }

  private static int parsePort(String value) {
    int port;
    try {
      port = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid integer for " + PORT + ": '" + value + "'", e);
    }
    if (port < 1 || port > 65535) {
      throw new ConfigurationException(PORT + " must be between 1 and 65535, got " + port);
    }
    return port;
  }

  private static Duration parseSeconds(String key, String value) {
    double seconds;
    try {
      seconds = Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid number of seconds for " + key + ": '" + value + "'", e);
    }
    if (!(seconds > 0) || Double.isInfinite(seconds)) {
      throw new ConfigurationException(key + " must be a positive number of seconds, got '" + value + "'");
    }
    return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
  }

  public String dbname() {
    return dbname;
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String user() {
    return user;
  }

  public String password() {
    return password;
  }

  /** Maximum session age, or {@code null} if sessions never expire. */
  public Duration connMaxAge() {
    return connMaxAge;
  }

  public boolean prePing() {
    return prePing;
  }

  public boolean createTable() {
    return createTable;
  }

  /** {@code jdbc:postgresql://host:port/dbname}. */
  public String jdbcUrl() {
    return "jdbc:postgresql://" + host + ":" + port + "/" + dbname;
  }

  @Override
  public String toString() {
    return "DatastoreSettings[url=" + jdbcUrl()
        + ", user=" + user
        + ", password=****"
        + ", connMaxAge=" + connMaxAge
        + ", prePing=" + prePing
        + ", createTable=" + createTable + "]";
  }

  private static final class Lookup {
    private final String prefix;
    private final Map<String, String> env;

    private Lookup(String applicationName, Map<String, String> env) {
      this.prefix = applicationName.isEmpty() ? null : applicationName.toUpperCase(Locale.ROOT) + "_";
      this.env = env;
    }

    String optional(String key) {
      if (prefix != null) {
        String value = env.get(prefix + key);
        if (value != null) {
          return value;
        }
      }
      return env.get(key);
    }

    String required(String key) {
      String value = optional(key);
      if (value == null) {
        throw new ConfigurationException(key + " is not set");
      }
      return value;
    }
  }

  /** Builder for {@link DatastoreSettings}. */
  public static final class Builder {
    private String dbname;
    private String host;
    private int port = DEFAULT_PORT;
    private String user;
    private String password;
    private Duration connMaxAge;
    private boolean prePing;
    private boolean createTable = true;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder dbname(String dbname) {
      this.dbname = dbname;
      return this;
    }

    /** <b>Required.</b> */
    public Builder host(String host) {
      this.host = host;
      return this;
    }

    /** Optional. Defaults to {@code 5432}. */
    public Builder port(int port) {
      this.port = port;
      return this;
    }

    /** <b>Required.</b> */
    public Builder user(String user) {
      this.user = user;
      return this;
    }

    /** <b>Required.</b> */
    public Builder password(String password) {
      this.password = password;
      return this;
    }

    /** Optional. Defaults to {@code null}: sessions never expire. */
    public Builder connMaxAge(Duration connMaxAge) {
      this.connMaxAge = connMaxAge;
      return this;
    }

    /** Optional. Defaults to {@code false}. */
    public Builder prePing(boolean prePing) {
      this.prePing = prePing;
      return this;
    }

    /** Optional. Defaults to {@code true}. */
    public Builder createTable(boolean createTable) {
      this.createTable = createTable;
      return this;
    }

    public DatastoreSettings build() {
      return new DatastoreSettings(this);
    }
  }
}
