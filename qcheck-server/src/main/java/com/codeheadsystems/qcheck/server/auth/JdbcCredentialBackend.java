package com.codeheadsystems.qcheck.server.auth;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialBackend} looking users up in a relational table.
 * <p>
 * The query takes the username and secret as its two parameters and returns at least one
 * row for a match. The display name is every non-blank column of the first row, joined
 * with a space.
 */
public class JdbcCredentialBackend implements CredentialBackend {

  public static final String DEFAULT_NAME = "database";
  public static final String DEFAULT_QUERY = "SELECT fname, lname FROM auth WHERE email = ? AND passwd = ?";

  private static final Logger log = LoggerFactory.getLogger(JdbcCredentialBackend.class);

  private final String name;
  private final DataSource dataSource;
  private final String query;

  public JdbcCredentialBackend(DataSource dataSource) {
    this(DEFAULT_NAME, dataSource, DEFAULT_QUERY);
  }

  /**
   * Instantiates a new JDBC backend.
   *
   * @param name       the backend name
   * @param dataSource the connection pool
   * @param query      the lookup query with two positional parameters
   */
  public JdbcCredentialBackend(String name, DataSource dataSource, String query) {
    this.name = name;
    this.dataSource = dataSource;
    this.query = query;
    log.info("JdbcCredentialBackend({})", name);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Optional<String> authenticate(String username, String secret) {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(query)) {
      statement.setString(1, username);
      statement.setString(2, secret);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(displayName(rs, username));
      }
    } catch (SQLException e) {
      throw new BackendUnreachableException("Credential lookup failed on " + name, e);
    }
  }

  private static String displayName(ResultSet rs, String fallback) throws SQLException {
    int columns = rs.getMetaData().getColumnCount();
    List<String> parts = new ArrayList<>();
    for (int i = 1; i <= columns; i++) {
      String value = rs.getString(i);
      if (value != null && !value.isBlank()) {
        parts.add(value.trim());
      }
    }
    return parts.isEmpty() ? fallback : String.join(" ", parts);
  }
}
