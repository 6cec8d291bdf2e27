package org.hypertrace.core.filter.service.postgres;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.filter.service.api.Params;
import org.hypertrace.core.filter.service.postgres.PostgresClientFactory.PostgresClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs resource queries with their params bound to a prepared statement. */
public class ResourceQueryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(ResourceQueryExecutor.class);

  private final PostgresClient postgresClient;

  @Inject
  public ResourceQueryExecutor(PostgresClient postgresClient) {
    this.postgresClient = postgresClient;
  }

  /** Rows of the query, each as the string values of its columns. */
  public List<List<String>> list(ResourceQuery query) {
    Connection connection = postgresClient.getConnection();
    try (PreparedStatement statement = prepare(connection, query);
        ResultSet resultSet = statement.executeQuery()) {
      List<List<String>> rows = new ArrayList<>();
      ResultSetMetaData metaData = resultSet.getMetaData();
      int columnCount = metaData.getColumnCount();
      while (resultSet.next()) {
        List<String> row = new ArrayList<>(columnCount);
        for (int c = 1; c <= columnCount; c++) {
          row.add(resultSet.getString(c));
        }
        rows.add(Collections.unmodifiableList(row));
      }
      LOG.debug("Query returned {} rows", rows.size());
      return rows;
    } catch (SQLException ex) {
      // Log the statement that caused the issue before rethrowing it to the caller.
      LOG.error("An error occurred while executing: {}", query.getResolvedStatement(), ex);
      throw new RuntimeException(ex);
    }
  }

  public long count(ResourceQuery query) {
    Connection connection = postgresClient.getConnection();
    try (PreparedStatement statement = prepare(connection, query);
        ResultSet resultSet = statement.executeQuery()) {
      return resultSet.next() ? resultSet.getLong(1) : 0L;
    } catch (SQLException ex) {
      LOG.error("An error occurred while executing: {}", query.getResolvedStatement(), ex);
      throw new RuntimeException(ex);
    }
  }

  static PreparedStatement prepare(Connection connection, ResourceQuery query)
      throws SQLException {
    PreparedStatement statement = connection.prepareStatement(query.getStatement());
    try {
      bind(statement, query.getParams());
    } catch (SQLException ex) {
      statement.close();
      throw ex;
    }
    return statement;
  }

  static void bind(PreparedStatement statement, Params params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      Object value = params.getValue(i);
      int parameterIndex = i + 1;
      if (value instanceof Long) {
        statement.setLong(parameterIndex, (Long) value);
      } else if (value instanceof Double) {
        statement.setDouble(parameterIndex, (Double) value);
      } else {
        statement.setString(parameterIndex, (String) value);
      }
    }
  }
}
