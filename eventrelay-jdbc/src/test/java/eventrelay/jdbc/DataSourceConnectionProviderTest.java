package eventrelay.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DataSourceConnectionProviderTest {

  @Test
  void delegatesToDataSource() throws Exception {
    JdbcDataSource ds = H2Databases.newDataSource();
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);
    try (Connection conn = provider.getConnection()) {
      assertFalse(conn.isClosed());
    }
  }

  @Test
  void rejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }
}
