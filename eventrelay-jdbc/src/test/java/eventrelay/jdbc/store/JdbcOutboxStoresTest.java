package eventrelay.jdbc.store;

import eventrelay.jdbc.H2Databases;
import eventrelay.util.JsonCodec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcOutboxStoresTest {

  @Test
  void allStoresAreRegistered() {
    assertEquals(3, JdbcOutboxStores.all().size());
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertInstanceOf(PostgresOutboxStore.class, JdbcOutboxStores.get("PostgreSQL"));
    assertInstanceOf(MySqlOutboxStore.class, JdbcOutboxStores.get("mysql"));
    assertInstanceOf(H2OutboxStore.class, JdbcOutboxStores.get("h2"));
  }

  @Test
  void unknownNameThrows() {
    assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.get("oracle"));
  }

  @Test
  void detectsFromJdbcUrl() {
    assertInstanceOf(MySqlOutboxStore.class, JdbcOutboxStores.detect("jdbc:mysql://localhost/app"));
    assertInstanceOf(MySqlOutboxStore.class, JdbcOutboxStores.detect("jdbc:tidb://localhost/app"));
    assertInstanceOf(PostgresOutboxStore.class,
        JdbcOutboxStores.detect("jdbc:postgresql://localhost/app"));
    assertInstanceOf(H2OutboxStore.class, JdbcOutboxStores.detect("JDBC:H2:mem:test"));
  }

  @Test
  void unsupportedOrBlankUrlThrows() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcOutboxStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.detect(""));
  }

  @Test
  void detectsFromDataSource() throws Exception {
    assertInstanceOf(H2OutboxStore.class, JdbcOutboxStores.detect(H2Databases.newDataSource()));
  }

  @Test
  void detectWithCodecReturnsNewInstance() throws Exception {
    var ds = H2Databases.newDataSource();
    AbstractJdbcOutboxStore store = JdbcOutboxStores.detect(ds, JsonCodec.getDefault());
    assertInstanceOf(H2OutboxStore.class, store);
    assertNotSame(JdbcOutboxStores.get("h2"), store);
  }
}
