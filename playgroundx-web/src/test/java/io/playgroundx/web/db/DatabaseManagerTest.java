package io.playgroundx.web.db;

import io.playgroundx.persistence.ConnectionException;
import io.playgroundx.persistence.exec.DatabaseConnector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class DatabaseManagerTest {
  @Test
  void connector_isOpenedOncePerRequest() {
    DatabaseConnector primary = mock(DatabaseConnector.class);
    StubConnectorFactory factory = new StubConnectorFactory().with(DatabaseTarget.PRIMARY, primary);
    DatabaseManager db = new DatabaseManager(factory);

    assertSame(primary, db.connector(DatabaseTarget.PRIMARY));
    assertSame(primary, db.primary());
    assertEquals(1, factory.opened.get());
    verify(primary, times(1)).connect();
    assertTrue(db.isOpen(DatabaseTarget.PRIMARY));
    assertFalse(db.isOpen(DatabaseTarget.SECONDARY));
  }

  @Test
  void close_closesEveryOpenedConnector_evenWhenOneFails() {
    DatabaseConnector primary = mock(DatabaseConnector.class);
    DatabaseConnector secondary = mock(DatabaseConnector.class);
    doThrow(new IllegalStateException("boom")).when(primary).close();
    DatabaseManager db = new DatabaseManager(new StubConnectorFactory()
        .with(DatabaseTarget.PRIMARY, primary)
        .with(DatabaseTarget.SECONDARY, secondary));
    db.connector(DatabaseTarget.PRIMARY);
    db.connector(DatabaseTarget.SECONDARY);

    assertDoesNotThrow(db::close);
    verify(primary).close();
    verify(secondary).close();
    assertThrows(IllegalStateException.class, db::primary);
  }

  @Test
  void close_withoutAnyConnector_isNoOp() {
    DatabaseManager db = new DatabaseManager(new StubConnectorFactory());
    assertDoesNotThrow(db::close);
    assertDoesNotThrow(db::close);
  }

  @Test
  void find_isEmptyForUnconfiguredOrUnreachableTargets() {
    DatabaseManager db = new DatabaseManager(new StubConnectorFactory().unreachable(DatabaseTarget.SECONDARY));
    assertTrue(db.find(DatabaseTarget.PRIMARY).isEmpty());
    assertTrue(db.find(DatabaseTarget.SECONDARY).isEmpty());
    assertThrows(ConnectionException.class, () -> db.connector(DatabaseTarget.SECONDARY));
  }

  @Test
  void failedConnect_isNotCached() {
    DatabaseConnector primary = mock(DatabaseConnector.class);
    doThrow(new ConnectionException("down")).doNothing().when(primary).connect();
    StubConnectorFactory factory = new StubConnectorFactory().with(DatabaseTarget.PRIMARY, primary);
    DatabaseManager db = new DatabaseManager(factory);

    assertThrows(ConnectionException.class, db::primary);
    assertFalse(db.isOpen(DatabaseTarget.PRIMARY));
    assertSame(primary, db.primary());
    assertEquals(2, factory.opened.get());
  }
}
