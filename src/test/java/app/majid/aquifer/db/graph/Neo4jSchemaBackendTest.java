package app.majid.aquifer.db.graph;

import app.majid.aquifer.synchronizer.db.BackendVariant;
import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import app.majid.aquifer.synchronizer.exception.LogWriteException;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.model.ObjectKind;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.SyncAction;
import app.majid.aquifer.synchronizer.model.SyncLogEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.ServiceUnavailableException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Neo4jSchemaBackend Tests")
class Neo4jSchemaBackendTest {

    @Mock
    private Driver driver;

    @Mock
    private Session session;

    private Neo4jSchemaBackend backend;

    @BeforeEach
    void setUp() {
        backend = new Neo4jSchemaBackend("graph", driver, "neo4j");
    }

    @Test
    @DisplayName("Should list labels as tables without the sync log label")
    void shouldListLabels() throws Exception {
        // Arrange
        when(driver.session(any(SessionConfig.class))).thenReturn(session);
        when(session.executeRead(any())).thenReturn(List.of("Customer", "Order", "SyncLog"));

        // Act
        List<String> labels = backend.listObjects(ObjectKind.TABLE);

        // Assert
        assertEquals(List.of("Customer", "Order"), labels);
        verify(session).close();
    }

    @Test
    @DisplayName("Should report an unreachable server as a connection failure")
    void shouldWrapUnavailableServer() {
        // Arrange
        when(driver.session(any(SessionConfig.class))).thenReturn(session);
        when(session.executeRead(any())).thenThrow(new ServiceUnavailableException("no route"));

        // Act & Assert
        BackendConnectionException e = assertThrows(BackendConnectionException.class,
                () -> backend.listObjects(ObjectKind.TABLE));
        assertEquals("graph", e.getBackendName());
    }

    @Test
    @DisplayName("Should report schema operations as unsupported")
    void shouldRejectSchemaOperations() {
        SchemaObjectRef order = SchemaObjectRef.table("Order");

        assertEquals(BackendVariant.GRAPH_STORE, backend.variant());
        assertThrows(UnsupportedBackendOperationException.class, () -> backend.listObjects(ObjectKind.PROCEDURE));
        assertThrows(UnsupportedBackendOperationException.class, () -> backend.getDefinition(order));
        assertThrows(UnsupportedBackendOperationException.class, () -> backend.execute("MATCH (n) DETACH DELETE n"));
        assertThrows(UnsupportedBackendOperationException.class, () -> backend.rollbackTestTransaction());
        verifyNoInteractions(driver);
    }

    @Test
    @DisplayName("Should wrap failed log writes")
    void shouldWrapLogWriteFailure() {
        // Arrange
        when(driver.session(any(SessionConfig.class))).thenReturn(session);
        when(session.executeWrite(any())).thenThrow(new ServiceUnavailableException("leader switch"));
        SyncLogEntry entry = new SyncLogEntry(ObjectKind.TABLE, "Order", SyncAction.CREATE, null, null, null,
                "Order", "drop Order", Instant.now());

        // Act & Assert
        LogWriteException e = assertThrows(LogWriteException.class, () -> backend.appendLogEntry(entry));
        assertEquals(SchemaObjectRef.table("Order"), e.getRef());
    }
}
