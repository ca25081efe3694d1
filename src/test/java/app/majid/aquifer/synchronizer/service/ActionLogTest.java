package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.synchronizer.db.InMemorySchemaBackend;
import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.exception.LogWriteException;
import app.majid.aquifer.synchronizer.model.ColumnDefinition;
import app.majid.aquifer.synchronizer.model.DiffResult;
import app.majid.aquifer.synchronizer.model.ObjectKind;
import app.majid.aquifer.synchronizer.model.SchemaChange;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.ScriptDefinition;
import app.majid.aquifer.synchronizer.model.SyncAction;
import app.majid.aquifer.synchronizer.model.SyncLogEntry;
import app.majid.aquifer.synchronizer.model.SyncOptions;
import app.majid.aquifer.synchronizer.model.TableDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static app.majid.aquifer.common.constants.SyncConstants.SYNC_DIRECTION_SOURCE_TO_TARGET;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ActionLog Tests")
class ActionLogTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");
    private static final SyncOptions ALL = new SyncOptions(true, true, true, true, true, true);

    private ActionLog actionLog;
    private InMemorySchemaBackend backend;
    private final DiffEngine diffEngine = new DiffEngine();

    @BeforeEach
    void setUp() {
        actionLog = new ActionLog(Clock.fixed(NOW, ZoneOffset.UTC), new SourceCodeHashProvider("c0ffee"));
        backend = new InMemorySchemaBackend("reporting");
    }

    @Nested
    @DisplayName("Draft Tests")
    class DraftTests {

        @Test
        @DisplayName("Should draft a create with no original state and a drop as rollback")
        void shouldDraftCreate() throws Exception {
            // Arrange
            TableDefinition source = new TableDefinition("orders", List.of(new ColumnDefinition("id", "INTEGER")));
            DiffResult create = diffEngine.diffTable(source, null, ALL).changes().get(0);

            // Act
            SyncLogEntry entry = actionLog.draft(backend, create);

            // Assert
            assertEquals(ObjectKind.TABLE, entry.objectType());
            assertEquals("orders", entry.objectName());
            assertEquals(SyncAction.CREATE, entry.action());
            assertNull(entry.originalState());
            assertEquals("CREATE TABLE orders (id INTEGER)", entry.newState());
            assertEquals("DROP TABLE orders", entry.rollbackAction());
            assertEquals("c0ffee", entry.sourceCodeHash());
            assertEquals(SYNC_DIRECTION_SOURCE_TO_TARGET, entry.syncDirection());
        }

        @Test
        @DisplayName("Should draft an alter with the column drop as rollback")
        void shouldDraftAlter() throws Exception {
            // Arrange
            TableDefinition source = new TableDefinition("orders", List.of(
                    new ColumnDefinition("id", "INTEGER"), new ColumnDefinition("email", "VARCHAR(255)")));
            TableDefinition target = new TableDefinition("orders", List.of(new ColumnDefinition("id", "INTEGER")));
            DiffResult alter = diffEngine.diffTable(source, target, ALL).changes().get(0);

            // Act
            SyncLogEntry entry = actionLog.draft(backend, alter);

            // Assert
            assertEquals(SyncAction.ALTER, entry.action());
            assertEquals("CREATE TABLE orders (id INTEGER)", entry.originalState());
            assertEquals("CREATE TABLE orders (id INTEGER, email VARCHAR(255))", entry.newState());
            assertEquals("ALTER TABLE orders DROP COLUMN email", entry.rollbackAction());
        }

        @Test
        @DisplayName("Should use the original definition as rollback for a sync")
        void shouldDraftSync() throws Exception {
            // Arrange
            SchemaObjectRef ref = SchemaObjectRef.view("v_active");
            ScriptDefinition source = new ScriptDefinition(ref, "CREATE VIEW v_active AS SELECT 2");
            ScriptDefinition target = new ScriptDefinition(ref, "CREATE VIEW v_active AS SELECT 1");
            DiffResult sync = diffEngine.diffView(source, target, ALL).changes().get(0);

            // Act
            SyncLogEntry entry = actionLog.draft(backend, sync);

            // Assert
            assertEquals(SyncAction.SYNC, entry.action());
            assertEquals(target.text(), entry.originalState());
            assertEquals(target.text(), entry.rollbackAction());
            assertEquals(source.text(), entry.newState());
        }
    }

    @Nested
    @DisplayName("Append Tests")
    class AppendTests {

        @Test
        @DisplayName("Should stamp the entry with the current time when appending")
        void shouldStampOnAppend() throws Exception {
            // Arrange
            SyncLogEntry draft = new SyncLogEntry(ObjectKind.VIEW, "v_active", SyncAction.CREATE, "c0ffee",
                    SYNC_DIRECTION_SOURCE_TO_TARGET, null, "CREATE VIEW v_active AS SELECT 1", "DROP VIEW v_active",
                    Instant.EPOCH);

            // Act
            SyncLogEntry stored = actionLog.append(backend, draft);

            // Assert
            assertEquals(NOW, stored.timestamp());
            assertEquals(List.of(stored), backend.logEntries());
        }

        @Test
        @DisplayName("Should wrap unexpected backend failures in a log write exception")
        void shouldWrapRuntimeFailures() throws Exception {
            // Arrange
            SchemaBackend failing = mock(SchemaBackend.class);
            doThrow(new IllegalStateException("disk full")).when(failing).appendLogEntry(any());
            SyncLogEntry draft = new SyncLogEntry(ObjectKind.TABLE, "orders", SyncAction.CREATE, null, null, null,
                    "CREATE TABLE orders (id INTEGER)", "DROP TABLE orders", NOW);

            // Act & Assert
            LogWriteException e = assertThrows(LogWriteException.class, () -> actionLog.append(failing, draft));
            assertEquals(SchemaObjectRef.table("orders"), e.getRef());
        }

        @Test
        @DisplayName("Should return the latest entry for the object")
        void shouldReturnLatestEntry() throws Exception {
            // Arrange
            SyncLogEntry older = new SyncLogEntry(ObjectKind.TABLE, "orders", SyncAction.CREATE, null, null, null,
                    "CREATE TABLE orders (id INTEGER)", "DROP TABLE orders", NOW.minusSeconds(60));
            SyncLogEntry newer = new SyncLogEntry(ObjectKind.TABLE, "orders", SyncAction.ALTER, null, null,
                    "CREATE TABLE orders (id INTEGER)", "CREATE TABLE orders (id INTEGER, email TEXT)",
                    "ALTER TABLE orders DROP COLUMN email", NOW);
            SyncLogEntry other = new SyncLogEntry(ObjectKind.VIEW, "orders", SyncAction.CREATE, null, null, null,
                    "CREATE VIEW orders AS SELECT 1", "DROP VIEW orders", NOW.plusSeconds(60));
            backend.withLogEntry(older).withLogEntry(newer).withLogEntry(other);

            // Act
            Optional<SyncLogEntry> latest = actionLog.latest(backend, SchemaObjectRef.table("orders"));

            // Assert
            assertEquals(Optional.of(newer), latest);
        }
    }
}
