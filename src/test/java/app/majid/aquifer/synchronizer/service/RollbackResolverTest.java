package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.synchronizer.db.BackendVariant;
import app.majid.aquifer.synchronizer.db.InMemorySchemaBackend;
import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.event.RecordingSyncEventListener;
import app.majid.aquifer.synchronizer.event.Severity;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.model.CancellationToken;
import app.majid.aquifer.synchronizer.model.ColumnDefinition;
import app.majid.aquifer.synchronizer.model.ErrorKind;
import app.majid.aquifer.synchronizer.model.ObjectKind;
import app.majid.aquifer.synchronizer.model.RollbackResult;
import app.majid.aquifer.synchronizer.model.SchemaChange;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.SyncAction;
import app.majid.aquifer.synchronizer.model.SyncLogEntry;
import app.majid.aquifer.synchronizer.model.SyncOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.BadSqlGrammarException;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("RollbackResolver Tests")
class RollbackResolverTest {

    private static final SyncOptions ALL = new SyncOptions(true, true, true, true, true, true);
    private static final String VIEW_V1 = "CREATE VIEW v_totals AS SELECT 1 AS total";
    private static final String VIEW_V2 = "CREATE VIEW v_totals AS SELECT 2 AS total";

    private RecordingSyncEventListener events;
    private ActionLog actionLog;
    private RollbackResolver resolver;
    private SyncOrchestrator orchestrator;
    private InMemorySchemaBackend source;
    private InMemorySchemaBackend target;

    @BeforeEach
    void setUp() throws IOException {
        events = new RecordingSyncEventListener();
        actionLog = new ActionLog(Clock.systemUTC(), new SourceCodeHashProvider("c0ffee"));
        TestGate testGate = new TestGate();
        resolver = new RollbackResolver(actionLog, testGate, events);
        orchestrator = new SyncOrchestrator(new DiffEngine(), testGate, actionLog,
                new SynchronizerIgnoreService(""), events);
        source = new InMemorySchemaBackend("source");
        target = new InMemorySchemaBackend("reporting");
    }

    private void sync() {
        orchestrator.synchronize(source, target, ALL, CancellationToken.none());
    }

    @Nested
    @DisplayName("Inverse Tests")
    class InverseTests {

        @Test
        @DisplayName("Should drop a created table without a test transaction")
        void shouldDropCreatedTable() {
            // Arrange
            source.withTable("orders", "id INTEGER");
            sync();
            int transactions = target.testTransactionCount();

            // Act
            RollbackResult result = resolver.rollback(target, SchemaObjectRef.table("orders"));

            // Assert
            assertEquals(RollbackResult.Status.ROLLED_BACK, result.status());
            assertTrue(target.table("orders").isEmpty());
            assertEquals(transactions, target.testTransactionCount());
        }

        @Test
        @DisplayName("Should drop only the most recently added column after validating it")
        void shouldUndoLatestAlter() {
            // Arrange
            source.withTable("orders", "id INTEGER", "email VARCHAR(255)", "status VARCHAR(16)");
            target.withTable("orders", "id INTEGER");
            sync();
            int transactions = target.testTransactionCount();

            // Act
            RollbackResult result = resolver.rollback(target, SchemaObjectRef.table("orders"));

            // Assert
            assertEquals(RollbackResult.Status.ROLLED_BACK, result.status());
            assertEquals(List.of("id", "email"),
                    target.table("orders").orElseThrow().columns().stream().map(ColumnDefinition::name).toList());
            assertEquals(transactions + 1, target.testTransactionCount());
        }

        @Test
        @DisplayName("Should restore the original definition of a synced view")
        void shouldRestoreSyncedView() {
            // Arrange
            source.withView("v_totals", VIEW_V2);
            target.withView("v_totals", VIEW_V1);
            sync();
            assertEquals(VIEW_V2, target.script(SchemaObjectRef.view("v_totals")).orElseThrow());

            // Act
            RollbackResult result = resolver.rollback(target, SchemaObjectRef.view("v_totals"));

            // Assert
            assertEquals(RollbackResult.Status.ROLLED_BACK, result.status());
            assertEquals(VIEW_V1, target.script(SchemaObjectRef.view("v_totals")).orElseThrow());
            assertEquals(1, target.logEntries().size());
        }

        @Test
        @DisplayName("Should drop a created index using the logged statement")
        void shouldDropCreatedIndex() {
            // Arrange
            source.withTable("orders", "id INTEGER", "email VARCHAR(255)")
                    .withIndex("idx_orders_email", "orders", false, "email");
            target.withTable("orders", "id INTEGER", "email VARCHAR(255)");
            sync();
            assertEquals(1, target.indexesOf("orders").size());

            // Act
            RollbackResult result = resolver.rollback(target,
                    new SchemaObjectRef(ObjectKind.INDEX, "idx_orders_email"));

            // Assert
            assertEquals(RollbackResult.Status.ROLLED_BACK, result.status());
            assertTrue(target.indexesOf("orders").isEmpty());
        }

        @Test
        @DisplayName("Should re-apply the same inverse when rolled back twice")
        void shouldNotConsumeLogEntry() {
            // Arrange
            source.withTable("orders", "id INTEGER", "email VARCHAR(255)");
            target.withTable("orders", "id INTEGER");
            sync();
            resolver.rollback(target, SchemaObjectRef.table("orders"));

            // Act
            RollbackResult second = resolver.rollback(target, SchemaObjectRef.table("orders"));

            // Assert
            assertEquals(RollbackResult.Status.VALIDATION_FAILED, second.status());
            assertEquals(ErrorKind.VALIDATION, second.errorKind());
            assertEquals(1, target.logEntries().size());
        }
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("Should report objects without history as not found")
        void shouldReportMissingHistory() {
            // Act
            RollbackResult result = resolver.rollback(target, SchemaObjectRef.table("orders"));

            // Assert
            assertEquals(RollbackResult.Status.NOT_FOUND, result.status());
            assertEquals(ErrorKind.NOT_FOUND, result.errorKind());
            assertEquals("reporting", result.target());
        }

        @Test
        @DisplayName("Should report a sync entry without original state as not found")
        void shouldRejectSyncWithoutOriginalState() {
            // Arrange
            target.withView("v_totals", VIEW_V2).withLogEntry(new SyncLogEntry(ObjectKind.VIEW, "v_totals",
                    SyncAction.SYNC, null, null, null, VIEW_V2, VIEW_V1, Instant.now()));

            // Act
            RollbackResult result = resolver.rollback(target, SchemaObjectRef.view("v_totals"));

            // Assert
            assertEquals(RollbackResult.Status.NOT_FOUND, result.status());
            assertEquals(VIEW_V2, target.script(SchemaObjectRef.view("v_totals")).orElseThrow());
        }

        @Test
        @DisplayName("Should leave the target untouched when the inverse is rejected")
        void shouldNotApplyRejectedInverse() {
            // Arrange
            source.withView("v_totals", VIEW_V2);
            target.withView("v_totals", VIEW_V1);
            sync();
            target.rejectStatementsContaining("SELECT 1");

            // Act
            RollbackResult result = resolver.rollback(target, SchemaObjectRef.view("v_totals"));

            // Assert
            assertEquals(RollbackResult.Status.VALIDATION_FAILED, result.status());
            assertEquals(VIEW_V2, target.script(SchemaObjectRef.view("v_totals")).orElseThrow());
            assertEquals(1, events.withSeverity(Severity.ERROR).size());
        }

        @Test
        @DisplayName("Should report a failed inverse as severe")
        void shouldReportExecutionFailure() {
            // Arrange
            source.withTable("orders", "id INTEGER");
            sync();
            target.failApplyContaining("DROP TABLE");

            // Act
            RollbackResult result = resolver.rollback(target, SchemaObjectRef.table("orders"));

            // Assert
            assertEquals(RollbackResult.Status.EXECUTION_FAILED, result.status());
            assertEquals(1, events.withSeverity(Severity.SEVERE).size());
            assertTrue(target.table("orders").isPresent());
        }

        @Test
        @DisplayName("Should report unsupported backends")
        void shouldReportUnsupportedBackend() throws Exception {
            // Arrange
            SchemaBackend documentStore = mock(SchemaBackend.class);
            when(documentStore.name()).thenReturn("documents");
            when(documentStore.latestLogEntry(any())).thenReturn(Optional.of(new SyncLogEntry(ObjectKind.TABLE,
                    "orders", SyncAction.CREATE, null, null, null, "orders", "drop orders", Instant.now())));
            when(documentStore.render(any(SchemaChange.class))).thenThrow(
                    new UnsupportedBackendOperationException(BackendVariant.DOCUMENT_STORE, "render DDL"));

            // Act
            RollbackResult result = resolver.rollback(documentStore, SchemaObjectRef.table("orders"));

            // Assert
            assertEquals(RollbackResult.Status.UNSUPPORTED, result.status());
            verify(documentStore, never()).execute(any());
        }

        @Test
        @DisplayName("Should report an unreadable sync log as failed")
        void shouldReportUnreadableLog() throws Exception {
            // Arrange
            SchemaBackend broken = mock(SchemaBackend.class);
            when(broken.name()).thenReturn("reporting");
            when(broken.latestLogEntry(any())).thenThrow(new BadSqlGrammarException("latest sync log entry",
                    "SELECT * FROM sync_log", new SQLException("relation \"sync_log\" does not exist")));

            // Act
            RollbackResult result = resolver.rollback(broken, SchemaObjectRef.view("v_totals"));

            // Assert
            assertEquals(RollbackResult.Status.FAILED, result.status());
            assertTrue(result.message().contains("sync_log"));
            assertEquals(1, events.withSeverity(Severity.ERROR).size());
            verify(broken, never()).execute(any());
        }

        @Test
        @DisplayName("Should report a lost connection as failed")
        void shouldReportConnectionLoss() {
            // Arrange
            target.disconnect();

            // Act
            RollbackResult result = resolver.rollback(target, SchemaObjectRef.table("orders"));

            // Assert
            assertEquals(RollbackResult.Status.FAILED, result.status());
            assertEquals(ErrorKind.CONNECTION, result.errorKind());
        }
    }
}
