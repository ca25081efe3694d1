package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.db.config.DbConfig;
import app.majid.aquifer.db.config.DbProperties;
import app.majid.aquifer.db.config.DbType;
import app.majid.aquifer.db.config.TargetConfig;
import app.majid.aquifer.db.service.SchemaBackendFactory;
import app.majid.aquifer.synchronizer.db.InMemorySchemaBackend;
import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.event.RecordingSyncEventListener;
import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import app.majid.aquifer.synchronizer.model.CancellationToken;
import app.majid.aquifer.synchronizer.model.ErrorKind;
import app.majid.aquifer.synchronizer.model.ObjectSyncResult;
import app.majid.aquifer.synchronizer.model.RollbackResult;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.SyncAction;
import app.majid.aquifer.synchronizer.model.SyncOptions;
import app.majid.aquifer.synchronizer.model.TargetSyncResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.BadSqlGrammarException;

import java.net.ConnectException;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("DatabaseSynchronizerService Tests")
class DatabaseSynchronizerServiceTest {

    private static final SyncOptions OPTIONS = new SyncOptions(true, true, true, true, true, false);

    private final DbConfig sourceConfig = config("jdbc:postgresql://source/app");
    private final TargetConfig reporting = new TargetConfig("reporting", config("jdbc:postgresql://reporting/app"));
    private final TargetConfig archive = new TargetConfig("archive", config("jdbc:postgresql://archive/app"));

    private SchemaBackendFactory backendFactory;
    private SyncOrchestrator orchestrator;
    private RollbackResolver rollbackResolver;
    private RecordingSyncEventListener events;
    private final List<InMemorySchemaBackend> opened = new CopyOnWriteArrayList<>();

    private static DbConfig config(String url) {
        return new DbConfig(DbType.POSTGRESQL, url, "sync", "secret", null, null, null);
    }

    @BeforeEach
    void setUp() throws Exception {
        backendFactory = mock(SchemaBackendFactory.class);
        orchestrator = mock(SyncOrchestrator.class);
        rollbackResolver = mock(RollbackResolver.class);
        events = new RecordingSyncEventListener();

        when(backendFactory.open(any(), any())).thenAnswer(invocation -> track(invocation.getArgument(0)));
        when(backendFactory.openSource(any(), any())).thenAnswer(invocation -> track(invocation.getArgument(0)));
        when(orchestrator.synchronize(any(), any(), any(), any())).thenAnswer(invocation -> {
            SchemaBackend target = invocation.getArgument(1);
            return new TargetSyncResult(target.name(), TargetSyncResult.Status.COMPLETED, List.of(), null);
        });
    }

    private InMemorySchemaBackend track(String name) {
        InMemorySchemaBackend backend = new InMemorySchemaBackend(name);
        opened.add(backend);
        return backend;
    }

    private DatabaseSynchronizerService service(DbConfig source, int parallelism, TargetConfig... targets) {
        return new DatabaseSynchronizerService(new DbProperties(source, List.of(targets), parallelism),
                backendFactory, orchestrator, rollbackResolver, events);
    }

    @Nested
    @DisplayName("Synchronize Tests")
    class SynchronizeTests {

        @Test
        @DisplayName("Should return one result per target in configuration order")
        void shouldSyncEveryTarget() {
            // Arrange
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting, archive);

            // Act
            List<TargetSyncResult> results = service.synchronize(OPTIONS, List.of());

            // Assert
            assertEquals(List.of("reporting", "archive"), results.stream().map(TargetSyncResult::target).toList());
            assertTrue(results.stream().allMatch(r -> r.status() == TargetSyncResult.Status.COMPLETED));
        }

        @Test
        @DisplayName("Should give every target its own source connection and close both")
        void shouldOpenAndCloseConnectionsPerTarget() throws Exception {
            // Arrange
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting, archive);

            // Act
            service.synchronize(OPTIONS, null);

            // Assert
            verify(backendFactory, times(2)).openSource(eq("source"), eq(sourceConfig));
            verify(backendFactory, never()).open(eq("source"), any());
            verify(backendFactory).open("reporting", reporting.config());
            verify(backendFactory).open("archive", archive.config());
            assertEquals(4, opened.size());
            assertTrue(opened.stream().allMatch(InMemorySchemaBackend::isClosed));
        }

        @Test
        @DisplayName("Should only sync the named targets")
        void shouldSyncNamedTargets() throws Exception {
            // Arrange
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting, archive);

            // Act
            List<TargetSyncResult> results = service.synchronize(OPTIONS, List.of("ARCHIVE"));

            // Assert
            assertEquals(1, results.size());
            assertEquals("archive", results.get(0).target());
            verify(backendFactory, never()).open(eq("reporting"), any());
        }

        @Test
        @DisplayName("Should reject unknown target names before connecting")
        void shouldRejectUnknownTargets() throws Exception {
            // Arrange
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting);

            // Act & Assert
            assertThrows(IllegalArgumentException.class, () -> service.synchronize(OPTIONS, List.of("missing")));
            verify(backendFactory, never()).open(any(), any());
            verify(backendFactory, never()).openSource(any(), any());
        }

        @Test
        @DisplayName("Should require a configured source")
        void shouldRequireSource() {
            // Arrange
            DatabaseSynchronizerService service = service(null, 4, reporting);

            // Act & Assert
            assertThrows(IllegalStateException.class, () -> service.synchronize(OPTIONS, null));
        }

        @Test
        @DisplayName("Should return no results when no target is configured")
        void shouldHandleNoTargets() {
            assertEquals(List.of(), service(sourceConfig, 4).synchronize(OPTIONS, null));
        }

        @Test
        @DisplayName("Should fail only the target that cannot be reached")
        void shouldIsolateConnectionFailures() throws Exception {
            // Arrange
            doThrow(new BackendConnectionException("reporting", new ConnectException("Connection refused")))
                    .when(backendFactory).open(eq("reporting"), any());
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting, archive);

            // Act
            List<TargetSyncResult> results = service.synchronize(OPTIONS, null);

            // Assert
            assertEquals(TargetSyncResult.Status.FAILED, results.get(0).status());
            assertTrue(results.get(0).message().contains("Connection refused"));
            assertEquals(TargetSyncResult.Status.COMPLETED, results.get(1).status());
            assertEquals(ErrorKind.CONNECTION, events.events().get(0).errorKind());
        }

        @Test
        @DisplayName("Should turn unexpected failures into a failed target")
        void shouldContainUnexpectedFailures() {
            // Arrange
            doThrow(new IllegalStateException("bug")).when(orchestrator).synchronize(any(), any(), any(), any());
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting);

            // Act
            List<TargetSyncResult> results = service.synchronize(OPTIONS, null);

            // Assert
            assertEquals(TargetSyncResult.Status.FAILED, results.get(0).status());
            assertEquals("bug", results.get(0).message());
        }

        @Test
        @DisplayName("Should keep a target's outcomes when closing its connection fails")
        void shouldKeepOutcomesWhenCloseFails() throws Exception {
            // Arrange
            SchemaBackend flakyTarget = mock(SchemaBackend.class);
            when(flakyTarget.name()).thenReturn("reporting");
            doThrow(new IllegalStateException("socket already closed")).when(flakyTarget).close();
            doReturn(flakyTarget).when(backendFactory).open(eq("reporting"), any());
            ObjectSyncResult created = ObjectSyncResult.applied(SchemaObjectRef.table("orders"), SyncAction.CREATE,
                    "create applied (1 statements)");
            doReturn(new TargetSyncResult("reporting", TargetSyncResult.Status.COMPLETED, List.of(created), null))
                    .when(orchestrator).synchronize(any(), eq(flakyTarget), any(), any());
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting);

            // Act
            List<TargetSyncResult> results = service.synchronize(OPTIONS, null);

            // Assert
            assertEquals(TargetSyncResult.Status.COMPLETED, results.get(0).status());
            assertEquals(List.of(created), results.get(0).objects());
            assertTrue(opened.stream().allMatch(InMemorySchemaBackend::isClosed));
        }

        @Test
        @DisplayName("Should run targets concurrently")
        void shouldRunTargetsInParallel() {
            // Arrange
            CountDownLatch bothStarted = new CountDownLatch(2);
            doAnswer(invocation -> {
                SchemaBackend target = invocation.getArgument(1);
                bothStarted.countDown();
                boolean concurrent = bothStarted.await(5, TimeUnit.SECONDS);
                return new TargetSyncResult(target.name(),
                        concurrent ? TargetSyncResult.Status.COMPLETED : TargetSyncResult.Status.FAILED,
                        List.of(), null);
            }).when(orchestrator).synchronize(any(), any(), any(), any());
            DatabaseSynchronizerService service = service(sourceConfig, 2, reporting, archive);

            // Act
            List<TargetSyncResult> results = service.synchronize(OPTIONS, null);

            // Assert
            assertTrue(results.stream().allMatch(r -> r.status() == TargetSyncResult.Status.COMPLETED));
        }
    }

    @Nested
    @DisplayName("Cancellation Tests")
    class CancellationTests {

        @Test
        @DisplayName("Should report no runs when nothing is running")
        void shouldCancelNothing() {
            assertEquals(0, service(sourceConfig, 4, reporting).cancelRunning());
        }

        @Test
        @DisplayName("Should signal the token of a running sync")
        void shouldCancelRunningSync() throws Exception {
            // Arrange
            CountDownLatch started = new CountDownLatch(1);
            doAnswer(invocation -> {
                SchemaBackend target = invocation.getArgument(1);
                CancellationToken token = invocation.getArgument(3);
                started.countDown();
                long deadline = System.currentTimeMillis() + 5_000;
                while (!token.isCancelled() && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }
                return new TargetSyncResult(target.name(),
                        token.isCancelled() ? TargetSyncResult.Status.CANCELLED : TargetSyncResult.Status.COMPLETED,
                        List.of(), null);
            }).when(orchestrator).synchronize(any(), any(), any(), any());
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting);

            // Act
            CompletableFuture<List<TargetSyncResult>> run =
                    CompletableFuture.supplyAsync(() -> service.synchronize(OPTIONS, null));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            int cancelled = service.cancelRunning();

            // Assert
            assertEquals(1, cancelled);
            assertEquals(TargetSyncResult.Status.CANCELLED, run.get(10, TimeUnit.SECONDS).get(0).status());
            assertEquals(0, service.cancelRunning());
        }
    }

    @Nested
    @DisplayName("Rollback Tests")
    class RollbackTests {

        private final SchemaObjectRef ref = SchemaObjectRef.view("v_active");

        @Test
        @DisplayName("Should roll back on every target and close each connection")
        void shouldRollBackEveryTarget() {
            // Arrange
            when(rollbackResolver.rollback(any(), eq(ref))).thenAnswer(invocation -> {
                SchemaBackend target = invocation.getArgument(0);
                return RollbackResult.of(target.name(), ref, RollbackResult.Status.ROLLED_BACK, null, "ok");
            });
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting, archive);

            // Act
            List<RollbackResult> results = service.rollback(ref, null);

            // Assert
            assertEquals(List.of("reporting", "archive"), results.stream().map(RollbackResult::target).toList());
            assertTrue(opened.stream().allMatch(InMemorySchemaBackend::isClosed));
        }

        @Test
        @DisplayName("Should keep rolling back other targets when one fails unexpectedly")
        void shouldIsolateRollbackFailures() {
            // Arrange
            doAnswer(invocation -> {
                SchemaBackend target = invocation.getArgument(0);
                if (target.name().equals("reporting")) {
                    throw new BadSqlGrammarException("latest sync log entry", "SELECT * FROM sync_log",
                            new SQLException("relation \"sync_log\" does not exist"));
                }
                return RollbackResult.of(target.name(), ref, RollbackResult.Status.ROLLED_BACK, null, "ok");
            }).when(rollbackResolver).rollback(any(), eq(ref));
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting, archive);

            // Act
            List<RollbackResult> results = service.rollback(ref, null);

            // Assert
            assertEquals(2, results.size());
            assertEquals(RollbackResult.Status.FAILED, results.get(0).status());
            assertTrue(results.get(0).message().contains("sync_log"));
            assertEquals(RollbackResult.Status.ROLLED_BACK, results.get(1).status());
            assertEquals("archive", results.get(1).target());
            assertTrue(opened.stream().allMatch(InMemorySchemaBackend::isClosed));
        }

        @Test
        @DisplayName("Should report an unreachable target as failed")
        void shouldReportUnreachableTarget() throws Exception {
            // Arrange
            doThrow(new BackendConnectionException("reporting", new ConnectException("Connection refused")))
                    .when(backendFactory).open(eq("reporting"), any());
            DatabaseSynchronizerService service = service(sourceConfig, 4, reporting);

            // Act
            List<RollbackResult> results = service.rollback(ref, List.of("reporting"));

            // Assert
            assertEquals(RollbackResult.Status.FAILED, results.get(0).status());
            assertEquals(ErrorKind.CONNECTION, results.get(0).errorKind());
            verifyNoInteractions(rollbackResolver);
        }
    }
}
