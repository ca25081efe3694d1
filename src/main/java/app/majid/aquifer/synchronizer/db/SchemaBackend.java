package app.majid.aquifer.synchronizer.db;

import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import app.majid.aquifer.synchronizer.exception.LogWriteException;
import app.majid.aquifer.synchronizer.exception.ObjectNotFoundException;
import app.majid.aquifer.synchronizer.exception.StatementExecutionException;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.model.IndexDefinition;
import app.majid.aquifer.synchronizer.model.ObjectDefinition;
import app.majid.aquifer.synchronizer.model.ObjectKind;
import app.majid.aquifer.synchronizer.model.SchemaChange;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.SyncLogEntry;

import java.util.List;
import java.util.Optional;

/**
 * Capability interface over one concrete database: introspection, DDL execution, test transactions
 * and storage for the sync log.
 * <p>
 * One instance wraps one logical connection and is not safe for concurrent use. Operations that
 * have no meaning for a variant throw {@link UnsupportedBackendOperationException}; they never
 * silently do nothing.
 */
public interface SchemaBackend extends AutoCloseable {

    /**
     * Name of the configured database this backend is connected to, used in results and events.
     */
    String name();

    BackendVariant variant();

    /**
     * Lists the names of all user objects of a kind. Re-querying is safe.
     * The sync log itself is never listed.
     */
    List<String> listObjects(ObjectKind kind)
            throws UnsupportedBackendOperationException, BackendConnectionException;

    /**
     * Reads the current definition of an object.
     *
     * @throws ObjectNotFoundException if the object does not exist
     */
    ObjectDefinition getDefinition(SchemaObjectRef ref)
            throws ObjectNotFoundException, UnsupportedBackendOperationException, BackendConnectionException;

    boolean objectExists(SchemaObjectRef ref)
            throws UnsupportedBackendOperationException, BackendConnectionException;

    /**
     * Lists the secondary (non primary key) indexes of a table.
     */
    List<IndexDefinition> listIndexes(String table)
            throws UnsupportedBackendOperationException, BackendConnectionException;

    /**
     * Renders a change to the statements this backend executes for it, in order.
     */
    List<String> render(SchemaChange change) throws UnsupportedBackendOperationException;

    /**
     * Renders a definition to the text stored in the sync log.
     */
    String renderDefinition(ObjectDefinition definition) throws UnsupportedBackendOperationException;

    /**
     * Applies a statement permanently.
     */
    void execute(String statement) throws StatementExecutionException, UnsupportedBackendOperationException;

    /**
     * Opens a transaction that will always be rolled back. Statements executed until
     * {@link #rollbackTestTransaction()} run inside it.
     *
     * @throws UnsupportedBackendOperationException if rolling back would not undo every statement,
     *                                              DDL included
     */
    void beginTestTransaction() throws UnsupportedBackendOperationException, BackendConnectionException;

    void rollbackTestTransaction() throws UnsupportedBackendOperationException, BackendConnectionException;

    void appendLogEntry(SyncLogEntry entry) throws LogWriteException;

    /**
     * Returns the entry with the latest timestamp for the object, ties broken by insertion order.
     */
    Optional<SyncLogEntry> latestLogEntry(SchemaObjectRef ref) throws BackendConnectionException;

    @Override
    void close();
}
