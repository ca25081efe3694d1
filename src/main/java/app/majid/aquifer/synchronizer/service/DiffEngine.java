package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.synchronizer.model.ColumnDefinition;
import app.majid.aquifer.synchronizer.model.DiffResult;
import app.majid.aquifer.synchronizer.model.IndexDefinition;
import app.majid.aquifer.synchronizer.model.ObjectDiff;
import app.majid.aquifer.synchronizer.model.SchemaChange;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.ScriptDefinition;
import app.majid.aquifer.synchronizer.model.SyncAction;
import app.majid.aquifer.synchronizer.model.SyncOptions;
import app.majid.aquifer.synchronizer.model.TableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the changes that converge one target object toward its source definition.
 * <p>
 * The diff is source-wins and append-only: only objects or columns present on the source and
 * absent from the target produce changes. Target-only columns are never touched and column types
 * are not reconciled, only presence of a column name is compared.
 * <p>
 * All methods are pure; definitions are fetched by the caller.
 */
@Component
public class DiffEngine {

    private static final Logger logger = LoggerFactory.getLogger(DiffEngine.class);

    /**
     * Diffs a table.
     *
     * @param source source table definition
     * @param target target table definition, {@code null} if the table does not exist on the target
     */
    public ObjectDiff diffTable(TableDefinition source, TableDefinition target, SyncOptions options) {
        SchemaObjectRef ref = source.ref();

        if (target == null) {
            if (!options.createOnTarget()) {
                return ObjectDiff.noOp(ref, "Table %s doesn't exist on target and creation is disabled"
                        .formatted(source.name()));
            }
            DiffResult create = new DiffResult(
                    SyncAction.CREATE,
                    new SchemaChange.CreateTable(source),
                    new SchemaChange.DropObject(ref),
                    null,
                    source);
            return ObjectDiff.of(ref, create);
        }

        Map<String, ColumnDefinition> targetColumns = target.columnsByKey();
        List<ColumnDefinition> missing = source.columns().stream()
                .filter(c -> !targetColumns.containsKey(c.key()))
                .toList();

        if (missing.isEmpty()) {
            logger.debug("Table {} already has every source column", source.name());
            return ObjectDiff.noOp(ref);
        }

        List<String> missingNames = missing.stream().map(ColumnDefinition::name).toList();
        if (!options.alterSync()) {
            return ObjectDiff.noOp(ref, "Table %s is missing columns %s on target and alter sync is disabled"
                    .formatted(source.name(), missingNames));
        }

        // Each ALTER sees the table as left by the previous one
        List<DiffResult> changes = new ArrayList<>(missing.size());
        TableDefinition current = target;
        for (ColumnDefinition column : missing) {
            TableDefinition next = current.withColumn(column);
            changes.add(new DiffResult(
                    SyncAction.ALTER,
                    new SchemaChange.AddColumn(target.name(), column),
                    new SchemaChange.DropColumn(target.name(), column.name()),
                    current,
                    next));
            current = next;
        }

        logger.debug("Table {} needs {} new columns: {}", source.name(), missing.size(), missingNames);
        return new ObjectDiff(ref, changes, List.of());
    }

    /**
     * Diffs a view by comparing definitions verbatim.
     *
     * @param target target view definition, {@code null} if the view does not exist on the target
     */
    public ObjectDiff diffView(ScriptDefinition source, ScriptDefinition target, SyncOptions options) {
        SchemaObjectRef ref = source.ref();

        if (target == null) {
            if (!options.createOnTarget()) {
                return ObjectDiff.noOp(ref, "View %s doesn't exist on target and creation is disabled"
                        .formatted(ref.name()));
            }
            return ObjectDiff.of(ref, createFromSource(source));
        }

        if (source.sameText(target)) {
            return ObjectDiff.noOp(ref);
        }

        return ObjectDiff.of(ref, replaceFromSource(source, target));
    }

    /**
     * Diffs a stored procedure.
     * <p>
     * When {@code createOnTarget} is set the procedure is re-created from the source even if it
     * already exists with an identical body, and the change is recorded as a {@code CREATE} with no
     * original state. Rolling such an entry back drops the procedure.
     *
     * @param target target procedure definition, {@code null} if the procedure does not exist on the target
     */
    public ObjectDiff diffProcedure(ScriptDefinition source, ScriptDefinition target, SyncOptions options) {
        SchemaObjectRef ref = source.ref();

        if (options.createOnTarget()) {
            String notice = target == null
                    ? "Procedure %s doesn't exist on target, creating".formatted(ref.name())
                    : "Procedure %s exists on target and creation is enabled, re-creating".formatted(ref.name());
            return new ObjectDiff(ref, List.of(createFromSource(source)), List.of(notice));
        }

        if (target == null) {
            return ObjectDiff.noOp(ref, "Procedure %s doesn't exist on target and creation is disabled"
                    .formatted(ref.name()));
        }

        if (source.sameText(target)) {
            return ObjectDiff.noOp(ref);
        }

        return ObjectDiff.of(ref, replaceFromSource(source, target));
    }

    /**
     * Produces a {@code CREATE} for every source index whose name is absent from the target table.
     * Existing indexes are never altered or dropped.
     */
    public ObjectDiff diffIndexes(String table, List<IndexDefinition> source, List<IndexDefinition> target) {
        SchemaObjectRef ref = SchemaObjectRef.table(table);
        Set<String> existing = target.stream().map(IndexDefinition::key).collect(Collectors.toSet());

        List<DiffResult> changes = source.stream()
                .filter(index -> !existing.contains(index.key()))
                .map(index -> {
                    IndexDefinition onTarget = new IndexDefinition(index.name(), table, index.columns(), index.unique());
                    return new DiffResult(
                            SyncAction.CREATE,
                            new SchemaChange.CreateIndex(onTarget),
                            new SchemaChange.DropIndex(onTarget),
                            null,
                            onTarget);
                })
                .toList();

        return new ObjectDiff(ref, changes, List.of());
    }

    private DiffResult createFromSource(ScriptDefinition source) {
        return new DiffResult(
                SyncAction.CREATE,
                new SchemaChange.CreateFromDefinition(source.ref(), source.text()),
                new SchemaChange.DropObject(source.ref()),
                null,
                source);
    }

    private DiffResult replaceFromSource(ScriptDefinition source, ScriptDefinition target) {
        return new DiffResult(
                SyncAction.SYNC,
                new SchemaChange.ReplaceFromDefinition(source.ref(), source.text()),
                new SchemaChange.ReplaceFromDefinition(target.ref(), target.text()),
                target,
                source);
    }
}
