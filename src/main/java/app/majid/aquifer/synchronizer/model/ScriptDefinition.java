package app.majid.aquifer.synchronizer.model;

import java.util.Objects;

/**
 * DDL text of a view or procedure. Compared verbatim.
 */
public record ScriptDefinition(
        SchemaObjectRef ref,
        String text
) implements ObjectDefinition {

    public ScriptDefinition {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(text, "text");
    }

    public boolean sameText(ScriptDefinition other) {
        return other != null && text.equals(other.text());
    }

    @Override
    public String toString() {
        return "ScriptDefinition[ref=%s, length=%d]".formatted(ref, text.length());
    }
}
