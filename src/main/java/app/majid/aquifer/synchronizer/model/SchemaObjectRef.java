package app.majid.aquifer.synchronizer.model;

import java.util.Objects;

import static app.majid.aquifer.common.constants.SyncConstants.OBJECT_SELECTOR_SEPARATOR;

/**
 * Identity of a schema object within one database: {@code (kind, name)}.
 */
public record SchemaObjectRef(
        ObjectKind kind,
        String name
) {

    public SchemaObjectRef {
        Objects.requireNonNull(kind, "kind");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Object name cannot be null or empty");
        }
    }

    public static SchemaObjectRef table(String name) {
        return new SchemaObjectRef(ObjectKind.TABLE, name);
    }

    public static SchemaObjectRef view(String name) {
        return new SchemaObjectRef(ObjectKind.VIEW, name);
    }

    public static SchemaObjectRef procedure(String name) {
        return new SchemaObjectRef(ObjectKind.PROCEDURE, name);
    }

    /**
     * Parses a {@code kind:name} selector such as {@code table:orders}.
     *
     * @throws IllegalArgumentException if the selector is malformed or names an unknown kind
     */
    public static SchemaObjectRef parse(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("Object selector cannot be null or empty");
        }

        int separator = selector.indexOf(OBJECT_SELECTOR_SEPARATOR);
        if (separator <= 0 || separator == selector.length() - 1) {
            throw new IllegalArgumentException("Invalid object selector '" + selector + "', expected kind:name");
        }

        ObjectKind kind = ObjectKind.fromLabel(selector.substring(0, separator));
        return new SchemaObjectRef(kind, selector.substring(separator + 1).trim());
    }

    /**
     * Path-like key ({@code kind/name}) matched against ignore patterns.
     */
    public String key() {
        return kind.label() + "/" + name;
    }

    @Override
    public String toString() {
        return kind.label() + OBJECT_SELECTOR_SEPARATOR + name;
    }
}
