package io.segmentnav.core.engine;

import io.segmentnav.core.model.SchemaTree;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of all loaded schema trees, keyed by {@code id@version}.
 *
 * <p>
 * Schemas are loaded once and shared by every parse in the process; a new set of schemas means a
 * new registry, never a mutation of this one.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class SchemaRegistry {

    private final Map<String, SchemaTree> schemas;

    /**
     * Creates a registry over the given schemas. The map is defensively copied.
     *
     * @param schemas map of schema keys (by id@version) to trees
     */
    public SchemaRegistry(Map<String, SchemaTree> schemas) {
        this.schemas = Collections.unmodifiableMap(new HashMap<>(schemas));
    }

    /** Creates an empty registry. */
    public static SchemaRegistry empty() {
        return new SchemaRegistry(Map.of());
    }

    /** Returns a new {@link Builder}. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves a schema reference of the form {@code id@version}, or {@code id} for the highest
     * loaded version.
     *
     * @param ref the schema reference
     * @return the schema, or empty if none matches
     */
    public Optional<SchemaTree> get(String ref) {
        Objects.requireNonNull(ref, "ref must not be null");
        SchemaTree exact = schemas.get(ref);
        if (exact != null || ref.contains("@")) {
            return Optional.ofNullable(exact);
        }
        return Optional.ofNullable(findLatestVersion(ref));
    }

    /** Returns an unmodifiable view of all loaded schemas keyed by {@code id@version}. */
    public Map<String, SchemaTree> allSchemas() {
        return schemas;
    }

    /** Number of loaded schema versions. */
    public int size() {
        return schemas.size();
    }

    private SchemaTree findLatestVersion(String schemaId) {
        SchemaTree latest = null;
        for (SchemaTree tree : schemas.values()) {
            if (tree.id().equals(schemaId)
                    && (latest == null || compareVersions(tree.version(), latest.version()) > 0)) {
                latest = tree;
            }
        }
        return latest;
    }

    /**
     * Simple semver comparison for "major.minor.patch" strings.
     * Returns positive if v1 > v2, negative if v1 < v2, 0 if equal. Non-numeric parts compare
     * lexically.
     */
    static int compareVersions(String v1, String v2) {
        String[] parts1 = v1.split("\\.");
        String[] parts2 = v2.split("\\.");
        int len = Math.max(parts1.length, parts2.length);
        for (int i = 0; i < len; i++) {
            String p1 = i < parts1.length ? parts1[i] : "0";
            String p2 = i < parts2.length ? parts2[i] : "0";
            int cmp = comparePart(p1, p2);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static int comparePart(String p1, String p2) {
        try {
            return Integer.compare(Integer.parseInt(p1), Integer.parseInt(p2));
        } catch (NumberFormatException e) {
            return p1.compareTo(p2);
        }
    }

    /**
     * Builder for constructing a {@link SchemaRegistry} incrementally. A later schema with the
     * same {@code id@version} replaces an earlier one.
     */
    public static final class Builder {

        private final Map<String, SchemaTree> schemas = new HashMap<>();

        Builder() {}

        public Builder add(SchemaTree schema) {
            schemas.put(schema.key(), schema);
            return this;
        }

        public SchemaRegistry build() {
            return new SchemaRegistry(schemas);
        }
    }
}
