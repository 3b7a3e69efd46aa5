package com.e2eq.apiversion.catalog;

import com.e2eq.apiversion.exceptions.CatalogLookupException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static view of the shapes of every type the conversion generator may touch.
 * <p>
 * Types are added during bootstrap, from source directories, compiled local classes or classes of
 * explicitly imported modules, and the catalog is then frozen. A frozen catalog is read-only and
 * safe to share between threads.
 * </p>
 */
public final class TypeCatalog {

    private static final Logger LOG = Logger.getLogger(TypeCatalog.class);

    private final Map<String, String> modules = new LinkedHashMap<>();
    private final Map<TypeKey, TypeInfo> types = new LinkedHashMap<>();
    private final ReflectiveTypeIntrospector introspector = new ReflectiveTypeIntrospector();
    private volatile boolean frozen;

    /**
     * Pins an external module to a version tag. Pinning the same tag twice is a no-op; a
     * different tag is an error.
     */
    public void addModule(String modulePath, String versionTag) {
        checkMutable();
        requireText(modulePath, "modulePath");
        requireText(versionTag, "versionTag");
        String existing = modules.get(modulePath);
        if (existing != null && !existing.equals(versionTag)) {
            throw new CatalogLookupException(String.format(
                    "module %s is already pinned to %s, cannot pin it to %s", modulePath, existing, versionTag));
        }
        modules.put(modulePath, versionTag);
        LOG.debugf("Pinned module %s@%s", modulePath, versionTag);
    }

    public Optional<String> pinnedVersion(String modulePath) {
        return Optional.ofNullable(modules.get(modulePath));
    }

    public Map<String, String> modules() {
        return Collections.unmodifiableMap(modules);
    }

    public List<FieldMeta> getFields(String packagePath, String typeName) {
        return getTypeInfo(packagePath, typeName).fields();
    }

    public TypeInfo getTypeInfo(String packagePath, String typeName) {
        TypeKey key = new TypeKey(packagePath, typeName);
        TypeInfo info = types.get(key);
        if (info == null) {
            throw new CatalogLookupException(packagePath, typeName, String.format(
                    "type %s not found in catalog; it must be declared via an explicit import", key));
        }
        return info;
    }

    public TypeInfo getTypeInfo(TypeKey key) {
        return getTypeInfo(key.packagePath(), key.typeName());
    }

    public Optional<TypeInfo> find(String packagePath, String typeName) {
        return Optional.ofNullable(types.get(new TypeKey(packagePath, typeName)));
    }

    public boolean contains(String packagePath, String typeName) {
        return types.containsKey(new TypeKey(packagePath, typeName));
    }

    public Collection<TypeInfo> types() {
        return Collections.unmodifiableCollection(types.values());
    }

    /** Adds or replaces a type. Later registrations of the same key win. */
    public TypeInfo register(TypeInfo info) {
        checkMutable();
        Objects.requireNonNull(info, "info");
        TypeInfo previous = types.put(info.key(), info);
        if (previous != null && !previous.equals(info)) {
            LOG.debugf("Replaced catalog entry %s", info.key());
        }
        return info;
    }

    /** Registers a compiled local type by reflection. */
    public TypeInfo registerClass(Class<?> type) {
        return register(introspector.introspect(type));
    }

    /**
     * Registers a type that belongs to an explicitly imported module. The module must already be
     * pinned, and when the class's package advertises an implementation version it must equal
     * the pinned tag.
     */
    public TypeInfo registerImportedClass(String modulePath, Class<?> type) {
        checkMutable();
        String pinned = modules.get(modulePath);
        if (pinned == null) {
            throw new CatalogLookupException(type.getPackageName(), type.getSimpleName(), String.format(
                    "module %s is not pinned; declare it as an import before registering %s",
                    modulePath, type.getName()));
        }
        Package pkg = type.getPackage();
        String actual = pkg == null ? null : pkg.getImplementationVersion();
        if (actual != null && !actual.equals(pinned)) {
            throw new CatalogLookupException(type.getPackageName(), type.getSimpleName(), String.format(
                    "type %s comes from %s@%s but the module is pinned to %s",
                    type.getName(), modulePath, actual, pinned));
        }
        return registerClass(type);
    }

    /** Parses the {@code .java} files directly inside {@code dir}. */
    public int scanLocalPackage(Path dir) throws IOException {
        return addAll(new SourceTypeScanner().scanDirectory(dir, false), dir);
    }

    /** Parses every {@code .java} file below {@code dir}. */
    public int loadFromDirectory(Path dir) throws IOException {
        return addAll(new SourceTypeScanner().scanDirectory(dir, true), dir);
    }

    public void freeze() {
        frozen = true;
        LOG.infof("Type catalog frozen with %d types and %d pinned modules", types.size(), modules.size());
    }

    public boolean isFrozen() {
        return frozen;
    }

    private int addAll(List<TypeInfo> scanned, Path dir) {
        scanned.forEach(this::register);
        LOG.infof("Catalogued %d types from %s", scanned.size(), dir);
        return scanned.size();
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("type catalog is frozen");
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
