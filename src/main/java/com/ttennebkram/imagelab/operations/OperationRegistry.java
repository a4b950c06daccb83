package com.ttennebkram.imagelab.operations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Lookup table from operation identifier (or alias) to operation.
 * Built once and never modified afterwards, so it can be shared freely.
 *
 * Usage:
 *   OperationRegistry registry = OperationRegistry.getDefault();
 *   Optional&lt;OperationEntry&gt; entry = registry.find("grayscale");
 */
public final class OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private final Map<String, OperationEntry> entries;
    private final Map<String, ImageOperation> operations;

    private OperationRegistry(Map<String, OperationEntry> entries, Map<String, ImageOperation> operations) {
        this.entries = Collections.unmodifiableMap(entries);
        this.operations = Collections.unmodifiableMap(operations);
    }

    /**
     * The registry of every operation discovered on the classpath.
     */
    public static OperationRegistry getDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Build a registry from explicit operation instances.
     * Aliases come from each operation's {@link OperationInfo}, when present.
     *
     * @throws IllegalStateException if two operations or aliases share an identifier
     */
    public static OperationRegistry of(Collection<? extends ImageOperation> operations) {
        Map<String, OperationEntry> entries = new TreeMap<>();
        Map<String, ImageOperation> byId = new TreeMap<>();

        for (ImageOperation operation : operations) {
            String id = operation.getOperationId();
            register(entries, new OperationEntry(id, operation, Collections.emptyMap()));
            byId.put(id, operation);
        }
        // Aliases after all primary ids, so a clash is always reported against the alias
        for (ImageOperation operation : operations) {
            OperationInfo info = operation.getClass().getAnnotation(OperationInfo.class);
            if (info == null) continue;
            for (OperationAlias alias : info.aliases()) {
                register(entries, new OperationEntry(alias.id(), operation, parsePreset(alias)));
            }
        }
        return new OperationRegistry(entries, byId);
    }

    public static OperationRegistry of(ImageOperation... operations) {
        return of(Arrays.asList(operations));
    }

    /**
     * Scan the classpath and instantiate every annotated operation.
     */
    static OperationRegistry scan() {
        Map<String, ImageOperation> found = new LinkedHashMap<>();
        for (Class<? extends ImageOperation> operationClass : OperationScanner.findOperationClasses()) {
            try {
                ImageOperation operation = operationClass.getDeclaredConstructor().newInstance();
                found.put(operation.getOperationId(), operation);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to create operation " + operationClass.getName(), e);
            }
        }
        OperationRegistry registry = of(found.values());
        log.info("Registered {} operations: {}", registry.operations.size(), registry.operations.keySet());
        return registry;
    }

    private static void register(Map<String, OperationEntry> entries, OperationEntry entry) {
        OperationEntry previous = entries.putIfAbsent(entry.getId(), entry);
        if (previous != null) {
            throw new IllegalStateException("Duplicate operation identifier '" + entry.getId() + "': "
                    + previous.getOperation().getClass().getSimpleName() + " and "
                    + entry.getOperation().getClass().getSimpleName());
        }
    }

    private static Map<String, Object> parsePreset(OperationAlias alias) {
        Map<String, Object> preset = new LinkedHashMap<>();
        for (String pair : alias.preset()) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalStateException("Malformed preset '" + pair + "' on alias " + alias.id());
            }
            // Values stay strings; the schema coerces them like form fields
            preset.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return preset;
    }

    /**
     * Look up an identifier or alias.
     */
    public Optional<OperationEntry> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(entries.get(id));
    }

    public boolean contains(String id) {
        return id != null && entries.containsKey(id);
    }

    /**
     * Primary operation identifiers, sorted.
     */
    public Set<String> getOperationIds() {
        return operations.keySet();
    }

    /**
     * Every resolvable identifier (operation ids and aliases), sorted.
     */
    public Set<String> getIdentifiers() {
        return entries.keySet();
    }

    public Collection<ImageOperation> getOperations() {
        return operations.values();
    }

    private static final class DefaultHolder {
        static final OperationRegistry INSTANCE = scan();
    }
}
