package com.autoregister.registry;

import com.autoregister.config.ConfigLoader;
import com.autoregister.registry.module.RegistrationDefinition;
import com.autoregister.registry.module.RegistryModule;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Default implementation of {@link AutoRegistry}.
 *
 * <p>Entries live in a map guarded by the registry lock. The lock is held only
 * to look up, install or snapshot entries; creators and initializers run after
 * it is released, serialized per entry by {@link RegistrationEntry}. A lookup
 * therefore blocks only on the entry it asks for.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * DefaultAutoRegistry registry = DefaultAutoRegistry.create("app.conf");
 *
 * registry.loadModules();                  // RegistryModule implementations on the classpath
 * registry.loadRegistrationsFromConfig();  // autoregister.registrations block
 * registry.registerClass(Logger.class, Logger::start, 1);
 *
 * registry.executeAllInits();
 *
 * Logger logger = registry.getInstance(Logger.class).orElseThrow();
 * }</pre>
 *
 * <p>{@link #clear()} only detaches entries: a creator running concurrently on
 * another thread completes into its detached entry, and that instance is never
 * visible through the registry.</p>
 */
public class DefaultAutoRegistry implements AutoRegistry, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DefaultAutoRegistry.class);

    /** Constant prefix of every diagnostic line. */
    public static final String LOG_PREFIX = "AutoRegister";

    private final Config config;
    private final RegistrySettings settings;
    private final String tag;

    private final Object lock = new Object();

    // Keyed by RegistryKeys, guarded by lock
    private final Map<String, RegistrationEntry> entries = new LinkedHashMap<>();

    private DefaultAutoRegistry(Config config, RegistrySettings settings) {
        this.config = config;
        this.settings = settings;
        this.tag = LOG_PREFIX + ":" + settings.getName();
    }

    /**
     * Create a registry from a Config object, reading the {@code autoregister} block.
     */
    public static DefaultAutoRegistry create(Config config) {
        return new DefaultAutoRegistry(config, RegistrySettings.fromConfig(config));
    }

    /**
     * Create a registry with explicit settings and no config-driven registrations.
     */
    public static DefaultAutoRegistry create(RegistrySettings settings) {
        return new DefaultAutoRegistry(ConfigFactory.empty(), settings);
    }

    /**
     * Create a registry from the classpath configuration and the files it lists
     * under {@code autoregister.config-files}.
     */
    public static DefaultAutoRegistry create() {
        return create(ConfigLoader.load());
    }

    /**
     * Create a registry from the classpath configuration layered with config files.
     *
     * @param configFiles filesystem or classpath paths, later overriding earlier
     */
    public static DefaultAutoRegistry create(String... configFiles) {
        return create(ConfigLoader.load(configFiles));
    }

    // ==================== Registration ====================

    @Override
    public <T> void register(Class<T> type, String name, InstanceCreator<? extends T> creator,
                             InstanceInitializer<? super T> initializer, int priority) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(creator, "creator");
        String key = RegistryKeys.of(type, name);
        int effective = Priority.clamp(priority);

        InstanceInitializer<Object> erased = initializer == null
                ? null
                : instance -> initializer.initialize(type.cast(instance));

        RegistrationEntry entry = new RegistrationEntry(key, type, creator, erased, effective,
                settings.getFailurePolicy(), tag);

        RegistrationEntry previous;
        synchronized (lock) {
            previous = entries.put(key, entry);
        }

        if (previous != null) {
            log.warn("[{}] Overwriting registration for '{}'", tag, key);
        }
        if (settings.isLogRegistrations()) {
            log.info("[{}] Registered '{}' with priority {}", tag, key, effective);
        } else {
            log.debug("[{}] Registered '{}' with priority {}", tag, key, effective);
        }
    }

    @Override
    public int defaultPriority() {
        return settings.getDefaultPriority();
    }

    // ==================== Lookup ====================

    @Override
    public <T> Optional<T> getInstance(String name, Class<T> type) {
        String key = lookupKey(name, type);
        if (key == null) {
            return Optional.empty();
        }
        RegistrationEntry entry = lookup(key);
        if (entry == null) {
            log.warn("[{}] No registration for '{}'", tag, key);
            return Optional.empty();
        }

        if (entry.create() == null) {
            return Optional.empty();
        }
        if (!entry.init()) {
            return Optional.empty();
        }
        return typed(entry, entry.instance(), type);
    }

    @Override
    public <T> Optional<T> createTransient(String name, Class<T> type) {
        String key = lookupKey(name, type);
        if (key == null) {
            return Optional.empty();
        }
        RegistrationEntry entry = lookup(key);
        if (entry == null) {
            log.warn("[{}] No registration for '{}'", tag, key);
            return Optional.empty();
        }
        return typed(entry, entry.createTransient(), type);
    }

    private <T> Optional<T> typed(RegistrationEntry entry, Object instance, Class<T> type) {
        if (instance == null) {
            return Optional.empty();
        }
        if (settings.isStrictTypes() && !type.isInstance(instance)) {
            log.error("[{}] Type mismatch for '{}': requested {}, registered {}, stored {}",
                    tag, entry.key(), type.getName(), entry.type().getName(), instance.getClass().getName());
            return Optional.empty();
        }
        return Optional.of(type.cast(instance));
    }

    @Override
    public boolean has(String name, Class<?> type) {
        return lookup(lookupKey(name, type)) != null;
    }

    @Override
    public boolean hasInstance(String name, Class<?> type) {
        RegistrationEntry entry = lookup(lookupKey(name, type));
        return entry != null && entry.state().hasInstance();
    }

    @Override
    public Optional<EntryState> entryState(String name, Class<?> type) {
        return Optional.ofNullable(lookup(lookupKey(name, type))).map(RegistrationEntry::state);
    }

    /**
     * Key for a lookup, or null when the name is one that registration rejects.
     */
    private String lookupKey(String name, Class<?> type) {
        try {
            return RegistryKeys.of(type, name);
        } catch (IllegalArgumentException e) {
            log.warn("[{}] Invalid instance name for {}: {}", tag, type.getName(), e.getMessage());
            return null;
        }
    }

    private RegistrationEntry lookup(String key) {
        if (key == null) {
            return null;
        }
        synchronized (lock) {
            return entries.get(key);
        }
    }

    // ==================== Batch initialization ====================

    @Override
    public int executePriorInits(int maxPriority) {
        int limit = Priority.clamp(maxPriority);
        List<RegistrationEntry> batch = snapshot(entry -> entry.priority() <= limit);

        log.info("[{}] Starting execution of initializers with priority {}-{} ({} items)",
                tag, Priority.MIN, limit, batch.size());
        int initialized = runBatch(batch);
        log.info("[{}] Priority {}-{} initializers executed. Total instances: {}",
                tag, Priority.MIN, limit, getInstanceCount());
        return initialized;
    }

    @Override
    public int executeInitsAtPriority(int priority) {
        int target = Priority.clamp(priority);
        List<RegistrationEntry> batch = snapshot(entry -> entry.priority() == target);

        log.info("[{}] Executing priority {} initializers ({} items)", tag, target, batch.size());
        return runBatch(batch);
    }

    private List<RegistrationEntry> snapshot(Predicate<RegistrationEntry> filter) {
        List<RegistrationEntry> batch = new ArrayList<>();
        synchronized (lock) {
            for (RegistrationEntry entry : entries.values()) {
                if (filter.test(entry)) {
                    batch.add(entry);
                }
            }
        }
        batch.sort(RegistrationEntry.BY_PRIORITY);
        return batch;
    }

    /**
     * Two passes over the sorted slice: every creator, then every initializer.
     */
    private int runBatch(List<RegistrationEntry> batch) {
        for (RegistrationEntry entry : batch) {
            entry.create();
        }

        int initialized = 0;
        int failed = 0;
        for (RegistrationEntry entry : batch) {
            if (entry.init()) {
                initialized++;
            } else {
                failed++;
            }
        }

        if (failed > 0) {
            log.warn("[{}] {} of {} entries failed to initialize", tag, failed, batch.size());
        }
        return initialized;
    }

    // ==================== Diagnostics ====================

    @Override
    public int getRegisteredCount() {
        synchronized (lock) {
            return entries.size();
        }
    }

    @Override
    public int getInstanceCount() {
        synchronized (lock) {
            int count = 0;
            for (RegistrationEntry entry : entries.values()) {
                if (entry.state().hasInstance()) {
                    count++;
                }
            }
            return count;
        }
    }

    @Override
    public Set<String> getRegisteredKeys() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(entries.keySet()));
        }
    }

    @Override
    public void dumpEntries(PrintStream out) {
        List<RegistrationEntry> all = snapshot(entry -> true);
        out.println("[" + tag + "] Registry entries (" + all.size() + "):");
        for (RegistrationEntry entry : all) {
            out.println("  - Key: " + entry.key()
                    + ", Priority: " + entry.priority()
                    + ", State: " + entry.state());
        }
    }

    @Override
    public void dumpInstances(PrintStream out) {
        List<RegistrationEntry> built = snapshot(entry -> entry.state().hasInstance());
        out.println("[" + tag + "] Registered instances (" + built.size() + "):");
        if (built.isEmpty()) {
            out.println("  No instances registered.");
            return;
        }
        for (RegistrationEntry entry : built) {
            Object instance = entry.instance();
            out.println("  - Key: " + entry.key()
                    + ", Instance: " + instance.getClass().getName()
                    + "@" + Integer.toHexString(System.identityHashCode(instance)));
        }
    }

    @Override
    public void clear() {
        int removed;
        synchronized (lock) {
            removed = entries.size();
            entries.clear();
        }
        log.info("[{}] Cleared {} entries", tag, removed);
    }

    @Override
    public void close() {
        clear();
    }

    // ==================== Config-Driven Registration ====================

    /**
     * Register every enabled definition in the {@code autoregister.registrations} block.
     *
     * @return number of registrations installed
     * @throws RegistrationException if a definition names an unknown type, a type
     *         without a no-arg constructor, or an unknown init method
     */
    public int loadRegistrationsFromConfig() {
        Map<String, RegistrationDefinition> definitions = RegistrationDefinition.loadAll(config);
        if (definitions.isEmpty()) {
            log.debug("[{}] No registrations in configuration", tag);
            return 0;
        }

        int count = 0;
        for (RegistrationDefinition def : definitions.values()) {
            log.debug("[{}] Loaded registration definition: {}", tag, def);
            if (!def.isEnabled()) {
                log.debug("[{}] Skipping disabled registration '{}'", tag, def.getId());
                continue;
            }
            registerFromDefinition(def);
            count++;
        }

        log.info("[{}] Loaded {} registrations from configuration", tag, count);
        return count;
    }

    @SuppressWarnings("unchecked")
    private void registerFromDefinition(RegistrationDefinition def) {
        Class<Object> type = (Class<Object>) def.getType();
        try {
            type.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new RegistrationException(
                "Registration '" + def.getId() + "': " + type.getName() + " has no no-arg constructor", e);
        }
        register(type, def.getInstanceName(), InstanceCreator.constructing(type), def.initializer(),
                def.getPriority(defaultPriority()));
    }

    /**
     * Let every {@link RegistryModule} on the context class path install its registrations.
     *
     * @return number of modules loaded
     */
    public int loadModules() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        return loadModules(classLoader != null ? classLoader : DefaultAutoRegistry.class.getClassLoader());
    }

    /**
     * Let every {@link RegistryModule} visible to {@code classLoader} install its registrations.
     *
     * @return number of modules loaded
     * @throws RegistrationException if a provider cannot be instantiated
     */
    public int loadModules(ClassLoader classLoader) {
        int count = 0;
        try {
            for (RegistryModule module : ServiceLoader.load(RegistryModule.class, classLoader)) {
                log.info("[{}] Loading registry module: {}", tag, module.getName());
                module.register(this);
                count++;
            }
        } catch (ServiceConfigurationError e) {
            throw new RegistrationException("Failed to load registry modules", e);
        }
        log.info("[{}] Loaded {} registry modules", tag, count);
        return count;
    }

    // ==================== Accessors ====================

    public String getName() {
        return settings.getName();
    }

    public RegistrySettings getSettings() {
        return settings;
    }

    /**
     * Get the raw configuration.
     */
    public Config getConfig() {
        return config;
    }
}
