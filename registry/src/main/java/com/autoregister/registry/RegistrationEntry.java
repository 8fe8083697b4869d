package com.autoregister.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One registration: a key, its creator, optional initializer, priority and,
 * once built, the cached instance.
 *
 * <p>Creation happens at most once on success and the initializer runs exactly
 * once on the created instance. Both are serialized by a lock owned by the entry,
 * so concurrent lookups of the same key observe a single creation while lookups
 * of other keys proceed in parallel. The lock is reentrant: a creator or
 * initializer that looks up its own key on the same thread gets an empty result
 * (during creation) or the built, un-initialized instance (during initialization)
 * instead of deadlocking.</p>
 *
 * <p>Failures of client code are logged and never propagated.</p>
 */
public final class RegistrationEntry {

    private static final Logger log = LoggerFactory.getLogger(RegistrationEntry.class);

    /**
     * Orders entries by ascending priority. {@code List.sort} is stable, so equal
     * priorities keep their snapshot order.
     */
    public static final Comparator<RegistrationEntry> BY_PRIORITY =
            Comparator.comparingInt(RegistrationEntry::priority);

    private final String key;
    private final Class<?> type;
    private final InstanceCreator<?> creator;
    private final InstanceInitializer<Object> initializer;
    private final int priority;
    private final FailurePolicy failurePolicy;
    private final String tag;

    private final ReentrantLock lock = new ReentrantLock();

    private volatile Object instance;
    private volatile EntryState state = EntryState.EMPTY;

    // guarded by lock
    private boolean creating;
    private boolean initializing;

    /**
     * @param key the registry key
     * @param type the type the entry was registered under
     * @param creator parameterless factory, required
     * @param initializer post-construction hook, may be null
     * @param priority batch priority, clamped into {@code [0, 10]}
     * @param failurePolicy what to do after a failed creation
     * @param tag diagnostic prefix of the owning registry
     */
    RegistrationEntry(String key, Class<?> type, InstanceCreator<?> creator,
                      InstanceInitializer<Object> initializer, int priority,
                      FailurePolicy failurePolicy, String tag) {
        this.key = Objects.requireNonNull(key, "key");
        this.type = Objects.requireNonNull(type, "type");
        this.creator = Objects.requireNonNull(creator, "creator");
        this.initializer = initializer;
        this.priority = Priority.clamp(priority);
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.tag = tag;
    }

    /**
     * Build the instance if it is not built yet.
     *
     * @return the cached instance, or null if creation failed, is in progress on
     *         this thread, or previously failed under {@link FailurePolicy#STICKY}
     */
    public Object create() {
        Object current = instance;
        if (current != null) {
            return current;
        }

        lock.lock();
        try {
            if (instance != null) {
                return instance;
            }
            if (state == EntryState.FAILED) {
                log.debug("[{}] Skipping creation of '{}': creator failed previously", tag, key);
                return null;
            }
            if (creating) {
                log.warn("[{}] Cyclic creation of '{}': creator requested its own instance", tag, key);
                return null;
            }

            creating = true;
            try {
                Object created = creator.create();
                if (created == null) {
                    log.warn("[{}] Create failed for '{}': creator returned null", tag, key);
                    onCreateFailure();
                    return null;
                }
                instance = created;
                moveTo(EntryState.BUILT);
                log.debug("[{}] Created '{}' ({})", tag, key, created.getClass().getSimpleName());
                return created;
            } catch (Exception e) {
                log.warn("[{}] Create failed for '{}': {}", tag, key, e.getMessage(), e);
                onCreateFailure();
                return null;
            } finally {
                creating = false;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Build the instance if needed and run the initializer once.
     *
     * @return true if the instance may be handed out: it is initialized, or this
     *         thread is inside its initializer (a dependency cycle)
     */
    public boolean init() {
        if (state == EntryState.INITIALIZED) {
            return true;
        }

        lock.lock();
        try {
            if (state == EntryState.INITIALIZED) {
                return true;
            }
            if (initializing) {
                log.warn("[{}] Cyclic initialization of '{}': returning un-initialized instance", tag, key);
                return instance != null;
            }

            Object built = create();
            if (built == null) {
                return false;
            }

            if (initializer == null) {
                moveTo(EntryState.INITIALIZED);
                return true;
            }

            initializing = true;
            try {
                initializer.initialize(built);
                moveTo(EntryState.INITIALIZED);
                log.debug("[{}] Initialized '{}'", tag, key);
                return true;
            } catch (Exception e) {
                log.warn("[{}] Init failed for '{}': {}", tag, key, e.getMessage(), e);
                return false;
            } finally {
                initializing = false;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run the creator and initializer for a fresh instance that is not cached.
     * The entry's own state is left untouched.
     *
     * @return the new instance, or null if creation or initialization failed
     */
    public Object createTransient() {
        Object created;
        try {
            created = creator.create();
        } catch (Exception e) {
            log.warn("[{}] Transient create failed for '{}': {}", tag, key, e.getMessage(), e);
            return null;
        }
        if (created == null) {
            log.warn("[{}] Transient create failed for '{}': creator returned null", tag, key);
            return null;
        }
        if (initializer != null) {
            try {
                initializer.initialize(created);
            } catch (Exception e) {
                log.warn("[{}] Transient init failed for '{}': {}", tag, key, e.getMessage(), e);
                return null;
            }
        }
        return created;
    }

    private void onCreateFailure() {
        if (failurePolicy == FailurePolicy.STICKY) {
            moveTo(EntryState.FAILED);
        }
    }

    // caller holds lock
    private void moveTo(EntryState target) {
        EntryState current = state;
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("Invalid transition for '" + key + "': " + current + " -> " + target);
        }
        state = target;
    }

    public String key() {
        return key;
    }

    /**
     * The type passed at registration.
     */
    public Class<?> type() {
        return type;
    }

    public int priority() {
        return priority;
    }

    public EntryState state() {
        return state;
    }

    /**
     * The cached instance, or null if not built.
     */
    public Object instance() {
        return instance;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    /**
     * Human-readable summary for diagnostics.
     */
    public String info() {
        return "RegistrationEntry{" +
               "key='" + key + '\'' +
               ", type=" + type.getSimpleName() +
               ", priority=" + priority +
               ", state=" + state +
               ", initializer=" + (initializer != null) +
               '}';
    }

    @Override
    public String toString() {
        return info();
    }
}
