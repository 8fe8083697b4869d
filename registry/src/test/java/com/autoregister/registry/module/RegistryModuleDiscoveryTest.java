package com.autoregister.registry.module;

import com.autoregister.registry.DefaultAutoRegistry;
import com.autoregister.registry.EntryState;
import com.autoregister.registry.RegistrySettings;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ServiceLoader discovery of registry modules.
 */
class RegistryModuleDiscoveryTest {

    @Test
    void loadModules_installsRegistrationsFromServiceFile() {
        DefaultAutoRegistry registry = DefaultAutoRegistry.create(RegistrySettings.defaults());

        int loaded = registry.loadModules();

        assertEquals(1, loaded);
        assertTrue(registry.has(SampleStorageModule.Storage.class));
        assertTrue(registry.has("archive", SampleStorageModule.Storage.class));
        assertEquals(Optional.of(EntryState.EMPTY), registry.entryState(SampleStorageModule.Storage.class));
    }

    @Test
    void loadModules_registrationsKeepPriorities() {
        DefaultAutoRegistry registry = DefaultAutoRegistry.create(RegistrySettings.defaults());
        registry.loadModules();

        registry.executePriorInits(1);

        assertTrue(registry.getInstance(SampleStorageModule.Storage.class).orElseThrow().isOpened());
        assertFalse(registry.hasInstance("archive", SampleStorageModule.Storage.class));
    }

    @Test
    void loadModules_withEmptyClassLoaderFindsNothing() {
        DefaultAutoRegistry registry = DefaultAutoRegistry.create(RegistrySettings.defaults());
        ClassLoader isolated = new ClassLoader(null) { };

        assertEquals(0, registry.loadModules(isolated));
        assertEquals(0, registry.getRegisteredCount());
    }

    @Test
    void moduleName_defaultsToSimpleClassName() {
        assertEquals("SampleStorageModule", new SampleStorageModule().getName());
    }
}
