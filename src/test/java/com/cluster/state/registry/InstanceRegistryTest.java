package com.cluster.state.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InstanceRegistry Tests")
class InstanceRegistryTest {

    private InstanceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InstanceRegistry();
    }

    @Test
    @DisplayName("Should track registered instances")
    void registerAndUnregister() {
        AutoCloseable instance = () -> { };

        registry.register(instance);
        registry.register(instance);

        assertTrue(registry.contains(instance));
        assertEquals(1, registry.size());
        assertTrue(registry.unregister(instance));
        assertFalse(registry.unregister(instance));
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Should ignore null instances")
    void nullInstance() {
        registry.register(null);

        assertEquals(0, registry.size());
        assertFalse(registry.unregister(null));
    }

    @Test
    @DisplayName("Should close leftovers and keep going past failures")
    void closeAll() {
        AtomicInteger closed = new AtomicInteger();
        registry.register(closed::incrementAndGet);
        registry.register(() -> {
            throw new IllegalStateException("boom");
        });
        registry.register(closed::incrementAndGet);

        assertEquals(2, registry.closeAll());
        assertEquals(2, closed.get());
        assertEquals(0, registry.size());
    }
}
