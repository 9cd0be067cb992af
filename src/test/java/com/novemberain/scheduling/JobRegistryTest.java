package com.novemberain.scheduling;

import org.junit.Test;

import java.util.Arrays;
import java.util.ArrayList;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class JobRegistryTest {

    private final JobRegistry registry = new JobRegistry();

    @Test
    public void createsFreshInstanceForEveryCall() throws Exception {
        registry.register("noop", () -> context -> { });

        Job first = registry.newJob("noop");
        Job second = registry.newJob("noop");

        assertNotSame(first, second);
        assertTrue(registry.isRegistered("noop"));
    }

    @Test
    public void listsRegisteredTypesInOrder() {
        registry.register("b", () -> context -> { }).register("a", () -> context -> { });

        assertEquals(Arrays.asList("a", "b"), new ArrayList<String>(registry.getJobTypes()));
    }

    @Test(expected = ObjectNotFoundException.class)
    public void unknownTypeIsNotFound() throws Exception {
        registry.newJob("missing");
    }

    @Test
    public void failingFactoryIsReported() {
        registry.register("broken", () -> {
            throw new IllegalStateException("no dependencies");
        });

        try {
            registry.newJob("broken");
            throw new AssertionError("expected a SchedulerException");
        } catch (SchedulerException e) {
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void unregisterRemovesType() {
        registry.register("noop", () -> context -> { });

        assertTrue(registry.unregister("noop"));
        assertFalse(registry.isRegistered("noop"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void typeNameIsRequired() {
        registry.register(" ", () -> context -> { });
    }
}
