package org.puneet.fdrbench.method;

import org.junit.jupiter.api.Test;
import org.puneet.fdrbench.exceptions.DuplicateMethodException;
import org.puneet.fdrbench.exceptions.RegistryException;
import org.puneet.fdrbench.exceptions.UnknownMethodException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MethodRegistryTest {

    private static MethodSpec identity(String id) {
        return MethodSpec.builder(id, in -> in.pValues()).build();
    }

    @Test
    void testRegisterPreservesInsertionOrder() throws Exception {
        MethodRegistry registry = new MethodRegistry()
            .register(identity("c"))
            .register(identity("a"))
            .register(identity("b"));
        assertEquals(List.of("c", "a", "b"), registry.listIds());
        assertEquals(3, registry.size());
        assertFalse(registry.isEmpty());
    }

    @Test
    void testDuplicateRegistrationFails() throws Exception {
        MethodRegistry registry = new MethodRegistry().register(identity("bh"));
        DuplicateMethodException ex = assertThrows(DuplicateMethodException.class,
            () -> registry.register(identity("bh")));
        assertEquals("bh", ex.getMethodId());
        assertEquals(RegistryException.RegistryErrorType.DUPLICATE_METHOD, ex.getErrorType());
        assertEquals(1, registry.size());
    }

    @Test
    void testUnknownMethodFails() {
        MethodRegistry registry = new MethodRegistry();
        assertThrows(UnknownMethodException.class, () -> registry.get("missing"));
        assertThrows(UnknownMethodException.class, () -> registry.remove("missing"));
        assertThrows(UnknownMethodException.class, () -> registry.override("missing", Map.of("x", 1)));
    }

    @Test
    void testOverrideKeepsPositionAndMergesParameters() throws Exception {
        MethodRegistry registry = new MethodRegistry()
            .register(MethodSpec.builder("storey", in -> in.pValues())
                .parameter("lambda", 0.5).parameter("bins", 3).build())
            .register(identity("other"));

        MethodSpec updated = registry.override("storey", Map.of("lambda", 0.8));

        assertEquals(List.of("storey", "other"), registry.listIds());
        assertEquals(0.8, updated.getParameters().get("lambda"));
        assertEquals(3, updated.getParameters().get("bins"));
        assertSame(updated, registry.get("storey"));
    }

    @Test
    void testCopyIsIndependent() throws Exception {
        MethodRegistry registry = new MethodRegistry().register(identity("a"));
        MethodRegistry copy = registry.copy();
        copy.register(identity("b"));
        copy.remove("a");
        assertEquals(List.of("a"), registry.listIds());
        assertEquals(List.of("b"), copy.listIds());
    }

    @Test
    void testConvenienceRegistration() throws Exception {
        MethodRegistry registry = new MethodRegistry()
            .register("map", in -> Map.of("qvalues", in.pValues()), Map.of("alpha", 0.1),
                OutputExtractor.mapEntry("qvalues"));
        MethodSpec spec = registry.get("map");
        assertEquals(0.1, spec.getParameters().get("alpha"));
        assertTrue(registry.contains("map"));
        assertFalse(registry.contains("nope"));
    }
}
