package org.puneet.fdrbench.exceptions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegistryExceptionTest {

    @Test
    void testErrorTypeEnum() {
        for (RegistryException.RegistryErrorType type : RegistryException.RegistryErrorType.values()) {
            assertTrue(type.getCode().startsWith("REG"));
            assertNotNull(type.getDescription());
        }
    }

    @Test
    void testMessageCarriesCode() {
        RegistryException ex = new RegistryException(RegistryException.RegistryErrorType.UNKNOWN_METHOD,
            "m1", "no inputs");
        assertTrue(ex.getMessage().startsWith("[REG002]"));
        assertTrue(ex.getMessage().contains("no inputs"));
        assertEquals("m1", ex.getMethodId());
    }

    @Test
    void testSubclasses() {
        DuplicateMethodException dup = new DuplicateMethodException("bh");
        UnknownMethodException unknown = new UnknownMethodException("qvalue");
        assertEquals(RegistryException.RegistryErrorType.DUPLICATE_METHOD, dup.getErrorType());
        assertEquals(RegistryException.RegistryErrorType.UNKNOWN_METHOD, unknown.getErrorType());
        assertTrue(dup.getMessage().contains("bh"));
        assertTrue(unknown.getMessage().contains("qvalue"));
    }

    @Test
    void testNullErrorTypeRejected() {
        assertThrows(NullPointerException.class, () -> new RegistryException(null, "x", "msg"));
    }

    @Test
    void testRuntimeExceptions() {
        assertEquals("bad covariate", new MethodUnsupportedException("bad covariate").getMessage());
        ResamplingException ex = new ResamplingException("gave up", 12);
        assertEquals(12, ex.getAttempts());
    }
}
