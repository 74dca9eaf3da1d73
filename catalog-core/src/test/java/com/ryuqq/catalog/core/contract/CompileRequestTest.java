package com.ryuqq.catalog.core.contract;

import com.ryuqq.catalog.core.model.NodeName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CompileRequest 테스트.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class CompileRequestTest {

    @Test
    void of_CopiesFacts() {
        // Given
        Map<String, String> facts = new HashMap<>();
        facts.put("osfamily", "Debian");

        // When
        CompileRequest request = CompileRequest.of(NodeName.of("web1"), facts);
        facts.put("kernel", "Linux");

        // Then
        assertEquals(Map.of("osfamily", "Debian"), request.facts());
    }

    @Test
    void constructor_NullNode_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CompileRequest.of(null, Map.of())
        );
        assertTrue(exception.getMessage().contains("node cannot be null"));
    }
}
