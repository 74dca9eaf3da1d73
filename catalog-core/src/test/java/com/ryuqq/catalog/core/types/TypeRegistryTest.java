package com.ryuqq.catalog.core.types;

import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.ResourceId;
import com.ryuqq.catalog.core.model.SourceLocation;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.validation.ValidatorPipeline;
import com.ryuqq.catalog.core.validation.Validators;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TypeRegistry 테스트.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class TypeRegistryTest {

    @Test
    void pipelineFor_UnregisteredType_AcceptsAnything() {
        // Given
        TypeRegistry registry = TypeRegistry.empty();
        Resource res = Resource.of(ResourceId.of("apache::vhost", "site"), Map.of("port", Value.number(80)));

        // When & Then
        assertFalse(registry.isRegistered("apache::vhost"));
        assertEquals(res, registry.validate(res).valueOrNull());
    }

    @Test
    void register_SameTypeTwice_ThrowsException() {
        // Given
        TypeRegistry.Builder builder = TypeRegistry.builder().register("file", ValidatorPipeline.acceptAll());

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> builder.register("File", ValidatorPipeline.acceptAll()));
    }

    @Test
    void validate_Failure_PrefixedWithResourceIdAndLocated() {
        // Given
        TypeRegistry registry = TypeRegistry.builder()
            .register("exec", ValidatorPipeline.builder().parameter("command", Validators::mandatory).build())
            .build();
        SourceLocation location = new SourceLocation("site.pp", 7, 3);
        Resource res = Resource.of(ResourceId.of("exec", "run"), Map.of(), false, location);

        // When
        Diagnostic diagnostic = registry.validate(res).diagnosticOrNull();

        // Then
        assertEquals(ErrorKind.MISSING_REQUIRED, diagnostic.kind());
        assertTrue(diagnostic.message().startsWith("exec[run]: "));
        assertEquals(location, diagnostic.location());
    }
}
