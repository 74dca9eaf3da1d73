package com.ryuqq.catalog.core.validation;

import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.ResourceId;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultValidation 테스트.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class DefaultValidationTest {

    @Test
    void checkParameterList_UnknownKeys_ReportedSorted() {
        // Given
        Resource res = Resource.of(ResourceId.of("file", "/x"),
            Map.of("zeta", Value.string("1"), "alpha", Value.string("2"), "mode", Value.string("0644")));

        // When
        Result<Resource> result = DefaultValidation.checkParameterList(Set.of("mode")).validate(res);

        // Then
        assertEquals(ErrorKind.UNKNOWN_PARAMETER, result.diagnosticOrNull().kind());
        assertEquals("Unknown parameters: alpha, zeta", result.diagnosticOrNull().message());
    }

    @Test
    void checkParameterList_Metaparameters_AreAlwaysLegal() {
        // Given
        Resource res = Resource.of(ResourceId.of("file", "/x"),
            Map.of("require", Value.string("package[nginx]"), "tag", Value.string("web")));

        // When & Then
        assertTrue(DefaultValidation.checkParameterList(Set.of("mode")).validate(res).isOk());
    }

    @Test
    void defaultValidate_EmptyLegalSet_ReturnsInputUnchanged() {
        // Given
        Resource res = Resource.of(ResourceId.of("concat", "motd"),
            Map.of("anything", Value.undef(), "else", Value.string("x")));

        // When
        Result<Resource> result = DefaultValidation.defaultValidate(Set.of()).validate(res);

        // Then
        assertSame(res, result.valueOrNull());
    }

    @Test
    void addDefaults_NeverOverwritesAndSkipsUndefined() {
        // Given
        Map<String, Value> defaults = new LinkedHashMap<>();
        defaults.put("ensure", Value.string("present"));
        defaults.put("owner", Value.string("root"));
        defaults.put("group", Value.undef());
        Resource res = Resource.of(ResourceId.of("file", "/x"), Map.of("owner", Value.string("www")));

        // When
        Resource result = DefaultValidation.addDefaults(defaults).validate(res).valueOrNull();

        // Then
        assertEquals(Value.string("present"), result.attribute("ensure").orElseThrow());
        assertEquals(Value.string("www"), result.attribute("owner").orElseThrow());
        assertFalse(result.hasAttribute("group"));
    }
}
