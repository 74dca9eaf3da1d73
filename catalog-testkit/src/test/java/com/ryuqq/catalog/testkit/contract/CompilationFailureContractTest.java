package com.ryuqq.catalog.testkit.contract;

import com.ryuqq.catalog.adapter.runner.CompilerConfig;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.ResourceId;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 2: Fail-Fast Compilation.
 *
 * <p>Every failing compilation yields exactly one diagnostic and no catalog.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Front end: syntax errors, missing classes, {@code fail()}, strict variables</li>
 *   <li>Validation: relative paths, enum values, unknown parameters</li>
 *   <li>Assembly: duplicates after retitling, unresolved relationship targets</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class CompilationFailureContractTest extends AbstractCompilerContractTest {

    private static final Map<String, String> FACTS = Map.of("osfamily", "Solaris");

    // ===================================================================
    // FRONT END
    // ===================================================================

    @Test
    void testParse_SyntaxError_ParseErrorWithLocation() {
        // Given
        writeSite("node 'web1' {\n  file { '/etc/motd' content => 'x' }\n}\n");

        // When
        Diagnostic diagnostic = compileFail("web1", FACTS);

        // Then
        assertEquals(ErrorKind.PARSE_ERROR, diagnostic.kind());
        assertNotNull(diagnostic.location(), "Parse errors carry a location");
        assertTrue(diagnostic.location().file().endsWith("site.pp"),
            "Location should point at site.pp but was " + diagnostic.location());
        assertEquals(2, diagnostic.location().line());
    }

    @Test
    void testInterpret_MissingClass_MissingDefinition() {
        // Given
        writeSite("node 'web1' { include nope }");

        // When
        Diagnostic diagnostic = compileFail("web1", FACTS);

        // Then
        assertDiagnostic(diagnostic, ErrorKind.MISSING_DEFINITION, "nope");
    }

    @Test
    void testInterpret_NoMatchingNodeAndNoDefault_MissingDefinition() {
        // Given
        writeSite("node 'web1' { }");

        // When
        Diagnostic diagnostic = compileFail("db1", FACTS);

        // Then
        assertDiagnostic(diagnostic, ErrorKind.MISSING_DEFINITION, "db1");
    }

    @Test
    void testInterpret_FailFunction_InterpreterErrorWithMessage() {
        // Given
        writeSite("node 'web1' {\n  if $osfamily != 'Debian' { fail('unsupported os', $osfamily) }\n}\n");

        // When
        Diagnostic diagnostic = compileFail("web1", FACTS);

        // Then
        assertEquals(ErrorKind.INTERPRETER_ERROR, diagnostic.kind());
        assertEquals("unsupported os Solaris", diagnostic.message());
    }

    @Test
    void testInterpret_UnknownVariableStrict_FailsButLenientWarns() {
        // Given
        writeSite("node 'web1' { notify { \"role=${role}\": } }");

        // When
        Diagnostic strict = compileFail(compiler(config().withStrict(true)), "web1", FACTS);
        Catalog lenient = compileOk("web1", FACTS);

        // Then
        assertDiagnostic(strict, ErrorKind.INTERPRETER_ERROR, "$role");
        assertHasResource(lenient, "notify", "role=");
        assertEquals(1, lenient.warnings().size(), "Lenient mode records one warning");
    }

    // ===================================================================
    // VALIDATION
    // ===================================================================

    @Test
    void testValidate_RelativeFilePath_NotAbsolute() {
        // Given
        writeSite("node 'web1' { file { 'etc/motd': content => 'hi' } }");

        // When
        Diagnostic diagnostic = compileFail("web1", FACTS);

        // Then
        assertDiagnostic(diagnostic, ErrorKind.NOT_ABSOLUTE, "file[etc/motd]");
    }

    @Test
    void testValidate_InvalidEnumValue_InvalidEnum() {
        // Given
        writeSite("node 'web1' { service { 'app': ensure => sleeping } }");

        // When
        Diagnostic diagnostic = compileFail("web1", FACTS);

        // Then
        assertDiagnostic(diagnostic, ErrorKind.INVALID_ENUM, "service[app]");
    }

    @Test
    void testValidate_UnknownParameter_UnknownParameter() {
        // Given
        writeSite("node 'web1' { package { 'vim': colour => 'blue' } }");

        // When
        Diagnostic diagnostic = compileFail("web1", FACTS);

        // Then
        assertDiagnostic(diagnostic, ErrorKind.UNKNOWN_PARAMETER, "colour");
    }

    @Test
    void testValidate_ExponentInteger_TypeMismatchTwice() {
        // Given
        writeSite("node default { user { 'bob': uid => '1e999999999' } }");

        // When: the second node replays the cached parse and validates again
        Diagnostic first = compileFail("web1", FACTS);
        Diagnostic second = compileFail("web2", FACTS);

        // Then
        assertDiagnostic(first, ErrorKind.TYPE_MISMATCH, "user[bob]");
        assertDiagnostic(second, ErrorKind.TYPE_MISMATCH, "1e999999999");
    }

    // ===================================================================
    // ASSEMBLY
    // ===================================================================

    @Test
    void testAssemble_RetitledResourceCollides_DuplicateResource() {
        // Given: the first file is retitled to its path
        writeSite(""
            + "node 'web1' {\n"
            + "  file { 'motd': path => '/etc/motd', content => 'a' }\n"
            + "  file { '/etc/motd': content => 'b' }\n"
            + "}\n");

        // When
        Diagnostic diagnostic = compileFail("web1", FACTS);

        // Then
        assertDiagnostic(diagnostic, ErrorKind.DUPLICATE_RESOURCE, "file[/etc/motd]");
    }

    @Test
    void testAssemble_ReferenceToRetitledResource_Resolves() {
        // Given
        writeSite(""
            + "node 'web1' {\n"
            + "  file { 'motd': path => '/etc/motd', content => 'a' }\n"
            + "  notify { 'motd changed': subscribe => File['/etc/motd'] }\n"
            + "}\n");

        // When
        Catalog catalog = compileOk("web1", FACTS);

        // Then
        assertNull(catalog.resource(ResourceId.of("file", "motd")), "Original title is replaced");
        assertDependsOn(catalog, ResourceId.of("notify", "motd changed"), ResourceId.of("file", "/etc/motd"));
    }

    @Test
    void testAssemble_MissingRelationshipTarget_UnresolvedReference() {
        // Given
        writeSite("node 'web1' { service { 'app': require => Package['missing'] } }");

        // When
        Diagnostic diagnostic = compileFail("web1", FACTS);

        // Then
        assertDiagnostic(diagnostic, ErrorKind.UNRESOLVED_REFERENCE, "package[missing]");
    }

    @Test
    void testCompile_FailureStillMeasured_NoExportsPublished() {
        // Given
        writeSite("node 'web1' { @@host { 'web1': ip => '10.0.0.1' }\n service { 'app': require => Package['missing'] } }");
        CompilerConfig config = config().withPublishExports(true);

        // When
        compileFail(compiler(config), "web1", FACTS);

        // Then
        assertEquals(1, catalogStats.measurements().size(), "Failed compilation is still measured");
        assertTrue(exportStore.exportedResources("host").orElseThrow().isEmpty(),
            "Exports of a failed compilation are not published");
    }
}
