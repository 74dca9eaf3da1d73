package com.ryuqq.catalog.testkit.contract;

import com.ryuqq.catalog.application.compiler.CatalogCompiler;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 4: Extra Catalog Checks.
 *
 * <p>Post-assembly checks run only when {@code extraTests} is enabled.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class CatalogChecksContractTest extends AbstractCompilerContractTest {

    private CatalogCompiler checkingCompiler() {
        return compiler(config().withExtraTests(true));
    }

    @Test
    void testChecks_UndeclaredOwner_CheckFailed() {
        // Given
        writeSite("node 'web1' { file { '/srv/app': ensure => directory, owner => 'deploy' } }");

        // When
        Diagnostic diagnostic = compileFail(checkingCompiler(), "web1", Map.of());

        // Then
        assertEquals(ErrorKind.CHECK_FAILED, diagnostic.kind());
        assertEquals("file[/srv/app] owner 'deploy' is not a declared user", diagnostic.message());
    }

    @Test
    void testChecks_UndeclaredExecGroup_CheckFailed() {
        // Given
        writeSite(""
            + "node 'web1' {\n"
            + "  user { 'deploy': ensure => present }\n"
            + "  exec { '/usr/bin/make': user => 'deploy', group => 'builders' }\n"
            + "}\n");

        // When
        Diagnostic diagnostic = compileFail(checkingCompiler(), "web1", Map.of());

        // Then
        assertDiagnostic(diagnostic, ErrorKind.CHECK_FAILED, "'builders' is not a declared group");
    }

    @Test
    void testChecks_DeclaredAccounts_Pass() {
        // Given
        writeSite(""
            + "node 'web1' {\n"
            + "  user { 'deploy': ensure => present }\n"
            + "  group { 'www': ensure => present }\n"
            + "  file { '/srv/app': ensure => directory, owner => 'deploy', group => 'www' }\n"
            + "  file { '/etc/hosts': content => 'x', owner => 'root' }\n"
            + "}\n");

        // When
        Catalog catalog = compileOk(checkingCompiler(), "web1", Map.of());

        // Then
        assertHasResource(catalog, "file", "/srv/app");
    }

    @Test
    void testChecks_ExtraTestsDisabled_UndeclaredOwnerAccepted() {
        // Given
        writeSite("node 'web1' { file { '/srv/app': ensure => directory, owner => 'deploy' } }");

        // When
        Catalog catalog = compileOk("web1", Map.of());

        // Then
        assertAttribute(assertHasResource(catalog, "file", "/srv/app"), "owner", "deploy");
    }
}
