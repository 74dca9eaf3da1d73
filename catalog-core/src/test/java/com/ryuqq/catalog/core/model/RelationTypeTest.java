package com.ryuqq.catalog.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RelationType 테스트.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class RelationTypeTest {

    @Test
    void fromParameter_KnownNames_ResolveWithDirection() {
        assertTrue(RelationType.fromParameter("require").orElseThrow().sourceDependsOnTarget());
        assertTrue(RelationType.fromParameter("after").orElseThrow().sourceDependsOnTarget());
        assertTrue(RelationType.fromParameter("subscribe").orElseThrow().sourceDependsOnTarget());
        assertFalse(RelationType.fromParameter("before").orElseThrow().sourceDependsOnTarget());
        assertFalse(RelationType.fromParameter("notify").orElseThrow().sourceDependsOnTarget());
    }

    @Test
    void fromParameter_OtherName_ReturnsEmpty() {
        assertTrue(RelationType.fromParameter("tag").isEmpty());
    }

    @Test
    void metaparameters_IncludeRelationshipsAndTag() {
        for (RelationType type : RelationType.values()) {
            assertTrue(Metaparameters.isMetaparameter(type.parameter()));
        }
        assertTrue(Metaparameters.isMetaparameter("tag"));
        assertFalse(Metaparameters.isMetaparameter("mode"));
    }
}
