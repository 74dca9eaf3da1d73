package com.ryuqq.catalog.adapter.runner;

import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.ResourceId;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DeclaredUsersAndGroupsCheck 테스트.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class DeclaredUsersAndGroupsCheckTest {

    private static Catalog catalogOf(Resource... resources) {
        Map<ResourceId, Resource> byId = new LinkedHashMap<>();
        for (Resource resource : resources) {
            byId.put(resource.id(), resource);
        }
        return new Catalog(byId, Map.of(), Map.of(), List.of());
    }

    private static Resource file(String path, String owner, String group) {
        Map<String, Value> attributes = new LinkedHashMap<>();
        attributes.put("owner", Value.string(owner));
        attributes.put("group", Value.string(group));
        return Resource.of(ResourceId.of("file", path), attributes);
    }

    @Test
    void 선언된_사용자와_그룹_root는_통과() {
        // given
        Catalog catalog = catalogOf(
            Resource.of(ResourceId.of("user", "deploy"), Map.of()),
            Resource.of(ResourceId.of("group", "www"), Map.of()),
            file("/srv/app", "deploy", "www"),
            file("/etc/motd", "root", "root"),
            Resource.of(ResourceId.of("exec", "migrate"), Map.of("user", Value.string("deploy"))));

        // when
        Optional<Diagnostic> result = new DeclaredUsersAndGroupsCheck().check(catalog);

        // then
        assertThat(result).isEmpty();
    }

    @Test
    void 선언되지_않은_파일_소유자는_CHECK_FAILED() {
        // given
        Catalog catalog = catalogOf(file("/srv/app", "alice", "root"));

        // when
        Optional<Diagnostic> result = new DeclaredUsersAndGroupsCheck().check(catalog);

        // then
        assertThat(result).hasValueSatisfying(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.CHECK_FAILED);
            assertThat(d.message()).contains("file[/srv/app]").contains("alice");
        });
    }

    @Test
    void exec_그룹과_시스템_계정_설정() {
        // given
        Catalog catalog = catalogOf(
            Resource.of(ResourceId.of("exec", "backup"), Map.of("user", Value.string("daemon"), "group", Value.string("backup"))));

        // when
        Optional<Diagnostic> defaults = new DeclaredUsersAndGroupsCheck().check(catalog);
        Optional<Diagnostic> custom = new DeclaredUsersAndGroupsCheck(Set.of("daemon", "backup")).check(catalog);

        // then
        assertThat(defaults).isPresent();
        assertThat(custom).isEmpty();
    }

    @Test
    void 숫자_ID는_검사하지_않음() {
        // when
        Optional<Diagnostic> result = new DeclaredUsersAndGroupsCheck().check(catalogOf(file("/srv/data", "1001", "1001")));

        // then
        assertThat(result).isEmpty();
    }
}
