package com.ryuqq.catalog.adapter.runner;

import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.ResourceId;
import com.ryuqq.catalog.core.model.SourceLocation;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.model.Warning;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CatalogAssembler 테스트.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class CatalogAssemblerTest {

    private static final ResourceId NGINX_PACKAGE = ResourceId.of("package", "nginx");
    private static final ResourceId NGINX_SERVICE = ResourceId.of("service", "nginx");
    private static final ResourceId NGINX_CONF = ResourceId.of("file", "/etc/nginx/nginx.conf");

    private final CatalogAssembler assembler = new CatalogAssembler();

    private static Resource resource(ResourceId id, Map<String, Value> attributes) {
        return Resource.of(id, attributes, false, new SourceLocation("site.pp", 3, 5));
    }

    @Test
    void require와_before는_방향이_반대인_간선() {
        // given
        List<Resource> declared = List.of(
            resource(NGINX_PACKAGE, Map.of("before", Value.string("File['/etc/nginx/nginx.conf']"))),
            resource(NGINX_CONF, Map.of()),
            resource(NGINX_SERVICE, Map.of("require", Value.array(
                Value.string("package[nginx]"), Value.string("file[/etc/nginx/nginx.conf]")))));

        // when
        Catalog catalog = assembler.assemble(declared, List.of(), List.of()).orElseThrow();

        // then
        assertThat(catalog.dependenciesOf(NGINX_CONF)).containsExactly(NGINX_PACKAGE);
        assertThat(catalog.dependenciesOf(NGINX_SERVICE)).containsExactlyInAnyOrder(NGINX_PACKAGE, NGINX_CONF);
        assertThat(catalog.dependenciesOf(NGINX_PACKAGE)).isEmpty();
        assertThat(catalog.edges()).doesNotContainKey(NGINX_PACKAGE);
    }

    @Test
    void export_리소스는_분리되고_수집된_리소스는_로컬() {
        // given
        Resource exported = Resource.of(ResourceId.of("host", "web1"), Map.of(), true, null);
        Resource collected = Resource.of(ResourceId.of("host", "db1"), Map.of(), false, null);
        List<Warning> warnings = List.of(Warning.of("Unknown variable $x"));

        // when
        Catalog catalog = assembler.assemble(List.of(resource(NGINX_PACKAGE, Map.of()), exported),
            List.of(collected), warnings).orElseThrow();

        // then
        assertThat(catalog.resources()).containsOnlyKeys(NGINX_PACKAGE, collected.id());
        assertThat(catalog.exported()).containsOnlyKeys(exported.id());
        assertThat(catalog.warnings()).isEqualTo(warnings);
        assertThat(catalog.knownResources()).extracting(Resource::id)
            .containsExactly(NGINX_PACKAGE, exported.id(), collected.id());
    }

    @Test
    void 같은_식별자는_DUPLICATE_RESOURCE() {
        // given
        Resource local = resource(NGINX_PACKAGE, Map.of());
        Resource exportedTwin = Resource.of(NGINX_PACKAGE, Map.of(), true, null);

        // when
        Result<Catalog> result = assembler.assemble(List.of(local, exportedTwin), List.of(), List.of());

        // then
        assertThat(result.diagnosticOrNull().kind()).isEqualTo(ErrorKind.DUPLICATE_RESOURCE);
        assertThat(result.diagnosticOrNull().message()).contains("package[nginx]").contains("site.pp:3:5");
    }

    @Test
    void 없는_대상은_UNRESOLVED_REFERENCE() {
        // given
        Resource service = resource(NGINX_SERVICE, Map.of("require", Value.string("Package['nginx']")));

        // when
        Result<Catalog> result = assembler.assemble(List.of(service), List.of(), List.of());

        // then
        assertThat(result.diagnosticOrNull().kind()).isEqualTo(ErrorKind.UNRESOLVED_REFERENCE);
        assertThat(result.diagnosticOrNull().location()).isEqualTo(new SourceLocation("site.pp", 3, 5));
    }

    @Test
    void export_리소스는_관계_대상이_아님() {
        // given
        Resource exported = Resource.of(ResourceId.of("host", "web1"), Map.of(), true, null);
        Resource notify = resource(ResourceId.of("notify", "hi"), Map.of("require", Value.string("host[web1]")));

        // when
        Result<Catalog> result = assembler.assemble(List.of(exported, notify), List.of(), List.of());

        // then
        assertThat(result.diagnosticOrNull().kind()).isEqualTo(ErrorKind.UNRESOLVED_REFERENCE);
    }

    @Test
    void 참조_형식이_아니면_INVALID_FORMAT() {
        // given
        Resource badString = resource(NGINX_SERVICE, Map.of("notify", Value.string("nginx")));
        Resource badType = resource(NGINX_CONF, Map.of("subscribe", Value.number(3)));

        // when
        Result<Catalog> first = assembler.assemble(List.of(badString), List.of(), List.of());
        Result<Catalog> second = assembler.assemble(List.of(badType), List.of(), List.of());

        // then
        assertThat(first.diagnosticOrNull().kind()).isEqualTo(ErrorKind.INVALID_FORMAT);
        assertThat(second.diagnosticOrNull().kind()).isEqualTo(ErrorKind.INVALID_FORMAT);
    }
}
