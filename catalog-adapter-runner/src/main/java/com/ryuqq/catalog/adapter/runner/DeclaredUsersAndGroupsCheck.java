package com.ryuqq.catalog.adapter.runner;

import com.ryuqq.catalog.application.compiler.CatalogCheck;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.StringValue;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.ErrorKind;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 파일 소유자와 exec 실행 계정이 카탈로그에 선언되어 있는지 검사.
 *
 * <p><strong>검사 대상:</strong></p>
 * <ul>
 *   <li>{@code file}의 {@code owner} → user, {@code group} → group</li>
 *   <li>{@code exec}의 {@code user} → user, {@code group} → group</li>
 * </ul>
 *
 * <p>시스템 계정(기본 {@code root})과 숫자 ID는 검사하지 않습니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class DeclaredUsersAndGroupsCheck implements CatalogCheck {

    private final Set<String> systemAccounts;

    /**
     * 기본 생성자 (시스템 계정: root).
     */
    public DeclaredUsersAndGroupsCheck() {
        this(Set.of("root"));
    }

    /**
     * 생성자.
     *
     * @param systemAccounts 선언 없이 허용할 계정/그룹 이름
     * @throws IllegalArgumentException systemAccounts가 null인 경우
     */
    public DeclaredUsersAndGroupsCheck(Set<String> systemAccounts) {
        if (systemAccounts == null) {
            throw new IllegalArgumentException("systemAccounts cannot be null");
        }
        this.systemAccounts = Set.copyOf(systemAccounts);
    }

    @Override
    public Optional<Diagnostic> check(Catalog catalog) {
        Set<String> users = new HashSet<>(systemAccounts);
        Set<String> groups = new HashSet<>(systemAccounts);
        for (Resource resource : catalog.resources().values()) {
            if (resource.type().equals("user")) {
                users.add(resource.title());
            } else if (resource.type().equals("group")) {
                groups.add(resource.title());
            }
        }

        for (Resource resource : catalog.resources().values()) {
            Optional<Diagnostic> problem = Optional.empty();
            if (resource.type().equals("file")) {
                problem = undeclared(resource, "owner", users, "user")
                    .or(() -> undeclared(resource, "group", groups, "group"));
            } else if (resource.type().equals("exec")) {
                problem = undeclared(resource, "user", users, "user")
                    .or(() -> undeclared(resource, "group", groups, "group"));
            }
            if (problem.isPresent()) {
                return problem;
            }
        }
        return Optional.empty();
    }

    private static Optional<Diagnostic> undeclared(Resource resource, String attribute, Set<String> declared, String kind) {
        Optional<Value> value = resource.attribute(attribute);
        if (value.isEmpty() || !(value.get() instanceof StringValue account)) {
            return Optional.empty();
        }
        if (declared.contains(account.value()) || account.value().chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        return Optional.of(new Diagnostic(ErrorKind.CHECK_FAILED,
            resource.id() + " " + attribute + " '" + account.value() + "' is not a declared " + kind,
            resource.location().orElse(null)));
    }
}
