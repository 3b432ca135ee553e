package com.bastion.security.authz;

import com.bastion.security.identity.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonPolicyStore")
class JsonPolicyStoreTest {

    private static InputStream json(String value) {
        return new ByteArrayInputStream(value.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("loads role, owner and acl rules from the classpath")
    void loadsClasspathDocument() {
        JsonPolicyStore store = JsonPolicyStore.fromClasspath("classpath:policy/test-policy.json");

        assertThat(store.rules()).containsExactly(
                new RolePolicyRule(Role.ADMINISTRATORS, Set.of("project.view", "project.edit")),
                new RolePolicyRule(Role.USERS, Set.of("project.view")),
                new OwnerPolicyRule(Set.of("project.view", "project.edit")),
                new AclPolicyRule());
    }

    @Test
    @DisplayName("role names may use the canonical value")
    void canonicalRoleValue() {
        JsonPolicyStore store = JsonPolicyStore.read(json(
                "{\"rules\":[{\"type\":\"role\",\"role\":\"Administrators\",\"actions\":[\"a\"]}]}"));

        assertThat(store.rules()).containsExactly(new RolePolicyRule(Role.ADMINISTRATORS, Set.of("a")));
    }

    @Test
    @DisplayName("rejects unknown types, unknown roles and empty actions")
    void invalidRules() {
        assertThatThrownBy(() -> JsonPolicyStore.read(json("{\"rules\":[{\"type\":\"deny\"}]}")))
                .isInstanceOf(PolicyLoadException.class)
                .hasMessageContaining("unknown type");
        assertThatThrownBy(() -> JsonPolicyStore.read(json(
                "{\"rules\":[{\"type\":\"role\",\"role\":\"Root\",\"actions\":[\"a\"]}]}")))
                .isInstanceOf(PolicyLoadException.class)
                .hasMessageContaining("unknown role");
        assertThatThrownBy(() -> JsonPolicyStore.read(json("{\"rules\":[{\"type\":\"owner\",\"actions\":[]}]}")))
                .isInstanceOf(PolicyLoadException.class)
                .hasMessageContaining("at least one action");
    }

    @Test
    @DisplayName("rejects malformed and missing documents")
    void malformed() {
        assertThatThrownBy(() -> JsonPolicyStore.read(json("{\"rules\": [")))
                .isInstanceOf(PolicyLoadException.class);
        assertThatThrownBy(() -> JsonPolicyStore.read(json("{}")))
                .isInstanceOf(PolicyLoadException.class)
                .hasMessageContaining("rules");
        assertThatThrownBy(() -> JsonPolicyStore.fromClasspath("policy/missing.json"))
                .isInstanceOf(PolicyLoadException.class)
                .hasMessageContaining("not found");
    }
}
