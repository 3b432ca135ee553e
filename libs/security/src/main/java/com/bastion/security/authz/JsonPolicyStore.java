package com.bastion.security.authz;

import com.bastion.security.identity.Role;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * {@link PolicyStore} loaded once from a JSON policy document.
 * <p>
 * Document shape:
 * <pre>{@code
 * { "rules": [
 *   { "type": "role",  "role": "ADMINISTRATORS", "actions": ["project.edit"] },
 *   { "type": "owner", "actions": ["project.edit"] },
 *   { "type": "acl" } ] }
 * }</pre>
 */
public final class JsonPolicyStore implements PolicyStore {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final List<PolicyRule> rules;

    private JsonPolicyStore(List<PolicyRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Reads a policy document. The stream is not closed.
     *
     * @throws PolicyLoadException if the document is unreadable or contains an invalid rule
     */
    public static JsonPolicyStore read(InputStream json) {
        PolicyDocument document;
        try {
            document = MAPPER.readValue(json, PolicyDocument.class);
        } catch (IOException e) {
            throw new PolicyLoadException("Failed to read policy document", e);
        }
        if (document == null || document.rules() == null) {
            throw new PolicyLoadException("Policy document has no 'rules' array");
        }
        List<PolicyRule> rules = new ArrayList<>(document.rules().size());
        for (int i = 0; i < document.rules().size(); i++) {
            rules.add(toRule(i, document.rules().get(i)));
        }
        return new JsonPolicyStore(rules);
    }

    /**
     * Reads a policy document from the classpath.
     *
     * @param resource classpath location, with or without a {@code classpath:} prefix
     */
    public static JsonPolicyStore fromClasspath(String resource) {
        String path = resource.startsWith("classpath:") ? resource.substring("classpath:".length()) : resource;
        if (path.startsWith("/")) {
            path = path.substring(1);
        }
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = JsonPolicyStore.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(path)) {
            if (in == null) {
                throw new PolicyLoadException("Policy document not found on classpath: " + path);
            }
            return read(in);
        } catch (IOException e) {
            throw new PolicyLoadException("Failed to read policy document " + path, e);
        }
    }

    @Override
    public List<PolicyRule> rules() {
        return rules;
    }

    private static PolicyRule toRule(int index, RuleDefinition definition) {
        if (definition == null || definition.type() == null) {
            throw new PolicyLoadException("Rule " + index + " has no type");
        }
        return switch (definition.type().toLowerCase(Locale.ROOT)) {
            case "role" -> new RolePolicyRule(
                    Role.fromString(definition.role()).orElseThrow(() ->
                            new PolicyLoadException("Rule " + index + " has unknown role '" + definition.role() + "'")),
                    actions(index, definition));
            case "owner" -> new OwnerPolicyRule(actions(index, definition));
            case "acl" -> new AclPolicyRule();
            default -> throw new PolicyLoadException(
                    "Rule " + index + " has unknown type '" + definition.type() + "'");
        };
    }

    private static Set<String> actions(int index, RuleDefinition definition) {
        if (definition.actions() == null || definition.actions().isEmpty()) {
            throw new PolicyLoadException("Rule " + index + " must list at least one action");
        }
        return Set.copyOf(definition.actions());
    }

    record PolicyDocument(List<RuleDefinition> rules) {}

    record RuleDefinition(String type, String role, List<String> actions) {}
}
