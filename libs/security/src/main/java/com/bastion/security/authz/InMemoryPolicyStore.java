package com.bastion.security.authz;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable {@link PolicyStore}; rules can be added while requests are being authorized.
 */
public class InMemoryPolicyStore implements PolicyStore {

    private final List<PolicyRule> rules = new CopyOnWriteArrayList<>();

    public InMemoryPolicyStore() {
    }

    public InMemoryPolicyStore(List<? extends PolicyRule> initialRules) {
        rules.addAll(initialRules);
    }

    public InMemoryPolicyStore add(PolicyRule rule) {
        rules.add(rule);
        return this;
    }

    @Override
    public List<PolicyRule> rules() {
        return List.copyOf(rules);
    }
}
