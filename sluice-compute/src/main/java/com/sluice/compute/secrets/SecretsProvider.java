package com.sluice.compute.secrets;

import java.util.Map;
import java.util.Optional;

/**
 * Source of secrets available to running nodes.
 */
public interface SecretsProvider {

    /** Provider type name as used in configuration. */
    String type();

    Optional<String> find(String name);

    /**
     * @throws SecretsException when the secret is not defined
     */
    default String get(String name) {
        return find(name).orElseThrow(() -> new SecretsException("Secret not found: " + name + " (" + type() + ")"));
    }

    Map<String, String> getAll();
}
