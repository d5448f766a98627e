package com.sluice.compute.secrets;

import com.sluice.compute.env.EnvironmentSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Secrets read from environment variables. With a prefix, only prefixed variables are secrets and the prefix is
 * not part of the secret name.
 */
public final class EnvSecretsProvider implements SecretsProvider {

    public static final String TYPE = "env";

    private final EnvironmentSnapshot environment;
    private final String prefix;

    public EnvSecretsProvider(EnvironmentSnapshot environment, String prefix) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.prefix = prefix != null ? prefix : "";
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Optional<String> find(String name) {
        return Optional.ofNullable(environment.get(prefix + name));
    }

    @Override
    public Map<String, String> getAll() {
        Map<String, String> out = new LinkedHashMap<>();
        environment.asMap().forEach((k, v) -> {
            if (k.startsWith(prefix)) {
                out.put(k.substring(prefix.length()), v);
            }
        });
        return out;
    }
}
