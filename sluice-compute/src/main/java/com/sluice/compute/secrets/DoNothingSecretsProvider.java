package com.sluice.compute.secrets;

import java.util.Map;
import java.util.Optional;

public final class DoNothingSecretsProvider implements SecretsProvider {

    public static final String TYPE = "do-nothing";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Optional<String> find(String name) {
        return Optional.empty();
    }

    @Override
    public Map<String, String> getAll() {
        return Map.of();
    }
}
