package com.sluice.compute.secrets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Secrets from a dotenv file: {@code KEY=VALUE} lines, {@code #} comments and blank lines ignored, optional
 * quotes around the value stripped. The file is read once, when the provider is created.
 */
public final class DotEnvSecretsProvider implements SecretsProvider {

    public static final String TYPE = "dotenv";
    public static final String DEFAULT_LOCATION = ".env";

    private static final Logger log = LoggerFactory.getLogger(DotEnvSecretsProvider.class);

    private final Map<String, String> secrets;

    public DotEnvSecretsProvider(Path file) {
        this.secrets = Collections.unmodifiableMap(read(file));
        log.info("Secrets loaded | type={} | file={} | count={}", TYPE, file, secrets.size());
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Optional<String> find(String name) {
        return Optional.ofNullable(secrets.get(name));
    }

    @Override
    public Map<String, String> getAll() {
        return secrets;
    }

    static Map<String, String> read(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file);
        } catch (IOException e) {
            throw new SecretsException("Cannot read secrets file " + file + ": " + e.getMessage(), e);
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            int eq = line.indexOf('=');
            if (eq <= 0) {
                throw new SecretsException("Malformed line " + (i + 1) + " in " + file + ": expected KEY=VALUE");
            }
            out.put(line.substring(0, eq).trim(), unquote(line.substring(eq + 1).trim()));
        }
        return out;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
