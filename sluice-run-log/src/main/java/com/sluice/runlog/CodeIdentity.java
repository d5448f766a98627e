package com.sluice.runlog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identity of the code a step ran with, e.g. a git commit or a container image id. {@code dependable} is false
 * when the identifier does not pin the code exactly (a git checkout with uncommitted changes).
 */
public final class CodeIdentity {

    public static final String GIT = "git";
    public static final String DOCKER = "docker";

    private final String identifier;
    private final String type;
    private final boolean dependable;
    private final String url;

    @JsonCreator
    public CodeIdentity(
            @JsonProperty("identifier") String identifier,
            @JsonProperty("type") String type,
            @JsonProperty("dependable") boolean dependable,
            @JsonProperty("url") String url) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.type = Objects.requireNonNull(type, "type");
        this.dependable = dependable;
        this.url = url;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getType() {
        return type;
    }

    public boolean isDependable() {
        return dependable;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CodeIdentity)) {
            return false;
        }
        CodeIdentity that = (CodeIdentity) o;
        return dependable == that.dependable
                && identifier.equals(that.identifier)
                && type.equals(that.type)
                && Objects.equals(url, that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, type, dependable, url);
    }

    @Override
    public String toString() {
        return type + ":" + identifier + (dependable ? "" : " (not dependable)");
    }
}
