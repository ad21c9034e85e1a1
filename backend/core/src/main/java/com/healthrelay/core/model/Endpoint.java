package com.healthrelay.core.model;

import java.util.Objects;

public record Endpoint(
        String name,
        String group,
        String url
) {
    public Endpoint {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(url, "url is required");
        group = group == null ? "" : group;
    }

    public Endpoint(String name, String url) {
        this(name, "", url);
    }

    public boolean hasGroup() {
        return !group.isEmpty();
    }

    public String displayName() {
        return hasGroup() ? group + "/" + name : name;
    }
}
