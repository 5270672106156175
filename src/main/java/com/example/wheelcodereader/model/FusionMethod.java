package com.example.wheelcodereader.model;

import java.util.Locale;
import java.util.Optional;

public enum FusionMethod {
    VOTING,
    WEIGHTED,
    SMART,
    MERGE;

    /**
     * Resolves a configured method name. Only the exact lower-case names are
     * recognized; anything else is reported as unsupported by the fusion.
     */
    public static Optional<FusionMethod> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (FusionMethod method : values()) {
            if (method.configName().equals(name)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
