package com.collectivestrategist.aigateway.provider;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ProviderName {

    OPENAI("openai"),
    ANTHROPIC("anthropic"),
    GOOGLE("google"),
    DEFAULT("default");

    private final String id;

    ProviderName(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public static Optional<ProviderName> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(p -> p.id.equals(id))
                .findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
