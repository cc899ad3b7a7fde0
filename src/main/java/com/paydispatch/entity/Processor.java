package com.paydispatch.entity;

public enum Processor {
    DEFAULT("default"),
    FALLBACK("fallback");

    private final String jsonName;

    Processor(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public static Processor fromJsonName(String name) {
        for (Processor processor : values()) {
            if (processor.jsonName.equals(name)) {
                return processor;
            }
        }
        throw new IllegalArgumentException("Unknown processor: " + name);
    }
}
