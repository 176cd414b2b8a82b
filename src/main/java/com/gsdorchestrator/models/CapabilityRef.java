package com.gsdorchestrator.models;

import java.util.Objects;

/**
 * A {@code verb: type/name} entry from a phase's capabilities line, e.g. {@code use: skill/beautiful-commits}.
 */
public class CapabilityRef {

    private final String verb;
    private final String type;
    private final String name;

    public CapabilityRef(String verb, String type, String name) {
        this.verb = verb;
        this.type = type;
        this.name = name;
    }

    public String getVerb() {
        return verb;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CapabilityRef)) return false;
        CapabilityRef other = (CapabilityRef) o;
        return Objects.equals(verb, other.verb) && Objects.equals(type, other.type) && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verb, type, name);
    }

    @Override
    public String toString() {
        return verb + ": " + type + "/" + name;
    }
}
