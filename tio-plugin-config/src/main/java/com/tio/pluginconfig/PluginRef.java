package com.tio.pluginconfig;

import java.util.Objects;

/** Variant-tagged reference to a plugin configuration: kind plus name. */
public final class PluginRef {

    private final PluginKind kind;
    private final String name;

    public PluginRef(PluginKind kind, String name) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name").trim();
    }

    public static PluginRef of(PluginKind kind, String name) {
        return new PluginRef(kind, name);
    }

    public PluginKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginRef that = (PluginRef) o;
        return kind == that.kind && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + name;
    }
}
