package com.fixcraft.romclua;

public final class TableSnapshot {
    public enum Strategy {
        NATIVE_RUNTIME,
        EXTERNAL_INTERPRETER
    }

    private final String name;
    private final LuaValue value;
    private final Strategy strategy;

    public TableSnapshot(String name, LuaValue value, Strategy strategy) {
        if (name == null || value == null || strategy == null) {
            throw new IllegalArgumentException("name, value and strategy required");
        }
        this.name = name;
        this.value = value;
        this.strategy = strategy;
    }

    public String name() {
        return name;
    }

    public LuaValue value() {
        return value;
    }

    public Strategy strategy() {
        return strategy;
    }

    @Override
    public String toString() {
        return "TableSnapshot{" + name + " via " + strategy + "}";
    }
}
