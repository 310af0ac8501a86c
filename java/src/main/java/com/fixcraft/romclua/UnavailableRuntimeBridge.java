package com.fixcraft.romclua;

public final class UnavailableRuntimeBridge implements RuntimeBridge {
    private final String reason;

    public UnavailableRuntimeBridge(String reason) {
        this.reason = reason == null || reason.isEmpty() ? "native slua bridge unavailable" : reason;
    }

    public String reason() {
        return reason;
    }

    @Override
    public boolean isNative() {
        return false;
    }

    @Override
    public byte[] compile(byte[] blob) {
        throw new RuntimeUnavailableException(reason);
    }

    @Override
    public LuaValue runAndExtract(byte[] blob, String tableName) {
        throw new RuntimeUnavailableException(reason);
    }
}
