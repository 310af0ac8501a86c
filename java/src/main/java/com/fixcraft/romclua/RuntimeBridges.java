package com.fixcraft.romclua;

public final class RuntimeBridges {
    private RuntimeBridges() {}

    public static RuntimeBridge resolve(DecoderConfig config) {
        try {
            return new SluaRuntimeBridge(NativeLuaApi.load(config));
        } catch (RuntimeUnavailableException exc) {
            RuntimeLog.reason(exc.getMessage());
            return new UnavailableRuntimeBridge(exc.getMessage());
        }
    }
}
