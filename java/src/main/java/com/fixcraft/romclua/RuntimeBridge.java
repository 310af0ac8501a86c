package com.fixcraft.romclua;

public interface RuntimeBridge {
    boolean isNative();

    byte[] compile(byte[] blob);

    LuaValue runAndExtract(byte[] blob, String tableName);
}
