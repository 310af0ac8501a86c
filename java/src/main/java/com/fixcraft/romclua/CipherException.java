package com.fixcraft.romclua;

public final class CipherException extends RomcLuaException {
    public CipherException(String message) {
        super(message);
    }
}
