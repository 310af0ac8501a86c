package com.fixcraft.romclua;

public final class RuntimeUnavailableException extends RomcLuaException {
    public RuntimeUnavailableException(String message) {
        super(message);
    }

    public RuntimeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
