package com.fixcraft.romclua;

public class RomcLuaException extends RuntimeException {
    public RomcLuaException(String message) {
        super(message);
    }

    public RomcLuaException(String message, Throwable cause) {
        super(message, cause);
    }
}
