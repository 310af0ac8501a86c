package com.fixcraft.romclua;

public final class UnsupportedBlobException extends RomcLuaException {
    public UnsupportedBlobException(String message) {
        super(message);
    }

    public UnsupportedBlobException(String message, Throwable cause) {
        super(message, cause);
    }
}
