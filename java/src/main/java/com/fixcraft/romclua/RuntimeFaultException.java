package com.fixcraft.romclua;

public final class RuntimeFaultException extends RomcLuaException {
    public RuntimeFaultException(String message) {
        super(message);
    }

    public RuntimeFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
