package com.fixcraft.romclua;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

public final class SluaRuntimeBridge implements RuntimeBridge {
    private final LuaApi api;

    public SluaRuntimeBridge(LuaApi api) {
        if (api == null) {
            throw new IllegalArgumentException("api == null");
        }
        this.api = api;
    }

    @Override
    public boolean isNative() {
        return true;
    }

    @Override
    public byte[] compile(byte[] blob) {
        if (blob == null || blob.length == 0) {
            return new byte[0];
        }
        long state = openState();
        try {
            load(state, blob);
            final ByteArrayOutputStream out = new ByteArrayOutputStream(blob.length);
            int rc = api.dump(state, new LuaApi.ChunkWriter() {
                @Override
                public int write(byte[] block) {
                    out.write(block, 0, block.length);
                    return 0;
                }
            }, false);
            if (rc != 0) {
                throw new RuntimeFaultException("lua_dump failed with code " + rc);
            }
            return out.toByteArray();
        } finally {
            api.close(state);
        }
    }

    @Override
    public LuaValue runAndExtract(byte[] blob, String tableName) {
        if (tableName == null || tableName.isEmpty()) {
            throw new IllegalArgumentException("table name required");
        }
        if (blob == null || blob.length == 0) {
            return LuaValue.emptyMap();
        }
        long state = openState();
        try {
            load(state, blob);
            if (api.pcall(state, 0, 0, 0) != LuaApi.LUA_OK) {
                throw new RuntimeFaultException(stackError(state));
            }
            api.getGlobal(state, tableName);
            if (api.type(state, -1) != LuaApi.LUA_TTABLE) {
                throw new RuntimeFaultException("table '" + tableName + "' not found");
            }
            return new TableMarshaller(api, state).read(-1);
        } finally {
            api.close(state);
        }
    }

    private long openState() {
        long state = api.newState();
        if (state == 0) {
            throw new RuntimeFaultException("Failed to create Lua state");
        }
        try {
            api.openLibs(state);
        } catch (RuntimeException exc) {
            api.close(state);
            throw exc;
        }
        return state;
    }

    private void load(long state, byte[] blob) {
        int rc = api.loadBuffer(state, blob, Constants.CHUNK_NAME);
        if (rc != LuaApi.LUA_OK) {
            throw new RuntimeFaultException("luaRO_loadbufferx failed with code " + rc + ": " + stackError(state));
        }
    }

    private String stackError(long state) {
        String message = "lua runtime error";
        if (api.type(state, -1) == LuaApi.LUA_TSTRING) {
            byte[] raw = api.toLString(state, -1);
            if (raw != null) {
                message = new String(raw, StandardCharsets.UTF_8);
            }
        }
        api.setTop(state, -2);
        return message;
    }
}
