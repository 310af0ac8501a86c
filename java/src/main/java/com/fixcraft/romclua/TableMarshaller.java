package com.fixcraft.romclua;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts values on a Lua stack into {@link LuaValue} trees.
 * <p>
 * Tables are walked with {@code lua_next}. The set of tables on the current
 * path is threaded through the recursion: a table met again on its own path
 * becomes {@link LuaValue#NIL}, and it leaves the set once its subtree is
 * done, so siblings sharing a table each get a full copy.
 */
public final class TableMarshaller {
    private final LuaApi api;
    private final long state;

    public TableMarshaller(LuaApi api, long state) {
        this.api = api;
        this.state = state;
    }

    public LuaValue read(int index) {
        return read(index, new HashSet<Long>());
    }

    LuaValue read(int index, Set<Long> visiting) {
        int type = api.type(state, index);
        switch (type) {
            case LuaApi.LUA_TNIL:
                return LuaValue.NIL;
            case LuaApi.LUA_TBOOLEAN:
                return LuaValue.valueOf(api.toBoolean(state, index));
            case LuaApi.LUA_TNUMBER:
                if (api.isInteger(state, index)) {
                    return LuaValue.valueOf(api.toInteger(state, index));
                }
                return LuaValue.valueOf(api.toNumber(state, index));
            case LuaApi.LUA_TSTRING: {
                byte[] raw = api.toLString(state, index);
                return LuaValue.valueOf(raw == null ? "" : new String(raw, StandardCharsets.UTF_8));
            }
            case LuaApi.LUA_TTABLE:
                return readTable(index, visiting);
            default:
                return LuaValue.NIL;
        }
    }

    private LuaValue readTable(int index, Set<Long> visiting) {
        int absIndex = absIndex(index);
        long ident = api.toPointer(state, absIndex);
        Long key = ident != 0 ? Long.valueOf(ident) : null;
        if (key != null) {
            if (visiting.contains(key)) {
                return LuaValue.NIL;
            }
            visiting.add(key);
        }
        try {
            Map<Object, LuaValue> entries = new LinkedHashMap<Object, LuaValue>();
            api.pushNil(state);
            while (api.next(state, absIndex) != 0) {
                LuaValue value = read(-1, visiting);
                Object rawKey = readKey(-2, visiting);
                api.setTop(state, -2);
                entries.put(rawKey, value);
            }
            return LuaValue.table(entries);
        } finally {
            if (key != null) {
                visiting.remove(key);
            }
        }
    }

    // Keys keep their Lua type so the array test sees real integers.
    private Object readKey(int index, Set<Long> visiting) {
        LuaValue keyValue = read(index, visiting);
        switch (keyValue.type()) {
            case INTEGER:
                return Long.valueOf(keyValue.asLong());
            case NUMBER:
                return Double.valueOf(keyValue.asDouble());
            case STRING:
                return keyValue.asString();
            case BOOLEAN:
                return Boolean.valueOf(keyValue.asBoolean());
            default:
                return LuaJson.toJson(keyValue);
        }
    }

    private int absIndex(int index) {
        if (index > 0 || index <= LuaApi.LUA_REGISTRYINDEX) {
            return index;
        }
        return api.getTop(state) + index + 1;
    }
}
