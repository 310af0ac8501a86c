package com.fixcraft.romclua;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.luaj.vm2.Globals;
import org.luaj.vm2.LoadState;
import org.luaj.vm2.LuaError;
import org.luaj.vm2.LuaString;
import org.luaj.vm2.LuaTable;
import org.luaj.vm2.Varargs;
import org.luaj.vm2.compiler.LuaC;
import org.luaj.vm2.lib.TwoArgFunction;

/**
 * Evaluates Lua literal data with LuaJ in an environment without libraries.
 * Unknown globals read as their own name, so {@code {kind=MONSTER}} yields
 * the string {@code "MONSTER"}. Lua strings are byte strings and are decoded
 * as UTF-8.
 */
public final class LuaLiteralParser {
    private static final String CHUNK_NAME = "literal";
    private static final double MAX_EXACT_INTEGER = 9007199254740992.0d;

    private LuaLiteralParser() {}

    public static LuaValue parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text == null");
        }
        org.luaj.vm2.LuaValue result;
        try {
            Globals globals = bareGlobals();
            byte[] source = ("return " + text).getBytes(StandardCharsets.UTF_8);
            org.luaj.vm2.LuaValue chunk = globals.load(new ByteArrayInputStream(source), CHUNK_NAME, "t", globals);
            result = chunk.call();
        } catch (LuaError exc) {
            throw new UnsupportedBlobException("Malformed Lua literal: " + exc.getMessage(), exc);
        }
        return convert(result);
    }

    private static Globals bareGlobals() {
        Globals globals = new Globals();
        LoadState.install(globals);
        LuaC.install(globals);
        LuaTable meta = new LuaTable();
        meta.set(org.luaj.vm2.LuaValue.INDEX, new TwoArgFunction() {
            @Override
            public org.luaj.vm2.LuaValue call(org.luaj.vm2.LuaValue table, org.luaj.vm2.LuaValue key) {
                return key;
            }
        });
        globals.setmetatable(meta);
        return globals;
    }

    private static LuaValue convert(org.luaj.vm2.LuaValue value) {
        switch (value.type()) {
            case org.luaj.vm2.LuaValue.TNIL:
                return LuaValue.NIL;
            case org.luaj.vm2.LuaValue.TBOOLEAN:
                return LuaValue.valueOf(value.toboolean());
            case org.luaj.vm2.LuaValue.TNUMBER:
                return number(value);
            case org.luaj.vm2.LuaValue.TSTRING:
                return LuaValue.valueOf(text(value.checkstring()));
            case org.luaj.vm2.LuaValue.TTABLE:
                return table(value.checktable());
            default:
                throw new UnsupportedBlobException("Unsupported value in Lua literal: " + value.typename());
        }
    }

    private static LuaValue table(LuaTable table) {
        Map<Object, LuaValue> entries = new LinkedHashMap<Object, LuaValue>();
        org.luaj.vm2.LuaValue key = org.luaj.vm2.LuaValue.NIL;
        while (true) {
            Varargs next = table.next(key);
            key = next.arg1();
            if (key.isnil()) {
                break;
            }
            entries.put(tableKey(key), convert(next.arg(2)));
        }
        return LuaValue.table(entries);
    }

    private static Object tableKey(org.luaj.vm2.LuaValue key) {
        switch (key.type()) {
            case org.luaj.vm2.LuaValue.TNUMBER: {
                LuaValue number = number(key);
                if (number.type() == LuaValue.Type.INTEGER) {
                    return Long.valueOf(number.asLong());
                }
                return Double.valueOf(number.asDouble());
            }
            case org.luaj.vm2.LuaValue.TSTRING:
                return text(key.checkstring());
            case org.luaj.vm2.LuaValue.TBOOLEAN:
                return Boolean.valueOf(key.toboolean());
            default:
                throw new UnsupportedBlobException("Unsupported key in Lua literal: " + key.typename());
        }
    }

    // integral values read as integers; LuaJ keeps no integer subtype beyond int range
    private static LuaValue number(org.luaj.vm2.LuaValue value) {
        if (value.isint()) {
            return LuaValue.valueOf((long) value.toint());
        }
        double d = value.todouble();
        if (d == Math.rint(d) && Math.abs(d) < MAX_EXACT_INTEGER) {
            return LuaValue.valueOf((long) d);
        }
        return LuaValue.valueOf(d);
    }

    private static String text(LuaString value) {
        byte[] bytes = new byte[value.length()];
        value.copyInto(0, bytes, 0, bytes.length);
        return ScriptBytes.lossyUtf8(bytes);
    }
}
