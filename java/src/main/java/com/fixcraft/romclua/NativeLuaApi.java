package com.fixcraft.romclua;

import com.sun.jna.Callback;
import com.sun.jna.IntegerType;
import com.sun.jna.Library;
import com.sun.jna.Memory;
import com.sun.jna.Native;
import com.sun.jna.NativeLibrary;
import com.sun.jna.Pointer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Binds the client's slua library directly through JNA. The library is
 * loaded at most once per process; a failed load is remembered until
 * {@link #resetForTests()}.
 */
public final class NativeLuaApi implements LuaApi {
    private static final String[] REQUIRED_SYMBOLS = {
        "luaL_newstate", "luaL_openlibs", "lua_close", "luaRO_loadbufferx", "lua_dump", "lua_pcallk",
        "lua_getglobal", "lua_type", "lua_pushnil", "lua_next", "lua_gettop", "lua_settop",
        "lua_tointegerx", "lua_tonumberx", "lua_isinteger", "lua_toboolean", "lua_tolstring", "lua_topointer"
    };

    private static final Object LOCK = new Object();
    private static volatile NativeLuaApi loaded = null;
    private static volatile String loadFailure = null;

    public interface SluaLibrary extends Library {
        Pointer luaL_newstate();

        void luaL_openlibs(Pointer state);

        void lua_close(Pointer state);

        int luaRO_loadbufferx(Pointer state, byte[] buffer, SizeT size, byte[] chunkName, Pointer mode);

        int lua_dump(Pointer state, LuaWriter writer, Pointer data, int strip);

        int lua_pcallk(Pointer state, int nargs, int nresults, int msgh, SizeT ctx, Pointer k);

        int lua_getglobal(Pointer state, byte[] name);

        int lua_type(Pointer state, int index);

        void lua_pushnil(Pointer state);

        int lua_next(Pointer state, int index);

        int lua_gettop(Pointer state);

        void lua_settop(Pointer state, int index);

        long lua_tointegerx(Pointer state, int index, Pointer isnum);

        double lua_tonumberx(Pointer state, int index, Pointer isnum);

        int lua_isinteger(Pointer state, int index);

        int lua_toboolean(Pointer state, int index);

        Pointer lua_tolstring(Pointer state, int index, Pointer len);

        Pointer lua_topointer(Pointer state, int index);
    }

    // lua_Writer: int (*)(lua_State *L, const void *p, size_t sz, void *ud)
    public interface LuaWriter extends Callback {
        int invoke(Pointer state, Pointer block, SizeT size, Pointer userData);
    }

    public static final class SizeT extends IntegerType {
        private static final long serialVersionUID = 1L;

        public SizeT() {
            this(0);
        }

        public SizeT(long value) {
            super(Native.SIZE_T_SIZE, value, true);
        }
    }

    private final SluaLibrary lib;
    private final String source;

    NativeLuaApi(SluaLibrary lib, String source) {
        this.lib = lib;
        this.source = source;
    }

    public static NativeLuaApi load(DecoderConfig config) {
        NativeLuaApi current = loaded;
        if (current != null) {
            return current;
        }
        if (!config.nativeEnabled()) {
            throw new RuntimeUnavailableException("native slua bridge disabled (" + DecoderConfig.NATIVE_ENV + ")");
        }
        synchronized (LOCK) {
            if (loaded != null) {
                return loaded;
            }
            if (loadFailure != null) {
                throw new RuntimeUnavailableException(loadFailure);
            }
            Path file = config.sluaLibrary();
            String target;
            if (file != null) {
                if (!Files.isRegularFile(file)) {
                    loadFailure = "slua library not found at " + file;
                    throw new RuntimeUnavailableException(loadFailure);
                }
                target = file.toAbsolutePath().toString();
            } else {
                target = config.sluaLibraryName();
            }
            try {
                NativeLibrary handle = NativeLibrary.getInstance(target);
                for (String symbol : REQUIRED_SYMBOLS) {
                    handle.getFunction(symbol);
                }
                loaded = new NativeLuaApi(Native.load(target, SluaLibrary.class), target);
            } catch (UnsatisfiedLinkError | SecurityException exc) {
                loadFailure = "slua library could not be loaded from " + target + ": " + exc.getMessage();
                throw new RuntimeUnavailableException(loadFailure, exc);
            }
            RuntimeLog.reason("slua library loaded from " + target);
            return loaded;
        }
    }

    public static boolean isLoaded() {
        return loaded != null;
    }

    static void resetForTests() {
        synchronized (LOCK) {
            loadFailure = null;
        }
    }

    public String source() {
        return source;
    }

    private static Pointer ptr(long state) {
        return new Pointer(state);
    }

    private static byte[] cString(String text) {
        byte[] raw = text.getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[raw.length + 1];
        System.arraycopy(raw, 0, out, 0, raw.length);
        return out;
    }

    @Override
    public long newState() {
        return Pointer.nativeValue(lib.luaL_newstate());
    }

    @Override
    public void openLibs(long state) {
        lib.luaL_openlibs(ptr(state));
    }

    @Override
    public void close(long state) {
        lib.lua_close(ptr(state));
    }

    @Override
    public int loadBuffer(long state, byte[] buffer, String chunkName) {
        return lib.luaRO_loadbufferx(ptr(state), buffer, new SizeT(buffer.length), cString(chunkName), null);
    }

    @Override
    public int dump(long state, final ChunkWriter writer, boolean strip) {
        LuaWriter callback = new LuaWriter() {
            @Override
            public int invoke(Pointer ignored, Pointer block, SizeT size, Pointer userData) {
                long length = size.longValue();
                if (block == null || length == 0) {
                    return 0;
                }
                return writer.write(block.getByteArray(0, (int) length));
            }
        };
        return lib.lua_dump(ptr(state), callback, null, strip ? 1 : 0);
    }

    @Override
    public int pcall(long state, int nargs, int nresults, int msgh) {
        return lib.lua_pcallk(ptr(state), nargs, nresults, msgh, new SizeT(0), null);
    }

    @Override
    public int getGlobal(long state, String name) {
        return lib.lua_getglobal(ptr(state), cString(name));
    }

    @Override
    public int type(long state, int index) {
        return lib.lua_type(ptr(state), index);
    }

    @Override
    public void pushNil(long state) {
        lib.lua_pushnil(ptr(state));
    }

    @Override
    public int next(long state, int index) {
        return lib.lua_next(ptr(state), index);
    }

    @Override
    public int getTop(long state) {
        return lib.lua_gettop(ptr(state));
    }

    @Override
    public void setTop(long state, int index) {
        lib.lua_settop(ptr(state), index);
    }

    @Override
    public long toInteger(long state, int index) {
        return lib.lua_tointegerx(ptr(state), index, null);
    }

    @Override
    public double toNumber(long state, int index) {
        return lib.lua_tonumberx(ptr(state), index, null);
    }

    @Override
    public boolean isInteger(long state, int index) {
        return lib.lua_isinteger(ptr(state), index) != 0;
    }

    @Override
    public boolean toBoolean(long state, int index) {
        return lib.lua_toboolean(ptr(state), index) != 0;
    }

    @Override
    public byte[] toLString(long state, int index) {
        Memory len = new Memory(Native.SIZE_T_SIZE);
        Pointer data = lib.lua_tolstring(ptr(state), index, len);
        if (data == null) {
            return null;
        }
        long length = Native.SIZE_T_SIZE == 8 ? len.getLong(0) : len.getInt(0) & 0xFFFFFFFFL;
        return data.getByteArray(0, (int) length);
    }

    @Override
    public long toPointer(long state, int index) {
        return Pointer.nativeValue(lib.lua_topointer(ptr(state), index));
    }
}
