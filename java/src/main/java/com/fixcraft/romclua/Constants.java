package com.fixcraft.romclua;

import java.nio.charset.StandardCharsets;

public final class Constants {
    private Constants() {}

    public static final int LUA_MARKER = 0x2A;

    public static final byte[] ROM_SIG = "czjzgqde".getBytes(StandardCharsets.US_ASCII);
    public static final byte[] ROM_KEY = new byte[] {2, 5, 9, 3, 6, 1, 0, 1};
    public static final int ROM_LENGTH_FIELD = 4;

    public static final int DES_BLOCK = 8;
    public static final int DES_KEY_LEN = 8;

    // marker byte + opaque region that precedes the embedded source path
    public static final int LUA_OPAQUE_REGION = 0x100;
    public static final int LUA_MIN_BLOB = 1 + LUA_OPAQUE_REGION;

    public static final byte[] LUAC_SIGNATURE = new byte[] {0x1B, 'L', 'u', 'a'};
    public static final int LUAC_VERSION = 0x53;
    public static final int LUAC_FORMAT = 0x00;
    public static final byte[] LUAC_DATA = new byte[] {0x19, (byte) 0x93, '\r', '\n', 0x1A, '\n'};
    public static final int LUAC_SIZEOF_INT = 4;
    public static final int LUAC_SIZEOF_SIZE_T = 4;
    public static final int LUAC_SIZEOF_INSTRUCTION = 4;
    public static final int LUAC_SIZEOF_INTEGER = 8;
    public static final int LUAC_SIZEOF_NUMBER = 8;
    public static final long LUAC_INT = 0x5678L;
    public static final double LUAC_NUM = 370.5d;

    public static final String CHUNK_NAME = "romc";

    public static final int DEFAULT_MAX_UNWRAP_DEPTH = 2;
    public static final String DEFAULT_SLUA_LIBRARY = "slua_encrypt";
    public static final String DEFAULT_UNLUAC_JAR = "third_party/unluac/unluac.jar";
    public static final String DEFAULT_LUA_EXECUTABLE = "lua5.3";

    public static final String DUMP_SCRIPT_RESOURCE = "dump_table.lua";

    public static final String ENGINE_VERSION = "1.2.0";
}
