package com.fixcraft.romclua;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

public final class LuacPayload {
    private static final byte[] HEADER = buildHeader();

    private LuacPayload() {}

    public static byte[] synthesize(byte[] blob) {
        if (blob == null || blob.length < Constants.LUA_MIN_BLOB || (blob[0] & 0xFF) != Constants.LUA_MARKER) {
            throw new UnsupportedBlobException("Unsupported Lua blob format");
        }
        int start = Constants.LUA_MIN_BLOB;
        int zero = -1;
        for (int i = start; i < blob.length; i++) {
            if (blob[i] == 0) {
                zero = i;
                break;
            }
        }
        if (zero < 0) {
            throw new UnsupportedBlobException("Malformed Lua payload (missing null terminator)");
        }
        int body = zero + 1;
        while (body < blob.length && blob[body] == 0) {
            body++;
        }
        byte[] out = new byte[HEADER.length + (blob.length - body)];
        System.arraycopy(HEADER, 0, out, 0, HEADER.length);
        System.arraycopy(blob, body, out, HEADER.length, blob.length - body);
        return out;
    }

    public static byte[] header() {
        return HEADER.clone();
    }

    public static String sourcePath(byte[] blob) {
        if (blob == null || blob.length < Constants.LUA_MIN_BLOB || (blob[0] & 0xFF) != Constants.LUA_MARKER) {
            return "";
        }
        int end = Constants.LUA_MIN_BLOB;
        while (end < blob.length && blob[end] != 0) {
            end++;
        }
        return ScriptBytes.lossyUtf8(Arrays.copyOfRange(blob, Constants.LUA_MIN_BLOB, end));
    }

    private static byte[] buildHeader() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(33);
        out.write(Constants.LUAC_SIGNATURE, 0, Constants.LUAC_SIGNATURE.length);
        out.write(Constants.LUAC_VERSION);
        out.write(Constants.LUAC_FORMAT);
        out.write(Constants.LUAC_DATA, 0, Constants.LUAC_DATA.length);
        out.write(Constants.LUAC_SIZEOF_INT);
        out.write(Constants.LUAC_SIZEOF_SIZE_T);
        out.write(Constants.LUAC_SIZEOF_INSTRUCTION);
        out.write(Constants.LUAC_SIZEOF_INTEGER);
        out.write(Constants.LUAC_SIZEOF_NUMBER);
        ByteBuffer sentinels = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
        sentinels.putLong(Constants.LUAC_INT);
        sentinels.putDouble(Constants.LUAC_NUM);
        out.write(sentinels.array(), 0, 16);
        return out.toByteArray();
    }
}
