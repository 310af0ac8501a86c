package com.fixcraft.romclua;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public final class ScriptBytes {
    private ScriptBytes() {}

    public static byte[] coerce(String script) {
        if (script == null) {
            throw new IllegalArgumentException("script == null");
        }
        if (!containsSurrogate(script)) {
            return script.getBytes(StandardCharsets.UTF_8);
        }
        byte[] out = new byte[script.length() * 2];
        for (int i = 0; i < script.length(); i++) {
            char ch = script.charAt(i);
            out[i * 2] = (byte) ch;
            out[i * 2 + 1] = (byte) (ch >>> 8);
        }
        return out;
    }

    public static String lossyUtf8(byte[] data) {
        if (data == null || data.length == 0) {
            return "";
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            CharBuffer chars = decoder.decode(ByteBuffer.wrap(data));
            return chars.toString();
        } catch (CharacterCodingException exc) {
            throw new IllegalStateException("UTF-8 decoder rejected input", exc);
        }
    }

    public static boolean startsWithMarker(byte[] data) {
        return data != null && data.length > 0 && (data[0] & 0xFF) == Constants.LUA_MARKER;
    }

    private static boolean containsSurrogate(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isSurrogate(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
