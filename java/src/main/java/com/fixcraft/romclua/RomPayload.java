package com.fixcraft.romclua;

import java.util.Arrays;

public final class RomPayload {
    private RomPayload() {}

    public static byte[] unwrap(byte[] blob) {
        if (blob == null) {
            return null;
        }
        int idx = indexOf(blob, Constants.ROM_SIG, 0);
        if (idx < 0 || blob.length < idx + Constants.ROM_SIG.length + Constants.ROM_LENGTH_FIELD) {
            return null;
        }
        int sizeOffset = idx + Constants.ROM_SIG.length;
        long declared = (blob[sizeOffset] & 0xFFL)
            | ((blob[sizeOffset + 1] & 0xFFL) << 8)
            | ((blob[sizeOffset + 2] & 0xFFL) << 16)
            | ((blob[sizeOffset + 3] & 0xFFL) << 24);
        int encOffset = sizeOffset + Constants.ROM_LENGTH_FIELD;
        int encLen = blob.length - encOffset;
        int blockLen = encLen - (encLen % Constants.DES_BLOCK);
        if (blockLen <= 0) {
            return null;
        }
        byte[] decrypted = RomDes.rom().decrypt(Arrays.copyOfRange(blob, encOffset, encOffset + blockLen));
        if (declared >= decrypted.length) {
            return decrypted;
        }
        return Arrays.copyOf(decrypted, (int) declared);
    }

    public static byte[] wrap(byte[] plain, byte[] prefix) {
        if (plain == null) {
            throw new IllegalArgumentException("plain == null");
        }
        byte[] head = prefix == null ? new byte[0] : prefix;
        int padded = (plain.length + Constants.DES_BLOCK - 1) / Constants.DES_BLOCK * Constants.DES_BLOCK;
        byte[] encrypted = RomDes.rom().encrypt(Arrays.copyOf(plain, padded));

        byte[] out = new byte[head.length + Constants.ROM_SIG.length + Constants.ROM_LENGTH_FIELD + encrypted.length];
        int offset = 0;
        System.arraycopy(head, 0, out, offset, head.length);
        offset += head.length;
        System.arraycopy(Constants.ROM_SIG, 0, out, offset, Constants.ROM_SIG.length);
        offset += Constants.ROM_SIG.length;
        int len = plain.length;
        out[offset]     = (byte) len;
        out[offset + 1] = (byte) (len >>> 8);
        out[offset + 2] = (byte) (len >>> 16);
        out[offset + 3] = (byte) (len >>> 24);
        offset += Constants.ROM_LENGTH_FIELD;
        System.arraycopy(encrypted, 0, out, offset, encrypted.length);
        return out;
    }

    public static boolean isWrapped(byte[] blob) {
        return blob != null && indexOf(blob, Constants.ROM_SIG, 0) >= 0;
    }

    static int indexOf(byte[] haystack, byte[] needle, int from) {
        outer:
        for (int i = Math.max(0, from); i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
