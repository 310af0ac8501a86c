package com.fixcraft.romclua;

import org.bouncycastle.crypto.engines.DESEngine;

/**
 * DES as used by the client's ROM encryption: key bits are read
 * least-significant first, which is standard DES keyed with every key byte
 * bit-reversed. Blocks are processed independently.
 */
public final class RomDes extends DESEngine {
    private static final int WORKING_KEY_WORDS = 32;

    private static final RomDes SCHEDULER = new RomDes();
    private static final RomDes ROM = new RomDes(Constants.ROM_KEY);

    private final int[] encryptKey;
    private final int[] decryptKey;

    private RomDes() {
        this.encryptKey = null;
        this.decryptKey = null;
    }

    public RomDes(byte[] key) {
        this.encryptKey = scheduleKey(key, true);
        this.decryptKey = scheduleKey(key, false);
    }

    public static RomDes rom() {
        return ROM;
    }

    public byte[] encrypt(byte[] data) {
        return crypt(data, encryptKey);
    }

    public byte[] decrypt(byte[] data) {
        return crypt(data, decryptKey);
    }

    public static int[] scheduleKey(byte[] key, boolean encrypt) {
        if (key == null || key.length != Constants.DES_KEY_LEN) {
            throw new CipherException("DES key must be " + Constants.DES_KEY_LEN + " bytes long");
        }
        return SCHEDULER.generateWorkingKey(encrypt, reverseBits(key));
    }

    public static byte[] crypt(byte[] data, int[] workingKey) {
        if (data == null) {
            throw new IllegalArgumentException("data == null");
        }
        if (workingKey == null || workingKey.length != WORKING_KEY_WORDS) {
            throw new CipherException("round keys must come from scheduleKey");
        }
        if (data.length % Constants.DES_BLOCK != 0) {
            throw new CipherException("Data length must be a multiple of " + Constants.DES_BLOCK + " bytes");
        }
        byte[] out = new byte[data.length];
        for (int off = 0; off < data.length; off += Constants.DES_BLOCK) {
            SCHEDULER.desFunc(workingKey, data, off, out, off);
        }
        return out;
    }

    static byte[] reverseBits(byte[] key) {
        byte[] out = new byte[key.length];
        for (int i = 0; i < key.length; i++) {
            out[i] = (byte) (Integer.reverse(key[i] & 0xFF) >>> 24);
        }
        return out;
    }
}
