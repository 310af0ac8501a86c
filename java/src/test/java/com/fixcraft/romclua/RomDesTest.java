package com.fixcraft.romclua;

import static com.fixcraft.romclua.TestBytes.hex;
import static com.fixcraft.romclua.TestBytes.toHex;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;

import org.bouncycastle.crypto.engines.DESEngine;
import org.bouncycastle.crypto.params.KeyParameter;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link RomDes}.
 * <p>
 * The engine reads key bits least-significant first, so it must agree with a
 * standard DES engine keyed with every key byte bit-reversed.
 */
@Tag("unit")
class RomDesTest {

    @Test
    void encrypt_zeroBlockWithClientKey_matchesReference() {
        byte[] cipher = RomDes.rom().encrypt(new byte[8]);

        assertThat(toHex(cipher)).isEqualTo("e6118ceecfd243a8");
    }

    @Test
    void encrypt_countingBlockWithClientKey_matchesReference() {
        byte[] cipher = RomDes.rom().encrypt(hex("0123456789abcdef"));

        assertThat(toHex(cipher)).isEqualTo("63cecc5906b263e3");
    }

    @Test
    void decrypt_referenceCipher_returnsPlain() {
        assertThat(RomDes.rom().decrypt(hex("e6118ceecfd243a8"))).isEqualTo(new byte[8]);
    }

    @Test
    void encrypt_randomKeysAndBlocks_agreesWithBouncyCastleOnReversedKey() {
        Random random = new Random(20251019L);
        for (int round = 0; round < 64; round++) {
            byte[] key = new byte[8];
            byte[] data = new byte[8 * (1 + random.nextInt(4))];
            random.nextBytes(key);
            random.nextBytes(data);

            byte[] ours = new RomDes(key).encrypt(data);

            assertThat(ours).isEqualTo(bouncyCastleEncrypt(RomDes.reverseBits(key), data));
        }
    }

    @Test
    void decrypt_afterEncrypt_roundTripsForAnyKey() {
        Random random = new Random(7L);
        for (int round = 0; round < 32; round++) {
            byte[] key = new byte[8];
            byte[] data = new byte[8 * (1 + random.nextInt(8))];
            random.nextBytes(key);
            random.nextBytes(data);
            RomDes des = new RomDes(key);

            assertThat(des.decrypt(des.encrypt(data))).isEqualTo(data);
        }
    }

    @Test
    void crypt_emptyBuffer_returnsEmpty() {
        assertThat(RomDes.rom().encrypt(new byte[0])).isEmpty();
    }

    @Test
    void crypt_unalignedBuffer_throwsCipherException() {
        assertThatThrownBy(() -> RomDes.rom().decrypt(new byte[12]))
            .isInstanceOf(CipherException.class)
            .hasMessageContaining("multiple of 8");
    }

    @Test
    void scheduleKey_wrongKeyLength_throwsCipherException() {
        assertThatThrownBy(() -> RomDes.scheduleKey(new byte[7], true))
            .isInstanceOf(CipherException.class);
        assertThatThrownBy(() -> new RomDes(new byte[16]))
            .isInstanceOf(CipherException.class);
    }

    @Test
    void crypt_foreignRoundKeys_throwsCipherException() {
        assertThatThrownBy(() -> RomDes.crypt(new byte[8], new int[16]))
            .isInstanceOf(CipherException.class);
    }

    @Test
    void reverseBits_mirrorsEachByte() {
        assertThat(toHex(RomDes.reverseBits(hex("0180f00f")))).isEqualTo("80010ff0");
    }

    @Test
    void scheduleKey_doesNotModifyCallerKey() {
        byte[] key = hex("0102030405060708");

        RomDes.scheduleKey(key, true);

        assertThat(toHex(key)).isEqualTo("0102030405060708");
    }

    @Test
    void scheduleKey_decryptKeys_areEncryptKeysInReverseRoundOrder() {
        int[] enc = RomDes.scheduleKey(Constants.ROM_KEY, true);
        int[] dec = RomDes.scheduleKey(Constants.ROM_KEY, false);

        for (int round = 0; round < 16; round++) {
            assertThat(dec[round * 2]).isEqualTo(enc[(15 - round) * 2]);
            assertThat(dec[round * 2 + 1]).isEqualTo(enc[(15 - round) * 2 + 1]);
        }
    }

    private static byte[] bouncyCastleEncrypt(byte[] key, byte[] data) {
        DESEngine engine = new DESEngine();
        engine.init(true, new KeyParameter(key));
        byte[] out = new byte[data.length];
        for (int off = 0; off < data.length; off += 8) {
            engine.processBlock(data, off, out, off);
        }
        return out;
    }
}
