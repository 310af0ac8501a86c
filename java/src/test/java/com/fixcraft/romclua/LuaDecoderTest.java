package com.fixcraft.romclua;

import static com.fixcraft.romclua.TestBytes.concat;
import static com.fixcraft.romclua.TestBytes.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for the {@link LuaDecoder} strategy order. No external tool is
 * installed in these tests, so every tool call reports RuntimeUnavailable.
 */
@Tag("unit")
class LuaDecoderTest {
    private static final byte[] MARKER = new byte[] {(byte) Constants.LUA_MARKER};
    private static final String PLAIN = TestBytes.TABLE_TEST_PLAIN;

    @TempDir
    Path tempDir;

    private DecoderConfig config;
    private StubRuntimeBridge stub;

    @BeforeEach
    void setUp() {
        config = DecoderConfig.builder()
            .nativeEnabled(false)
            .unluacJar(tempDir.resolve("missing-unluac.jar"))
            .luaExecutable(tempDir.resolve("missing-lua").toString())
            .build();
        stub = new StubRuntimeBridge();
    }

    private LuaDecoder decoder(RuntimeBridge bridge) {
        return new LuaDecoder(config, bridge, new ExternalTools(config));
    }

    private LuaDecoder unavailable() {
        return decoder(new UnavailableRuntimeBridge("no slua in tests"));
    }

    private static byte[] wrapped(byte[] inner) {
        return RomPayload.wrap(inner, MARKER);
    }

    @Test
    void decodeToText_withoutMarker_returnsUtf8Unchanged() {
        String text = "Table_Skill = {id=1}\n-- ünïcode";

        assertThat(decoder(stub).decodeToText(utf8(text))).isEqualTo(text);
        assertThat(stub.compileCalls).isZero();
    }

    @Test
    void decodeToText_empty_returnsEmpty() {
        assertThat(decoder(stub).decodeToText(new byte[0])).isEmpty();
        assertThat(decoder(stub).decodeToText((byte[]) null, null)).isEmpty();
    }

    @Test
    void decodeToText_wrappedPlainText_unwrapsOnce() {
        assertThat(unavailable().decodeToText(wrapped(utf8(PLAIN)))).isEqualTo(PLAIN);
    }

    @Test
    void decodeToText_doublyWrapped_succeedsAfterTwoPasses() {
        byte[] blob = wrapped(wrapped(utf8(PLAIN)));

        assertThat(unavailable().decodeToText(blob)).isEqualTo(PLAIN);
    }

    @Test
    void decodeToText_doublyWrappedScript_decodesInnermostChunkAfterTwoPasses() {
        byte[] inner = TestBytes.scriptBlob("@Script/Table_Test.lua", utf8("body"));
        byte[] blob = wrapped(wrapped(inner));

        // the innermost script reaches the decompiler, which is missing here
        assertThatThrownBy(() -> unavailable().decodeToText(blob))
            .isInstanceOf(RuntimeUnavailableException.class)
            .hasMessageContaining("unluac jar missing");
    }

    @Test
    void decodeToText_tripleWrapped_failsWithoutRecursingFurther() {
        byte[] blob = wrapped(wrapped(wrapped(utf8(PLAIN))));

        assertThatThrownBy(() -> unavailable().decodeToText(blob))
            .isInstanceOf(UnsupportedBlobException.class)
            .hasMessageContaining("2 unwrap passes");
    }

    @Test
    void decodeToText_markerChainThatNeverEnds_failsCleanly() {
        byte[] blob = utf8(PLAIN);
        for (int i = 0; i < 10; i++) {
            blob = wrapped(blob);
        }
        byte[] input = blob;

        assertThatThrownBy(() -> unavailable().decodeToText(input))
            .isInstanceOf(UnsupportedBlobException.class);
    }

    @Test
    void decodeToText_deeperBoundConfigured_allowsThirdPass() {
        config = config.toBuilder().maxUnwrapDepth(3).build();
        byte[] blob = wrapped(wrapped(wrapped(utf8(PLAIN))));

        assertThat(unavailable().decodeToText(blob)).isEqualTo(PLAIN);
    }

    @Test
    void decodeToText_onlyCompanionWrapped_usesCompanion() {
        byte[] blob = concat(MARKER, utf8("not a payload"));

        assertThat(unavailable().decodeToText(blob, TestBytes.tableTestBlob())).isEqualTo(PLAIN);
    }

    @Test
    void decodeToText_blobWrappedAndCompanionWrapped_prefersBlob() {
        byte[] blob = wrapped(utf8("from blob"));

        assertThat(unavailable().decodeToText(blob, TestBytes.tableTestBlob())).isEqualTo("from blob");
    }

    @Test
    void decodeToText_nothingApplies_raisesLastConcreteError() {
        byte[] blob = concat(MARKER, utf8("opaque"));

        assertThatThrownBy(() -> unavailable().decodeToText(blob))
            .isInstanceOf(RuntimeUnavailableException.class)
            .hasMessage("no slua in tests");
    }

    @Test
    void decodeToText_synthesizedChunkButNoDecompiler_raisesDecompilerUnavailable() {
        byte[] blob = TestBytes.scriptBlob("@Script/Table_Test.lua", utf8("body"));

        assertThatThrownBy(() -> unavailable().decodeToText(blob))
            .isInstanceOf(RuntimeUnavailableException.class)
            .hasMessageContaining("unluac jar missing");
    }

    @Test
    void decodeToText_compileFaults_skipsSynthesisAndRaisesFault() {
        stub.compileError = new RuntimeFaultException("luaRO_loadbufferx failed with code 3: bad");
        byte[] blob = TestBytes.scriptBlob("@Script/Table_Test.lua", utf8("body"));

        assertThatThrownBy(() -> decoder(stub).decodeToText(blob))
            .isInstanceOf(RuntimeFaultException.class)
            .hasMessageContaining("code 3");
    }

    @Test
    void decodeToText_compileFaultsButPayloadWrapped_unwraps() {
        stub.compileError = new RuntimeFaultException("bad chunk");

        assertThat(decoder(stub).decodeToText(wrapped(utf8(PLAIN)))).isEqualTo(PLAIN);
    }

    @Test
    void decodeToText_stringInput_isCoercedBeforeDecoding() {
        assertThat(decoder(stub).decodeToText("plain text", null)).isEqualTo("plain text");
    }

    @Test
    void textOrRaw_undecodableMarkerBlob_fallsBackToRawText() {
        byte[] blob = concat(MARKER, utf8("raw text"));

        assertThat(unavailable().textOrRaw(blob, null)).isEqualTo("*raw text");
    }

    @Test
    void textOrRaw_decodableBlob_returnsDecodedText() {
        assertThat(unavailable().textOrRaw(wrapped(utf8(PLAIN)), null)).isEqualTo(PLAIN);
        assertThat(unavailable().textOrRaw("abc", null)).isEqualTo("abc");
    }

    @Test
    void records_wrappedScript_parsesEveryRecord() {
        String source = "Table_Item = {\n  [1] = {id=1, Name='Apple'},\n  [2] = {id=2, Name='Potion'}\n}\n";

        List<LuaValue> records = unavailable().records(wrapped(utf8(source)), null);

        assertThat(records).hasSize(2);
        assertThat(records.get(1).get("Name").asString()).isEqualTo("Potion");
    }

    @Test
    void snapshot_nativeRuntime_isUsedFirst() {
        stub.extractResult = LuaLiteralParser.parse("{{id=1}}");

        TableSnapshot snapshot = decoder(stub).snapshot(utf8("*chunk"), "Table_Test");

        assertThat(snapshot.strategy()).isEqualTo(TableSnapshot.Strategy.NATIVE_RUNTIME);
        assertThat(snapshot.name()).isEqualTo("Table_Test");
        assertThat(snapshot.value().get(1).get("id").asLong()).isEqualTo(1L);
        assertThat(stub.compileCalls).isZero();
    }

    @Test
    void snapshot_runtimeFault_propagatesWithoutFallback() {
        stub.extractError = new RuntimeFaultException("table 'Nope' not found");

        assertThatThrownBy(() -> decoder(stub).dumpTable(utf8("*chunk"), "Nope"))
            .isInstanceOf(RuntimeFaultException.class)
            .hasMessage("table 'Nope' not found");
        assertThat(stub.compileCalls).isZero();
    }

    @Test
    void snapshot_runtimeUnavailable_fallsBackToInterpreter() {
        byte[] blob = TestBytes.scriptBlob("@Script/Table_Test.lua", utf8("body"));

        assertThatThrownBy(() -> unavailable().snapshot(blob, "Table_Test"))
            .isInstanceOf(RuntimeUnavailableException.class)
            .hasMessageContaining("Lua interpreter not found");
    }

    @Test
    void snapshot_runtimeUnavailableAndBlobNotSynthesizable_raisesFormatError() {
        assertThatThrownBy(() -> unavailable().snapshot(concat(MARKER, utf8("short")), "T"))
            .isInstanceOf(UnsupportedBlobException.class);
    }

    @Test
    void constructor_missingCollaborator_isRejected() {
        assertThatThrownBy(() -> new LuaDecoder(config, null, new ExternalTools(config)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
