package com.fixcraft.romclua;

import java.util.List;

/**
 * Turns script blobs from text assets into source text or table snapshots.
 * <p>
 * Text decoding tries, in order: the native runtime compile plus the
 * decompiler, header synthesis plus the decompiler, then the ROM payload
 * wrapper on the blob and on its companion. Table dumps prefer the native
 * runtime and fall back to the external interpreter only when the runtime is
 * unavailable.
 */
public final class LuaDecoder {
    private final DecoderConfig config;
    private final RuntimeBridge bridge;
    private final ExternalTools tools;

    public LuaDecoder(DecoderConfig config, RuntimeBridge bridge, ExternalTools tools) {
        if (config == null || bridge == null || tools == null) {
            throw new IllegalArgumentException("config, bridge and tools required");
        }
        this.config = config;
        this.bridge = bridge;
        this.tools = tools;
    }

    public static LuaDecoder create() {
        return create(DecoderConfig.fromEnvironment());
    }

    public static LuaDecoder create(DecoderConfig config) {
        return new LuaDecoder(config, RuntimeBridges.resolve(config), new ExternalTools(config));
    }

    public DecoderConfig config() {
        return config;
    }

    public String decodeToText(byte[] blob) {
        return decodeToText(blob, null);
    }

    public String decodeToText(byte[] blob, byte[] companion) {
        return decodeToText(blob, companion, 0);
    }

    public String decodeToText(String script, byte[] companion) {
        if (script == null) {
            throw new IllegalArgumentException("script == null");
        }
        return decodeToText(ScriptBytes.coerce(script), companion, 0);
    }

    private String decodeToText(byte[] blob, byte[] companion, int depth) {
        if (blob == null || blob.length == 0) {
            return "";
        }
        if (!ScriptBytes.startsWithMarker(blob)) {
            return ScriptBytes.lossyUtf8(blob);
        }
        RuntimeException lastError = null;

        byte[] chunk = null;
        try {
            chunk = bridge.compile(blob);
        } catch (RuntimeUnavailableException exc) {
            RuntimeLog.fallback("runtime compile", exc.getMessage(), "header synthesis");
            try {
                chunk = LuacPayload.synthesize(blob);
            } catch (UnsupportedBlobException synthError) {
                RuntimeLog.fallback("header synthesis", synthError.getMessage(), "ROM payload");
                lastError = exc;
            }
        } catch (RuntimeFaultException exc) {
            RuntimeLog.fallback("runtime compile", exc.getMessage(), "ROM payload");
            lastError = exc;
        }
        if (chunk != null && chunk.length > 0) {
            try {
                return tools.decompile(chunk);
            } catch (RuntimeUnavailableException exc) {
                RuntimeLog.fallback("decompiler", exc.getMessage(), "ROM payload");
                lastError = exc;
            } catch (ToolFailureException exc) {
                RuntimeLog.fallback("decompiler", exc.getMessage(), "ROM payload");
                lastError = exc;
            }
        }

        if (depth >= config.maxUnwrapDepth()) {
            if (RomPayload.isWrapped(blob)) {
                throw new UnsupportedBlobException(
                    "ROM payload still wrapped after " + depth + " unwrap passes");
            }
        } else {
            byte[][] candidates = new byte[][] {blob, companion};
            for (byte[] candidate : candidates) {
                if (candidate == null || candidate.length == 0) {
                    continue;
                }
                byte[] decrypted = RomPayload.unwrap(candidate);
                if (decrypted == null || decrypted.length == 0) {
                    continue;
                }
                if (ScriptBytes.startsWithMarker(decrypted)) {
                    RuntimeLog.reason("ROM payload unwrapped to another script chunk, decoding it");
                    return decodeToText(decrypted, null, depth + 1);
                }
                RuntimeLog.reason("ROM payload unwrapped to plain text");
                return ScriptBytes.lossyUtf8(decrypted);
            }
        }

        if (lastError != null) {
            throw lastError;
        }
        throw new UnsupportedBlobException("Unsupported Lua blob format");
    }

    public String textOrRaw(byte[] raw, byte[] companion) {
        if (raw == null || raw.length == 0) {
            return "";
        }
        if (ScriptBytes.startsWithMarker(raw)) {
            try {
                return decodeToText(raw, companion);
            } catch (RuntimeException exc) {
                RuntimeLog.reason("decode failed, using raw text: " + exc.getMessage());
            }
        }
        return ScriptBytes.lossyUtf8(raw);
    }

    public String textOrRaw(String script, byte[] companion) {
        if (script == null) {
            return "";
        }
        return textOrRaw(ScriptBytes.coerce(script), companion);
    }

    public List<LuaValue> records(byte[] raw, byte[] companion) {
        return LuaTableScanner.parseRecords(textOrRaw(raw, companion));
    }

    public LuaValue dumpTable(byte[] blob, String tableName) {
        return snapshot(blob, tableName).value();
    }

    public TableSnapshot snapshot(byte[] blob, String tableName) {
        if (blob == null) {
            throw new IllegalArgumentException("blob == null");
        }
        if (tableName == null || tableName.isEmpty()) {
            throw new IllegalArgumentException("table name required");
        }
        try {
            LuaValue value = bridge.runAndExtract(blob, tableName);
            return new TableSnapshot(tableName, value, TableSnapshot.Strategy.NATIVE_RUNTIME);
        } catch (RuntimeUnavailableException exc) {
            RuntimeLog.fallback("native table dump", exc.getMessage(), "external interpreter");
        }
        if (blob.length == 0) {
            return new TableSnapshot(tableName, LuaValue.emptyMap(), TableSnapshot.Strategy.EXTERNAL_INTERPRETER);
        }
        byte[] chunk;
        try {
            chunk = bridge.compile(blob);
        } catch (RuntimeUnavailableException exc) {
            chunk = LuacPayload.synthesize(blob);
        }
        LuaValue value = tools.dumpTable(chunk, tableName);
        return new TableSnapshot(tableName, value, TableSnapshot.Strategy.EXTERNAL_INTERPRETER);
    }
}
