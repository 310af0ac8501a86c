package com.fixcraft.romclua;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Locations of the native bridge library and the external tools, plus the
 * unwrap nesting bound. Each setting resolves from an explicit builder
 * value, then a system property, then an environment variable, then a
 * default.
 */
public final class DecoderConfig {
    public static final String NATIVE_ENV = "ROMC_NATIVE";
    public static final String SLUA_LIB_ENV = "ROMC_SLUA_LIB";
    public static final String LEGACY_SLUA_LIB_ENV = "SLUA_DLL";
    public static final String SLUA_NAME_ENV = "ROMC_SLUA_NAME";
    public static final String UNLUAC_JAR_ENV = "ROMC_UNLUAC_JAR";
    public static final String JAVA_ENV = "ROMC_JAVA";
    public static final String LUA_ENV = "ROMC_LUA_PATH";
    public static final String MAX_UNWRAP_ENV = "ROMC_MAX_UNWRAP_DEPTH";

    private final boolean nativeEnabled;
    private final Path sluaLibrary;
    private final String sluaLibraryName;
    private final Path unluacJar;
    private final Path javaExecutable;
    private final List<String> decompilerCommand;
    private final String luaExecutable;
    private final int maxUnwrapDepth;

    private DecoderConfig(Builder builder) {
        this.nativeEnabled = builder.nativeEnabled;
        this.sluaLibrary = builder.sluaLibrary;
        this.sluaLibraryName = builder.sluaLibraryName;
        this.unluacJar = builder.unluacJar;
        this.javaExecutable = builder.javaExecutable;
        this.decompilerCommand = builder.decompilerCommand == null
            ? null
            : Collections.unmodifiableList(new ArrayList<String>(builder.decompilerCommand));
        this.luaExecutable = builder.luaExecutable;
        this.maxUnwrapDepth = builder.maxUnwrapDepth;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DecoderConfig defaults() {
        return builder().build();
    }

    public static DecoderConfig fromEnvironment() {
        return fromEnvironment(System.getenv(), System.getProperties());
    }

    static DecoderConfig fromEnvironment(Map<String, String> env, Properties props) {
        Builder builder = builder();
        String nativeFlag = pick(props, "romc.native", env, NATIVE_ENV);
        if (RuntimeLog.falsy(nativeFlag)) {
            builder.nativeEnabled(false);
        }
        String lib = pick(props, "romc.slua.lib", env, SLUA_LIB_ENV);
        if (lib == null) {
            lib = blankToNull(env.get(LEGACY_SLUA_LIB_ENV));
        }
        if (lib != null) {
            builder.sluaLibrary(Paths.get(lib));
        }
        String name = pick(props, "romc.slua.name", env, SLUA_NAME_ENV);
        if (name != null) {
            builder.sluaLibraryName(name);
        }
        String jar = pick(props, "romc.unluac.jar", env, UNLUAC_JAR_ENV);
        if (jar != null) {
            builder.unluacJar(Paths.get(jar));
        }
        String java = pick(props, "romc.java", env, JAVA_ENV);
        if (java != null) {
            builder.javaExecutable(Paths.get(java));
        }
        String lua = pick(props, "romc.lua", env, LUA_ENV);
        if (lua != null) {
            builder.luaExecutable(lua);
        }
        String depth = pick(props, "romc.maxUnwrapDepth", env, MAX_UNWRAP_ENV);
        if (depth != null) {
            try {
                int parsed = Integer.parseInt(depth);
                if (parsed >= 1) {
                    builder.maxUnwrapDepth(parsed);
                } else {
                    RuntimeLog.warn("Ignoring " + MAX_UNWRAP_ENV + "=" + depth + " (must be >= 1)");
                }
            } catch (NumberFormatException exc) {
                RuntimeLog.warn("Ignoring " + MAX_UNWRAP_ENV + "=" + depth + " (not a number)");
            }
        }
        return builder.build();
    }

    private static String pick(Properties props, String property, Map<String, String> env, String envName) {
        String value = blankToNull(props.getProperty(property));
        if (value != null) {
            return value;
        }
        return blankToNull(env.get(envName));
    }

    private static String blankToNull(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public boolean nativeEnabled() {
        return nativeEnabled;
    }

    public Path sluaLibrary() {
        return sluaLibrary;
    }

    public String sluaLibraryName() {
        return sluaLibraryName;
    }

    public Path unluacJar() {
        return unluacJar;
    }

    public Path javaExecutable() {
        return javaExecutable;
    }

    public List<String> decompilerCommand() {
        return decompilerCommand;
    }

    public String luaExecutable() {
        return luaExecutable;
    }

    public int maxUnwrapDepth() {
        return maxUnwrapDepth;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.nativeEnabled = nativeEnabled;
        builder.sluaLibrary = sluaLibrary;
        builder.sluaLibraryName = sluaLibraryName;
        builder.unluacJar = unluacJar;
        builder.javaExecutable = javaExecutable;
        builder.decompilerCommand = decompilerCommand;
        builder.luaExecutable = luaExecutable;
        builder.maxUnwrapDepth = maxUnwrapDepth;
        return builder;
    }

    @Override
    public String toString() {
        return "DecoderConfig{native=" + nativeEnabled
            + ", sluaLibrary=" + (sluaLibrary != null ? sluaLibrary : sluaLibraryName)
            + ", decompiler=" + (decompilerCommand != null ? decompilerCommand : unluacJar)
            + ", lua=" + luaExecutable
            + ", maxUnwrapDepth=" + maxUnwrapDepth + "}";
    }

    public static final class Builder {
        private boolean nativeEnabled = true;
        private Path sluaLibrary = null;
        private String sluaLibraryName = Constants.DEFAULT_SLUA_LIBRARY;
        private Path unluacJar = Paths.get(Constants.DEFAULT_UNLUAC_JAR);
        private Path javaExecutable = Paths.get(System.getProperty("java.home"), "bin", javaBinaryName());
        private List<String> decompilerCommand = null;
        private String luaExecutable = Constants.DEFAULT_LUA_EXECUTABLE;
        private int maxUnwrapDepth = Constants.DEFAULT_MAX_UNWRAP_DEPTH;

        private Builder() {}

        public Builder nativeEnabled(boolean enabled) {
            this.nativeEnabled = enabled;
            return this;
        }

        public Builder sluaLibrary(Path library) {
            this.sluaLibrary = library;
            return this;
        }

        public Builder sluaLibraryName(String name) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("library name required");
            }
            this.sluaLibraryName = name.trim();
            return this;
        }

        public Builder unluacJar(Path jar) {
            if (jar == null) {
                throw new IllegalArgumentException("jar == null");
            }
            this.unluacJar = jar;
            return this;
        }

        public Builder javaExecutable(Path java) {
            if (java == null) {
                throw new IllegalArgumentException("java == null");
            }
            this.javaExecutable = java;
            return this;
        }

        public Builder decompilerCommand(List<String> command) {
            if (command != null && command.isEmpty()) {
                throw new IllegalArgumentException("decompiler command must not be empty");
            }
            this.decompilerCommand = command;
            return this;
        }

        public Builder luaExecutable(String lua) {
            if (lua == null || lua.trim().isEmpty()) {
                throw new IllegalArgumentException("lua executable required");
            }
            this.luaExecutable = lua.trim();
            return this;
        }

        public Builder maxUnwrapDepth(int depth) {
            if (depth < 1) {
                throw new IllegalArgumentException("maxUnwrapDepth must be >= 1");
            }
            this.maxUnwrapDepth = depth;
            return this;
        }

        public DecoderConfig build() {
            return new DecoderConfig(this);
        }
    }

    private static String javaBinaryName() {
        return File.separatorChar == '\\' ? "java.exe" : "java";
    }
}
