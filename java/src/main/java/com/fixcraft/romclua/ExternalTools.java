package com.fixcraft.romclua;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ExternalTools {
    static final int DUMP_TABLE_MISSING = 3;

    private static volatile String dumpScript = null;

    private final DecoderConfig config;
    private volatile List<String> decompilerCache = null;
    private volatile Path luaCache = null;

    public ExternalTools(DecoderConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config == null");
        }
        this.config = config;
    }

    public String decompile(byte[] chunk) {
        if (chunk == null || chunk.length == 0) {
            throw new IllegalArgumentException("chunk required");
        }
        List<String> prefix = resolveDecompiler();
        File tempDir = createTempDir();
        try {
            File chunkFile = new File(tempDir, "chunk.luac");
            writeFileBytes(chunkFile, chunk);
            List<String> cmd = new ArrayList<String>(prefix);
            cmd.add(chunkFile.getAbsolutePath());
            ToolResult result = runTool("decompiler", cmd, tempDir);
            if (result.exitCode != 0) {
                throw new ToolFailureException("decompiler", result.exitCode, result.stderr);
            }
            return result.stdout;
        } finally {
            deleteRecursive(tempDir);
        }
    }

    public LuaValue dumpTable(byte[] chunk, String tableName) {
        if (chunk == null || chunk.length == 0) {
            throw new IllegalArgumentException("chunk required");
        }
        if (tableName == null || tableName.isEmpty()) {
            throw new IllegalArgumentException("table name required");
        }
        Path lua = resolveLua();
        File tempDir = createTempDir();
        try {
            File chunkFile = new File(tempDir, "chunk.luac");
            File scriptFile = new File(tempDir, "dump.lua");
            writeFileBytes(chunkFile, chunk);
            writeFileBytes(scriptFile, dumpScript().getBytes(StandardCharsets.UTF_8));
            List<String> cmd = new ArrayList<String>();
            cmd.add(lua.toString());
            cmd.add(scriptFile.getAbsolutePath());
            cmd.add(chunkFile.getAbsolutePath());
            cmd.add(tableName);
            ToolResult result = runTool("lua", cmd, tempDir);
            if (result.exitCode == DUMP_TABLE_MISSING) {
                throw new RuntimeFaultException("table '" + tableName + "' not found");
            }
            if (result.exitCode != 0) {
                throw new ToolFailureException("lua", result.exitCode, result.stderr);
            }
            return LuaJson.parse(result.stdout.trim());
        } finally {
            deleteRecursive(tempDir);
        }
    }

    public void reset() {
        decompilerCache = null;
        luaCache = null;
    }

    List<String> resolveDecompiler() {
        List<String> cached = decompilerCache;
        if (cached != null) {
            return cached;
        }
        List<String> command;
        if (config.decompilerCommand() != null) {
            command = config.decompilerCommand();
        } else {
            Path jar = config.unluacJar();
            if (!Files.isRegularFile(jar)) {
                throw new RuntimeUnavailableException(
                    "unluac jar missing at " + jar.toAbsolutePath()
                        + ". Build it from https://github.com/viruscamp/unluac and set " + DecoderConfig.UNLUAC_JAR_ENV);
            }
            List<String> built = new ArrayList<String>();
            built.add(config.javaExecutable().toString());
            built.add("-jar");
            built.add(jar.toAbsolutePath().toString());
            command = Collections.unmodifiableList(built);
        }
        decompilerCache = command;
        return command;
    }

    Path resolveLua() {
        Path cached = luaCache;
        if (cached != null) {
            return cached;
        }
        Path found = locateExecutable(config.luaExecutable());
        if (found == null) {
            throw new RuntimeUnavailableException(
                "Lua interpreter not found at " + config.luaExecutable()
                    + ". Build Lua 5.3.x (32-bit) and set " + DecoderConfig.LUA_ENV);
        }
        luaCache = found;
        return found;
    }

    static Path locateExecutable(String nameOrPath) {
        Path direct = Paths.get(nameOrPath);
        if (direct.getNameCount() > 1 || direct.isAbsolute()) {
            return Files.isRegularFile(direct) ? direct.toAbsolutePath() : null;
        }
        if (Files.isRegularFile(direct)) {
            return direct.toAbsolutePath();
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return null;
        }
        boolean windows = File.separatorChar == '\\';
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Paths.get(dir, nameOrPath);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
            if (windows) {
                Path exe = Paths.get(dir, nameOrPath + ".exe");
                if (Files.isRegularFile(exe)) {
                    return exe;
                }
            }
        }
        return null;
    }

    static String dumpScript() {
        String cached = dumpScript;
        if (cached != null) {
            return cached;
        }
        try (InputStream in = ExternalTools.class.getResourceAsStream(Constants.DUMP_SCRIPT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("missing resource " + Constants.DUMP_SCRIPT_RESOURCE);
            }
            dumpScript = new String(readAll(in), StandardCharsets.UTF_8);
            return dumpScript;
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to read " + Constants.DUMP_SCRIPT_RESOURCE, exc);
        }
    }

    private static ToolResult runTool(String tool, List<String> cmd, File workDir) {
        File errFile = new File(workDir, tool + ".stderr");
        ProcessBuilder builder = new ProcessBuilder(cmd);
        builder.directory(workDir);
        builder.redirectError(errFile);
        Process process;
        try {
            process = builder.start();
        } catch (IOException exc) {
            throw new RuntimeUnavailableException(tool + " could not be started: " + exc.getMessage(), exc);
        }
        try {
            process.getOutputStream().close();
            byte[] stdout;
            try (InputStream in = process.getInputStream()) {
                stdout = readAll(in);
            }
            int code = process.waitFor();
            String stderr = errFile.isFile()
                ? new String(Files.readAllBytes(errFile.toPath()), StandardCharsets.UTF_8).trim()
                : "";
            return new ToolResult(code, new String(stdout, StandardCharsets.UTF_8), stderr);
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IllegalStateException(tool + " interrupted", exc);
        } catch (IOException exc) {
            process.destroyForcibly();
            throw new IllegalStateException(tool + " output could not be read", exc);
        }
    }

    private static byte[] readAll(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        int read;
        while ((read = in.read(buf)) != -1) {
            out.write(buf, 0, read);
        }
        return out.toByteArray();
    }

    private static File createTempDir() {
        try {
            return Files.createTempDirectory("romc-lua-").toFile();
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to create temp dir", exc);
        }
    }

    private static void writeFileBytes(File file, byte[] data) {
        try {
            Files.write(file.toPath(), data);
        } catch (IOException exc) {
            throw new IllegalStateException("Failed to write " + file.getName(), exc);
        }
    }

    private static void deleteRecursive(File file) {
        if (file == null || !file.exists()) {
            return;
        }
        if (file.isDirectory()) {
            File[] children = file.listFiles();
            if (children != null) {
                for (File child : children) {
                    deleteRecursive(child);
                }
            }
        }
        if (!file.delete()) {
            RuntimeLog.reason("could not delete temp file " + file);
        }
    }

    private static final class ToolResult {
        final int exitCode;
        final String stdout;
        final String stderr;

        ToolResult(int exitCode, String stdout, String stderr) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
        }
    }
}
