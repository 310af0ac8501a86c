package com.fixcraft.romclua.cli;

import com.fixcraft.romclua.Constants;
import com.fixcraft.romclua.LuaDecoder;
import com.fixcraft.romclua.LuaJson;
import com.fixcraft.romclua.LuacPayload;
import com.fixcraft.romclua.RomPayload;
import com.fixcraft.romclua.RuntimeLog;
import com.fixcraft.romclua.TableSnapshot;

import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

public final class RomcLuaCli {
    private static final class GlobalOptions {
        final boolean verbose;
        final boolean noLog;
        final String[] args;

        GlobalOptions(boolean verbose, boolean noLog, String[] args) {
            this.verbose = verbose;
            this.noLog = noLog;
            this.args = args;
        }
    }

    private static final class IoArgs {
        File input;
        File companion;
        File output;
        List<String> rest = new ArrayList<String>();
    }

    private RomcLuaCli() {}

    public static void main(String[] args) {
        int code = run(args, System.out);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out) {
        if (args == null || args.length == 0) {
            usage(out);
            return 2;
        }
        GlobalOptions globals = parseGlobalOptions(args);
        RuntimeLog.configureFromCli(globals.verbose, globals.noLog);
        args = globals.args;
        if (args.length == 0) {
            usage(out);
            return 2;
        }

        String command = args[0];
        try {
            switch (command) {
                case "decode": {
                    IoArgs io = parseIoArgs(args, 1);
                    if (!io.rest.isEmpty()) {
                        throw new IllegalArgumentException("Too many arguments for decode");
                    }
                    byte[] companion = io.companion == null ? null : readAllBytes(io.companion);
                    String text = LuaDecoder.create().decodeToText(readAllBytes(io.input), companion);
                    emit(out, io.output, text);
                    return 0;
                }
                case "dump-table": {
                    IoArgs io = parseIoArgs(args, 1);
                    if (io.rest.size() != 1) {
                        usage(out);
                        return 2;
                    }
                    TableSnapshot snapshot = LuaDecoder.create().snapshot(readAllBytes(io.input), io.rest.get(0));
                    RuntimeLog.reason("table " + snapshot.name() + " read via " + snapshot.strategy());
                    emit(out, io.output, LuaJson.toPrettyJson(snapshot.value()) + "\n");
                    return 0;
                }
                case "records": {
                    IoArgs io = parseIoArgs(args, 1);
                    if (!io.rest.isEmpty()) {
                        throw new IllegalArgumentException("Too many arguments for records");
                    }
                    byte[] companion = io.companion == null ? null : readAllBytes(io.companion);
                    String json = LuaJson.toPrettyJson(LuaDecoder.create().records(readAllBytes(io.input), companion));
                    emit(out, io.output, json + "\n");
                    return 0;
                }
                case "rom-decrypt": {
                    if (args.length < 3) {
                        usage(out);
                        return 2;
                    }
                    byte[] plain = RomPayload.unwrap(readAllBytes(new File(args[1])));
                    if (plain == null) {
                        throw new IllegalArgumentException("No ROM payload signature in " + args[1]);
                    }
                    writeAllBytes(new File(args[2]), plain);
                    return 0;
                }
                case "rom-encrypt": {
                    if (args.length < 3) {
                        usage(out);
                        return 2;
                    }
                    writeAllBytes(new File(args[2]), RomPayload.wrap(readAllBytes(new File(args[1])), null));
                    return 0;
                }
                case "luac": {
                    if (args.length < 3) {
                        usage(out);
                        return 2;
                    }
                    byte[] blob = readAllBytes(new File(args[1]));
                    RuntimeLog.reason("source path: " + LuacPayload.sourcePath(blob));
                    writeAllBytes(new File(args[2]), LuacPayload.synthesize(blob));
                    return 0;
                }
                default:
                    usage(out);
                    return 2;
            }
        } catch (RuntimeException exc) {
            System.err.println("Error: " + exc.getMessage());
            return 1;
        }
    }

    private static void usage(PrintStream out) {
        out.println("romc-lua CLI " + Constants.ENGINE_VERSION);
        out.println("  [global] --verbose|-v --no-log");
        out.println("  decode <in> [--companion <file>] [--out <file>]");
        out.println("  dump-table <in> <table> [--out <file>]");
        out.println("  records <in> [--companion <file>] [--out <file>]");
        out.println("  rom-decrypt <in> <out>");
        out.println("  rom-encrypt <in> <out>");
        out.println("  luac <in> <out>");
    }

    private static GlobalOptions parseGlobalOptions(String[] args) {
        boolean verbose = false;
        boolean noLog = false;
        List<String> cleaned = new ArrayList<String>(args.length);
        for (String arg : args) {
            if ("--verbose".equals(arg) || "-v".equals(arg)) {
                verbose = true;
                continue;
            }
            if ("--no-log".equals(arg)) {
                noLog = true;
                continue;
            }
            cleaned.add(arg);
        }
        return new GlobalOptions(verbose, noLog, cleaned.toArray(new String[0]));
    }

    private static IoArgs parseIoArgs(String[] args, int startIndex) {
        IoArgs parsed = new IoArgs();
        List<String> positional = new ArrayList<String>();
        for (int i = startIndex; i < args.length; i++) {
            String arg = args[i];
            if ("-o".equalsIgnoreCase(arg) || "--out".equalsIgnoreCase(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing output value");
                }
                parsed.output = new File(args[++i]);
                continue;
            }
            if ("--companion".equalsIgnoreCase(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing companion value");
                }
                parsed.companion = new File(args[++i]);
                continue;
            }
            positional.add(arg);
        }
        if (positional.isEmpty()) {
            throw new IllegalArgumentException("Missing input path");
        }
        parsed.input = new File(positional.get(0));
        parsed.rest.addAll(positional.subList(1, positional.size()));
        return parsed;
    }

    private static void emit(PrintStream out, File output, String text) {
        if (output == null) {
            out.print(text);
            out.flush();
            return;
        }
        writeAllBytes(output, text.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] readAllBytes(File file) {
        try {
            return Files.readAllBytes(file.toPath());
        } catch (java.io.IOException exc) {
            throw new RuntimeException("Failed to read file: " + file.getPath(), exc);
        }
    }

    private static void writeAllBytes(File file, byte[] data) {
        try {
            Files.write(file.toPath(), data);
        } catch (java.io.IOException exc) {
            throw new RuntimeException("Failed to write file: " + file.getPath(), exc);
        }
    }
}
