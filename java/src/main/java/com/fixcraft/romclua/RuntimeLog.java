package com.fixcraft.romclua;

import java.util.Locale;

/**
 * Process-wide stderr log. CLI switches win over the {@code romc.verbose} /
 * {@code romc.noLog} system properties, which win over {@code ROMC_VERBOSE} /
 * {@code ROMC_NO_LOG}.
 */
public final class RuntimeLog {
    static final String VERBOSE_PROPERTY = "romc.verbose";
    static final String NO_LOG_PROPERTY = "romc.noLog";
    static final String VERBOSE_ENV = "ROMC_VERBOSE";
    static final String NO_LOG_ENV = "ROMC_NO_LOG";

    private static volatile Boolean cliVerbose = null;
    private static volatile Boolean cliNoLog = null;

    private RuntimeLog() {}

    public static void configureFromCli(boolean verbose, boolean noLog) {
        cliVerbose = Boolean.valueOf(verbose);
        cliNoLog = Boolean.valueOf(noLog);
    }

    static void resetForTests() {
        cliVerbose = null;
        cliNoLog = null;
    }

    public static boolean isVerbose() {
        return flag(cliVerbose, VERBOSE_PROPERTY, VERBOSE_ENV);
    }

    public static boolean isNoLog() {
        return flag(cliNoLog, NO_LOG_PROPERTY, NO_LOG_ENV);
    }

    public static void warn(String message) {
        if (isNoLog()) {
            return;
        }
        System.err.println("WARN: " + message);
    }

    public static void info(String message) {
        if (isNoLog()) {
            return;
        }
        System.err.println(message);
    }

    public static void reason(String message) {
        if (isNoLog() || !isVerbose()) {
            return;
        }
        System.err.println("   reason: " + message);
    }

    public static void fallback(String failed, String cause, String next) {
        reason(failed + " failed (" + cause + "), trying " + next);
    }

    private static boolean flag(Boolean cliValue, String property, String env) {
        if (cliValue != null) {
            return cliValue.booleanValue();
        }
        String raw = System.getProperty(property);
        if (raw != null) {
            return truthy(raw);
        }
        return truthy(System.getenv(env));
    }

    static boolean truthy(String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.trim().toLowerCase(Locale.US);
        return "1".equals(value) || "true".equals(value) || "yes".equals(value) || "on".equals(value);
    }

    static boolean falsy(String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.trim().toLowerCase(Locale.US);
        return "0".equals(value) || "false".equals(value) || "no".equals(value) || "off".equals(value);
    }
}
