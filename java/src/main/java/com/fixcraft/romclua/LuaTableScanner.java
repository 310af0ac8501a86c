package com.fixcraft.romclua;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls record-like table constructors out of decompiled source text.
 * <p>
 * A record is anchored on the literal text {@code id=}: the nearest unmatched
 * {@code {} to its left opens the record unless that brace is itself assigned
 * ({@code ={}) or is the first entry of an assigned table ({@code ={{}).
 * The block is then consumed by a small state machine that keeps brace depth
 * outside single-quoted strings.
 */
public final class LuaTableScanner {
    private static final String ANCHOR = "id=";

    private enum State {
        NORMAL,
        IN_STRING,
        ESCAPED
    }

    private LuaTableScanner() {}

    public static List<String> scan(String text) {
        List<String> out = new ArrayList<String>();
        if (text == null || text.isEmpty()) {
            return out;
        }
        int pos = 0;
        while (true) {
            int idx = text.indexOf(ANCHOR, pos);
            if (idx < 0) {
                break;
            }
            int start = openingBrace(text, idx);
            if (start < 0 || assigned(text, start)) {
                pos = idx + ANCHOR.length();
                continue;
            }
            int end = consumeBlock(text, start);
            if (end < 0) {
                pos = idx + ANCHOR.length();
                continue;
            }
            out.add(text.substring(start, end));
            pos = end;
        }
        return out;
    }

    public static List<LuaValue> parseRecords(String text) {
        List<LuaValue> records = new ArrayList<LuaValue>();
        for (String snippet : scan(text)) {
            try {
                records.add(LuaLiteralParser.parse(snippet));
            } catch (UnsupportedBlobException exc) {
                RuntimeLog.reason("skipping record: " + exc.getMessage());
            }
        }
        return records;
    }

    // nearest '{' left of idx that is not closed before idx
    static int openingBrace(String text, int idx) {
        int depth = 0;
        for (int i = idx - 1; i >= 0; i--) {
            char ch = text.charAt(i);
            if (ch == '}') {
                depth++;
            } else if (ch == '{') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    private static boolean assigned(String text, int start) {
        if (start == 0) {
            return false;
        }
        char prev = text.charAt(start - 1);
        if (prev == '=') {
            return true;
        }
        return prev == '{' && start > 1 && text.charAt(start - 2) == '=';
    }

    static int consumeBlock(String text, int start) {
        State state = State.NORMAL;
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (state) {
                case NORMAL:
                    if (ch == '\'') {
                        state = State.IN_STRING;
                    } else if (ch == '{') {
                        depth++;
                    } else if (ch == '}') {
                        depth--;
                        if (depth == 0) {
                            return i + 1;
                        }
                    }
                    break;
                case IN_STRING:
                    if (ch == '\\') {
                        state = State.ESCAPED;
                    } else if (ch == '\'') {
                        state = State.NORMAL;
                    }
                    break;
                case ESCAPED:
                    state = State.IN_STRING;
                    break;
                default:
                    throw new IllegalStateException("unknown state " + state);
            }
        }
        return -1;
    }
}
