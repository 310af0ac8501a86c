package com.fixcraft.romclua;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class LuaValue {
    public enum Type {
        NIL,
        BOOLEAN,
        INTEGER,
        NUMBER,
        STRING,
        ARRAY,
        MAP
    }

    public static final LuaValue NIL = new LuaValue(Type.NIL, null);
    public static final LuaValue TRUE = new LuaValue(Type.BOOLEAN, Boolean.TRUE);
    public static final LuaValue FALSE = new LuaValue(Type.BOOLEAN, Boolean.FALSE);

    private final Type type;
    private final Object value;

    private LuaValue(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static LuaValue valueOf(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static LuaValue valueOf(long value) {
        return new LuaValue(Type.INTEGER, Long.valueOf(value));
    }

    public static LuaValue valueOf(double value) {
        return new LuaValue(Type.NUMBER, Double.valueOf(value));
    }

    public static LuaValue valueOf(String value) {
        if (value == null) {
            return NIL;
        }
        return new LuaValue(Type.STRING, value);
    }

    public static LuaValue array(List<LuaValue> items) {
        List<LuaValue> copy = new ArrayList<LuaValue>(items.size());
        for (LuaValue item : items) {
            copy.add(item == null ? NIL : item);
        }
        return new LuaValue(Type.ARRAY, Collections.unmodifiableList(copy));
    }

    public static LuaValue map(Map<String, LuaValue> entries) {
        Map<String, LuaValue> copy = new LinkedHashMap<String, LuaValue>();
        for (Map.Entry<String, LuaValue> entry : entries.entrySet()) {
            copy.put(entry.getKey(), entry.getValue() == null ? NIL : entry.getValue());
        }
        return new LuaValue(Type.MAP, Collections.unmodifiableMap(copy));
    }

    public static LuaValue emptyMap() {
        return map(Collections.<String, LuaValue>emptyMap());
    }

    public static LuaValue table(Map<Object, LuaValue> entries) {
        Map<Long, LuaValue> arrayPart = new LinkedHashMap<Long, LuaValue>();
        Map<String, LuaValue> mapPart = new LinkedHashMap<String, LuaValue>();
        boolean arrayCandidate = true;
        long maxIndex = 0;
        for (Map.Entry<Object, LuaValue> entry : entries.entrySet()) {
            Object key = entry.getKey();
            if (key instanceof Long && ((Long) key).longValue() >= 1) {
                long index = ((Long) key).longValue();
                arrayPart.put(Long.valueOf(index), entry.getValue());
                if (index > maxIndex) {
                    maxIndex = index;
                }
            } else {
                arrayCandidate = false;
                mapPart.put(keyString(key), entry.getValue());
            }
        }
        if (arrayCandidate && !arrayPart.isEmpty() && arrayPart.size() == maxIndex) {
            List<LuaValue> items = new ArrayList<LuaValue>(arrayPart.size());
            for (long i = 1; i <= maxIndex; i++) {
                items.add(arrayPart.get(Long.valueOf(i)));
            }
            return array(items);
        }
        for (Map.Entry<Long, LuaValue> entry : arrayPart.entrySet()) {
            mapPart.put(entry.getKey().toString(), entry.getValue());
        }
        return map(mapPart);
    }

    public static String keyString(Object key) {
        if (key instanceof Double) {
            return formatNumber(((Double) key).doubleValue());
        }
        return String.valueOf(key);
    }

    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.format(Locale.ROOT, "%.1f", value);
        }
        String text = String.format(Locale.ROOT, "%.14g", value);
        if (text.contains("e")) {
            String mantissa = text.substring(0, text.indexOf('e'));
            String exponent = text.substring(text.indexOf('e'));
            return stripZeros(mantissa) + exponent;
        }
        return stripZeros(text);
    }

    private static String stripZeros(String text) {
        if (!text.contains(".")) {
            return text;
        }
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '0') {
            end--;
        }
        if (end > 0 && text.charAt(end - 1) == '.') {
            end--;
        }
        return text.substring(0, end);
    }

    public Type type() {
        return type;
    }

    public boolean isNil() {
        return type == Type.NIL;
    }

    public boolean isTable() {
        return type == Type.ARRAY || type == Type.MAP;
    }

    public boolean asBoolean() {
        expect(Type.BOOLEAN);
        return ((Boolean) value).booleanValue();
    }

    public long asLong() {
        if (type == Type.NUMBER) {
            return ((Double) value).longValue();
        }
        expect(Type.INTEGER);
        return ((Long) value).longValue();
    }

    public double asDouble() {
        if (type == Type.INTEGER) {
            return ((Long) value).doubleValue();
        }
        expect(Type.NUMBER);
        return ((Double) value).doubleValue();
    }

    public String asString() {
        expect(Type.STRING);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<LuaValue> asList() {
        expect(Type.ARRAY);
        return (List<LuaValue>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, LuaValue> asMap() {
        expect(Type.MAP);
        return (Map<String, LuaValue>) value;
    }

    public LuaValue get(String key) {
        if (type == Type.MAP) {
            LuaValue found = asMap().get(key);
            return found == null ? NIL : found;
        }
        if (type == Type.ARRAY) {
            try {
                return get(Integer.parseInt(key));
            } catch (NumberFormatException exc) {
                return NIL;
            }
        }
        return NIL;
    }

    public LuaValue get(int index) {
        if (type == Type.ARRAY) {
            List<LuaValue> items = asList();
            return index >= 1 && index <= items.size() ? items.get(index - 1) : NIL;
        }
        if (type == Type.MAP) {
            return get(Integer.toString(index));
        }
        return NIL;
    }

    public int size() {
        if (type == Type.ARRAY) {
            return asList().size();
        }
        if (type == Type.MAP) {
            return asMap().size();
        }
        return 0;
    }

    public Object toJava() {
        switch (type) {
            case NIL:
            case BOOLEAN:
            case INTEGER:
            case NUMBER:
            case STRING:
                return value;
            case ARRAY: {
                List<Object> out = new ArrayList<Object>(size());
                for (LuaValue item : asList()) {
                    out.add(item.toJava());
                }
                return out;
            }
            case MAP: {
                Map<String, Object> out = new LinkedHashMap<String, Object>();
                for (Map.Entry<String, LuaValue> entry : asMap().entrySet()) {
                    out.put(entry.getKey(), entry.getValue().toJava());
                }
                return out;
            }
            default:
                throw new IllegalStateException("unknown type " + type);
        }
    }

    private void expect(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("expected " + expected + " but was " + type);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LuaValue)) {
            return false;
        }
        LuaValue that = (LuaValue) other;
        if (type != that.type) {
            return false;
        }
        return value == null ? that.value == null : value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + (value == null ? 0 : value.hashCode());
    }

    @Override
    public String toString() {
        return LuaJson.toJson(this);
    }
}
