package com.fixcraft.romclua;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class LuaJson {
    private static final Gson COMPACT = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
    private static final Gson PRETTY = new GsonBuilder().serializeNulls().disableHtmlEscaping()
        .setPrettyPrinting().create();

    private LuaJson() {}

    public static String toJson(LuaValue value) {
        return COMPACT.toJson(toElement(value));
    }

    public static String toPrettyJson(LuaValue value) {
        return PRETTY.toJson(toElement(value));
    }

    public static String toPrettyJson(List<LuaValue> values) {
        JsonArray array = new JsonArray();
        for (LuaValue value : values) {
            array.add(toElement(value));
        }
        return PRETTY.toJson(array);
    }

    public static LuaValue parse(String json) {
        if (json == null || json.trim().isEmpty()) {
            return LuaValue.emptyMap();
        }
        try {
            return fromElement(JsonParser.parseString(json));
        } catch (JsonParseException exc) {
            throw new UnsupportedBlobException("Malformed table dump: " + exc.getMessage(), exc);
        }
    }

    public static JsonElement toElement(LuaValue value) {
        switch (value.type()) {
            case NIL:
                return JsonNull.INSTANCE;
            case BOOLEAN:
                return new JsonPrimitive(Boolean.valueOf(value.asBoolean()));
            case INTEGER:
                return new JsonPrimitive(Long.valueOf(value.asLong()));
            case NUMBER: {
                double number = value.asDouble();
                if (Double.isNaN(number) || Double.isInfinite(number)) {
                    return JsonNull.INSTANCE;
                }
                return new JsonPrimitive(Double.valueOf(number));
            }
            case STRING:
                return new JsonPrimitive(value.asString());
            case ARRAY: {
                JsonArray array = new JsonArray();
                for (LuaValue item : value.asList()) {
                    array.add(toElement(item));
                }
                return array;
            }
            case MAP: {
                JsonObject object = new JsonObject();
                for (Map.Entry<String, LuaValue> entry : value.asMap().entrySet()) {
                    object.add(entry.getKey(), toElement(entry.getValue()));
                }
                return object;
            }
            default:
                throw new IllegalStateException("unknown type " + value.type());
        }
    }

    public static LuaValue fromElement(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return LuaValue.NIL;
        }
        if (element.isJsonArray()) {
            List<LuaValue> items = new ArrayList<LuaValue>();
            for (JsonElement item : element.getAsJsonArray()) {
                items.add(fromElement(item));
            }
            return LuaValue.array(items);
        }
        if (element.isJsonObject()) {
            Map<String, LuaValue> entries = new LinkedHashMap<String, LuaValue>();
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                entries.put(entry.getKey(), fromElement(entry.getValue()));
            }
            return LuaValue.map(entries);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return LuaValue.valueOf(primitive.getAsBoolean());
        }
        if (primitive.isNumber()) {
            String text = primitive.getAsNumber().toString();
            if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
                try {
                    return LuaValue.valueOf(Long.parseLong(text));
                } catch (NumberFormatException exc) {
                    return LuaValue.valueOf(primitive.getAsDouble());
                }
            }
            return LuaValue.valueOf(primitive.getAsDouble());
        }
        return LuaValue.valueOf(primitive.getAsString());
    }
}
