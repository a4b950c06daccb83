package com.ttennebkram.imagelab.params;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.ttennebkram.imagelab.errors.InvalidParameterException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the JSON-encoded parameter object accepted by batch and compare requests.
 */
public final class ParameterJson {

    private ParameterJson() {
    }

    /**
     * Parse a JSON object into a raw parameter map. Blank input means no parameters.
     * Values must be JSON primitives; nested objects and arrays are rejected.
     *
     * @throws InvalidParameterException if the text is not a JSON object of primitives
     */
    public static Map<String, Object> parse(String json) {
        if (json == null || json.trim().isEmpty()) {
            return Collections.emptyMap();
        }

        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new InvalidParameterException("params", "Parameters are not valid JSON: " + e.getMessage(), e);
        }
        if (root.isJsonNull()) {
            return Collections.emptyMap();
        }
        if (!root.isJsonObject()) {
            throw new InvalidParameterException("params", "Parameters must be a JSON object");
        }

        Map<String, Object> raw = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : ((JsonObject) root).entrySet()) {
            JsonElement value = entry.getValue();
            if (value.isJsonNull()) {
                continue;
            }
            if (!value.isJsonPrimitive()) {
                throw new InvalidParameterException(entry.getKey(),
                        "Parameter '" + entry.getKey() + "' must be a number, boolean or string");
            }
            raw.put(entry.getKey(), toJava((JsonPrimitive) value));
        }
        return raw;
    }

    private static Object toJava(JsonPrimitive primitive) {
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return primitive.getAsBigDecimal();
        }
        return primitive.getAsString();
    }
}
