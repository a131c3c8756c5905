package mytrader.worker.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed, validating access to the JSON params of a task.
 */
public final class HandlerParams {

    private final JsonNode root;

    private HandlerParams(JsonNode root) {
        this.root = root;
    }

    public static HandlerParams of(JsonNode params) {
        return new HandlerParams(params != null && params.isObject() ? params : JsonNodeFactory.instance.objectNode());
    }

    public boolean has(String name) {
        JsonNode node = root.get(name);
        return node != null && !node.isNull();
    }

    public int getInt(String name, int defaultValue) throws InvalidParamsException {
        if (!has(name)) {
            return defaultValue;
        }
        JsonNode node = root.get(name);
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new InvalidParamsException(name + " must be an integer, got " + node);
        }
        return node.intValue();
    }

    public double getDouble(String name, double defaultValue) throws InvalidParamsException {
        if (!has(name)) {
            return defaultValue;
        }
        JsonNode node = root.get(name);
        if (!node.isNumber()) {
            throw new InvalidParamsException(name + " must be a number, got " + node);
        }
        return node.doubleValue();
    }

    public boolean getBoolean(String name, boolean defaultValue) throws InvalidParamsException {
        if (!has(name)) {
            return defaultValue;
        }
        JsonNode node = root.get(name);
        if (!node.isBoolean()) {
            throw new InvalidParamsException(name + " must be true or false, got " + node);
        }
        return node.booleanValue();
    }

    public String getString(String name, String defaultValue) throws InvalidParamsException {
        if (!has(name)) {
            return defaultValue;
        }
        JsonNode node = root.get(name);
        if (!node.isTextual()) {
            throw new InvalidParamsException(name + " must be a string, got " + node);
        }
        return node.textValue();
    }

    /**
     * A list of non-blank strings; absent reads as empty.
     */
    public List<String> getStringList(String name) throws InvalidParamsException {
        List<String> values = new ArrayList<>();
        if (!has(name)) {
            return values;
        }
        JsonNode node = root.get(name);
        if (!node.isArray()) {
            throw new InvalidParamsException(name + " must be a list, got " + node);
        }
        for (JsonNode item : node) {
            if (!item.isTextual() || item.textValue().isBlank()) {
                throw new InvalidParamsException(name + " must only contain non-empty strings, got " + item);
            }
            values.add(item.textValue().trim());
        }
        return values;
    }
}
