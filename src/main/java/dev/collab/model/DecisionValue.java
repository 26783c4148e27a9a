package dev.collab.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A JSON value taken from an agent's {@code decisions} block.
 * Exactly one of six forms: null, boolean, number, string, array, or mapping.
 */
public sealed interface DecisionValue {

    /**
     * Truthiness used by bare identifiers in conditions: {@code false}, zero,
     * empty strings and empty collections are falsy, as is null.
     */
    boolean truthy();

    /** Plain text used when the value is substituted into a prompt. */
    String render();

    JsonNode toJson();

    record Null() implements DecisionValue {
        public boolean truthy() { return false; }
        public String render() { return ""; }
        public JsonNode toJson() { return JsonNodeFactory.instance.nullNode(); }
    }

    record Bool(boolean value) implements DecisionValue {
        public boolean truthy() { return value; }
        public String render() { return Boolean.toString(value); }
        public JsonNode toJson() { return JsonNodeFactory.instance.booleanNode(value); }
    }

    record Number(BigDecimal value) implements DecisionValue {
        public Number {
            Objects.requireNonNull(value, "value");
        }

        public boolean truthy() { return value.signum() != 0; }
        public String render() { return value.stripTrailingZeros().toPlainString(); }
        public JsonNode toJson() { return JsonNodeFactory.instance.numberNode(value); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Number other && value.compareTo(other.value) == 0;
        }

        @Override
        public int hashCode() {
            return value.stripTrailingZeros().hashCode();
        }
    }

    record Text(String value) implements DecisionValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        public boolean truthy() { return !value.isEmpty(); }
        public String render() { return value; }
        public JsonNode toJson() { return JsonNodeFactory.instance.textNode(value); }
    }

    record Array(List<DecisionValue> items) implements DecisionValue {
        public Array {
            items = List.copyOf(items);
        }

        public boolean truthy() { return !items.isEmpty(); }
        public String render() { return toJson().toString(); }

        public JsonNode toJson() {
            ArrayNode node = JsonNodeFactory.instance.arrayNode();
            items.forEach(item -> node.add(item.toJson()));
            return node;
        }
    }

    record Mapping(Map<String, DecisionValue> entries) implements DecisionValue {
        public Mapping {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public boolean truthy() { return !entries.isEmpty(); }
        public String render() { return toJson().toString(); }

        public JsonNode toJson() {
            ObjectNode node = JsonNodeFactory.instance.objectNode();
            entries.forEach((key, value) -> node.set(key, value.toJson()));
            return node;
        }
    }

    DecisionValue NULL = new Null();
    DecisionValue TRUE = new Bool(true);
    DecisionValue FALSE = new Bool(false);

    static DecisionValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static DecisionValue of(long value) {
        return new Number(BigDecimal.valueOf(value));
    }

    static DecisionValue of(String value) {
        return value == null ? NULL : new Text(value);
    }

    /**
     * Convert a Jackson tree into a decision value. Missing nodes map to null.
     */
    static DecisionValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        if (node.isBoolean()) {
            return of(node.booleanValue());
        }
        if (node.isNumber()) {
            // out-of-range doubles have no decimal form
            if (node.isFloatingPointNumber() && !node.isBigDecimal() && !Double.isFinite(node.doubleValue())) {
                return new Text(node.asText());
            }
            return new Number(node.decimalValue());
        }
        if (node.isTextual()) {
            return new Text(node.textValue());
        }
        if (node.isArray()) {
            var items = new ArrayList<DecisionValue>();
            node.forEach(item -> items.add(fromJson(item)));
            return new Array(items);
        }
        if (node.isObject()) {
            return new Mapping(mapFromJson(node));
        }
        return new Text(node.asText());
    }

    /**
     * Convert every field of a JSON object, keeping field order.
     */
    static Map<String, DecisionValue> mapFromJson(JsonNode objectNode) {
        var entries = new LinkedHashMap<String, DecisionValue>();
        if (objectNode != null && objectNode.isObject()) {
            for (var field : objectNode.properties()) {
                entries.put(field.getKey(), fromJson(field.getValue()));
            }
        }
        return entries;
    }

    static ObjectNode mapToJson(Map<String, DecisionValue> entries) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        entries.forEach((key, value) -> node.set(key, value.toJson()));
        return node;
    }
}
