package ru.uzden.vpnpanel.xui;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Map;

/**
 * Разбор inbound'ов 3x-ui. settings и streamSettings панель отдаёт то строкой JSON, то объектом.
 */
public final class InboundJson {

    private InboundJson() {
    }

    /**
     * Достаёт вложенный объект parent.field. Строку JSON парсит, отсутствующее/пустое поле - MissingNode.
     *
     * @throws IllegalArgumentException если поле есть, но это не объект и не JSON-объект строкой
     */
    public static JsonNode embeddedObject(ObjectMapper om, JsonNode parent, String field) {
        if (parent == null || parent.isMissingNode() || parent.isNull()) return MissingNode.getInstance();
        JsonNode v = parent.get(field);
        if (v == null || v.isNull() || v.isMissingNode()) return MissingNode.getInstance();
        if (v.isTextual()) {
            String raw = v.asText();
            if (raw.isBlank()) return MissingNode.getInstance();
            try {
                v = om.readTree(raw);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Malformed " + field + ": " + e.getOriginalMessage(), e);
            }
        }
        if (!v.isObject()) {
            throw new IllegalArgumentException("Malformed " + field + ": expected JSON object");
        }
        return v;
    }

    /**
     * Объект parent.field без разбора строк: для уже распарсенных настроек.
     */
    public static JsonNode objectOrMissing(JsonNode parent, String field) {
        if (parent == null || parent.isMissingNode() || parent.isNull()) return MissingNode.getInstance();
        JsonNode v = parent.get(field);
        if (v == null || v.isNull() || v.isMissingNode()) return MissingNode.getInstance();
        if (!v.isObject()) {
            throw new IllegalArgumentException("Malformed " + field + ": expected JSON object");
        }
        return v;
    }

    public static JsonNode toTree(ObjectMapper om, Map<String, Object> map) {
        if (map == null || map.isEmpty()) return MissingNode.getInstance();
        return om.valueToTree(map);
    }

    public static String textOrNull(JsonNode node, String field) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isMissingNode() || v.isContainerNode()) return null;
        return blankToNull(v.asText());
    }

    /**
     * Первый непустой элемент массива node.field.
     */
    public static String firstText(JsonNode node, String field) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        JsonNode arr = node.get(field);
        if (arr == null || !arr.isArray()) return null;
        for (JsonNode n : arr) {
            String v = blankToNull(n.asText(""));
            if (v != null) return v;
        }
        return null;
    }

    public static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    public static String firstNonBlank(String... values) {
        if (values == null) return null;
        for (String v : values) {
            String t = blankToNull(v);
            if (t != null) return t;
        }
        return null;
    }
}
