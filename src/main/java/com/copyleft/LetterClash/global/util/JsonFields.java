package com.copyleft.LetterClash.global.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 클라이언트가 보낸 느슨한 JSON 값을 안전한 기본값으로 읽는다.
 */
public final class JsonFields {

    private JsonFields() {
    }

    /**
     * 정수로 해석할 수 없으면 null.
     */
    public static Integer asInteger(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? node.intValue() : null;
        }
        if (node.isNumber()) {
            double value = node.doubleValue();
            boolean integral = value == Math.rint(value) && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
            return integral ? (int) value : null;
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Boolean asBoolean(JsonNode node) {
        if (node == null || !node.isBoolean()) {
            return null;
        }
        return node.booleanValue();
    }

    /**
     * 배열이 아니면 빈 리스트. 각 원소는 문자열로 바꿔 maxLength 로 자른다.
     */
    public static List<String> asStringList(JsonNode node, int maxLength) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            values.add(TextNormalizer.truncate(asText(element), maxLength));
        }
        return values;
    }

    public static String asText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
