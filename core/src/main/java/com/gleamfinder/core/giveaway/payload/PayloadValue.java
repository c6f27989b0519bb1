package com.gleamfinder.core.giveaway.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gleamfinder.core.model.FinderError;
import com.gleamfinder.core.model.FinderException;
import com.gleamfinder.core.model.MissingFieldException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 스키마 없는 페이로드(JSON) 값 + 경로.
 * 타입별 require* 접근자는 실패 시 누락 필드 경로를 담은 {@link MissingFieldException} 을 던진다.
 */
public final class PayloadValue {

    // 값 뒤에 남는 토큰이 있으면 실패
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final JsonNode node;
    private final String path;

    private PayloadValue(JsonNode node, String path) {
        this.node = Objects.requireNonNull(node, "node");
        this.path = path;
    }

    /** JSON 텍스트 파싱. 문법 오류는 INVALID_RESPONSE. */
    public static PayloadValue parse(String json) throws FinderException {
        try {
            JsonNode root = MAPPER.readTree(json);
            if (root == null || root.isMissingNode()) {
                throw FinderException.invalidResponse("empty campaign payload");
            }
            return new PayloadValue(root, "");
        } catch (JsonProcessingException e) {
            throw new FinderException(FinderError.INVALID_RESPONSE,
                    "campaign payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String path() { return path; }

    public PayloadValue requireObject(String key) throws MissingFieldException {
        JsonNode v = child(key);
        if (v == null || !v.isObject()) throw new MissingFieldException(childPath(key), "an object");
        return new PayloadValue(v, childPath(key));
    }

    public List<PayloadValue> requireArray(String key) throws MissingFieldException {
        JsonNode v = child(key);
        if (v == null || !v.isArray()) throw new MissingFieldException(childPath(key), "an array");
        String base = childPath(key);
        List<PayloadValue> out = new ArrayList<>(v.size());
        for (int i = 0; i < v.size(); i++) {
            out.add(new PayloadValue(v.get(i), base + "[" + i + "]"));
        }
        return Collections.unmodifiableList(out);
    }

    public String requireString(String key) throws MissingFieldException {
        JsonNode v = child(key);
        if (v == null || !v.isTextual()) throw new MissingFieldException(childPath(key), "a string");
        return v.textValue();
    }

    /** 0 이상의 정수(long 범위)만 허용. 소수/음수/문자열은 실패. */
    public long requireUnsignedLong(String key) throws MissingFieldException {
        JsonNode v = child(key);
        if (v == null || !v.isIntegralNumber() || !v.canConvertToLong() || v.longValue() < 0) {
            throw new MissingFieldException(childPath(key), "a non-negative integer");
        }
        return v.longValue();
    }

    private JsonNode child(String key) {
        if (!node.isObject()) return null;
        JsonNode v = node.get(key);
        return (v == null || v.isNull()) ? null : v;
    }

    private String childPath(String key) {
        return path.isEmpty() ? key : path + "." + key;
    }

    @Override
    public String toString() {
        return "PayloadValue{" + (path.isEmpty() ? "<root>" : path) + "=" + node.getNodeType() + "}";
    }
}
