package com.webmonkey.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 메타 태그 맵: name → String | List&lt;String&gt;.
 * 리스트 값은 {@link #MULTI_VALUED_KEYS} 에만 쓰고, 나머지는 마지막 값이 이긴다.
 * 삽입 순서를 유지한다.
 */
public final class Metadata {

    /** 반복 등장 시 순서대로 누적하는 키 */
    public static final Set<String> MULTI_VALUED_KEYS =
            Set.of("og:title", "og:url", "og:description", "og:image");

    private final Map<String, Object> values;

    private Metadata(Map<String, Object> values) {
        this.values = values;
    }

    public static Metadata empty() { return new Metadata(Collections.emptyMap()); }

    public boolean isEmpty() { return values.isEmpty(); }
    public boolean contains(String key) { return values.containsKey(key); }
    public Set<String> keys() { return values.keySet(); }

    /** String 또는 List&lt;String&gt; (없으면 null) */
    public Object get(String key) { return values.get(key); }

    /** 단일 값. 리스트면 첫 값. */
    public String getString(String key) {
        Object v = values.get(key);
        if (v == null) return null;
        if (v instanceof List<?> l) return l.isEmpty() ? null : String.valueOf(l.get(0));
        return String.valueOf(v);
    }

    /** 값 목록. 단일 값이면 1개짜리 리스트. */
    public List<String> getAll(String key) {
        Object v = values.get(key);
        if (v == null) return List.of();
        if (v instanceof List<?> l) {
            List<String> out = new ArrayList<>(l.size());
            for (Object o : l) out.add(String.valueOf(o));
            return out;
        }
        return List.of(String.valueOf(v));
    }

    @JsonValue
    public Map<String, Object> asMap() { return values; }

    @Override public String toString() { return values.toString(); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        /** 메타 태그 하나 반영: 다중값 키는 누적, 그 외는 덮어쓰기 */
        public Builder put(String key, String value) {
            if (key == null || key.isEmpty() || value == null) return this;
            if (MULTI_VALUED_KEYS.contains(key)) {
                Object cur = values.get(key);
                List<String> list;
                if (cur instanceof List<?>) {
                    @SuppressWarnings("unchecked") List<String> l = (List<String>) cur;
                    list = l;
                } else {
                    list = new ArrayList<>();
                    values.put(key, list);
                }
                list.add(value);
            } else {
                values.put(key, value);
            }
            return this;
        }

        /** 파생 필드용: 다중값 규칙 없이 그대로 덮어쓴다 */
        public Builder set(String key, String value) {
            if (key != null && value != null) values.put(key, value);
            return this;
        }

        public Builder putIfAbsent(String key, String value) {
            if (key != null && value != null && !values.containsKey(key)) values.put(key, value);
            return this;
        }

        public boolean contains(String key) { return values.containsKey(key); }

        public Object get(String key) { return values.get(key); }

        public Metadata build() {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : values.entrySet()) {
                Object v = e.getValue();
                copy.put(e.getKey(), v instanceof List<?> l ? List.copyOf(l) : v);
            }
            return new Metadata(Collections.unmodifiableMap(copy));
        }
    }
}
