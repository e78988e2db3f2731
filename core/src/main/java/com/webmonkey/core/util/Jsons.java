package com.webmonkey.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** 공용 Jackson 설정 (ISO-8601 날짜, 모르는 필드 무시) */
public final class Jsons {
    private Jsons() {}

    private static final ObjectMapper OM = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /** 설정 완료 후 공유되는 인스턴스 (읽기/쓰기는 스레드 안전) */
    public static ObjectMapper mapper() { return OM; }
}
