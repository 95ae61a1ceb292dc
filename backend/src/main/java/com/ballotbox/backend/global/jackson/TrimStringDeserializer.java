package com.ballotbox.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * 문자열 입력을 trim 처리하는 역직렬화기.
 *
 * - 앞뒤 공백을 제거하고, 공백만 있던 값은 null로 만든다.
 *   (@NotBlank / @NotNull 검증이 같은 방식으로 걸리게 하기 위함)
 * - 비밀번호처럼 공백도 의미가 있는 필드에는 붙이지 않는다.
 */
public class TrimStringDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String v = p.getValueAsString();
        if (v == null) return null;

        String trimmed = v.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
