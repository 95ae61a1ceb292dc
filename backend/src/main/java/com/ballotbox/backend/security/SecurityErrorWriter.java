package com.ballotbox.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ballotbox.backend.global.ApiError;
import com.ballotbox.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 필터/EntryPoint에서 ApiError JSON을 직접 써 주는 유틸
 * - Security Filter Chain에서 막힌 요청은 GlobalExceptionHandler까지 오지 않는다.
 * - 외부 코드는 ErrorCode.code() 기준이라 컨트롤러 쪽 에러와 스키마가 같다.
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter {
    
    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        write(response, errorCode, errorCode.defaultMessage());
    }

    public void write(HttpServletResponse response, ErrorCode errorCode, String messageOverride) throws IOException {
        
        if (response.isCommitted()) {
            return;
        }

        // 인증 실패 응답은 캐시 금지
        response.setHeader("Cache-Control", "no-store");
        response.setHeader("Pragma", "no-cache");

        response.setStatus(errorCode.status().value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType("application/json;charset=UTF-8");
        
        objectMapper.writeValue(
                response.getWriter(),
                ApiError.of(errorCode, messageOverride)
        );
    }

}
