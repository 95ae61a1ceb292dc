package com.ballotbox.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.ballotbox.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 보호 자원(/auth/me 등)에 Authentication 없이 접근했을 때 호출되는 EntryPoint.
 * - Bearer 헤더가 없거나 형식이 다른 경우 여기로 온다. (401 AUTH_REQUIRED)
 * - 헤더는 있는데 JWT가 invalid면 JwtAuthenticationFilter가 먼저 401 ACCESS_INVALID로 끝낸다.
 */
@Slf4j
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {


        log.debug("인증 없이 보호 자원 접근: {} {}", request.getMethod(), request.getRequestURI());
        errorWriter.write(response, ErrorCode.AUTH_REQUIRED);
    }
}
