package com.ballotbox.backend.auth.identity.login.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.ballotbox.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * [로그인 요청 DTO]
 * - 형식 검증(@Email/@NotBlank)만 한다. 소문자 정규화는 LoginService에서.
 * - password는 trim 하지 않는다.
 */
public record LoginRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Email
        @NotBlank
        String email,

        @NotBlank
        String password
) {}
