package com.ballotbox.backend.auth.identity.register.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ballotbox.backend.auth.domain.User;
import com.ballotbox.backend.auth.identity.register.dto.RegisterRequest;
import com.ballotbox.backend.auth.identity.register.dto.RegisterResponse;
import com.ballotbox.backend.auth.identity.register.service.RegistrationService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 회원가입 API: 201 Created
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthRegisterController {

    private final RegistrationService registrationService;

    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@RequestBody @Valid RegisterRequest req) {
        User user = registrationService.register(
                req.firstName(),
                req.lastName(),
                req.email(),
                req.roleOrDefault(),
                req.password()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(RegisterResponse.created(user));
    }
}
