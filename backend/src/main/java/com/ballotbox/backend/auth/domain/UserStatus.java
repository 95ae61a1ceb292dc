package com.ballotbox.backend.auth.domain;

public enum UserStatus {
    ACTIVE,
    DISABLED
}
