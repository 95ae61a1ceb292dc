package com.ballotbox.backend.auth.domain;

/**
 * 사용자 역할
 * - VOTER / CANDIDATE: 가입 시 본인이 고를 수 있다.
 * - ADMIN: 가입으로는 만들 수 없다. (운영 데이터로만 부여)
 */
public enum UserRole {
    VOTER,
    CANDIDATE,
    ADMIN;

    public boolean isSelfAssignable() {
        return this != ADMIN;
    }
}
