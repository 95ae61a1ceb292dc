package com.ballotbox.backend.auth.token.service;

import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.ballotbox.backend.auth.config.AuthProperties;
import com.ballotbox.backend.auth.token.domain.RefreshToken;
import com.ballotbox.backend.auth.token.store.RefreshTokenStore;
import com.ballotbox.backend.auth.token.support.ClientInfo;
import com.ballotbox.backend.auth.token.support.TokenGenerator;
import com.ballotbox.backend.auth.token.support.TokenHashUtils;

import lombok.RequiredArgsConstructor;

/**
 * refresh 토큰 발급기
 *
 * - openLineage: 로그인 1회마다 새 lineage(UUID)와 그 root 토큰을 만든다.
 * - issueSuccessor: 회전 성공 시 같은 lineage에 후속 토큰을 붙인다.
 *
 * 원문(raw)은 반환값으로만 나가고(쿠키용), 저장되는 건 sha256 해시뿐이다.
 * 항상 호출자(로그인/회전) 트랜잭션 안에서 실행된다.
 */
@Service
@RequiredArgsConstructor
public class RefreshTokenIssuer {

    private final RefreshTokenStore store;
    private final TokenGenerator tokenGenerator;
    private final AuthProperties props;

    @Transactional(propagation = Propagation.MANDATORY)
    public Issued openLineage(Long userId, ClientInfo client, LocalDateTime now) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");

        String raw = newRaw();
        RefreshToken root = RefreshToken.root(
                userId,
                UUID.randomUUID().toString(),
                TokenHashUtils.sha256Hex(raw),
                now,
                expiresAt(now),
                client.userAgent(),
                client.ipAddress()
        );
        return new Issued(raw, store.insert(root));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Issued issueSuccessor(RefreshToken parent, ClientInfo client, LocalDateTime now) {
        String raw = newRaw();
        RefreshToken next = parent.successor(
                TokenHashUtils.sha256Hex(raw),
                now,
                expiresAt(now),
                client.userAgent(),
                client.ipAddress()
        );
        return new Issued(raw, store.insert(next));
    }

    private String newRaw() {
        String raw = tokenGenerator.generateRefreshToken();
        if (!TokenGenerator.isWellFormed(raw)) {
            throw new IllegalStateException("generated refresh token is malformed");
        }
        return raw;
    }

    private LocalDateTime expiresAt(LocalDateTime now) {
        return now.plusSeconds(props.refresh().ttlSeconds());
    }

    /** raw: 쿠키로 내려갈 원문, record: 저장된 레코드 */
    public record Issued(String raw, RefreshToken record) {
        public LocalDateTime expiresAt() {
            return record.getExpiresAt();
        }
    }
}
