package com.ballotbox.backend.auth.token.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * refresh_tokens 테이블 매핑 엔티티 (lineage를 이루는 refresh 토큰 한 개)
 *
 * - Access Token(JWT)은 서버에 저장하지 않음(Stateless)
 * - Refresh Token은 서버가 DB로 상태 관리. 로그인 1회 = lineage 1개.
 * - 회전할 때마다 같은 lineage_id로 새 row가 추가되고, parent_id로 이전 토큰을 가리킨다.
 *
 * 불변 조건:
 * 1) refresh raw(원문)은 DB에 절대 저장하지 않는다. (token_hash만 저장)
 * 2) lineage당 ACTIVE는 최대 1개.
 * 3) status는 ACTIVE → ROTATED → REVOKED 방향으로만 바뀐다.
 *    상태 전이는 전부 RefreshTokenStore의 조건부 UPDATE로만 일어나므로 이 엔티티에는 setter가 없다.
 *
 * 인덱스:
 * - idx_refresh_token_hash(unique): 쿠키 raw → sha256 → 조회 키
 * - idx_refresh_lineage_id: lineage 일괄 폐기/정리
 * - idx_refresh_user_id: 사용자 단위 조회
 */
@Getter
@Entity
@Table(
    name = "refresh_tokens",
    indexes = {
        @Index(name = "idx_refresh_token_hash", columnList = "token_hash", unique = true),
        @Index(name = "idx_refresh_lineage_id", columnList = "lineage_id"),
        @Index(name = "idx_refresh_user_id", columnList = "user_id")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RefreshToken {

    // ---- constants (DB 제약과 반드시 맞춰야 함) ----
    public static final int TOKEN_HASH_LEN = 64;      // sha256 hex
    public static final int LINEAGE_ID_LEN = 36;      // UUID 문자열
    public static final int USER_AGENT_MAX = 255;
    public static final int IP_ADDRESS_MAX = 45;

    private static final String HEX64_REGEX = "^[0-9a-f]{64}$";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "token_hash", nullable = false, length = TOKEN_HASH_LEN)
    private String tokenHash;

    @Column(name = "lineage_id", nullable = false, length = LINEAGE_ID_LEN, updatable = false)
    private String lineageId;

    // lineage root면 null
    @Column(name = "parent_id", updatable = false)
    private Long parentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RefreshTokenStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "revoke_reason", length = 30)
    private RefreshRevokeReason revokeReason;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private LocalDateTime issuedAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "rotated_at")
    private LocalDateTime rotatedAt;

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    // 회전/로그아웃으로 마지막 제출된 시각
    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    @Column(name = "user_agent", length = USER_AGENT_MAX)
    private String userAgent;

    @Column(name = "ip_address", length = IP_ADDRESS_MAX)
    private String ipAddress;


    // ========= factory =========

    /** 로그인 성공 시 lineage의 첫 토큰 */
    public static RefreshToken root(
            Long userId,
            String lineageId,
            String tokenHash,
            LocalDateTime now,
            LocalDateTime expiresAt,
            String userAgent,
            String ipAddress
    ) {
        return create(userId, lineageId, null, tokenHash, now, expiresAt, userAgent, ipAddress);
    }

    /**
     * 회전 성공 시 이 토큰을 부모로 하는 후속 토큰.
     * - lineage/user는 부모를 그대로 잇는다.
     * - 만료는 now 기준으로 새로 잡는다.
     */
    public RefreshToken successor(
            String tokenHash,
            LocalDateTime now,
            LocalDateTime expiresAt,
            String userAgent,
            String ipAddress
    ) {
        require(this.id != null, "parent must be persisted before issuing a successor");
        return create(this.userId, this.lineageId, this.id, tokenHash, now, expiresAt, userAgent, ipAddress);
    }

    private static RefreshToken create(
            Long userId,
            String lineageId,
            Long parentId,
            String tokenHash,
            LocalDateTime now,
            LocalDateTime expiresAt,
            String userAgent,
            String ipAddress
    ) {
        require(userId != null, "userId must not be null");
        require(lineageId != null && !lineageId.isBlank(), "lineageId must not be blank");
        require(lineageId.length() <= LINEAGE_ID_LEN, "lineageId too long");
        require(now != null, "now must not be null");
        require(expiresAt != null, "expiresAt must not be null");
        require(expiresAt.isAfter(now), "expiresAt must be after now");

        RefreshToken rt = new RefreshToken();
        rt.userId = userId;
        rt.lineageId = lineageId;
        rt.parentId = parentId;
        rt.tokenHash = requireTokenHash(tokenHash);
        rt.status = RefreshTokenStatus.ACTIVE;
        rt.issuedAt = now;
        rt.expiresAt = expiresAt;
        rt.userAgent = trimToNullAndMax(userAgent, USER_AGENT_MAX);
        rt.ipAddress = trimToNullAndMax(ipAddress, IP_ADDRESS_MAX);
        return rt;
    }


    // ========= domain =========
    public boolean isExpired(LocalDateTime now) {
        Objects.requireNonNull(now, "now must not be null");
        return !expiresAt.isAfter(now);
    }

    public boolean isActive() {
        return status == RefreshTokenStatus.ACTIVE;
    }

    public boolean isRotated() {
        return status == RefreshTokenStatus.ROTATED;
    }

    public boolean isRevoked() {
        return status == RefreshTokenStatus.REVOKED;
    }

    public boolean isRoot() {
        return parentId == null;
    }


    // ========= helpers =========
    private static String requireTokenHash(String tokenHash) {
        require(tokenHash != null, "tokenHash must not be null");
        String h = tokenHash.trim();
        require(h.length() == TOKEN_HASH_LEN, "tokenHash must be 64 chars");
        require(h.matches(HEX64_REGEX), "tokenHash must be lowercase hex(64)");
        return h;
    }

    private static String trimToNullAndMax(String v, int max) {
        if (v == null) return null;
        String t = v.trim();
        if (t.isEmpty()) return null;
        return t.length() <= max ? t : t.substring(0, max);
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
