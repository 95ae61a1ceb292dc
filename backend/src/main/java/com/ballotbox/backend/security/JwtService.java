package com.ballotbox.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.ballotbox.backend.auth.config.AuthProperties;
import com.ballotbox.backend.auth.domain.UserRole;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access Token(JWT) 발급/검증 서비스
 *
 * - HTTP(상태코드/응답)는 모른다. "유효/무효"만 판단한다.
 * - Access Token은 DB를 보지 않고 서명/만료/issuer 검증만으로 믿는다.
 *   그래서 lineage가 폐기돼도 이미 나간 Access Token은 exp까지 유효하다. (짧은 TTL로 감당)
 * - 검증 실패는 InvalidJwtException(런타임)으로 통일해서 던지고, 필터가 401 ApiError로 변환한다.
 *
 * 클레임:
 * - iss: 발급자(app.auth.jwt.issuer)
 * - sub: userId
 * - email, role
 * - iat / exp
 */
@Service
public class JwtService {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String ROLE_CLAIM = "role";
    private static final String EMAIL_CLAIM = "email";

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser parser;


    public JwtService(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;
        this.key = buildHmacKey(jwtProps.secret());

        // issuer(iss) 고정(requireIssuer)으로 다른 서비스가 같은 키로 만든 토큰도 차단한다.
        this.parser = buildParser(jwtProps.issuer(), this.key, this.clock);
    }


    /** userId/email/role 기반 Access JWT 발급 */
    public String issueAccessToken(Long userId, String email, UserRole role) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (email == null || email.isBlank()) throw new IllegalArgumentException("email must not be blank");
        if (role == null) throw new IllegalArgumentException("role must not be null");

        Instant now = clock.instant();
        Instant exp = now.plusSeconds(jwtProps.accessTtlSeconds());

        return Jwts.builder()
                .setIssuer(jwtProps.issuer())                // iss
                .setSubject(String.valueOf(userId))          // sub
                .claim(EMAIL_CLAIM, email)                   // email
                .claim(ROLE_CLAIM, role.name())              // role: "VOTER"
                .setIssuedAt(Date.from(now))                 // iat
                .setExpiration(Date.from(exp))               // exp
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /** 발급 직후 응답/로그에서 쓰는 Access Token 수명(초) */
    public long accessTtlSeconds() {
        return jwtProps.accessTtlSeconds();
    }

    /**
     * Access Token 검증 후, AuthPrincipal 반환
     *
     * 실패 시 InvalidJwtException을 던진다.
     * - refresh 토큰(불투명 문자열)을 여기 넣어도 JWT 형식이 아니므로 실패한다.
     */
    public AuthPrincipal verifyAccessToken(String token) {
        try {
            if (token == null || token.isBlank()) {
                throw new JwtException("token is null or blank");
            }

            // 서명/만료/issuer/포맷 검증 (하나라도 실패하면 JwtException)
            Claims claims = parser.parseClaimsJws(token).getBody();

            Long userId = parseUserId(claims.getSubject());
            String email = parseEmail(claims.get(EMAIL_CLAIM, String.class));
            UserRole role = parseRole(claims.get(ROLE_CLAIM, String.class));

            return new AuthPrincipal(userId, email, role);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException("Invalid JWT", e);
        }
    }


    private static SecretKey buildHmacKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be blank");
        }

        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }

        return Keys.hmacShaKeyFor(bytes);
    }

    private static JwtParser buildParser(String issuer, SecretKey key, Clock clock) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("JWT issuer must not be blank");
        }

        return Jwts.parserBuilder()
                .requireIssuer(issuer)
                .setSigningKey(key)
                // JJWT는 Date 기반 clock을 쓰므로 여기서 bridge
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    private static Long parseUserId(String sub) {
        if (sub == null || sub.isBlank()) {
            throw new JwtException("subject (userId) is missing");
        }
        try {
            return Long.valueOf(sub);
        } catch (NumberFormatException e) {
            throw new JwtException("subject is not a valid Long: " + sub, e);
        }
    }

    private static String parseEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new JwtException("email claim missing");
        }
        return email;
    }

    private static UserRole parseRole(String roleRaw) {
        if (roleRaw == null || roleRaw.isBlank()) {
            throw new JwtException("role claim missing");
        }
        try {
            return UserRole.valueOf(roleRaw);
        } catch (IllegalArgumentException e) {
            throw new JwtException("role claim invalid: " + roleRaw, e);
        }
    }

    /**
     * HTTP 레벨과 분리된 "JWT 검증 실패" 예외
     * - Filter에서 잡아서 401 ApiError로 변환한다.
     */
    public static class InvalidJwtException extends RuntimeException {
        public InvalidJwtException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
