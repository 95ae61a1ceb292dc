package com.ballotbox.backend.auth.token.store;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.ballotbox.backend.auth.token.domain.RefreshRevokeReason;
import com.ballotbox.backend.auth.token.domain.RefreshToken;
import com.ballotbox.backend.auth.token.domain.RefreshTokenStatus;
import com.ballotbox.backend.auth.token.repo.RefreshTokenRepository;

import lombok.RequiredArgsConstructor;

/**
 * Spring Data JPA 기반 RefreshTokenStore.
 * 조건부 전이는 RefreshTokenRepository의 bulk UPDATE에 그대로 위임한다.
 */
@Component
@RequiredArgsConstructor
public class JpaRefreshTokenStore implements RefreshTokenStore {

    private final RefreshTokenRepository repository;

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return repository.findByTokenHash(tokenHash);
    }

    @Override
    public RefreshToken insert(RefreshToken token) {
        if (token.getId() != null) {
            throw new IllegalArgumentException("token already persisted: id=" + token.getId());
        }
        // token_hash unique 위반을 커밋 시점이 아니라 여기서 드러내기 위해 즉시 flush
        return repository.saveAndFlush(token);
    }

    @Override
    public boolean markRotated(Long tokenId, LocalDateTime now) {
        int updated = repository.markRotated(tokenId, now, RefreshTokenStatus.ACTIVE, RefreshTokenStatus.ROTATED);
        if (updated > 1) {
            throw new IllegalStateException("markRotated updated " + updated + " rows for id=" + tokenId);
        }
        return updated == 1;
    }

    @Override
    public int revokeLineage(String lineageId, RefreshRevokeReason reason, LocalDateTime now) {
        return repository.revokeLineage(lineageId, now, reason, RefreshTokenStatus.REVOKED);
    }

    @Override
    public List<String> findLineagesWithExpiredActive(LocalDateTime now) {
        return repository.findLineageIdsWithExpiredActive(now, RefreshTokenStatus.ACTIVE);
    }

    @Override
    public List<String> findFullyRevokedLineagesBefore(LocalDateTime cutoff) {
        return repository.findFullyRevokedLineageIdsBefore(cutoff, RefreshTokenStatus.REVOKED);
    }

    @Override
    public int deleteLineages(Collection<String> lineageIds) {
        if (lineageIds == null || lineageIds.isEmpty()) {
            return 0;
        }
        return repository.deleteAllByLineageIdIn(lineageIds);
    }
}
