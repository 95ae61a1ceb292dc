package com.ballotbox.backend.auth.token.service;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ballotbox.backend.auth.token.RefreshTokenFixtures;
import com.ballotbox.backend.auth.token.domain.RefreshRevokeReason;
import com.ballotbox.backend.auth.token.domain.RefreshToken;
import com.ballotbox.backend.auth.token.domain.RefreshTokenStatus;
import com.ballotbox.backend.global.ApiException;
import com.ballotbox.backend.global.ErrorCode;

@ExtendWith(MockitoExtension.class)
@DisplayName("[Logout] LogoutService 단위 테스트")
class LogoutServiceTest {

    private static final String RAW = "l".repeat(64);

    @Mock RefreshTokenLookup lookup;
    @Mock LineageRevocationService revocationService;
    @InjectMocks LogoutService service;

    @Test
    @DisplayName("ACTIVE → lineage 폐기(LOGOUT)")
    void active_token_revokes_lineage() {
        when(lookup.require(RAW)).thenReturn(RefreshTokenFixtures.token(1L, RAW, RefreshTokenStatus.ACTIVE));

        service.logout(RAW);

        verify(revocationService).revokeLineage(RefreshTokenFixtures.LINEAGE, RefreshRevokeReason.LOGOUT);
    }

    @Test
    @DisplayName("만료된 ACTIVE도 LOGOUT으로 폐기")
    void expired_active_token_still_logs_out() {
        when(lookup.require(RAW)).thenReturn(RefreshTokenFixtures.expired(1L, RAW));

        service.logout(RAW);

        verify(revocationService).revokeLineage(RefreshTokenFixtures.LINEAGE, RefreshRevokeReason.LOGOUT);
    }

    @Test
    @DisplayName("ROTATED → 재사용 탐지 + REFRESH_REUSED")
    void rotated_token_is_reuse() {
        RefreshToken rotated = RefreshTokenFixtures.token(1L, RAW, RefreshTokenStatus.ROTATED);
        when(lookup.require(RAW)).thenReturn(rotated);

        assertThatThrownBy(() -> service.logout(RAW))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.REFRESH_REUSED);

        verify(revocationService).reuseDetected(rotated);
    }

    @Test
    @DisplayName("REVOKED → REFRESH_REVOKED, 아무것도 바꾸지 않음")
    void revoked_token_is_rejected() {
        when(lookup.require(RAW)).thenReturn(RefreshTokenFixtures.token(1L, RAW, RefreshTokenStatus.REVOKED));

        assertThatThrownBy(() -> service.logout(RAW))
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.REFRESH_REVOKED);

        verifyNoInteractions(revocationService);
    }

    @Test
    @DisplayName("lookup 실패(REFRESH_INVALID)는 그대로 전파")
    void lookup_failure_propagates() {
        when(lookup.require(null)).thenThrow(new ApiException(ErrorCode.REFRESH_INVALID));

        assertThatThrownBy(() -> service.logout(null))
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.REFRESH_INVALID);

        verifyNoInteractions(revocationService);
    }
}
