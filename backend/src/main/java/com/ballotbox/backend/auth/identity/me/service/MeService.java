package com.ballotbox.backend.auth.identity.me.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ballotbox.backend.auth.domain.User;
import com.ballotbox.backend.auth.identity.me.dto.MeResponse;
import com.ballotbox.backend.auth.repo.UserRepository;
import com.ballotbox.backend.global.ApiException;
import com.ballotbox.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;

/**
 * 내 정보 조회.
 * access token의 클레임은 발급 시점 값이라, 계정 상태와 이름은 users 테이블에서 다시 읽는다.
 * 삭제된 사용자는 USER_NOT_FOUND, ACTIVE가 아닌 계정은 ACCOUNT_DISABLED.
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public MeResponse describe(long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));
        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }
        return MeResponse.of(user);
    }
}
