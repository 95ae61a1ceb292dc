package com.ballotbox.backend.auth.refresh;

import org.junit.jupiter.api.DisplayName;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.ballotbox.backend.infra.MySqlTestContainer;

/**
 * AuthRefreshRotationFlowTest 시나리오를 MySQL 8(Testcontainers) 위에서 그대로 다시 돈다.
 * DATETIME(6) 만료 비교와 lineage 단위 bulk UPDATE를 실제 엔진에서 확인한다.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("[Auth][Refresh][MySQL] 리프레시 토큰 로테이션 통합 테스트")
class AuthRefreshRotationFlowMySqlTest extends AuthRefreshRotationFlowTest {

    @DynamicPropertySource
    static void mysql(DynamicPropertyRegistry r) {
        MySqlTestContainer.overrideProps(r);
    }
}
