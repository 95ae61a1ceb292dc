package com.ballotbox.backend.infra;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.testcontainers.containers.MySQLContainer;

import lombok.extern.slf4j.Slf4j;

/**
 * 운영과 같은 MySQL 8에서 돌려야 의미가 있는 테스트용 컨테이너.
 *
 * - 기본 테스트 실행은 H2(MySQL 모드)다. 조건부 UPDATE 경합/행 잠금처럼 엔진에 따라 달라질 수 있는 부분만
 *   *MySqlTest 클래스가 H2 테스트를 상속해 같은 시나리오를 이 컨테이너 위에서 한 번 더 돈다.
 * - 컨테이너는 JVM당 한 번만 뜬다. 여러 *MySqlTest 컨텍스트가 같은 DB를 공유하고,
 *   Flyway는 이미 적용된 마이그레이션을 건너뛴다.
 * - Docker가 없으면 각 클래스의 @Testcontainers(disabledWithoutDocker = true)로 통째로 skip 된다.
 *
 * 호출 순서:
 *   Spring이 컨텍스트 준비 시작
 *     → @DynamicPropertySource → MySqlTestContainer.overrideProps(registry)
 *     → startOnce() (여기서 처음 컨테이너가 뜬다)
 *     → registry.add(...) 로 datasource/flyway 값 등록
 */
@Slf4j
public final class MySqlTestContainer {

    private static final String MYSQL_IMAGE = "mysql:8.0.36";
    private static final String MYSQL_DB = "ballotbox_test";
    private static final String MYSQL_USER = "ballotbox";
    private static final String MYSQL_PASSWORD = "ballotbox";

    private static final AtomicBoolean STARTED = new AtomicBoolean(false);

    static final MySQLContainer<?> MYSQL = new MySQLContainer<>(MYSQL_IMAGE)
            .withDatabaseName(MYSQL_DB)
            .withUsername(MYSQL_USER)
            .withPassword(MYSQL_PASSWORD)
            .withStartupAttempts(3)
            .withStartupTimeout(Duration.ofMinutes(2));

    private MySqlTestContainer() {}

    public static void overrideProps(DynamicPropertyRegistry r) {
        startOnce();

        // --- DB ---
        r.add("spring.datasource.url", MYSQL::getJdbcUrl);
        r.add("spring.datasource.username", MYSQL::getUsername);
        r.add("spring.datasource.password", MYSQL::getPassword);
        r.add("spring.datasource.driver-class-name", () -> "com.mysql.cj.jdbc.Driver");

        // --- Flyway ---
        r.add("spring.flyway.url", MYSQL::getJdbcUrl);
        r.add("spring.flyway.user", MYSQL::getUsername);
        r.add("spring.flyway.password", MYSQL::getPassword);

        // --- Hikari ---
        r.add("spring.datasource.hikari.connection-timeout", () -> "30000");
        r.add("spring.datasource.hikari.initialization-fail-timeout", () -> "-1");

        log.info("MySQL 컨테이너로 datasource 오버라이드: url={}", MYSQL.getJdbcUrl());
    }

    private static void startOnce() {
        if (!STARTED.compareAndSet(false, true)) {
            return; // 이미 시작됨
        }

        try {
            MYSQL.start();
            log.info("MySQL 컨테이너 시작: {}:{} -> 3306", MYSQL.getHost(), MYSQL.getMappedPort(3306));
        } catch (Exception e) {
            log.error("MySQL Testcontainer init failed", e);
            throw new IllegalStateException("MySQL Testcontainer init failed", e);
        }
    }
}
