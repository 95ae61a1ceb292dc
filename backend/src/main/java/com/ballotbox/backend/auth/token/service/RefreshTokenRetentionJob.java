package com.ballotbox.backend.auth.token.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

// app.auth.retention.enabled=false 면 빈 자체가 없다. (테스트 프로필)
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.auth.retention", name = "enabled", havingValue = "true")
public class RefreshTokenRetentionJob {

    private final RefreshTokenRetentionService retentionService;

    @Scheduled(cron = "${app.auth.retention.cron}")
    public void run() {
        retentionService.sweep();
    }
}
