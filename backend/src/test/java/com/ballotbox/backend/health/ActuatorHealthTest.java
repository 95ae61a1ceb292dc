package com.ballotbox.backend.health;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.ballotbox.backend.infra.AbstractIntegrationTest;

/**
 * Actuator health는 인증 없이 열려 있어야 한다. (로드밸런서/오케스트레이터 헬스 체크)
 * - 나머지 actuator 엔드포인트는 노출하지 않는다.
 * - actuator는 application/vnd.spring-boot.actuator.v3+json 같은 vendor 타입을 줄 수 있어서 +json suffix로 비교한다.
 */
@DisplayName("[Actuator] health 체크")
class ActuatorHealthTest extends AbstractIntegrationTest {

    @Autowired MockMvc mvc;

    private static final MediaType ANY_JSON_PLUS = MediaType.parseMediaType("application/*+json");

    @Test
    @DisplayName("GET /actuator/health -> 200 + UP (익명)")
    void health_up() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(ANY_JSON_PLUS))
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("GET /actuator/health/liveness, readiness -> 200 + UP")
    void liveness_and_readiness_up() throws Exception {
        mvc.perform(get("/actuator/health/liveness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));

        mvc.perform(get("/actuator/health/readiness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("노출하지 않은 actuator 엔드포인트(env)는 익명으로 못 본다")
    void env_not_exposed() throws Exception {
        mvc.perform(get("/actuator/env"))
                .andExpect(status().is4xxClientError());
    }
}
