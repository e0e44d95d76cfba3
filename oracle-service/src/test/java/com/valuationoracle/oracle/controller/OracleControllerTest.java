package com.valuationoracle.oracle.controller;

import com.valuationoracle.common.ValuationOracle;
import com.valuationoracle.common.persistence.InMemoryOracleStatePersistence;
import com.valuationoracle.common.registry.OracleConfiguration;
import com.valuationoracle.oracle.dto.AddOracleRequest;
import com.valuationoracle.oracle.dto.SettingUpdateRequest;
import com.valuationoracle.oracle.dto.SubmissionRequest;
import com.valuationoracle.oracle.logger.SubmissionFlowLogger;
import com.valuationoracle.oracle.service.ValuationOracleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.concurrent.atomic.AtomicLong;

import static com.valuationoracle.oracle.controller.OracleController.CALLER_HEADER;

/**
 * Exercises the HTTP surface against a real {@link ValuationOracle}, with the controller
 * bound directly (no application context).
 */
class OracleControllerTest {

    private static final String ADMIN = "ST1OWNER";
    private static final String BASE = "/api/v1/oracle";

    private final AtomicLong time = new AtomicLong(100);
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        ValuationOracle oracle = new ValuationOracle(OracleConfiguration.withDefaults(ADMIN), time::get,
            new InMemoryOracleStatePersistence());
        ValuationOracleService service = new ValuationOracleService(oracle, new SubmissionFlowLogger());
        client = WebTestClient.bindToController(new OracleController(service)).build();

        addOracle("ST1ORACLE", 50).expectStatus().isOk();
        addOracle("ST2ORACLE", 30).expectStatus().isOk();
        addOracle("ST3ORACLE", 20).expectStatus().isOk();
    }

    private WebTestClient.ResponseSpec addOracle(String oracleId, int weight) {
        return client.post().uri(BASE + "/oracles")
            .header(CALLER_HEADER, ADMIN)
            .bodyValue(new AddOracleRequest(oracleId, weight))
            .exchange();
    }

    private WebTestClient.ResponseSpec submit(String caller, long subjectId, long price, String oracleId) {
        return client.post().uri(BASE + "/submissions")
            .header(CALLER_HEADER, caller)
            .bodyValue(new SubmissionRequest(subjectId, price, oracleId))
            .exchange();
    }

    @Nested
    @DisplayName("submissions")
    class Submissions {

        @Test
        @DisplayName("three submissions publish 500000 from 3 sources")
        void publishesValuation() {
            submit("ST1ORACLE", 123, 500_000, "ST1ORACLE").expectStatus().isEqualTo(HttpStatus.ACCEPTED);
            submit("ST2ORACLE", 123, 520_000, "ST2ORACLE").expectStatus().isEqualTo(HttpStatus.ACCEPTED);
            submit("ST3ORACLE", 123, 480_000, "ST3ORACLE")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(true)
                .jsonPath("$.value").isEqualTo(480_000);

            client.get().uri(BASE + "/valuations/123").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.value").isEqualTo(500_000)
                .jsonPath("$.sourceCount").isEqualTo(3)
                .jsonPath("$.timestamp").isEqualTo(100);
        }

        @Test
        @DisplayName("below quorum → 202 with INSUFFICIENT_ORACLES, valuation still 404")
        void insufficientOracles() {
            submit("ST1ORACLE", 123, 500_000, "ST1ORACLE")
                .expectStatus().isEqualTo(HttpStatus.ACCEPTED)
                .expectBody()
                .jsonPath("$.ok").isEqualTo(false)
                .jsonPath("$.errorCode").isEqualTo(103)
                .jsonPath("$.error").isEqualTo("INSUFFICIENT_ORACLES");

            client.get().uri(BASE + "/valuations/123").exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo(109);

            client.get().uri(BASE + "/submissions/123/ST1ORACLE").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.price").isEqualTo(500_000);
        }

        @Test
        @DisplayName("caller differs from oracle → 403 NOT_ORACLE")
        void callerMismatch() {
            submit("ST1FAKE", 123, 500_000, "ST1ORACLE")
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo(100);
        }

        @Test
        @DisplayName("missing caller header → 403 NOT_ORACLE")
        void missingCaller() {
            client.post().uri(BASE + "/submissions")
                .bodyValue(new SubmissionRequest(123, 500_000, "ST1ORACLE"))
                .exchange()
                .expectStatus().isForbidden();
        }

        @Test
        @DisplayName("invalid subject and price → 400 with distinct codes")
        void invalidInput() {
            submit("ST1ORACLE", 0, 500_000, "ST1ORACLE")
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errorCode").isEqualTo(101);
            submit("ST1ORACLE", 123, 0, "ST1ORACLE")
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errorCode").isEqualTo(102);
        }

        @Test
        @DisplayName("6th submission → 429 MAX_SUBMISSIONS_EXCEEDED")
        void quotaExceeded() {
            for (int i = 0; i < 5; i++) {
                submit("ST1ORACLE", 123, 500_000 + i, "ST1ORACLE");
            }

            submit("ST1ORACLE", 123, 600_000, "ST1ORACLE")
                .expectStatus().isEqualTo(HttpStatus.TOO_MANY_REQUESTS)
                .expectBody().jsonPath("$.errorCode").isEqualTo(111);

            client.get().uri(BASE + "/oracles/ST1ORACLE/activity").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.submissionCount").isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("administration")
    class Administration {

        @Test
        @DisplayName("non-admin addOracle → 403 NOT_ADMIN")
        void nonAdminAdd() {
            client.post().uri(BASE + "/oracles")
                .header(CALLER_HEADER, "ST1ORACLE")
                .bodyValue(new AddOracleRequest("ST4ORACLE", 40))
                .exchange()
                .expectStatus().isForbidden()
                .expectBody().jsonPath("$.errorCode").isEqualTo(112);
        }

        @Test
        @DisplayName("invalid weight → 400 INVALID_WEIGHT; duplicate → 409")
        void weightAndDuplicate() {
            addOracle("ST4ORACLE", 101)
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errorCode").isEqualTo(108);
            addOracle("ST1ORACLE", 60)
                .expectStatus().isEqualTo(HttpStatus.CONFLICT);

            client.get().uri(BASE + "/oracles/ST1ORACLE/weight").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.weight").isEqualTo(50);
        }

        @Test
        @DisplayName("registry full → 409 MAX_ORACLES_EXCEEDED")
        void registryFull() {
            client.put().uri(BASE + "/config/max-oracles")
                .header(CALLER_HEADER, ADMIN)
                .bodyValue(new SettingUpdateRequest(3))
                .exchange()
                .expectStatus().isOk();

            addOracle("ST4ORACLE", 40)
                .expectStatus().isEqualTo(HttpStatus.CONFLICT)
                .expectBody().jsonPath("$.errorCode").isEqualTo(107);

            client.get().uri(BASE + "/oracles").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.length()").isEqualTo(3);
        }

        @Test
        @DisplayName("removeOracle → approval false and weight 404")
        void remove() {
            client.delete().uri(BASE + "/oracles/ST1ORACLE")
                .header(CALLER_HEADER, ADMIN)
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.value").isEqualTo(true);

            client.get().uri(BASE + "/oracles/ST1ORACLE/approved").exchange()
                .expectStatus().isOk()
                .expectBody(Boolean.class).isEqualTo(false);
            client.get().uri(BASE + "/oracles/ST1ORACLE/weight").exchange()
                .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("threshold 4 accepted, 11 rejected with INVALID_SETTING")
        void consensusThreshold() {
            client.put().uri(BASE + "/config/consensus-threshold")
                .header(CALLER_HEADER, ADMIN)
                .bodyValue(new SettingUpdateRequest(4))
                .exchange()
                .expectStatus().isOk();
            client.put().uri(BASE + "/config/consensus-threshold")
                .header(CALLER_HEADER, ADMIN)
                .bodyValue(new SettingUpdateRequest(11))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errorCode").isEqualTo(114);

            client.get().uri(BASE + "/config").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.consensusThreshold").isEqualTo(4)
                .jsonPath("$.adminId").isEqualTo(ADMIN);
        }

        @Test
        @DisplayName("staleness window and quota setters update the configuration")
        void otherSettings() {
            client.put().uri(BASE + "/config/staleness-window")
                .header(CALLER_HEADER, ADMIN)
                .bodyValue(new SettingUpdateRequest(60))
                .exchange()
                .expectStatus().isOk();
            client.put().uri(BASE + "/config/max-submissions")
                .header(CALLER_HEADER, ADMIN)
                .bodyValue(new SettingUpdateRequest(9))
                .exchange()
                .expectStatus().isOk();

            client.get().uri(BASE + "/config").exchange()
                .expectBody()
                .jsonPath("$.stalenessWindow").isEqualTo(60)
                .jsonPath("$.maxSubmissionsPerOracle").isEqualTo(9);
        }
    }

    @Test
    @DisplayName("health endpoint")
    void health() {
        client.get().uri(BASE + "/health").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
