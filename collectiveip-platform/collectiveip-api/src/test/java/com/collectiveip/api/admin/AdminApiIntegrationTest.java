package com.collectiveip.api.admin;

import com.collectiveip.api.support.ApiIntegrationSupport;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AdminApiIntegrationTest extends ApiIntegrationSupport {

    @Test
    void pause_byAdministrator_shouldLeaveReadsAvailable() {
        long assetId = registerAsset();
        try {
            ResponseEntity<Map> paused = post("/admin/pause", ADMIN, null);
            assertThat(paused.getBody().get("paused")).isEqualTo(true);

            assertThat(get("/assets/" + assetId).getStatusCode().value()).isEqualTo(200);
            ResponseEntity<Map> mutation = post("/assets/" + assetId + "/supply", OWNER_1, Map.of("amount", 10));
            assertThat(errorCode(mutation)).isEqualTo("SYSTEM_PAUSED");
        } finally {
            post("/admin/unpause", ADMIN, null);
        }
    }

    @Test
    void pause_byOwner_shouldReturn403() {
        ResponseEntity<Map> response = post("/admin/pause", OWNER_1, null);

        assertThat(response.getStatusCode().value()).isEqualTo(403);
        assertThat(errorCode(response)).isEqualTo("NOT_ADMINISTRATOR");
        assertThat(get("/admin/status").getBody().get("paused")).isEqualTo(false);
    }

    @Test
    void unpause_whenNotPaused_shouldReturn409() {
        ResponseEntity<Map> response = post("/admin/unpause", ADMIN, null);

        assertThat(response.getStatusCode().value()).isEqualTo(409);
        assertThat(errorCode(response)).isEqualTo("SYSTEM_NOT_PAUSED");
    }

    @Test
    void mint_byNonAdministrator_shouldReturn403() {
        ResponseEntity<Map> response = post("/tokens/" + CURRENCY + "/mints", OWNER_1,
                Map.of("recipient", OWNER_1, "amount", 100));

        assertThat(response.getStatusCode().value()).isEqualTo(403);
    }

    @Test
    void approval_shouldReportPoolAllowance() {
        ResponseEntity<Map> response = post("/tokens/" + CURRENCY + "/approvals", OWNER_3, Map.of("amount", 75));

        assertThat(number(response.getBody(), "poolAllowance")).isEqualTo(75);
        assertThat(response.getBody().get("holder")).isEqualTo(OWNER_3);
    }
}
