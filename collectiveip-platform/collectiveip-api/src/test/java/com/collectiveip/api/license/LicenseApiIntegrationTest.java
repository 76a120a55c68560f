package com.collectiveip.api.license;

import com.collectiveip.api.support.ApiIntegrationSupport;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LicenseApiIntegrationTest extends ApiIntegrationSupport {

    private long createLicense(long assetId, String type, long fee) {
        ResponseEntity<Map> response = post("/licenses", OWNER_1, offer(assetId, type, fee, 500));
        assertThat(response.getStatusCode().value()).isEqualTo(201);
        return number(response.getBody(), "licenseId");
    }

    private long activeLicense(long assetId) {
        long licenseId = createLicense(assetId, "NON_EXCLUSIVE", 0);
        assertThat(post("/licenses/" + licenseId + "/execution", LICENSEE, null).getStatusCode().value()).isEqualTo(200);
        return licenseId;
    }

    private String status(long licenseId) {
        return (String) get("/licenses/" + licenseId + "/status").getBody().get("status");
    }

    private long pending(long assetId, String owner) {
        return number(get("/assets/" + assetId + "/revenue/earnings/" + owner + "?currency=" + CURRENCY).getBody(),
                "pending");
    }

    @Test
    void feeAndRoyalties_shouldBeRoutedToOwnersByPercentage() {
        long assetId = registerAsset();
        long licenseId = createLicense(assetId, "NON_EXCLUSIVE", 500);
        assertThat(status(licenseId)).isEqualTo("INACTIVE");

        fund(LICENSEE, 500);
        ResponseEntity<Map> executed = post("/licenses/" + licenseId + "/execution", LICENSEE, null);
        assertThat(executed.getStatusCode().value()).isEqualTo(200);
        assertThat(executed.getBody().get("status")).isEqualTo("ACTIVE");
        assertThat(pending(assetId, OWNER_1)).isEqualTo(300);
        assertThat(pending(assetId, OWNER_2)).isEqualTo(150);
        assertThat(pending(assetId, OWNER_3)).isEqualTo(50);

        ResponseEntity<Map> reported = post("/licenses/" + licenseId + "/usage", LICENSEE,
                Map.of("revenue", 10_000, "usageCount", 3));
        Map<?, ?> royalties = (Map<?, ?>) reported.getBody().get("royalties");
        assertThat(number(royalties, "due")).isEqualTo(500);
        assertThat(number(reported.getBody(), "usageCount")).isEqualTo(3);

        fund(LICENSEE, 500);
        ResponseEntity<Map> paid = post("/licenses/" + licenseId + "/royalties", LICENSEE, Map.of("amount", 500));
        assertThat(number((Map<?, ?>) paid.getBody().get("royalties"), "due")).isZero();
        assertThat(pending(assetId, OWNER_1)).isEqualTo(600);
    }

    @Test
    void exclusiveOffer_shouldWaitForOwnerApproval() {
        long assetId = registerAsset();
        long licenseId = createLicense(assetId, "EXCLUSIVE", 0);
        assertThat(status(licenseId)).isEqualTo("PENDING_APPROVAL");

        ResponseEntity<Map> early = post("/licenses/" + licenseId + "/execution", LICENSEE, null);
        assertThat(early.getStatusCode().value()).isEqualTo(409);
        assertThat(errorCode(early)).isEqualTo("LICENSE_NOT_APPROVED");

        ResponseEntity<Map> approved = post("/licenses/" + licenseId + "/approval", OWNER_2, Map.of("approve", true));
        assertThat(approved.getBody().get("status")).isEqualTo("INACTIVE");

        assertThat(post("/licenses/" + licenseId + "/execution", LICENSEE, null).getBody().get("status"))
                .isEqualTo("ACTIVE");
    }

    @Test
    void rejectedOffer_shouldStayRejected() {
        long assetId = registerAsset();
        long licenseId = createLicense(assetId, "SOLE_EXCLUSIVE", 0);

        post("/licenses/" + licenseId + "/approval", OWNER_3, Map.of("approve", false));
        ResponseEntity<Map> again = post("/licenses/" + licenseId + "/approval", OWNER_1, Map.of("approve", true));

        assertThat(status(licenseId)).isEqualTo("REJECTED");
        assertThat(again.getStatusCode().value()).isEqualTo(409);
        assertThat(errorCode(again)).isEqualTo("APPROVAL_ALREADY_RESOLVED");
    }

    @Test
    void suspendedLicense_shouldReactivateOnceSuspensionElapsed() {
        long assetId = registerAsset();
        long licenseId = activeLicense(assetId);

        ResponseEntity<Map> suspended = post("/licenses/" + licenseId + "/suspension", OWNER_1,
                Map.of("durationSeconds", 3600));
        assertThat(suspended.getBody().get("status")).isEqualTo("SUSPENDED");

        ResponseEntity<Map> early = post("/licenses/" + licenseId + "/reactivation", OUTSIDER, null);
        assertThat(early.getStatusCode().value()).isEqualTo(409);
        assertThat(errorCode(early)).isEqualTo("SUSPENSION_NOT_ELAPSED");

        clock.advance(Duration.ofHours(1));
        assertThat(status(licenseId)).isEqualTo("SUSPENSION_EXPIRED");

        ResponseEntity<Map> reactivated = post("/licenses/" + licenseId + "/reactivation", OUTSIDER, null);
        assertThat(reactivated.getStatusCode().value()).isEqualTo(200);
        assertThat(reactivated.getBody().get("status")).isEqualTo("ACTIVE");
    }

    @Test
    void manualReactivation_shouldLiftSuspensionEarly() {
        long assetId = registerAsset();
        long licenseId = activeLicense(assetId);
        post("/licenses/" + licenseId + "/suspension", OWNER_1, Map.of("durationSeconds", 86_400));

        ResponseEntity<Map> response = post("/licenses/" + licenseId + "/manual-reactivation", OWNER_2, null);

        assertThat(response.getBody().get("status")).isEqualTo("ACTIVE");
    }

    @Test
    void overflowingSuspension_shouldReturn400AndKeepLicenseActive() {
        long assetId = registerAsset();
        long licenseId = activeLicense(assetId);

        ResponseEntity<Map> response = post("/licenses/" + licenseId + "/suspension", OWNER_1,
                Map.of("durationSeconds", Long.MAX_VALUE));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(errorCode(response)).isEqualTo("INVALID_DURATION");
        assertThat(status(licenseId)).isEqualTo("ACTIVE");
        ResponseEntity<Map> reactivated = post("/licenses/" + licenseId + "/reactivation", LICENSEE, null);
        assertThat(reactivated.getStatusCode().value()).isEqualTo(409);
        assertThat(errorCode(reactivated)).isEqualTo("LICENSE_NOT_SUSPENDED");
    }

    @Test
    void revokedLicense_shouldRejectUsageReports() {
        long assetId = registerAsset();
        long licenseId = activeLicense(assetId);

        ResponseEntity<Map> revoked = post("/licenses/" + licenseId + "/revocation", OWNER_1, Map.of("reason", "breach"));
        assertThat(revoked.getBody().get("status")).isEqualTo("REVOKED");
        assertThat(revoked.getBody().get("revocationReason")).isEqualTo("breach");

        ResponseEntity<Map> usage = post("/licenses/" + licenseId + "/usage", LICENSEE,
                Map.of("revenue", 100, "usageCount", 1));
        assertThat(usage.getStatusCode().value()).isEqualTo(409);
        assertThat(errorCode(usage)).isEqualTo("LICENSE_REVOKED");
    }

    @Test
    void transfer_shouldMoveLicenseAndRoyaltyObligation() {
        long assetId = registerAsset();
        long licenseId = activeLicense(assetId);

        ResponseEntity<Map> response = post("/licenses/" + licenseId + "/transfer", LICENSEE,
                Map.of("newLicensee", OUTSIDER));

        assertThat(response.getBody().get("licensee")).isEqualTo(OUTSIDER);
        assertThat(((Map<?, ?>) response.getBody().get("royalties")).get("holder")).isEqualTo(OUTSIDER);

        ResponseEntity<Map> formerLicensee = post("/licenses/" + licenseId + "/usage", LICENSEE,
                Map.of("revenue", 100, "usageCount", 1));
        assertThat(formerLicensee.getStatusCode().value()).isEqualTo(403);
        assertThat(errorCode(formerLicensee)).isEqualTo("NOT_LICENSEE");
    }

    @Test
    void unknownLicense_shouldReportNotFound() {
        assertThat(status(999_999)).isEqualTo("NOT_FOUND");
        assertThat(get("/licenses/999999").getStatusCode().value()).isEqualTo(404);

        ResponseEntity<Map> approval = post("/licenses/999999/approval", OWNER_1, Map.of("approve", true));
        assertThat(approval.getStatusCode().value()).isEqualTo(409);
        assertThat(errorCode(approval)).isEqualTo("LICENSE_NOT_FOUND");
    }

    @Test
    void offerToOneself_shouldReturn400() {
        long assetId = registerAsset();
        Map<String, Object> body = new HashMap<>(offer(assetId, "NON_EXCLUSIVE", 0, 500));
        body.put("licensee", OWNER_1);

        ResponseEntity<Map> response = post("/licenses", OWNER_1, body);

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(errorCode(response)).isEqualTo("LICENSEE_IS_LICENSOR");
    }

    @Test
    void offerWithRoyaltyAboveFullRate_shouldFailBodyValidation() {
        long assetId = registerAsset();

        ResponseEntity<Map> response = post("/licenses", OWNER_1, offer(assetId, "NON_EXCLUSIVE", 0, 20_000));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(errorCode(response)).isEqualTo("INVALID_REQUEST");
    }

    @Test
    void licensesOfAsset_shouldListEveryOffer() {
        long assetId = registerAsset();
        createLicense(assetId, "NON_EXCLUSIVE", 0);
        createLicense(assetId, "EXCLUSIVE", 0);

        assertThat(getList("/licenses?assetId=" + assetId).getBody()).hasSize(2);
    }
}
