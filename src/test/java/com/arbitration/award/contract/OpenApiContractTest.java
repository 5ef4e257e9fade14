package com.arbitration.award.contract;

import com.arbitration.award.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published OpenAPI document against accidental drift of paths and schemas.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        DocumentContext json = apiDocs();
        Map<String, Object> paths = json.read("$.paths");

        // Draft review
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/draft-award");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/draft-award/approve");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/draft-award/modify");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/draft-award/reject");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/draft-award/escalate");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/draft-award/escalation");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/draft-award/revisions");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/draft-award/revisions/{version}");

        // Escalations
        assertThat(paths).containsKey("/api/v1/escalations/{escalationId}/resolve");
        assertThat(paths).containsKey("/api/v1/escalations/{escalationId}/return");
        assertThat(paths).containsKey("/api/v1/escalations/assign-pending");

        // Awards
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/award");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/award/can-issue");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/award/download");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/award/verify");

        // Audit
        assertThat(paths).containsKey("/api/v1/audit/cases/{caseId}/trail");
        assertThat(paths).containsKey("/api/v1/audit/cases/{caseId}/trail/export");
        assertThat(paths).containsKey("/api/v1/audit/cases/summary");
        assertThat(paths).containsKey("/api/v1/audit/verify");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKeys(
                "DraftAward", "AwardModification", "RejectionFeedback", "EscalationRequest",
                "AwardEscalation", "FinalizationResult", "Award", "AwardVerification",
                "CaseAuditTrail", "ChainVerification");
    }

    @Test
    void finalizationResult_exposesSignatureAndTimestampFields() {
        Map<String, Object> properties = apiDocs().read("$.components.schemas.FinalizationResult.properties");

        assertThat(properties).containsKeys("referenceNumber", "documentHash", "signatureAlgorithm",
                "certificateFingerprint", "timestampGranted", "claimantNotified", "respondentNotified");
    }

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        return JsonPath.parse(response.getBody());
    }
}
