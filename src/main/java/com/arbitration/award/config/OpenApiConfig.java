package com.arbitration.award.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI awardIntegrityOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Award Integrity API")
                        .version("1.0.0")
                        .description(
                                "Human review, finalization and audit integrity for AI-drafted arbitration awards.\n\n" +
                                "**Review Workflow:**\n" +
                                "1. Register the generated draft via `POST /cases/{caseId}/draft-award` (revision 1)\n" +
                                "2. Reviewer acts: **approve**, **modify** (new revision), **reject** (back to analysis) " +
                                "or **escalate** (senior reviewer assignment)\n" +
                                "3. Check `GET /cases/{caseId}/award/can-issue`\n" +
                                "4. Finalize via `POST /cases/{caseId}/award`: reference number, render, sign, " +
                                "timestamp, store, persist, notify parties\n\n" +
                                "**Integrity:**\n" +
                                "- Every state change is appended to a SHA-256 hash chain\n" +
                                "- `GET /audit/cases/{caseId}/trail` rebuilds the case timeline with its integrity status\n" +
                                "- `GET /audit/verify` re-verifies the whole chain\n\n" +
                                "**Reference numbers:** `AWD-YYYYMMDD-NNNNN`, sequential per UTC day")
                        .contact(new Contact().name("Award Integrity Team")));
    }
}
