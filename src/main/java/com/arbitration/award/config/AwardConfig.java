package com.arbitration.award.config;

import com.arbitration.award.model.CaseStatus;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "award")
public class AwardConfig {

    private Issuance issuance = new Issuance();

    private Escalation escalation = new Escalation();

    private Signing signing = new Signing();

    private Timestamp timestamp = new Timestamp();

    private Storage storage = new Storage();

    private Audit audit = new Audit();

    @Data
    public static class Issuance {
        private String referencePrefix = "AWD";
        // Case statuses from which an approved draft may be finalized.
        // DECIDED is included because approval already advances the case.
        private List<CaseStatus> allowedCaseStatuses = List.of(CaseStatus.ARBITRATOR_REVIEW, CaseStatus.DECIDED);
        private String jurisdictionDefault = "US-CA";
    }

    @Data
    public static class Escalation {
        private int minYearsExperience = 10;
        private boolean sweepEnabled = true;
        private int sweepIntervalSeconds = 300;
    }

    @Data
    public static class Signing {
        private String keystorePath;
        private String keystorePassword;
        private String keystoreType = "PKCS12";
        // Alias used when an arbitrator has no dedicated key entry. Blank disables the fallback.
        private String defaultAlias;
        private String algorithm = "SHA256withRSA";
    }

    @Data
    public static class Timestamp {
        private boolean enabled = false;
        private String url = "http://timestamp.digicert.com";
        private String authorityName = "DigiCert";
        private int connectTimeoutMs = 3000;
        private int readTimeoutMs = 5000;
    }

    @Data
    public static class Storage {
        private String baseDir = "./data/documents";
        private String publicBaseUrl = "file://";
    }

    @Data
    public static class Audit {
        private int appendMaxAttempts = 16;
        private int exportMaxEntries = 10000;
        // Refuse to finalize when the case's audit entries no longer verify.
        private boolean verifyBeforeFinalize = true;
    }
}
