package com.arbitration.award.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Signed, issued award. At most one per case, never modified after issuance except for notification stamps.")
public class Award {
    private String id;
    private String caseId;

    @Schema(example = "AWD-20260115-00001")
    private String referenceNumber;

    private AwardContent content;
    private String arbitratorId;
    private long signedAt;
    private long issuedAt;

    // Signature over the rendered document bytes
    private String signatureValue;          // Base64
    private String signatureAlgorithm;
    private String certificateFingerprint;  // SHA-256 hex of the DER certificate
    private String signerPublicKey;         // Base64 X.509 SubjectPublicKeyInfo

    // RFC 3161 timestamp, present only when the authority granted one
    private String timestampToken;          // Base64 DER
    private boolean timestampGranted;
    private Long timestampTime;
    private String timestampAuthority;

    private String documentUrl;
    private String documentHash;            // SHA-256 hex of the stored document

    private Long claimantNotifiedAt;
    private Long respondentNotifiedAt;
}
