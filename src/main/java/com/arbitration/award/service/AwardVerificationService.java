package com.arbitration.award.service;

import com.arbitration.award.exception.ExternalServiceException;
import com.arbitration.award.gateway.DocumentStorage;
import com.arbitration.award.model.AuditAction;
import com.arbitration.award.model.Award;
import com.arbitration.award.model.AwardVerification;
import com.arbitration.award.signing.Digests;
import com.arbitration.award.signing.DocumentSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.GeneralSecurityException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Re-checks an issued award against its stored document: the stored bytes must still hash to
 * the recorded document hash, and the recorded signature must verify under the signer's key.
 */
@Service
public class AwardVerificationService {

    private static final Logger log = LoggerFactory.getLogger(AwardVerificationService.class);

    private final AwardFinalizationService finalizationService;
    private final DocumentStorage documentStorage;
    private final DocumentSigner documentSigner;
    private final AuditChainService auditChainService;

    public AwardVerificationService(AwardFinalizationService finalizationService,
                                    DocumentStorage documentStorage,
                                    DocumentSigner documentSigner,
                                    AuditChainService auditChainService) {
        this.finalizationService = finalizationService;
        this.documentStorage = documentStorage;
        this.documentSigner = documentSigner;
        this.auditChainService = auditChainService;
    }

    public AwardVerification verify(String caseId, String userId) {
        Award award = finalizationService.getIssuedAward(caseId);
        byte[] document = documentStorage.fetch(award.getDocumentUrl());

        String actualHash = Digests.sha256Hex(document);
        boolean hashMatches = actualHash.equals(award.getDocumentHash());

        boolean signatureValid;
        try {
            signatureValid = documentSigner.verify(document, award.getSignatureValue(),
                    award.getSignatureAlgorithm(), award.getSignerPublicKey());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new ExternalServiceException("signing",
                    "Could not verify signature of award " + award.getReferenceNumber() + ": " + e.getMessage(), e);
        }

        AwardVerification result = new AwardVerification(award.getId(), award.getReferenceNumber(),
                hashMatches && signatureValid, hashMatches, signatureValid, award.getDocumentHash(), actualHash,
                award.isTimestampGranted(), award.getTimestampTime());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("awardId", award.getId());
        metadata.put("referenceNumber", award.getReferenceNumber());
        metadata.put("hashMatches", hashMatches);
        metadata.put("signatureValid", signatureValid);
        auditChainService.append(AuditAction.AWARD_VERIFIED, userId, caseId, metadata);

        if (!result.valid()) {
            log.warn("Award {} failed verification: hashMatches={}, signatureValid={}",
                    award.getReferenceNumber(), hashMatches, signatureValid);
        }
        return result;
    }
}
