package com.arbitration.award.gateway;

import com.arbitration.award.model.AwardContent;
import com.arbitration.award.model.ConclusionOfLaw;
import com.arbitration.award.model.FindingOfFact;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Plain-text rendition of an award, one section per block.
 */
@Component
public class TextAwardDocumentRenderer implements AwardDocumentRenderer {

    private static final DateTimeFormatter DATE =
            DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US).withZone(ZoneOffset.UTC);

    @Override
    public String contentType() {
        return "text/plain";
    }

    @Override
    public byte[] render(AwardDocumentRequest request) {
        AwardContent content = request.content();
        StringBuilder sb = new StringBuilder();

        sb.append("FINAL ARBITRATION AWARD\n");
        sb.append("Reference: ").append(request.referenceNumber()).append('\n');
        sb.append("Case: ").append(request.caseRecord().getReferenceNumber()).append('\n');
        if (request.caseRecord().getTitle() != null) {
            sb.append("Matter: ").append(request.caseRecord().getTitle()).append('\n');
        }
        sb.append("Jurisdiction: ").append(request.caseRecord().getJurisdiction()).append('\n');
        sb.append("Date of Award: ").append(DATE.format(Instant.ofEpochMilli(request.issuedAt()))).append("\n\n");

        sb.append("FINDINGS OF FACT\n");
        for (FindingOfFact f : content.getFindingsOfFact()) {
            sb.append(f.getNumber()).append(". ").append(f.getFinding());
            if (f.getBasis() != null) {
                sb.append(" [").append(f.getBasis().name().toLowerCase()).append(']');
            }
            sb.append('\n');
        }

        sb.append("\nCONCLUSIONS OF LAW\n");
        for (ConclusionOfLaw c : content.getConclusionsOfLaw()) {
            sb.append(c.getNumber()).append(". ").append(c.getIssue()).append(": ").append(c.getConclusion());
            if (c.getLegalBasis() != null && !c.getLegalBasis().isEmpty()) {
                sb.append(" (").append(String.join("; ", c.getLegalBasis())).append(')');
            }
            sb.append('\n');
        }

        sb.append("\nDECISION\n").append(content.getDecision()).append('\n');
        if (content.getAwardAmount() != null) {
            sb.append("\nAmount Awarded: $").append(formatAmount(content.getAwardAmount())).append('\n');
        }
        if (content.getPrevailingParty() != null) {
            sb.append("Prevailing Party: ").append(content.getPrevailingParty().name()).append('\n');
        }
        if (content.getReasoning() != null) {
            sb.append("\nREASONING\n").append(content.getReasoning()).append('\n');
        }

        sb.append("\nArbitrator: ").append(request.arbitratorName()).append('\n');
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String formatAmount(BigDecimal amount) {
        return String.format(Locale.US, "%,.2f", amount.setScale(2, RoundingMode.HALF_UP));
    }
}
