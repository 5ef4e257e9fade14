package com.arbitration.award.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Every action that can be recorded in the audit chain, with the human-readable description
 * and timeline category used by case audit trails.
 */
public enum AuditAction {

    // User
    USER_REGISTERED("User account created", AuditCategory.USER),
    USER_LOGIN("User logged in", AuditCategory.USER),
    USER_LOGOUT("User logged out", AuditCategory.USER),
    USER_PROFILE_UPDATED("User profile updated", AuditCategory.USER),
    KYC_INITIATED("Identity verification initiated", AuditCategory.USER),
    KYC_COMPLETED("Identity verification completed", AuditCategory.USER),
    KYC_FAILED("Identity verification failed", AuditCategory.USER),

    // Case lifecycle
    CASE_CREATED("Case filed", AuditCategory.CASE_LIFECYCLE),
    CASE_UPDATED("Case details updated", AuditCategory.CASE_LIFECYCLE),
    CASE_STATUS_CHANGED("Case status changed", AuditCategory.CASE_LIFECYCLE),
    CASE_CLOSED("Case closed", AuditCategory.CASE_LIFECYCLE),
    INVITATION_SENT("Respondent invitation sent", AuditCategory.CASE_LIFECYCLE),
    INVITATION_VIEWED("Respondent viewed invitation", AuditCategory.CASE_LIFECYCLE),
    INVITATION_ACCEPTED("Respondent accepted invitation", AuditCategory.CASE_LIFECYCLE),
    INVITATION_EXPIRED("Invitation expired", AuditCategory.CASE_LIFECYCLE),

    // Agreement
    AGREEMENT_VIEWED("Arbitration agreement viewed", AuditCategory.AGREEMENT),
    AGREEMENT_SIGNED("Arbitration agreement signed", AuditCategory.AGREEMENT),

    // Evidence
    EVIDENCE_UPLOADED("Evidence file uploaded", AuditCategory.EVIDENCE),
    EVIDENCE_VIEWED("Evidence file viewed", AuditCategory.EVIDENCE),
    EVIDENCE_DELETED("Evidence file deleted", AuditCategory.EVIDENCE),

    // Statements
    STATEMENT_SUBMITTED("Statement submitted", AuditCategory.STATEMENTS),
    STATEMENT_UPDATED("Statement updated", AuditCategory.STATEMENTS),

    // Analysis
    ANALYSIS_INITIATED("AI analysis initiated", AuditCategory.ANALYSIS),
    ANALYSIS_COMPLETED("AI analysis completed", AuditCategory.ANALYSIS),
    ANALYSIS_FAILED("AI analysis failed", AuditCategory.ANALYSIS),

    // Arbitration
    CASE_ASSIGNED("Arbitrator assigned to case", AuditCategory.ARBITRATION),
    REVIEW_STARTED("Arbitrator review started", AuditCategory.ARBITRATION),
    REVIEW_COMPLETED("Arbitrator review completed", AuditCategory.ARBITRATION),
    DRAFT_AWARD_GENERATED("Draft award generated", AuditCategory.ARBITRATION),
    DRAFT_AWARD_MODIFIED("Draft award modified", AuditCategory.ARBITRATION),
    DRAFT_AWARD_APPROVED("Draft award approved", AuditCategory.ARBITRATION),
    DRAFT_AWARD_REJECTED("Draft award rejected", AuditCategory.ARBITRATION),
    DRAFT_AWARD_ESCALATED("Case escalated for senior review", AuditCategory.ARBITRATION),
    ESCALATION_ASSIGNED("Escalation assigned to senior arbitrator", AuditCategory.ARBITRATION),
    ESCALATION_RESOLVED("Escalation resolved", AuditCategory.ARBITRATION),
    ESCALATION_RETURNED("Escalation returned to reviewing arbitrator", AuditCategory.ARBITRATION),

    // Award
    AWARD_SIGNED("Award signed by arbitrator", AuditCategory.AWARD),
    AWARD_ISSUED("Award issued to parties", AuditCategory.AWARD),
    AWARD_DOWNLOADED("Award document downloaded", AuditCategory.AWARD),
    AWARD_VERIFIED("Award signature and document hash verified", AuditCategory.AWARD),
    ENFORCEMENT_PACKAGE_DOWNLOADED("Enforcement package downloaded", AuditCategory.AWARD),

    // Arbitrator management
    ARBITRATOR_ONBOARDED("Arbitrator completed onboarding", AuditCategory.USER),
    ARBITRATOR_CREDENTIALS_SUBMITTED("Arbitrator credentials submitted", AuditCategory.USER),
    ARBITRATOR_CREDENTIALS_VERIFIED("Arbitrator credentials verified", AuditCategory.USER),
    ARBITRATOR_CREDENTIALS_REJECTED("Arbitrator credentials rejected", AuditCategory.USER),
    ARBITRATOR_ACTIVATED("Arbitrator activated", AuditCategory.USER),
    ARBITRATOR_DEACTIVATED("Arbitrator deactivated", AuditCategory.USER),

    // Compensation and payment
    COMPENSATION_CALCULATED("Arbitrator compensation calculated", AuditCategory.PAYMENT),
    COMPENSATION_APPROVED("Compensation approved for payout", AuditCategory.PAYMENT),
    COMPENSATION_PAID("Compensation paid to arbitrator", AuditCategory.PAYMENT),
    COMPENSATION_DISPUTED("Compensation disputed", AuditCategory.PAYMENT),
    PAYMENT_INITIATED("Payment initiated", AuditCategory.PAYMENT),
    PAYMENT_COMPLETED("Payment completed", AuditCategory.PAYMENT),
    PAYMENT_FAILED("Payment failed", AuditCategory.PAYMENT),
    REFUND_ISSUED("Refund issued", AuditCategory.PAYMENT),

    // Compliance
    AUDIT_LOG_EXPORTED("Audit logs exported", AuditCategory.CASE_LIFECYCLE),
    AUDIT_LOG_VERIFIED("Audit log integrity verified", AuditCategory.CASE_LIFECYCLE),
    COMPLIANCE_REPORT_GENERATED("Compliance report generated", AuditCategory.CASE_LIFECYCLE);

    private static final Set<AuditAction> MILESTONES = EnumSet.of(
            CASE_CREATED,
            INVITATION_ACCEPTED,
            AGREEMENT_SIGNED,
            CASE_ASSIGNED,
            ANALYSIS_COMPLETED,
            DRAFT_AWARD_APPROVED,
            AWARD_ISSUED,
            CASE_CLOSED);

    private final String description;
    private final AuditCategory category;

    AuditAction(String description, AuditCategory category) {
        this.description = description;
        this.category = category;
    }

    public String getDescription() {
        return description;
    }

    public AuditCategory getCategory() {
        return category;
    }

    public boolean isMilestone() {
        return MILESTONES.contains(this);
    }
}
