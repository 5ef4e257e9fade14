package com.arbitration.award.service;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.model.ArbitratorProfile;
import com.arbitration.award.model.CaseRecord;
import com.arbitration.award.model.UserAccount;
import com.arbitration.award.model.UserRole;
import com.arbitration.award.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the senior reviewer for an escalated draft.
 *
 * <p>Eligible: active arbitrators flagged as senior reviewers with at least
 * {@code award.escalation.min-years-experience} years, excluding the case's own arbitrator and
 * the person escalating. Highest completed-case count wins; ties go to the lowest user id.
 */
@Component
public class EscalationAssignor {

    private static final Logger log = LoggerFactory.getLogger(EscalationAssignor.class);

    private static final Comparator<UserAccount> PREFERENCE =
            Comparator.comparingInt((UserAccount u) -> u.getArbitratorProfile().getCasesCompleted()).reversed()
                    .thenComparing(UserAccount::getUserId);

    private final UserRepository userRepository;
    private final int minYearsExperience;

    public EscalationAssignor(UserRepository userRepository, AwardConfig awardConfig) {
        this.userRepository = userRepository;
        this.minYearsExperience = awardConfig.getEscalation().getMinYearsExperience();
    }

    public Optional<UserAccount> selectReviewer(CaseRecord caseRecord, String escalatingUserId) {
        List<UserAccount> arbitrators = userRepository.findArbitrators();

        Optional<UserAccount> selected = arbitrators.stream()
                .filter(u -> isEligible(u, caseRecord, escalatingUserId))
                .min(PREFERENCE);

        if (selected.isPresent()) {
            log.info("Selected senior reviewer {} for case {} out of {} arbitrators",
                    selected.get().getUserId(), caseRecord.getCaseId(), arbitrators.size());
        } else {
            log.warn("No eligible senior reviewer for case {} ({} arbitrators considered)",
                    caseRecord.getCaseId(), arbitrators.size());
        }
        return selected;
    }

    private boolean isEligible(UserAccount user, CaseRecord caseRecord, String escalatingUserId) {
        ArbitratorProfile profile = user.getArbitratorProfile();
        return user.getRole() == UserRole.ARBITRATOR
                && profile != null
                && profile.isActive()
                && profile.isSeniorReviewer()
                && profile.getYearsExperience() >= minYearsExperience
                && !Objects.equals(user.getUserId(), caseRecord.getAssignedArbitratorId())
                && !Objects.equals(user.getUserId(), escalatingUserId);
    }
}
