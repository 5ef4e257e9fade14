package com.arbitration.award.service;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.model.AwardEscalation;
import com.arbitration.award.model.EscalationStatus;
import com.arbitration.award.repository.EscalationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Background job that retries reviewer assignment for escalations left PENDING because no senior
 * reviewer was available at the time.
 */
@Service
public class EscalationSweepService {

    private static final Logger log = LoggerFactory.getLogger(EscalationSweepService.class);

    private final EscalationRepository escalationRepository;
    private final EscalationService escalationService;
    private final AwardConfig awardConfig;

    public EscalationSweepService(EscalationRepository escalationRepository,
                                  EscalationService escalationService,
                                  AwardConfig awardConfig) {
        this.escalationRepository = escalationRepository;
        this.escalationService = escalationService;
        this.awardConfig = awardConfig;
    }

    @Scheduled(fixedRateString = "${award.escalation.sweep-interval-seconds:300}",
               timeUnit = TimeUnit.SECONDS, initialDelayString = "60")
    public void sweepPendingEscalations() {
        if (!awardConfig.getEscalation().isSweepEnabled()) {
            return;
        }

        try {
            int assigned = assignPending();
            if (assigned > 0) {
                log.info("Escalation sweep: assigned {} pending escalations", assigned);
            }
        } catch (Exception e) {
            log.error("Error during escalation sweep: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of escalations that moved to ASSIGNED
     */
    public int assignPending() {
        List<AwardEscalation> pending = escalationRepository.findByStatus(EscalationStatus.PENDING);
        int assigned = 0;
        for (AwardEscalation escalation : pending) {
            try {
                AwardEscalation result = escalationService.tryAssign(escalation);
                if (result.getStatus() == EscalationStatus.ASSIGNED) {
                    assigned++;
                }
            } catch (Exception e) {
                log.warn("Failed to assign escalation {}: {}", escalation.getId(), e.getMessage());
            }
        }
        return assigned;
    }
}
