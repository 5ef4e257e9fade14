package com.arbitration.award.engine.stages;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.engine.FinalizationContext;
import com.arbitration.award.engine.FinalizationStage;
import com.arbitration.award.engine.StageFailurePolicy;
import com.arbitration.award.repository.AwardRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Reference numbers look like {@code AWD-20260115-00001}: UTC issue day plus a per-day sequence
 * from an atomic counter. An aborted finalization burns its number, so gaps are possible but
 * duplicates are not.
 */
@Component
@Order(1)
public class AllocateReferenceStage implements FinalizationStage {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final AwardRepository awardRepository;
    private final String prefix;

    public AllocateReferenceStage(AwardRepository awardRepository, AwardConfig awardConfig) {
        this.awardRepository = awardRepository;
        this.prefix = awardConfig.getIssuance().getReferencePrefix();
    }

    @Override
    public String name() {
        return "allocate-reference";
    }

    @Override
    public StageFailurePolicy failurePolicy() {
        return StageFailurePolicy.ABORT;
    }

    @Override
    public void execute(FinalizationContext context) {
        String day = DAY.format(Instant.ofEpochMilli(context.getIssuedAt()));
        long sequence = awardRepository.nextDailySequence(day);
        context.setReferenceNumber(formatReference(prefix, day, sequence));
    }

    static String formatReference(String prefix, String day, long sequence) {
        return String.format("%s-%s-%05d", prefix, day, sequence);
    }
}
