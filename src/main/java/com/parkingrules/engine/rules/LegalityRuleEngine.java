package com.parkingrules.engine.rules;

import com.parkingrules.engine.model.LegalityResult;
import com.parkingrules.engine.model.LegalityStatus;
import com.parkingrules.engine.model.MatchConfidence;
import com.parkingrules.engine.model.MeterSchedule;
import com.parkingrules.engine.model.Rule;
import com.parkingrules.engine.model.RuleKind;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.model.UpcomingRestriction;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates whether a stay on one segment side is legal.
 *
 * Flow:
 * 1. Stay is {@code [checkTime, checkTime + duration)}
 * 2. Keep the rules whose schedule intersects the stay at all (partial overlap counts); with
 *    none left the stay is legal with no restrictions
 * 3. Any hard blocker (tow-away, sweeping, no-parking) makes the stay illegal
 * 4. Every duration-constrained rule (RPP visitor allowance, time limit) must admit the
 *    duration; the smallest limit exceeded is reported
 * 5. Otherwise legal, with limit notes and the meter cost of the stay
 *
 * Limits are inclusive: a stay exactly as long as the limit is legal.
 *
 * A pure function of its arguments: no caching, no state, safe for concurrent readers.
 */
@RequiredArgsConstructor
public class LegalityRuleEngine {

    public static final String NO_RESTRICTIONS = "No restrictions found for this segment.";

    private static final Comparator<Rule> BLOCKER_ORDER = Comparator
        .comparing(Rule::kind)
        .thenComparing(Rule::description);

    private final RuleEngineSettings settings;
    private final VisitorAllowanceParser visitorAllowanceParser;

    public LegalityRuleEngine() {
        this(RuleEngineSettings.defaults(), new VisitorAllowanceParser());
    }

    public LegalityResult evaluate(StreetSegment segment, LocalDateTime checkTime, int durationMinutes) {
        return evaluate(segment, checkTime, durationMinutes, InterpretationLookup.NONE);
    }

    public LegalityResult evaluate(StreetSegment segment, LocalDateTime checkTime, int durationMinutes,
                                   InterpretationLookup interpretations) {
        if (durationMinutes < 0) {
            throw new IllegalArgumentException("Duration cannot be negative: " + durationMinutes);
        }
        LocalDateTime endTime = checkTime.plusMinutes(durationMinutes);

        if (!segment.hasRules()) {
            return new LegalityResult(LegalityStatus.LEGAL, NO_RESTRICTIONS, null, null, List.of());
        }

        List<Rule> applicable = new ArrayList<>();
        for (Rule rule : segment.rules()) {
            if (rule.schedule().overlaps(checkTime, endTime)) {
                applicable.add(rule);
            }
        }
        List<MeterSchedule> activeMeters = new ArrayList<>();
        for (MeterSchedule meter : segment.meters()) {
            if (meter.schedule().overlaps(checkTime, endTime)) {
                activeMeters.add(meter);
                applicable.add(asRule(meter));
            }
        }

        UpcomingRestriction next = nextRestriction(segment, endTime, interpretations).orElse(null);

        if (applicable.isEmpty()) {
            return new LegalityResult(LegalityStatus.LEGAL, NO_RESTRICTIONS, null, next, applicable);
        }

        Optional<Rule> blocker = applicable.stream()
            .filter(rule -> rule.kind().isHardBlocker())
            .min(BLOCKER_ORDER);
        if (blocker.isPresent()) {
            return new LegalityResult(LegalityStatus.ILLEGAL,
                describe(blocker.get(), interpretations), null, next, applicable);
        }

        List<Constraint> constraints = new ArrayList<>();
        for (Rule rule : applicable) {
            if (rule.kind() == RuleKind.RPP_ZONE) {
                constraints.add(new Constraint(rule, visitorAllowance(rule)));
            } else if (rule.kind() == RuleKind.TIME_LIMIT) {
                int limit = rule.durationLimitMinutes() != null
                    ? rule.durationLimitMinutes()
                    : settings.defaultTimeLimitMinutes();
                constraints.add(new Constraint(rule, limit));
            }
        }

        Optional<Constraint> exceeded = constraints.stream()
            .filter(constraint -> durationMinutes > constraint.limitMinutes())
            .min(Comparator.comparingInt(Constraint::limitMinutes).thenComparing(c -> c.rule().kind()));
        if (exceeded.isPresent()) {
            return new LegalityResult(LegalityStatus.ILLEGAL,
                exceededExplanation(exceeded.get(), interpretations), null, next, applicable);
        }

        BigDecimal cost = meterCost(activeMeters, durationMinutes);
        StringBuilder explanation = new StringBuilder("Parking allowed.");
        constraints.stream()
            .sorted(Comparator.comparingInt(Constraint::limitMinutes).thenComparing(c -> c.rule().kind()))
            .forEach(constraint -> explanation.append(' ').append(limitNote(constraint)));
        if (cost != null) {
            explanation.append(" Meter ")
                .append(formatMoney(maxRate(activeMeters)))
                .append("/hr, estimated ")
                .append(formatMoney(cost))
                .append('.');
        } else if (applicable.stream().anyMatch(rule -> rule.kind() == RuleKind.METER)) {
            explanation.append(" Metered parking.");
        }

        return new LegalityResult(LegalityStatus.LEGAL, explanation.toString(), cost, next, applicable);
    }

    /**
     * Earliest hard blocker starting at or after the end of the stay, within the lookahead.
     */
    Optional<UpcomingRestriction> nextRestriction(StreetSegment segment, LocalDateTime after,
                                                  InterpretationLookup interpretations) {
        UpcomingRestriction best = null;
        for (Rule rule : segment.rules()) {
            if (!rule.kind().isHardBlocker()) {
                continue;
            }
            Optional<LocalDateTime> start = rule.schedule().nextStart(after, settings.lookaheadDays());
            if (start.isEmpty()) {
                continue;
            }
            UpcomingRestriction candidate = new UpcomingRestriction(rule.kind(), start.get(),
                describe(rule, interpretations));
            if (best == null
                || candidate.startsAt().isBefore(best.startsAt())
                || (candidate.startsAt().equals(best.startsAt()) && candidate.kind().compareTo(best.kind()) < 0)) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private int visitorAllowance(Rule rule) {
        return visitorAllowanceParser.parseAllowanceMinutes(rule.description()).orElse(
            rule.durationLimitMinutes() != null
                ? rule.durationLimitMinutes()
                : settings.defaultVisitorAllowanceMinutes());
    }

    private String exceededExplanation(Constraint constraint, InterpretationLookup interpretations) {
        Rule rule = constraint.rule();
        String limit = formatLimit(constraint.limitMinutes());
        if (rule.kind() == RuleKind.RPP_ZONE) {
            String zone = rule.permitZone() != null ? " in permit zone " + rule.permitZone() : "";
            return "Exceeds " + limit + " visitor limit" + zone + ": " + describe(rule, interpretations);
        }
        return "Exceeds " + limit + " time limit: " + describe(rule, interpretations);
    }

    private static String limitNote(Constraint constraint) {
        String limit = formatLimit(constraint.limitMinutes());
        if (constraint.rule().kind() == RuleKind.RPP_ZONE) {
            String zone = constraint.rule().permitZone() != null
                ? " (permit zone " + constraint.rule().permitZone() + ")"
                : "";
            return limit + " visitor limit applies" + zone + ".";
        }
        return limit + " time limit applies.";
    }

    private static String describe(Rule rule, InterpretationLookup interpretations) {
        if (rule.interpretationKey() != null) {
            return interpretations.interpretation(rule.interpretationKey())
                .filter(summary -> summary.isUsable())
                .map(summary -> summary.summary())
                .orElse(rule.description());
        }
        return rule.description();
    }

    private static BigDecimal meterCost(List<MeterSchedule> meters, int durationMinutes) {
        BigDecimal rate = maxRate(meters);
        if (rate == null) {
            return null;
        }
        return rate.multiply(BigDecimal.valueOf(durationMinutes))
            .divide(BigDecimal.valueOf(60), 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal maxRate(List<MeterSchedule> meters) {
        return meters.stream()
            .map(MeterSchedule::ratePerHour)
            .max(Comparator.naturalOrder())
            .orElse(null);
    }

    private static Rule asRule(MeterSchedule meter) {
        return Rule.builder()
            .kind(RuleKind.METER)
            .schedule(meter.schedule())
            .description("Metered parking " + formatMoney(meter.ratePerHour()) + "/hr " + meter.schedule())
            .confidence(MatchConfidence.DIRECT)
            .sourceId("meter:" + meter.centerlineId() + (meter.side() != null ? ":" + meter.side().code() : ""))
            .build();
    }

    static String formatLimit(int minutes) {
        return minutes % 60 == 0 ? (minutes / 60) + "hr" : minutes + "min";
    }

    private static String formatMoney(BigDecimal amount) {
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private record Constraint(Rule rule, int limitMinutes) {
    }
}
