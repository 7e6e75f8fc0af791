package com.parkingrules.engine.rules;

/**
 * @param defaultVisitorAllowanceMinutes visitor allowance of an RPP rule that states none
 * @param defaultTimeLimitMinutes        limit of a time-limit rule that states none
 * @param lookaheadDays                  how far ahead to look for the next hard restriction
 */
public record RuleEngineSettings(int defaultVisitorAllowanceMinutes, int defaultTimeLimitMinutes, int lookaheadDays) {

    public static final int DEFAULT_VISITOR_ALLOWANCE_MINUTES = 120;
    public static final int DEFAULT_TIME_LIMIT_MINUTES = 120;
    public static final int DEFAULT_LOOKAHEAD_DAYS = 7;

    public RuleEngineSettings {
        if (defaultVisitorAllowanceMinutes <= 0 || defaultTimeLimitMinutes <= 0) {
            throw new IllegalArgumentException("Default limits must be positive");
        }
        if (lookaheadDays < 0) {
            throw new IllegalArgumentException("Lookahead cannot be negative: " + lookaheadDays);
        }
    }

    public static RuleEngineSettings defaults() {
        return new RuleEngineSettings(DEFAULT_VISITOR_ALLOWANCE_MINUTES, DEFAULT_TIME_LIMIT_MINUTES,
            DEFAULT_LOOKAHEAD_DAYS);
    }
}
