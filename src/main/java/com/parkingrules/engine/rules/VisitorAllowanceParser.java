package com.parkingrules.engine.rules;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the non-permit visitor allowance out of an RPP rule's free text, e.g.
 * {@code 2 hour visitor parking}, {@code Visitors 4 hours}, {@code 2hr non-permit}.
 */
public class VisitorAllowanceParser {

    private static final List<Pattern> HOUR_PATTERNS = List.of(
        Pattern.compile("visitors?\\s+(\\d+)\\s*(?:hr|hour)s?", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(\\d+)\\s*(?:hr|hour)s?\\s+visitor", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(\\d+)\\s*(?:hr|hour)s?\\s+(?:for\\s+)?non-?permit", Pattern.CASE_INSENSITIVE),
        Pattern.compile("non-?permit\\s+holders?\\s+(\\d+)\\s*(?:hr|hour)s?", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(\\d+)\\s*(?:hr|hour)s?\\s+(?:for\\s+)?non-?residents?", Pattern.CASE_INSENSITIVE));

    private static final Pattern MINUTE_PATTERN =
        Pattern.compile("(\\d+)\\s*(?:min|minute)s?\\s+visitor", Pattern.CASE_INSENSITIVE);

    /**
     * @return allowance in minutes, or empty when the text states none
     */
    public OptionalInt parseAllowanceMinutes(String text) {
        if (text == null || text.isBlank()) {
            return OptionalInt.empty();
        }
        for (Pattern pattern : HOUR_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return OptionalInt.of(Integer.parseInt(matcher.group(1)) * 60);
            }
        }
        Matcher minutes = MINUTE_PATTERN.matcher(text);
        if (minutes.find()) {
            return OptionalInt.of(Integer.parseInt(minutes.group(1)));
        }
        return OptionalInt.empty();
    }
}
