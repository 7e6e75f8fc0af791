package com.parkingrules.engine.normalize;

import com.parkingrules.engine.model.DaySet;
import com.parkingrules.engine.model.TimeWindow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns the many real-world spellings of days, hours and limits into canonical values.
 *
 * Days:   {@code Daily}, {@code M-F}, {@code Mon thru Sat}, {@code Mon, Wed & Fri}, {@code Tues}
 * Times:  {@code 900}, {@code 0900}, {@code 9}, {@code 9:00}, {@code 6pm}, {@code noon}, {@code 2400}
 * Hours:  {@code 800-1800}, {@code 8am to 6pm}, {@code Anytime}
 * Limits: {@code 2}, {@code 2 hr}, {@code 1.5 hours}, {@code 90 min}
 *
 * Anything it cannot read raises {@link InvalidRecordException}; nothing is guessed.
 */
public class ScheduleParser {

    private static final Map<String, DayOfWeek> DAY_TOKENS = new LinkedHashMap<>();

    static {
        put(DayOfWeek.MONDAY, "M", "MO", "MON", "MONDAY");
        put(DayOfWeek.TUESDAY, "TU", "TUE", "TUES", "TUESDAY");
        put(DayOfWeek.WEDNESDAY, "W", "WE", "WED", "WEDNES", "WEDNESDAY");
        put(DayOfWeek.THURSDAY, "TH", "THU", "THUR", "THURS", "THURSDAY");
        put(DayOfWeek.FRIDAY, "F", "FR", "FRI", "FRIDAY");
        put(DayOfWeek.SATURDAY, "SA", "SAT", "SATURDAY");
        put(DayOfWeek.SUNDAY, "SU", "SUN", "SUNDAY");
    }

    // longest first so "THURS" is tried before "TH"
    private static final List<String> PREFIXES = DAY_TOKENS.keySet().stream()
        .filter(token -> token.length() > 1)
        .sorted(Comparator.comparingInt(String::length).reversed())
        .collect(Collectors.toList());

    private static final Set<String> DAILY = Set.of("DAILY", "EVERY DAY", "EVERYDAY", "7 DAYS", "ALL DAYS", "ALL");
    private static final Set<String> ALL_DAY = Set.of("ANYTIME", "ANY TIME", "ALL DAY", "24 HRS", "24 HOURS", "24HRS", "24/7");

    private static final Pattern RANGE_SEPARATOR = Pattern.compile("\\s*(?:-|–|—|\\bTHRU\\b|\\bTHROUGH\\b|\\bTO\\b)\\s*");
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,&/;]|\\bAND\\b");
    private static final Pattern LIMIT = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(MINUTES?|MINS?|M|HOURS?|HRS?|H)?\\b.*");

    private static void put(DayOfWeek day, String... tokens) {
        for (String token : tokens) {
            DAY_TOKENS.put(token, day);
        }
    }

    /**
     * @return the days named by {@code text}; blank text means every day
     */
    public DaySet parseDays(String text) {
        if (text == null || text.isBlank()) {
            return DaySet.daily();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace(".", "").replaceAll("\\s+", " ");
        if (DAILY.contains(normalized)) {
            return DaySet.daily();
        }
        if (normalized.contains("SCHOOL")) {
            return DaySet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
        }

        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String part : LIST_SEPARATOR.split(normalized)) {
            if (part.isBlank()) {
                continue;
            }
            String[] range = RANGE_SEPARATOR.split(part.trim());
            if (range.length == 2) {
                DayOfWeek from = requireDay(range[0], text);
                DayOfWeek to = requireDay(range[1], text);
                days.addAll(DaySet.range(from, to).days());
                continue;
            }
            for (String token : part.trim().split(" ")) {
                days.add(requireDay(token, text));
            }
        }
        if (days.isEmpty()) {
            throw new InvalidRecordException("No days in '" + text + "'");
        }
        return DaySet.of(days);
    }

    /**
     * Window from a combined hours field.
     *
     * @return empty when the rule applies all day
     */
    public Optional<TimeWindow> parseHours(String hours) {
        if (hours == null || hours.isBlank()) {
            return Optional.empty();
        }
        String normalized = hours.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (ALL_DAY.contains(normalized)) {
            return Optional.empty();
        }
        String[] parts = RANGE_SEPARATOR.split(normalized);
        if (parts.length != 2) {
            throw new InvalidRecordException("Cannot split hours '" + hours + "' into start and end");
        }
        return parseWindow(parts[0], parts[1]);
    }

    /**
     * Window from separate start and end fields. Both blank means all day; one blank is invalid.
     */
    public Optional<TimeWindow> parseWindow(String from, String to) {
        boolean fromBlank = from == null || from.isBlank();
        boolean toBlank = to == null || to.isBlank();
        if (fromBlank && toBlank) {
            return Optional.empty();
        }
        if (fromBlank || toBlank) {
            throw new InvalidRecordException("Time window needs both ends, got '" + from + "' to '" + to + "'");
        }
        int start = parseMinuteOfDay(from);
        int end = parseMinuteOfDay(to);
        if (start == TimeWindow.MINUTES_PER_DAY) {
            start = 0;
        }
        return Optional.of(TimeWindow.of(start, end));
    }

    /**
     * Minute of day, {@code 0..1440}; {@code 1440} only for {@code 24}, {@code 2400} or {@code 24:00}.
     */
    public int parseMinuteOfDay(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidRecordException("Time is blank");
        }
        String value = text.trim().toUpperCase(Locale.ROOT).replace(".", "");
        if (value.equals("NOON")) {
            return 720;
        }
        if (value.equals("MIDNIGHT")) {
            return 0;
        }

        boolean pm = value.endsWith("PM") || value.endsWith("P");
        boolean am = value.endsWith("AM") || value.endsWith("A");
        String digits = value.replaceAll("[^0-9:]", "");
        if (digits.isEmpty()) {
            throw new InvalidRecordException("Unrecognized time '" + text + "'");
        }

        int hours;
        int minutes;
        try {
            if (digits.contains(":")) {
                String[] parts = digits.split(":");
                hours = Integer.parseInt(parts[0]);
                minutes = parts.length > 1 && !parts[1].isEmpty() ? Integer.parseInt(parts[1]) : 0;
            } else if (digits.length() >= 3) {
                int packed = Integer.parseInt(digits);
                hours = packed / 100;
                minutes = packed % 100;
            } else {
                hours = Integer.parseInt(digits);
                minutes = 0;
            }
        } catch (NumberFormatException e) {
            throw new InvalidRecordException("Unrecognized time '" + text + "'", e);
        }

        if (pm || am) {
            if (hours < 1 || hours > 12) {
                throw new InvalidRecordException("Hour out of range in '" + text + "'");
            }
            if (pm && hours < 12) {
                hours += 12;
            } else if (am && hours == 12) {
                hours = 0;
            }
        }

        if (minutes > 59 || hours > 24 || (hours == 24 && minutes > 0)) {
            throw new InvalidRecordException("Time out of range '" + text + "'");
        }
        return hours * 60 + minutes;
    }

    /**
     * Stated parking limit in minutes. A bare number is hours.
     *
     * @return {@code null} when the text is blank or states no limit
     */
    public Integer parseDurationMinutes(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim().toUpperCase(Locale.ROOT);
        if (value.chars().noneMatch(Character::isDigit)) {
            return null;
        }
        Matcher matcher = LIMIT.matcher(value);
        if (!matcher.matches()) {
            throw new InvalidRecordException("Unrecognized time limit '" + text + "'");
        }
        BigDecimal amount = new BigDecimal(matcher.group(1));
        String unit = matcher.group(2);
        boolean inMinutes = unit != null && unit.startsWith("M");
        BigDecimal minutes = inMinutes ? amount : amount.multiply(BigDecimal.valueOf(60));
        int result;
        try {
            result = minutes.setScale(0, RoundingMode.HALF_UP).intValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidRecordException("Time limit out of range '" + text + "'", e);
        }
        return result > 0 ? result : null;
    }

    private static DayOfWeek requireDay(String token, String text) {
        return dayOf(token).orElseThrow(
            () -> new InvalidRecordException("Unrecognized day '" + token.trim() + "' in '" + text + "'"));
    }

    private static Optional<DayOfWeek> dayOf(String token) {
        String clean = token.trim();
        if (!clean.chars().allMatch(Character::isLetter)) {
            return Optional.empty();
        }
        DayOfWeek exact = DAY_TOKENS.get(clean);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (String prefix : PREFIXES) {
            if (clean.startsWith(prefix)) {
                return Optional.of(DAY_TOKENS.get(prefix));
            }
        }
        return Optional.empty();
    }
}
