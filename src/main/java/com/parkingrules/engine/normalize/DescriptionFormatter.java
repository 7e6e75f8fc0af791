package com.parkingrules.engine.normalize;

import com.parkingrules.engine.model.Schedule;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Display text for schedules, street names and side labels.
 */
public final class DescriptionFormatter {

    private static final Map<String, String> STREET_TYPES = Map.ofEntries(
        Map.entry("ST", "Street"),
        Map.entry("AVE", "Avenue"),
        Map.entry("BLVD", "Boulevard"),
        Map.entry("DR", "Drive"),
        Map.entry("RD", "Road"),
        Map.entry("LN", "Lane"),
        Map.entry("CT", "Court"),
        Map.entry("PL", "Place"),
        Map.entry("WAY", "Way"),
        Map.entry("TER", "Terrace"),
        Map.entry("CIR", "Circle"),
        Map.entry("PKWY", "Parkway"));

    private static final Map<String, String> CARDINALS = Map.ofEntries(
        Map.entry("N", "North"),
        Map.entry("S", "South"),
        Map.entry("E", "East"),
        Map.entry("W", "West"),
        Map.entry("NE", "Northeast"),
        Map.entry("NW", "Northwest"),
        Map.entry("SE", "Southeast"),
        Map.entry("SW", "Southwest"),
        Map.entry("NORTH", "North"),
        Map.entry("SOUTH", "South"),
        Map.entry("EAST", "East"),
        Map.entry("WEST", "West"),
        Map.entry("NORTHEAST", "Northeast"),
        Map.entry("NORTHWEST", "Northwest"),
        Map.entry("SOUTHEAST", "Southeast"),
        Map.entry("SOUTHWEST", "Southwest"));

    private DescriptionFormatter() {
    }

    /**
     * {@code 18TH ST} becomes {@code 18th Street}, {@code MCALLISTER ST} becomes
     * {@code McAllister Street}.
     */
    public static String displayStreetName(String streetName) {
        if (streetName == null || streetName.isBlank()) {
            return "Unknown Street";
        }
        String[] words = streetName.trim().split("\\s+");
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                result.append(' ');
            }
            result.append(displayWord(words[i], i == words.length - 1));
        }
        return result.toString();
    }

    /**
     * Full cardinal name for {@code N}, {@code se}, {@code NORTH} and so on; other text is
     * returned unchanged, blank text as {@code null}.
     */
    public static String normalizeCardinal(String direction) {
        if (direction == null || direction.isBlank()) {
            return null;
        }
        String key = direction.trim().toUpperCase(Locale.ROOT);
        return CARDINALS.getOrDefault(key, direction.trim());
    }

    public static String describeSweeping(Schedule schedule) {
        StringBuilder text = new StringBuilder("Street cleaning ").append(schedule.days());
        if (schedule.window() != null) {
            text.append(' ').append(schedule.window());
        }
        if (!schedule.weeksOfMonth().isEmpty()) {
            text.append(" (")
                .append(schedule.weeksOfMonth().stream().map(DescriptionFormatter::ordinal)
                    .collect(Collectors.joining(" & ")))
                .append(" week of month)");
        }
        return text.toString();
    }

    public static String describeRegulation(String regulationText, String details, Schedule schedule) {
        if (details != null && !details.isBlank()) {
            return details.trim();
        }
        String base = regulationText == null ? "Regulation" : regulationText.trim();
        return base + " " + schedule.days() + " " + (schedule.window() == null ? "all day" : schedule.window());
    }

    static String ordinal(int number) {
        switch (number) {
            case 1:
                return "1st";
            case 2:
                return "2nd";
            case 3:
                return "3rd";
            default:
                return number + "th";
        }
    }

    private static String displayWord(String word, boolean last) {
        String upper = word.toUpperCase(Locale.ROOT);
        if (upper.length() > 2 && upper.matches("\\d+(ST|ND|RD|TH)")) {
            return upper.substring(0, upper.length() - 2) + upper.substring(upper.length() - 2).toLowerCase(Locale.ROOT);
        }
        if (last && STREET_TYPES.containsKey(upper)) {
            return STREET_TYPES.get(upper);
        }
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.startsWith("mc") && lower.length() > 2) {
            return "Mc" + capitalize(lower.substring(2));
        }
        if (lower.contains("'")) {
            String[] parts = lower.split("'", -1);
            StringBuilder joined = new StringBuilder();
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) {
                    joined.append('\'');
                }
                joined.append(capitalize(parts[i]));
            }
            return joined.toString();
        }
        return capitalize(lower);
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
