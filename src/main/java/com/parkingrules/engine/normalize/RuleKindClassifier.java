package com.parkingrules.engine.normalize;

import com.parkingrules.engine.model.RuleKind;

import java.util.Locale;

/**
 * Maps regulation type text to a {@link RuleKind}. First match wins, strongest kind first.
 */
public class RuleKindClassifier {

    public RuleKind classify(String regulationText, String permitZone) {
        if (regulationText == null || regulationText.isBlank()) {
            throw new InvalidRecordException("Regulation type is missing");
        }
        String text = regulationText.toLowerCase(Locale.ROOT);

        if (text.contains("sweeping") || text.contains("cleaning")) {
            return RuleKind.SWEEPING;
        }
        if (text.contains("tow")) {
            return RuleKind.TOW_AWAY;
        }
        if (text.contains("no parking") || text.contains("no stopping")) {
            return RuleKind.NO_PARKING;
        }
        if (text.contains("time") || text.contains("limit")) {
            // time-limited blocks inside a permit area are RPP for non-permit holders
            return hasText(permitZone) ? RuleKind.RPP_ZONE : RuleKind.TIME_LIMIT;
        }
        if (text.contains("permit") || text.contains("residential") || text.contains("rpp")) {
            return RuleKind.RPP_ZONE;
        }
        if (text.contains("meter") || text.contains("paid")) {
            return RuleKind.METER;
        }
        throw new InvalidRecordException("Unknown regulation kind '" + regulationText + "'");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
