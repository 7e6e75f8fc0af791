package com.parkingrules.engine.normalize;

import com.parkingrules.engine.dto.RegulationRecord;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Canonical key of a regulation's text fields, shared with the external annotator that
 * writes interpreted summaries. Two records with the same upper-cased field tuple share one
 * summary.
 */
public final class CanonicalKeys {

    private CanonicalKeys() {
    }

    public static String regulationKey(RegulationRecord record) {
        return md5(
            record.regulation(),
            record.days(),
            record.hours(),
            record.fromTime(),
            record.toTime(),
            record.description(),
            record.permitZone(),
            record.exceptions(),
            record.hourLimit());
    }

    static String md5(String... fields) {
        StringJoiner joined = new StringJoiner("|");
        for (String field : fields) {
            joined.add(field == null ? "" : field.trim().toUpperCase(Locale.ROOT));
        }
        return DigestUtils.md5DigestAsHex(joined.toString().getBytes(StandardCharsets.UTF_8));
    }
}
