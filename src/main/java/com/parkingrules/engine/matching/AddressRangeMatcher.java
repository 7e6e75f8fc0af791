package com.parkingrules.engine.matching;

import com.parkingrules.engine.model.AddressRange;
import com.parkingrules.engine.model.StreetSegment;

import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Matches a street address to the segment side whose address interval contains it.
 * Integer containment, no geometry. Segments without an interval are skipped.
 */
public class AddressRangeMatcher {

    /**
     * @param streetName    street name, compared after {@link #normalizeStreetName}
     * @param addressNumber house number
     * @param segments      segments to scan, typically both sides of every centerline on the street
     * @return the containing segment, or empty when no interval contains the number
     */
    public Optional<StreetSegment> matchByAddress(String streetName, int addressNumber,
                                                  Collection<StreetSegment> segments) {
        String wanted = normalizeStreetName(streetName);
        if (wanted.isEmpty() || segments == null) {
            return Optional.empty();
        }

        return segments.stream()
            .filter(segment -> wanted.equals(normalizeStreetName(segment.streetName())))
            .filter(segment -> contains(segment.addressRange(), addressNumber))
            .min(Comparator.comparing(StreetSegment::key));
    }

    /**
     * Upper case, periods dropped, runs of whitespace collapsed.
     */
    public static String normalizeStreetName(String streetName) {
        if (streetName == null) {
            return "";
        }
        return streetName.replace(".", "")
            .trim()
            .replaceAll("\\s+", " ")
            .toUpperCase(Locale.ROOT);
    }

    private static boolean contains(AddressRange range, int addressNumber) {
        return range != null && range.contains(addressNumber);
    }
}
