package com.parkingrules.engine.dto;

import com.parkingrules.engine.model.AddressRange;
import com.parkingrules.engine.model.MeterSchedule;
import com.parkingrules.engine.model.Rule;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.normalize.DescriptionFormatter;
import org.locationtech.jts.io.WKTWriter;

import java.util.List;

/**
 * API view of one segment side. Geometry is returned as WKT rather than JTS objects.
 */
public record SegmentView(
    String centerlineId,
    String side,
    String streetName,
    String displayName,
    String fromStreet,
    String toStreet,
    Integer fromAddress,
    Integer toAddress,
    String cardinalDirection,
    String centerlineWkt,
    String curbWkt,
    List<Rule> rules,
    List<MeterSchedule> meters
) {

    public static SegmentView from(StreetSegment segment) {
        WKTWriter writer = new WKTWriter();
        AddressRange range = segment.addressRange();
        return new SegmentView(
            segment.centerlineId(),
            segment.side().code(),
            segment.streetName(),
            DescriptionFormatter.displayStreetName(segment.streetName()),
            segment.fromStreet(),
            segment.toStreet(),
            range != null ? range.fromAddress() : null,
            range != null ? range.toAddress() : null,
            segment.cardinalDirection(),
            writer.write(segment.centerline()),
            segment.curbGeometry() != null ? writer.write(segment.curbGeometry()) : null,
            segment.rules(),
            segment.meters()
        );
    }
}
