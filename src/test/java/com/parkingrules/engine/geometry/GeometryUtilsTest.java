package com.parkingrules.engine.geometry;

import com.parkingrules.engine.model.StreetSide;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GeometryUtilsTest {

    private final GeometryFactory planar = new GeometryFactory();

    private LineString planarLine(double... xy) {
        Coordinate[] coords = new Coordinate[xy.length / 2];
        for (int i = 0; i < coords.length; i++) {
            coords[i] = new Coordinate(xy[2 * i], xy[2 * i + 1]);
        }
        return planar.createLineString(coords);
    }

    @Test
    void shouldComputeBearings() {
        assertThat(GeometryUtils.bearing(new Coordinate(-122.42, 37.77), new Coordinate(-122.42, 37.78)))
            .isCloseTo(0.0, within(1e-9));
        assertThat(GeometryUtils.bearing(new Coordinate(0, 0), new Coordinate(1, 0)))
            .isCloseTo(90.0, within(1e-9));
        assertThat(GeometryUtils.bearing(new Coordinate(0, 0), new Coordinate(-1, 0)))
            .isCloseTo(270.0, within(1e-9));
    }

    @Test
    void shouldLabelTheDirectionEachSideFaces() {
        assertThat(GeometryUtils.sideCardinal(90.0, StreetSide.LEFT)).isEqualTo("North");
        assertThat(GeometryUtils.sideCardinal(90.0, StreetSide.RIGHT)).isEqualTo("South");
        assertThat(GeometryUtils.sideCardinal(0.0, StreetSide.LEFT)).isEqualTo("West");
        assertThat(GeometryUtils.sideCardinal(45.0, StreetSide.RIGHT)).isEqualTo("Southeast");
    }

    @Test
    void shouldClassifyPointsAgainstADirectedLine() {
        Coordinate a = new Coordinate(0, 0);
        Coordinate b = new Coordinate(1, 0);

        assertThat(GeometryUtils.crossProductSide(a, b, new Coordinate(0.5, 1))).isEqualTo(1);
        assertThat(GeometryUtils.crossProductSide(a, b, new Coordinate(0.5, -1))).isEqualTo(-1);
        assertThat(GeometryUtils.crossProductSide(a, b, new Coordinate(2, 0))).isZero();
    }

    @Test
    void shouldInterpolateByArcLength() {
        LineString bent = planarLine(0, 0, 10, 0, 10, 10);

        Coordinate middle = GeometryUtils.midpoint(bent);
        assertThat(middle.x).isCloseTo(10.0, within(1e-9));
        assertThat(middle.y).isCloseTo(0.0, within(1e-9));

        Coordinate quarter = GeometryUtils.interpolate(bent, 0.25);
        assertThat(quarter.x).isCloseTo(5.0, within(1e-9));

        assertThatThrownBy(() -> GeometryUtils.interpolate(bent, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSampleLinesAtQuartersAndOtherGeometryAtItsCentroid() {
        List<Coordinate> onLine = GeometryUtils.samplePoints(planarLine(0, 0, 100, 0));
        assertThat(onLine).extracting(c -> c.x).containsExactly(25.0, 50.0, 75.0);

        List<Coordinate> onPoint = GeometryUtils.samplePoints(planar.createPoint(new Coordinate(3, 4)));
        assertThat(onPoint).hasSize(3).allSatisfy(c -> {
            assertThat(c.x).isEqualTo(3.0);
            assertThat(c.y).isEqualTo(4.0);
        });
    }

    @Test
    void shouldMeasureByMedianSoATouchingEndDoesNotCount() {
        LineString reference = planarLine(0, 0, 100, 0);
        // runs 8 m off the reference but dips onto it at the far end
        LineString candidate = planarLine(0, 8, 90, 8, 100, 0);

        assertThat(GeometryUtils.medianSampledDistance(candidate, reference)).isCloseTo(8.0, within(1e-9));
        assertThat(GeometryUtils.distanceToLine(new Coordinate(100, 0), reference)).isZero();
    }

    @Test
    void shouldComputeGreatCircleDistance() {
        double oneDegreeOfLatitude = GeometryUtils.haversineDistance(new Coordinate(0, 0), new Coordinate(0, 1));

        assertThat(oneDegreeOfLatitude).isCloseTo(111_195.0, within(1.0));
    }

    @Test
    void shouldRejectDegenerateLines() {
        assertThatThrownBy(() -> GeometryUtils.requireValidLine(null))
            .isInstanceOf(GeometryException.class);
        assertThatThrownBy(() -> GeometryUtils.requireValidLine(planarLine(1, 1, 1, 1)))
            .isInstanceOf(GeometryException.class)
            .hasMessageContaining("zero length");
    }
}
