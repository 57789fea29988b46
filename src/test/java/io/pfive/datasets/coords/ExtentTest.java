// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.coords;

import io.pfive.datasets.exception.OutOfBoundsException;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtentTest {

    private final Extent extent = Extent.yx(10, 20, 100, 50, 0.5);

    @Test
    void coordinatesOfCells () {
        int y = extent.axisIndex('y');
        int x = extent.axisIndex('x');
        assertEquals(0, y);
        assertEquals(1, x);
        assertEquals(100.25, extent.centerCoord(x, 0));
        assertEquals(50.25, extent.centerCoord(y, 0));
        assertEquals(54.75, extent.centerCoord(y, 9));
        assertEquals(new Envelope(100, 110, 50, 55), extent.envelope());
        assertEquals(200, extent.nCells());
    }

    @Test
    void windowContainment () {
        assertTrue(extent.contains(new int[] {0, 0}, new int[] {10, 20}));
        assertTrue(extent.contains(new int[] {9, 19}, new int[] {1, 1}));
        assertFalse(extent.contains(new int[] {9, 19}, new int[] {2, 1}));
        assertFalse(extent.contains(new int[] {-1, 0}, new int[] {1, 1}));
        assertFalse(extent.contains(new int[] {0, 0}, new int[] {1, 0}));
        assertFalse(extent.contains(new int[] {0, 0}, new int[] {1, Integer.MAX_VALUE}));
        assertFalse(extent.contains(new int[] {0}, new int[] {1}));
        assertThrows(OutOfBoundsException.class, () -> extent.checkWindow(new int[] {0, 20}, new int[] {1, 1}));
    }

    @Test
    void sameAsToleratesFloatingPointNoise () {
        Extent noisy = Extent.yx(10, 20, 100 + 1e-12, 50, 0.5);
        Extent shifted = Extent.yx(10, 20, 100.25, 50, 0.5);
        Extent smaller = Extent.yx(10, 19, 100, 50, 0.5);
        assertTrue(extent.sameAs(noisy));
        assertFalse(extent.sameAs(shifted));
        assertFalse(extent.sameAs(smaller));
        assertTrue(extent.describeDifference(smaller).startsWith("shape"));
    }

    @Test
    void addingAndRemovingAxes () {
        Extent series = extent.withAxis('t', 365, 0, 1);
        assertEquals("tyx", series.dimensions());
        assertArrayEquals(new int[] {365, 10, 20}, series.shape());
        Extent volume = series.withAxis('z', 5, -10, 2);
        assertEquals("tzyx", volume.dimensions());
        assertArrayEquals(new int[] {365, 5, 10, 20}, volume.shape());
        assertEquals(-8, volume.centerCoord(1, 1));
        assertTrue(volume.withoutAxis('z').withoutAxis('t').sameAs(extent));
        assertThrows(IllegalArgumentException.class, () -> extent.withoutAxis('x'));
        assertThrows(IllegalArgumentException.class, () -> series.withAxis('t', 2, 0, 1));
    }

    @Test
    void invalidExtents () {
        assertThrows(IllegalArgumentException.class,
              () -> Extent.of("xy", new int[] {1, 1}, new double[] {0, 0}, new double[] {1, 1}));
        assertThrows(IllegalArgumentException.class,
              () -> Extent.of("yx", new int[] {1, 0}, new double[] {0, 0}, new double[] {1, 1}));
        assertThrows(IllegalArgumentException.class,
              () -> Extent.of("yx", new int[] {1, 1}, new double[] {0, 0}, new double[] {1, -1}));
    }
}
