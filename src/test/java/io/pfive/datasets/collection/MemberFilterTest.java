// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.collection;

import io.pfive.datasets.table.FieldType;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemberFilterTest {

    private static final MemberDescriptor JANUARY = new MemberDescriptor("sst/2020/sst_20200131", MemberKind.GRID,
          null, "/data/sst/2020/sst_20200131.grid.json", Map.of("Year", 2020L, "Region", "north"),
          new Envelope(-80, -60, 30, 45));

    @Test
    void globWildcards () {
        assertTrue(MemberFilter.glob("sst/2020/*").test(JANUARY));
        assertFalse(MemberFilter.glob("sst/*").test(JANUARY));
        assertTrue(MemberFilter.glob("sst/**").test(JANUARY));
        assertTrue(MemberFilter.glob("**/sst_202001??").test(JANUARY));
    }

    @Test
    void attributesCompareNumbersByValue () {
        assertTrue(MemberFilter.attribute("Year", 2020).test(JANUARY));
        assertTrue(MemberFilter.attribute("Year", 2020.0).test(JANUARY));
        assertFalse(MemberFilter.attribute("Year", 2021L).test(JANUARY));
        assertTrue(MemberFilter.attribute("Region", "north").test(JANUARY));
        assertFalse(MemberFilter.attribute("Depth", 5).test(JANUARY));
    }

    @Test
    void envelopesAndComposition () {
        MemberFilter gulf = MemberFilter.intersects(new Envelope(-98, -80, 18, 31));
        assertTrue(gulf.test(JANUARY));
        assertFalse(gulf.test(MemberDescriptor.of("unknown", MemberKind.GRID)));
        MemberFilter both = gulf.and(MemberFilter.kind(MemberKind.TABLE));
        assertFalse(both.test(JANUARY));
        assertEquals("[intersects Env[-98.0 : -80.0, 18.0 : 31.0] and kind=TABLE]", both.toString());
        assertEquals("sst/2020/sst_20200131", JANUARY.displayName());
    }

    @Test
    void pathAttributesExtractTypedValues () {
        PathAttributes attributes = new PathAttributes("sst/(?<Year>\\d{4})/sst_\\d{4}(?<Month>\\d{2})(?<Day>\\d{2})",
              Map.of("Year", FieldType.INTEGER, "Month", FieldType.STRING, "Day", FieldType.REAL));
        Map<String, Object> values = attributes.extract(JANUARY.identifier());
        assertEquals(2020L, values.get("Year"));
        assertEquals("01", values.get("Month"));
        assertEquals(31.0, values.get("Day"));
        assertNull(attributes.extract("sst/2020/readme"));
        assertThrows(IllegalArgumentException.class,
              () -> new PathAttributes("(?<Year>\\d{4})", Map.of("Month", FieldType.INTEGER)));
    }
}
