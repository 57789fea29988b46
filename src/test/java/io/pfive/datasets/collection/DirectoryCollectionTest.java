// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.collection;

import io.pfive.datasets.adapter.CsvTable;
import io.pfive.datasets.adapter.RawRasterGrid;
import io.pfive.datasets.exception.AmbiguousIdentifierException;
import io.pfive.datasets.exception.BackendUnavailableException;
import io.pfive.datasets.exception.CyclicCollectionException;
import io.pfive.datasets.exception.NotFoundException;
import io.pfive.datasets.grid.Dataset;
import io.pfive.datasets.grid.Grid;
import io.pfive.datasets.table.FieldType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryCollectionTest {

    @TempDir
    Path root;

    /// A 2x2 uint8 grid whose lower left corner is at (x, y).
    static void writeGrid (Path dir, String name, double x, double y) throws IOException {
        Files.createDirectories(dir);
        Files.write(dir.resolve(name + ".raw"), new byte[] {1, 2, 3, 4});
        Files.writeString(dir.resolve(name + ".grid.json"), String.format(
              "{\"dataType\": \"uint8\", \"dimensions\": \"yx\", \"shape\": [2, 2], "
                    + "\"cornerCoords\": [%s, %s], \"cellSizes\": [1, 1]}", y + 0.5, x + 0.5));
    }

    private void populate () throws IOException {
        writeGrid(root, "sst_20200101", 0, 0);
        writeGrid(root, "sst_20200102", 100, 0);
        Files.writeString(root.resolve("stations.csv"), "id,depth\n1,20\n");
        Files.writeString(root.resolve("notes.txt"), "not a dataset");
        writeGrid(root.resolve("2021"), "sst_20210101", 0, 50);
    }

    private static List<String> identifiers (Iterable<MemberDescriptor> members) {
        List<String> identifiers = new ArrayList<>();
        for (MemberDescriptor member : members) identifiers.add(member.identifier());
        return identifiers;
    }

    @Test
    void listsGridsTablesAndDirectories () throws IOException {
        populate();
        DirectoryCollection collection = new DirectoryCollection(root);
        assertEquals(List.of("2021", "sst_20200101", "sst_20200102", "stations"), identifiers(collection.list()));
        assertEquals(List.of("stations"), identifiers(collection.list(MemberFilter.kind(MemberKind.TABLE))));
        assertEquals(List.of("sst_20200101", "sst_20200102"), identifiers(collection.list(MemberFilter.glob("sst_*"))));

        Dataset grid = collection.resolve("sst_20200102");
        assertInstanceOf(RawRasterGrid.class, grid);
        assertEquals(new Envelope(100, 102, 0, 2), ((Grid) grid).getExtent().envelope());
        assertInstanceOf(CsvTable.class, collection.resolve("stations"));
    }

    @Test
    void nestedIdentifiersAreRelativeToTheRoot () throws IOException {
        populate();
        DirectoryCollection collection = new DirectoryCollection(root);
        DatasetCollection nested = (DatasetCollection) collection.resolve("2021");
        assertEquals(List.of("2021/sst_20210101"), identifiers(nested.list()));
        assertInstanceOf(RawRasterGrid.class, nested.resolve("2021/sst_20210101"));

        List<String> all = new ArrayList<>();
        for (CollectionTraversal.Member member : CollectionTraversal.walk(collection, MemberFilter.kind(MemberKind.GRID))) {
            all.add(member.descriptor().identifier());
        }
        assertEquals(List.of("2021/sst_20210101", "sst_20200101", "sst_20200102"), all);
    }

    @Test
    void listingSeesLaterChanges () throws IOException {
        populate();
        Iterable<MemberDescriptor> grids = new DirectoryCollection(root).list(MemberFilter.kind(MemberKind.GRID));
        assertEquals(2, identifiers(grids).size());
        writeGrid(root, "sst_20200103", 0, 0);
        assertEquals(3, identifiers(grids).size());
    }

    @Test
    void resolveReportsMissingAndAmbiguousMembers () throws IOException {
        populate();
        DirectoryCollection collection = new DirectoryCollection(root);
        NotFoundException missing = assertThrows(NotFoundException.class, () -> collection.resolve("sst_19990101"));
        assertTrue(missing.getMessage().contains("sst_19990101"));
        AmbiguousIdentifierException ambiguous = assertThrows(AmbiguousIdentifierException.class,
              () -> collection.resolve(MemberFilter.glob("sst_2020*")));
        assertTrue(ambiguous.getMessage().contains("sst_20200101"));
        assertInstanceOf(RawRasterGrid.class, collection.resolve(MemberFilter.glob("sst_2020*")
              .and(MemberFilter.intersects(new Envelope(99, 101, 1, 1.5)))));
    }

    @Test
    void identifierSharedByGridAndTableIsAmbiguous () throws IOException {
        writeGrid(root, "sst", 0, 0);
        Files.writeString(root.resolve("sst.csv"), "id,depth\n1,20\n");
        DirectoryCollection collection = new DirectoryCollection(root);
        AmbiguousIdentifierException e = assertThrows(AmbiguousIdentifierException.class, () -> collection.resolve("sst"));
        assertEquals(List.of("sst (GRID)", "sst (TABLE)"), e.matches().stream().sorted().toList());
        assertInstanceOf(CsvTable.class,
              collection.resolve(MemberFilter.identifier("sst").and(MemberFilter.kind(MemberKind.TABLE))));
        assertInstanceOf(RawRasterGrid.class,
              collection.resolve(MemberFilter.identifier("sst").and(MemberFilter.kind(MemberKind.GRID))));
    }

    @Test
    void spatialFilterUsesHeaderEnvelopes () throws IOException {
        populate();
        DirectoryCollection collection = new DirectoryCollection(root);
        List<CollectionTraversal.Member> members =
              CollectionTraversal.collect(collection, MemberFilter.intersects(new Envelope(0.5, 1.5, 0.5, 60)));
        assertEquals(List.of("2021/sst_20210101", "sst_20200101"),
              members.stream().map(m -> m.descriptor().identifier()).toList());
    }

    @Test
    void pathAttributesSelectMembers () throws IOException {
        populate();
        PathAttributes attributes = new PathAttributes("(?:\\d{4}/)?sst_(?<Year>\\d{4})(?<Month>\\d{2})(?<Day>\\d{2})",
              Map.of("Year", FieldType.INTEGER, "Month", FieldType.INTEGER, "Day", FieldType.INTEGER));
        DirectoryCollection collection = new DirectoryCollection(root, attributes);
        // The table does not match the expression, so it is not a member.
        assertEquals(List.of("2021", "sst_20200101", "sst_20200102"), identifiers(collection.list()));
        List<CollectionTraversal.Member> in2021 = CollectionTraversal.collect(collection, MemberFilter.attribute("Year", 2021));
        assertEquals(1, in2021.size());
        MemberDescriptor descriptor = in2021.get(0).descriptor();
        assertEquals(2021L, descriptor.attribute("Year"));
        assertEquals(1L, descriptor.attribute("Month"));
        assertEquals(1, identifiers(collection.list(MemberFilter.attribute("Day", 2L))).size());
    }

    @Test
    void brokenHeadersAreSkipped () throws IOException {
        populate();
        Files.writeString(root.resolve("broken.grid.json"), "{\"dataType\": ");
        assertEquals(List.of("2021", "sst_20200101", "sst_20200102", "stations"),
              identifiers(new DirectoryCollection(root).list()));
    }

    @Test
    void symbolicLinkToAnAncestorIsACycle () throws IOException {
        populate();
        Files.createSymbolicLink(root.resolve("2021").resolve("loop"), root);
        DirectoryCollection collection = new DirectoryCollection(root);
        CyclicCollectionException e = assertThrows(CyclicCollectionException.class,
              () -> CollectionTraversal.collect(collection, MemberFilter.all()));
        assertEquals(3, e.path().size());
        assertEquals(e.path().get(0).substring(e.path().get(0).indexOf('(')),
              e.path().get(2).substring(e.path().get(2).indexOf('(')));
    }

    @Test
    void missingRootIsBackendUnavailable () {
        DirectoryCollection collection = new DirectoryCollection(root.resolve("absent"));
        assertThrows(BackendUnavailableException.class, () -> collection.list().iterator());
    }
}
