// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.collection;

import io.pfive.datasets.adapter.AdapterGrid;
import io.pfive.datasets.adapter.CsvTable;
import io.pfive.datasets.adapter.RawRasterGrid;
import io.pfive.datasets.exception.DatasetException;
import io.pfive.datasets.grid.Dataset;
import io.pfive.datasets.util.MilliTimer;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/// A directory tree as a collection. Each directory is one collection whose members are its raw
/// rasters (name.grid.json with name.raw beside it), its CSV tables, and its subdirectories as
/// nested collections. Other files are ignored. Member identifiers are paths relative to the root
/// of the tree, with "/" separators and without file suffixes, so they stay the same whichever
/// nested collection lists them.
///
/// Symbolic links are followed. A directory's fingerprint is its real path, so a link back to an
/// ancestor is recognized as the same collection when the tree is traversed.
public class DirectoryCollection implements DatasetCollection {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Path root;
    private final String relativePath;
    private final PathAttributes pathAttributes;

    public DirectoryCollection (Path root) {
        this(root, null);
    }

    /// @param pathAttributes extracts attributes from member paths, may be null
    public DirectoryCollection (Path root, PathAttributes pathAttributes) {
        this(root, "", pathAttributes);
    }

    private DirectoryCollection (Path root, String relativePath, PathAttributes pathAttributes) {
        this.root = checkNotNull(root, "root");
        this.relativePath = relativePath;
        this.pathAttributes = pathAttributes;
    }

    public Path directory () {
        return relativePath.isEmpty() ? root : root.resolve(relativePath);
    }

    @Override
    public String displayName () {
        return relativePath.isEmpty() ? String.valueOf(root.getFileName()) : relativePath;
    }

    @Override
    public String fingerprint () {
        try {
            return "dir:" + directory().toRealPath();
        } catch (IOException e) {
            throw AdapterGrid.unavailable(directory().toString(), e);
        }
    }

    @Override
    public Iterable<MemberDescriptor> list (MemberFilter filter) {
        return () -> scan(filter).iterator();
    }

    private List<MemberDescriptor> scan (MemberFilter filter) {
        MilliTimer timer = new MilliTimer();
        Path directory = directory();
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) entries.add(entry);
        } catch (IOException e) {
            throw AdapterGrid.unavailable(directory.toString(), e);
        }
        entries.sort(Comparator.comparing(p -> p.getFileName().toString()));
        List<MemberDescriptor> members = new ArrayList<>();
        for (Path entry : entries) {
            MemberDescriptor member;
            try {
                member = describe(entry);
            } catch (IOException | DatasetException e) {
                LOG.warn("Skipping unreadable entry {}: {}", entry, e.toString());
                continue;
            }
            if (member != null && filter.test(member)) members.add(member);
        }
        LOG.info("Scanned {}: {} of {} entries matched {} in {}.", directory, members.size(), entries.size(),
              filter, timer.getElapsedString());
        return members;
    }

    /// Returns null for entries that are not members.
    private MemberDescriptor describe (Path entry) throws IOException {
        String fileName = entry.getFileName().toString();
        if (Files.isDirectory(entry)) {
            String identifier = childIdentifier(fileName);
            return new MemberDescriptor(identifier, MemberKind.COLLECTION, fileName, entry.toString(), null, null);
        }
        if (!Files.isReadable(entry)) {
            throw new IOException("not readable");
        }
        if (RawRasterGrid.isHeader(entry)) {
            String name = fileName.substring(0, fileName.length() - RawRasterGrid.HEADER_SUFFIX.length());
            String identifier = childIdentifier(name);
            Map<String, Object> attributes = attributesFor(identifier);
            if (attributes == null) return null;
            Envelope envelope;
            try (RawRasterGrid grid = new RawRasterGrid(entry)) {
                envelope = grid.getExtent().envelope();
            }
            return new MemberDescriptor(identifier, MemberKind.GRID, name, entry.toString(), attributes, envelope);
        }
        if (CsvTable.isCsv(entry)) {
            String name = fileName.substring(0, fileName.length() - 4);
            String identifier = childIdentifier(name);
            Map<String, Object> attributes = attributesFor(identifier);
            if (attributes == null) return null;
            return new MemberDescriptor(identifier, MemberKind.TABLE, name, entry.toString(), attributes, null);
        }
        return null;
    }

    private String childIdentifier (String name) {
        return relativePath.isEmpty() ? name : relativePath + "/" + name;
    }

    private Map<String, Object> attributesFor (String identifier) {
        if (pathAttributes == null) return Map.of();
        return pathAttributes.extract(identifier);
    }

    @Override
    public Dataset open (MemberDescriptor member) {
        Path location = Path.of(member.location());
        switch (member.kind()) {
            case GRID: return new RawRasterGrid(location);
            case TABLE: return new CsvTable(location);
            case COLLECTION: return new DirectoryCollection(root, member.identifier(), pathAttributes);
            default: throw new IllegalArgumentException("Unknown member kind " + member.kind());
        }
    }

    @Override
    public String toString () {
        return "DirectoryCollection[" + directory() + "]";
    }
}
