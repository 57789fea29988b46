// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.collection;

import org.locationtech.jts.geom.Envelope;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Objects;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;

/// Selects collection members by their descriptors. Filters never open members, so they can only
/// look at what a listing provides: kind, identifier, queryable attributes and envelope.
/// Filters compose with and(). The description appears in lookup error messages.
public final class MemberFilter implements Predicate<MemberDescriptor> {

    private final Predicate<MemberDescriptor> predicate;
    private final String description;

    private MemberFilter (Predicate<MemberDescriptor> predicate, String description) {
        this.predicate = predicate;
        this.description = description;
    }

    public static MemberFilter all () {
        return new MemberFilter(member -> true, "all");
    }

    public static MemberFilter kind (MemberKind kind) {
        checkNotNull(kind, "kind");
        return new MemberFilter(member -> member.kind() == kind, "kind=" + kind);
    }

    public static MemberFilter identifier (String identifier) {
        checkNotNull(identifier, "identifier");
        return new MemberFilter(member -> member.identifier().equals(identifier), "identifier=" + identifier);
    }

    /// Match identifiers against a glob pattern such as "sst/2020*". The * wildcard does not cross
    /// "/" separators, ** does.
    public static MemberFilter glob (String pattern) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        return new MemberFilter(member -> matcher.matches(Path.of(member.identifier())), "glob=" + pattern);
    }

    /// Match members whose attribute equals the value. Numbers are compared by value regardless
    /// of their boxed type, so 2020 matches an attribute holding 2020L.
    public static MemberFilter attribute (String name, Object value) {
        checkNotNull(name, "name");
        return new MemberFilter(member -> attributeEquals(member.attribute(name), value), name + "=" + value);
    }

    /// Match members whose envelope intersects the given one. Members with unknown envelopes are
    /// excluded.
    public static MemberFilter intersects (Envelope envelope) {
        checkNotNull(envelope, "envelope");
        Envelope copy = new Envelope(envelope);
        return new MemberFilter(member -> member.envelope() != null && member.envelope().intersects(copy),
              "intersects " + copy);
    }

    private static boolean attributeEquals (Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        return Objects.equals(actual, expected);
    }

    public MemberFilter and (MemberFilter other) {
        return new MemberFilter(predicate.and(other.predicate), description + " and " + other.description);
    }

    @Override
    public boolean test (MemberDescriptor member) {
        return predicate.test(member);
    }

    @Override
    public String toString () {
        return "[" + description + "]";
    }
}
