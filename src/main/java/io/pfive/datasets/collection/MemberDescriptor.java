// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.collection;

import com.google.common.collect.ImmutableMap;
import org.locationtech.jts.geom.Envelope;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/// Describes a member of a collection without opening it. Listing a collection produces these;
/// only resolving one opens the dataset itself.
///
/// @param identifier unique within the root collection
/// @param location where the backend finds the member, e.g. a file path. Opaque to callers.
/// @param attributes queryable attribute values (Long, Double or String) usable in filters
/// @param envelope bounds in the member's own coordinates, or null if unknown
public record MemberDescriptor (
      String identifier,
      MemberKind kind,
      String displayName,
      String location,
      Map<String, Object> attributes,
      Envelope envelope
) {

    public MemberDescriptor {
        checkNotNull(identifier, "identifier");
        checkNotNull(kind, "kind");
        if (displayName == null) displayName = identifier;
        attributes = (attributes == null) ? ImmutableMap.of() : ImmutableMap.copyOf(attributes);
        envelope = (envelope == null) ? null : new Envelope(envelope);
    }

    public static MemberDescriptor of (String identifier, MemberKind kind) {
        return new MemberDescriptor(identifier, kind, identifier, identifier, null, null);
    }

    public Object attribute (String name) {
        return attributes.get(name);
    }

}
