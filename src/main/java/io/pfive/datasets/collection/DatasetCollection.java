// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.collection;

import io.pfive.datasets.exception.AmbiguousIdentifierException;
import io.pfive.datasets.exception.NotFoundException;
import io.pfive.datasets.grid.Dataset;

import java.util.ArrayList;
import java.util.List;

/// A dataset whose content is other datasets: grids, tables and nested collections. Members are
/// described cheaply by listing and opened only when resolved.
public interface DatasetCollection extends Dataset {

    /// The direct members matching the filter. Nothing is scanned until the result is iterated, and
    /// every iteration scans again, so changes to the backend are seen by later iterations.
    Iterable<MemberDescriptor> list (MemberFilter filter);

    default Iterable<MemberDescriptor> list () {
        return list(MemberFilter.all());
    }

    /// Open the member described. The descriptor must come from this collection's listing.
    Dataset open (MemberDescriptor member);

    /// Open the member with the identifier. Backends may list several members under one identifier
    /// (a grid and a table sharing a file name), in which case the caller must narrow the lookup
    /// with a filter, e.g. on kind.
    /// @throws NotFoundException if no direct member has the identifier
    /// @throws AmbiguousIdentifierException if more than one member has the identifier
    default Dataset resolve (String identifier) {
        return resolveOne(MemberFilter.identifier(identifier), identifier);
    }

    /// Open the one member matching the filter.
    /// @throws NotFoundException if no member matches
    /// @throws AmbiguousIdentifierException if more than one member matches
    default Dataset resolve (MemberFilter filter) {
        return resolveOne(filter, filter.toString());
    }

    private Dataset resolveOne (MemberFilter filter, String request) {
        List<MemberDescriptor> matches = new ArrayList<>();
        for (MemberDescriptor member : list(filter)) matches.add(member);
        if (matches.isEmpty()) {
            throw new NotFoundException(displayName(), request);
        }
        if (matches.size() > 1) {
            throw new AmbiguousIdentifierException(displayName(), request,
                  matches.stream().map(m -> m.identifier() + " (" + m.kind() + ")").toList());
        }
        return open(matches.get(0));
    }

    /// Open every member matching the filter, in listing order.
    default List<Dataset> resolveAll (MemberFilter filter) {
        List<Dataset> datasets = new ArrayList<>();
        for (MemberDescriptor member : list(filter)) datasets.add(open(member));
        return datasets;
    }

}
