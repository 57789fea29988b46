// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.collection;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.pfive.datasets.cache.CacheKey;
import io.pfive.datasets.derived.DependencyGraph;
import io.pfive.datasets.derived.Derivation;
import io.pfive.datasets.derived.GridEngine;
import io.pfive.datasets.exception.IncompatibleGridsException;
import io.pfive.datasets.exception.NotFoundException;
import io.pfive.datasets.grid.Dataset;
import io.pfive.datasets.grid.Grid;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// A collection assembled in code rather than found in storage. Members are supplied lazily: a
/// supplier is called the first time its member is opened, and the dataset it returns is reused
/// afterward. Members can also be derived grids defined over other members of the same collection
/// by identifier, evaluated through a GridEngine when opened.
///
/// The whole graph of derived definitions is checked when the collection is built: every input
/// must name a member, and no definition may depend on itself directly or through others.
///
/// The fingerprint covers the collection's name and structure (member identifiers, kinds,
/// locations and attributes, derivation identities and inputs) and the current fingerprints of
/// members added as ready datasets. Members added as suppliers are not opened to compute it, so
/// they only contribute their descriptors: two collections with the same name whose lazy members
/// have the same descriptors share a fingerprint, and traversal would see one nested inside the
/// other as a cycle. Give such members distinct locations, or add them as datasets.
public class VirtualCollection implements DatasetCollection {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final String displayName;
    private final Map<String, Entry> entries;
    private final String structure;
    private final Map<String, Dataset> readyMembers;

    private VirtualCollection (String displayName, Map<String, Entry> entries, String structure,
                               Map<String, Dataset> readyMembers) {
        this.displayName = displayName;
        this.entries = entries;
        this.structure = structure;
        this.readyMembers = readyMembers;
    }

    public static Builder builder (String displayName, GridEngine engine) {
        return new Builder(displayName, engine);
    }

    @Override
    public String displayName () {
        return displayName;
    }

    @Override
    public String fingerprint () {
        if (readyMembers.isEmpty()) return structure;
        // Recomputed on each call, ready members may be backed by files that change.
        CacheKey.Builder key = CacheKey.builder("virtual").put("structure", structure);
        for (Map.Entry<String, Dataset> member : readyMembers.entrySet()) {
            key.put("content." + member.getKey(), member.getValue().fingerprint());
        }
        return key.build().fingerprint();
    }

    @Override
    public Iterable<MemberDescriptor> list (MemberFilter filter) {
        return () -> entries.values().stream().map(Entry::descriptor).filter(filter).iterator();
    }

    @Override
    public Dataset open (MemberDescriptor member) {
        Entry entry = entries.get(member.identifier());
        if (entry == null) throw new NotFoundException(displayName, member.identifier());
        return entry.dataset().get();
    }

    /// Opens the member, which must be a grid.
    private Grid openGrid (String identifier) {
        Entry entry = entries.get(identifier);
        if (entry == null) throw new NotFoundException(displayName, identifier);
        Dataset dataset = entry.dataset().get();
        if (!(dataset instanceof Grid grid)) {
            throw new IncompatibleGridsException(String.format("Member %s of %s is not a grid.", identifier, displayName));
        }
        return grid;
    }

    @Override
    public String toString () {
        return "VirtualCollection[" + displayName + ", " + entries.size() + " members]";
    }

    private record Entry (MemberDescriptor descriptor, Supplier<Dataset> dataset) { }

    private record Definition (Derivation derivation, Double outputNoData, List<String> inputs) { }

    /// Not threadsafe, build the collection in one thread.
    public static class Builder {
        private final String displayName;
        private final GridEngine engine;
        private final Map<String, MemberDescriptor> descriptors = new LinkedHashMap<>();
        private final Map<String, Supplier<? extends Dataset>> suppliers = new LinkedHashMap<>();
        private final Map<String, Dataset> readyMembers = new LinkedHashMap<>();
        private final Map<String, Definition> definitions = new LinkedHashMap<>();

        private Builder (String displayName, GridEngine engine) {
            this.displayName = checkNotNull(displayName, "displayName");
            this.engine = engine;
        }

        private void checkNew (String identifier) {
            checkNotNull(identifier, "identifier");
            checkArgument(!descriptors.containsKey(identifier), "Duplicate member identifier %s.", identifier);
        }

        public Builder add (MemberDescriptor descriptor, Supplier<? extends Dataset> supplier) {
            checkNew(descriptor.identifier());
            descriptors.put(descriptor.identifier(), descriptor);
            suppliers.put(descriptor.identifier(), checkNotNull(supplier, "supplier"));
            return this;
        }

        /// Add a dataset that is already open. Its fingerprint is part of the collection's.
        public Builder add (MemberDescriptor descriptor, Dataset dataset) {
            checkNotNull(dataset, "dataset");
            add(descriptor, () -> dataset);
            readyMembers.put(descriptor.identifier(), dataset);
            return this;
        }

        public Builder grid (String identifier, Grid grid) {
            return add(MemberDescriptor.of(identifier, MemberKind.GRID), grid);
        }

        public Builder collection (String identifier, DatasetCollection collection) {
            return add(MemberDescriptor.of(identifier, MemberKind.COLLECTION), collection);
        }

        public Builder grid (String identifier, Supplier<? extends Grid> supplier) {
            return add(MemberDescriptor.of(identifier, MemberKind.GRID), supplier);
        }

        public Builder grid (String identifier, Map<String, Object> attributes, Envelope envelope,
                             Supplier<? extends Grid> supplier) {
            return add(new MemberDescriptor(identifier, MemberKind.GRID, identifier, identifier, attributes, envelope), supplier);
        }

        public Builder collection (String identifier, Supplier<? extends DatasetCollection> supplier) {
            return add(MemberDescriptor.of(identifier, MemberKind.COLLECTION), supplier);
        }

        /// Define a grid computed from other grid members of this collection.
        public Builder derived (String identifier, Derivation derivation, String... inputs) {
            return derived(identifier, derivation, null, inputs);
        }

        public Builder derived (String identifier, Derivation derivation, Double outputNoData, String... inputs) {
            checkNew(identifier);
            checkNotNull(derivation, "derivation");
            checkArgument(engine != null, "Derived members need a GridEngine.");
            descriptors.put(identifier, MemberDescriptor.of(identifier, MemberKind.GRID));
            definitions.put(identifier, new Definition(derivation, outputNoData, ImmutableList.copyOf(inputs)));
            return this;
        }

        /// @throws NotFoundException if a derived member names an input that is not a member
        /// @throws io.pfive.datasets.exception.CyclicDerivationException if derived members depend on themselves
        public VirtualCollection build () {
            DependencyGraph graph = new DependencyGraph();
            CacheKey.Builder key = CacheKey.builder("virtual").put("name", displayName);
            for (MemberDescriptor descriptor : descriptors.values()) {
                graph.addNode(descriptor.identifier());
                String member = "member." + descriptor.identifier();
                key.put(member, descriptor.kind().name());
                key.put(member + ".location", String.valueOf(descriptor.location()));
                if (!descriptor.attributes().isEmpty()) {
                    key.put(member + ".attributes", new TreeMap<>(descriptor.attributes()).toString());
                }
                if (descriptor.envelope() != null) {
                    key.put(member + ".envelope", descriptor.envelope().toString());
                }
            }
            for (Map.Entry<String, Definition> definition : definitions.entrySet()) {
                String identifier = definition.getKey();
                List<String> inputs = definition.getValue().inputs();
                for (String input : inputs) {
                    if (!descriptors.containsKey(input)) throw new NotFoundException(displayName, input);
                    graph.addDependency(identifier, input);
                }
                key.put("derived." + identifier, definition.getValue().derivation().identity() + inputs);
            }
            Map<String, Entry> entries = new LinkedHashMap<>();
            // The suppliers of derived members refer back to the collection being built.
            VirtualCollection collection = new VirtualCollection(displayName, entries, key.build().fingerprint(),
                  ImmutableMap.copyOf(readyMembers));
            for (MemberDescriptor descriptor : descriptors.values()) {
                String identifier = descriptor.identifier();
                Supplier<Dataset> supplier;
                Definition definition = definitions.get(identifier);
                if (definition == null) {
                    Supplier<? extends Dataset> base = suppliers.get(identifier);
                    supplier = Suppliers.memoize(() -> checkNotNull(base.get(), "Supplier for %s returned null.", identifier));
                } else {
                    supplier = Suppliers.memoize(() -> {
                        Grid[] inputGrids = definition.inputs().stream().map(collection::openGrid).toArray(Grid[]::new);
                        return engine.derive(definition.derivation(), definition.outputNoData(), inputGrids);
                    });
                }
                entries.put(identifier, new Entry(descriptor, supplier));
            }
            LOG.debug("Built {} with {} derived members.", collection, definitions.size());
            return collection;
        }
    }
}
