// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.collection;

import com.google.common.collect.AbstractIterator;
import io.pfive.datasets.exception.CyclicCollectionException;
import io.pfive.datasets.grid.Dataset;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/// Depth-first traversal of a collection and all collections nested in it. The traversal is lazy:
/// a nested collection is opened and listed only when the iteration reaches it, and closed once
/// all its members have been visited.
///
/// Collections are identified by fingerprint. If a nested collection has the same fingerprint as
/// one of the collections currently being traversed above it, the tree contains a cycle (usually
/// a symbolic link to a parent directory), and CyclicCollectionException is thrown naming the
/// chain of collections. The same collection reached by two different non-cyclic routes is
/// traversed twice.
public abstract class CollectionTraversal {

    /// A member found by traversal, with the collection that can open it.
    public record Member (DatasetCollection parent, MemberDescriptor descriptor) {
        /// The collection that listed this member must still be open, so call this during the
        /// traversal or on a root-level member.
        public Dataset open () {
            return parent.open(descriptor);
        }
    }

    /// All members at any depth matching the filter, in depth-first order with each collection
    /// member reported before its contents. Nested collections are descended whether or not they
    /// match the filter themselves.
    public static Iterable<Member> walk (DatasetCollection root, MemberFilter filter) {
        return () -> new TraversalIterator(root, filter);
    }

    /// Convenience for collecting all matches eagerly.
    public static List<Member> collect (DatasetCollection root, MemberFilter filter) {
        List<Member> members = new ArrayList<>();
        for (Member member : walk(root, filter)) members.add(member);
        return members;
    }

    private record Frame (DatasetCollection collection, String fingerprint, Iterator<MemberDescriptor> members,
                          boolean owned) { }

    private static class TraversalIterator extends AbstractIterator<Member> {
        private final MemberFilter filter;
        private final Deque<Frame> stack = new ArrayDeque<>();

        TraversalIterator (DatasetCollection root, MemberFilter filter) {
            this.filter = filter;
            stack.push(new Frame(root, root.fingerprint(), root.list().iterator(), false));
        }

        @Override
        protected Member computeNext () {
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.members().hasNext()) {
                    stack.pop();
                    if (frame.owned()) frame.collection().close();
                    continue;
                }
                MemberDescriptor descriptor = frame.members().next();
                Member member = new Member(frame.collection(), descriptor);
                if (descriptor.kind() == MemberKind.COLLECTION) {
                    descend(member);
                }
                if (filter.test(descriptor)) return member;
            }
            return endOfData();
        }

        private void descend (Member member) {
            Dataset opened = member.open();
            if (!(opened instanceof DatasetCollection nested)) {
                opened.close();
                return;
            }
            String fingerprint = nested.fingerprint();
            List<String> ancestors = new ArrayList<>();
            boolean cycle = false;
            // Deque iteration runs from the top of the stack, so reverse to list the root first.
            for (Frame frame : stack) {
                ancestors.add(0, frame.collection().displayName() + " (" + frame.fingerprint() + ")");
                cycle |= frame.fingerprint().equals(fingerprint);
            }
            if (cycle) {
                ancestors.add(nested.displayName() + " (" + fingerprint + ")");
                nested.close();
                throw new CyclicCollectionException(ancestors);
            }
            stack.push(new Frame(nested, fingerprint, nested.list().iterator(), true));
        }
    }
}
