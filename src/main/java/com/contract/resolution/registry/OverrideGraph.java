package com.contract.resolution.registry;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.DocumentOverride;
import com.contract.resolution.core.model.ResolutionTier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Path queries over the override edges of a snapshot.
 *
 * Traversal is an iterative depth-first search over document arena indices with an
 * explicit visited set and an in-progress set marking the current path.
 */
public final class OverrideGraph {

    private static final List<ResolutionTier> OVERRIDE_TIERS =
            List.of(ResolutionTier.CLAUSE_SPECIFIC, ResolutionTier.PARTIAL, ResolutionTier.FULL);

    private OverrideGraph() {
    }

    /**
     * Returns the document path that adding {@code candidate} would close into a cycle,
     * considering only existing edges whose scope overlaps the candidate's.
     * The path runs from the candidate's overridden document back to its overriding document.
     */
    public static Optional<List<String>> findCycle(ContractSnapshot snapshot, DocumentOverride candidate) {
        if (candidate.overridingDocumentId().equals(candidate.overriddenDocumentId())) {
            return Optional.of(List.of(candidate.overridingDocumentId()));
        }
        OptionalInt from = snapshot.indexOf(candidate.overriddenDocumentId());
        OptionalInt to = snapshot.indexOf(candidate.overridingDocumentId());
        if (from.isEmpty() || to.isEmpty()) {
            return Optional.empty();
        }
        return findPath(snapshot, from.getAsInt(), to.getAsInt(), candidate::overlaps)
                .map(path -> path.stream().map(i -> snapshot.documentAt(i).getId()).toList());
    }

    /**
     * The strongest override tier by which {@code winner} shadows {@code loser} for a clause.
     * Chains are followed transitively and are as strong as their weakest edge.
     */
    public static Optional<ResolutionTier> strongestTier(ContractSnapshot snapshot, String winner, String loser,
                                                         CanonicalClauseId clauseId) {
        OptionalInt from = snapshot.indexOf(winner);
        OptionalInt to = snapshot.indexOf(loser);
        if (from.isEmpty() || to.isEmpty() || from.getAsInt() == to.getAsInt()) {
            return Optional.empty();
        }
        for (ResolutionTier level : OVERRIDE_TIERS) {
            Predicate<DocumentOverride> usable = edge -> edge.covers(clauseId)
                    && ResolutionTier.of(edge.overrideType()).ordinal() <= level.ordinal();
            if (findPath(snapshot, from.getAsInt(), to.getAsInt(), usable).isPresent()) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Documents on any chain through {@code edge}: its two endpoints, everything the overridden
     * document reaches and everything that reaches the overriding document, over edges whose
     * scope overlaps the given one.
     */
    public static Set<String> chainThrough(ContractSnapshot snapshot, DocumentOverride edge) {
        Set<String> documents = new LinkedHashSet<>();
        documents.addAll(reachable(snapshot, edge.overridingDocumentId(), edge, false));
        documents.addAll(reachable(snapshot, edge.overriddenDocumentId(), edge, true));
        return documents;
    }

    private static Set<String> reachable(ContractSnapshot snapshot, String start, DocumentOverride scope,
                                         boolean downstream) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (DocumentOverride candidate : snapshot.getOverrides()) {
                if (!scope.overlaps(candidate)) {
                    continue;
                }
                String from = downstream ? candidate.overridingDocumentId() : candidate.overriddenDocumentId();
                String to = downstream ? candidate.overriddenDocumentId() : candidate.overridingDocumentId();
                if (from.equals(current) && seen.add(to)) {
                    queue.add(to);
                }
            }
        }
        return seen;
    }

    static Optional<List<Integer>> findPath(ContractSnapshot snapshot, int from, int to,
                                            Predicate<DocumentOverride> usable) {
        int size = snapshot.documentCount();
        boolean[] visited = new boolean[size];
        boolean[] inProgress = new boolean[size];
        // Each frame is {documentIndex, nextEdgePosition}
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{from, 0});
        visited[from] = true;
        inProgress[from] = true;

        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            int node = frame[0];
            if (node == to) {
                List<Integer> path = new ArrayList<>(stack.size());
                Iterator<int[]> it = stack.descendingIterator();
                while (it.hasNext()) {
                    path.add(it.next()[0]);
                }
                return Optional.of(path);
            }
            List<DocumentOverride> edges = snapshot.outgoingOverrides(node);
            if (frame[1] >= edges.size()) {
                inProgress[node] = false;
                stack.pop();
                continue;
            }
            DocumentOverride edge = edges.get(frame[1]++);
            if (!usable.test(edge)) {
                continue;
            }
            OptionalInt next = snapshot.indexOf(edge.overriddenDocumentId());
            if (next.isEmpty()) {
                continue;
            }
            int target = next.getAsInt();
            if (inProgress[target] || visited[target]) {
                continue;
            }
            visited[target] = true;
            inProgress[target] = true;
            stack.push(new int[]{target, 0});
        }
        return Optional.empty();
    }
}
