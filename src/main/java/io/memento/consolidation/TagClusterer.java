package io.memento.consolidation;

import io.memento.memory.Memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups memories that share tags.
 *
 * <p>Two memories are in the same group when they share at least one tag, transitively: if A shares
 * a tag with B and B shares one with C, A, B and C form one group. Memories without tags are never
 * grouped. Groups come out in the order of their first member in the input.</p>
 */
public final class TagClusterer {

    private TagClusterer() {
    }

    /**
     * @param memories     candidate memories, all active
     * @param minGroupSize smallest group returned
     * @return groups with at least {@code minGroupSize} members, members in input order
     */
    public static List<List<Memory>> findGroups(List<Memory> memories, int minGroupSize) {
        UnionFind unionFind = new UnionFind();
        Map<String, String> firstMemoryByTag = new HashMap<>();
        List<Memory> tagged = new ArrayList<>();

        for (Memory memory : memories) {
            if (memory.consolidated() || memory.tags().isEmpty()) continue;
            tagged.add(memory);
            unionFind.find(memory.id());
            for (String tag : memory.tags()) {
                String first = firstMemoryByTag.putIfAbsent(tag, memory.id());
                if (first != null) {
                    unionFind.union(first, memory.id());
                }
            }
        }

        Map<String, List<Memory>> groups = new LinkedHashMap<>();
        for (Memory memory : tagged) {
            groups.computeIfAbsent(unionFind.find(memory.id()), root -> new ArrayList<>()).add(memory);
        }

        return groups.values().stream()
                .filter(group -> group.size() >= minGroupSize)
                .map(List::copyOf)
                .toList();
    }

    /**
     * Union-find over memory ids with path compression and union by rank.
     */
    static final class UnionFind {
        private final Map<String, String> parent = new HashMap<>();
        private final Map<String, Integer> rank = new HashMap<>();

        String find(String x) {
            String root = parent.computeIfAbsent(x, k -> {
                rank.put(k, 0);
                return k;
            });
            if (!root.equals(x)) {
                root = find(root);
                parent.put(x, root);
            }
            return root;
        }

        void union(String a, String b) {
            String rootA = find(a);
            String rootB = find(b);
            if (rootA.equals(rootB)) return;

            int rankA = rank.get(rootA);
            int rankB = rank.get(rootB);
            if (rankA < rankB) {
                parent.put(rootA, rootB);
            } else if (rankA > rankB) {
                parent.put(rootB, rootA);
            } else {
                parent.put(rootB, rootA);
                rank.put(rootA, rankA + 1);
            }
        }
    }
}
