package org.kteam.mlcheck;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collates messages into threads.  A thread is treated as an undirected graph: every message is
 * a node, and a message is linked to the message it replies to and to every message named in
 * its References header.  Threads are the connected components of that graph.
 *
 * Messages can be added in any order.  A reply or reference to a message that was never added
 * (typically one sent before the archive window) is ignored, and a message without any links
 * forms a thread on its own.  If two messages share a message id, the last one added wins.
 *
 * Nodes live in an index arena; components are found with a union-find with path compression.
 */
public class ThreadCollator {
    // Insertion order is nice for usability when viewing the results.
    private final Map<String, Message> messagesById;

    public ThreadCollator() {
        messagesById = new LinkedHashMap<>();
    }

    /**
     * Create a collator holding the given messages.
     *
     * @param messages Messages to add.
     */
    public ThreadCollator(Collection<Message> messages) {
        this();
        messages.forEach(this::add);
    }

    /**
     * Add a message to be collated.
     *
     * @param message Message to add.
     */
    public void add(Message message) {
        messagesById.put(message.getMessageId(), message);
    }

    /**
     * Number of distinct messages held by the collator.
     */
    public int size() {
        return messagesById.size();
    }

    /**
     * Compute the threads of all messages added so far.  Every call recomputes the result from
     * scratch.  Each thread is sorted by timestamp, and threads are ordered by their earliest
     * message.
     *
     * @return List of threads, each a non-empty list of messages
     */
    public List<List<Message>> getThreads() {
        List<Message> nodes = new ArrayList<>(messagesById.values());
        Map<String, Integer> indexById = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            indexById.put(nodes.get(i).getMessageId(), i);
        }

        DisjointSet components = new DisjointSet(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            Message message = nodes.get(i);
            Integer parent = indexById.get(message.getInReplyTo());
            if (parent != null) {
                components.union(i, parent);
            }
            for (String reference : message.getReferences()) {
                Integer referenced = indexById.get(reference);
                if (referenced != null) {
                    components.union(i, referenced);
                }
            }
        }

        Map<Integer, List<Message>> threads = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            threads.computeIfAbsent(components.find(i), k -> new ArrayList<>()).add(nodes.get(i));
        }

        List<List<Message>> result = new ArrayList<>(threads.values());
        result.forEach(thread -> thread.sort(Comparator.naturalOrder()));
        result.sort(Comparator.comparing(thread -> thread.get(0)));
        return result;
    }

    /**
     * Union-find over node indices.
     */
    private static class DisjointSet {
        private final int[] parent;
        private final int[] rank;

        private DisjointSet(int size) {
            parent = new int[size];
            rank = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        private int find(int node) {
            int root = node;
            while (parent[root] != root) {
                root = parent[root];
            }
            // Path compression
            while (parent[node] != root) {
                int next = parent[node];
                parent[node] = root;
                node = next;
            }
            return root;
        }

        private void union(int a, int b) {
            int rootA = find(a);
            int rootB = find(b);
            if (rootA == rootB) {
                return;
            }
            if (rank[rootA] < rank[rootB]) {
                parent[rootA] = rootB;
            } else if (rank[rootA] > rank[rootB]) {
                parent[rootB] = rootA;
            } else {
                parent[rootB] = rootA;
                rank[rootA]++;
            }
        }
    }
}
