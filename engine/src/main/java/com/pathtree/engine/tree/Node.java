package com.pathtree.engine.tree;

import com.pathtree.engine.frame.Frame;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A node of a {@link PathTree}: either a {@link Branch} holding ordered children or a {@link Leaf}
 * holding an opaque payload.
 */
public interface Node {

    Node deepCopy();

    /** Converts the node back into plain nested maps, lists and payload objects. */
    Object toPlain();

    /**
     * Wraps plain data: maps become branches, lists become sequence leaves, frames become frame
     * leaves and anything else a scalar leaf. Nodes are returned unchanged.
     */
    static Node wrap(Object value) {
        if (value instanceof Node node) {
            return node;
        }
        if (value instanceof Map<?, ?> map) {
            Branch branch = new Branch();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                branch.put(entry.getKey(), wrap(entry.getValue()));
            }
            return branch;
        }
        return Leaf.of(value);
    }

    /** Insertion-ordered container of child nodes. */
    final class Branch implements Node {
        private final LinkedHashMap<Object, Node> children = new LinkedHashMap<>();

        public Set<Object> keys() {
            return Collections.unmodifiableSet(children.keySet());
        }

        public Iterable<Map.Entry<Object, Node>> entries() {
            return Collections.unmodifiableMap(children).entrySet();
        }

        public List<Node> values() {
            return List.copyOf(children.values());
        }

        public Node get(Object key) {
            return children.get(key);
        }

        public boolean containsKey(Object key) {
            return children.containsKey(key);
        }

        public void put(Object key, Node child) {
            children.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(child, "child"));
        }

        public Node remove(Object key) {
            return children.remove(key);
        }

        public void clear() {
            children.clear();
        }

        public int size() {
            return children.size();
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }

        @Override
        public Branch deepCopy() {
            Branch copy = new Branch();
            for (Map.Entry<Object, Node> entry : children.entrySet()) {
                copy.children.put(entry.getKey(), entry.getValue().deepCopy());
            }
            return copy;
        }

        @Override
        public Map<Object, Object> toPlain() {
            Map<Object, Object> plain = new LinkedHashMap<>();
            for (Map.Entry<Object, Node> entry : children.entrySet()) {
                plain.put(entry.getKey(), entry.getValue().toPlain());
            }
            return plain;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            return other instanceof Branch branch && children.equals(branch.children);
        }

        @Override
        public int hashCode() {
            return children.hashCode();
        }

        @Override
        public String toString() {
            return children.toString();
        }
    }

    /** Opaque payload at the end of a path. */
    final class Leaf implements Node {
        public enum Kind {
            SCALAR,
            SEQUENCE,
            FRAME
        }

        private final Kind kind;
        private final Object payload;
        private final List<Object> sequence;

        private Leaf(Kind kind, Object payload, List<Object> sequence) {
            this.kind = kind;
            this.payload = payload;
            this.sequence = sequence;
        }

        public static Leaf of(Object payload) {
            if (payload instanceof Frame) {
                return new Leaf(Kind.FRAME, payload, null);
            }
            if (payload instanceof List<?> list) {
                List<Object> sequence = Collections.unmodifiableList(new ArrayList<>(list));
                return new Leaf(Kind.SEQUENCE, sequence, sequence);
            }
            return new Leaf(Kind.SCALAR, payload, null);
        }

        public Kind kind() {
            return kind;
        }

        public Object payload() {
            return payload;
        }

        public List<Object> sequence() {
            if (kind != Kind.SEQUENCE) {
                throw new IllegalStateException("leaf is a " + kind + ", not a sequence");
            }
            return sequence;
        }

        public Frame frame() {
            if (kind != Kind.FRAME) {
                throw new IllegalStateException("leaf is a " + kind + ", not a frame");
            }
            return (Frame) payload;
        }

        /**
         * A leaf is empty when it holds {@code null}, the empty string, an empty sequence or a frame
         * without rows.
         */
        public boolean isEmpty() {
            return switch (kind) {
                case SEQUENCE -> sequence().isEmpty();
                case FRAME -> frame().isEmpty();
                case SCALAR -> payload == null || "".equals(payload);
            };
        }

        @Override
        public Leaf deepCopy() {
            // payloads are immutable or treated as opaque
            return this;
        }

        @Override
        public Object toPlain() {
            return payload;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            return other instanceof Leaf leaf && kind == leaf.kind && Objects.equals(payload, leaf.payload);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, payload);
        }

        @Override
        public String toString() {
            return String.valueOf(payload);
        }
    }
}
