package com.vidnyan.cpg.domain.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parent, depth and line lookups over one syntax tree.
 * Immutable once built.
 */
public final class AstIndex {

    private final AstNode root;
    private final Map<String, AstNode> byId;
    private final Map<String, AstNode> parents;
    private final Map<String, Integer> depths;
    private final Map<Integer, List<AstNode>> byLine;

    private AstIndex(AstNode root, Map<String, AstNode> byId, Map<String, AstNode> parents,
                     Map<String, Integer> depths, Map<Integer, List<AstNode>> byLine) {
        this.root = root;
        this.byId = Collections.unmodifiableMap(byId);
        this.parents = Collections.unmodifiableMap(parents);
        this.depths = Collections.unmodifiableMap(depths);
        this.byLine = Collections.unmodifiableMap(byLine);
    }

    public static AstIndex of(AstNode root) {
        Map<String, AstNode> byId = new HashMap<>();
        Map<String, AstNode> parents = new HashMap<>();
        Map<String, Integer> depths = new HashMap<>();
        Map<Integer, List<AstNode>> byLine = new HashMap<>();
        index(root, null, 0, byId, parents, depths, byLine);
        return new AstIndex(root, byId, parents, depths, byLine);
    }

    private static void index(AstNode node, AstNode parent, int depth, Map<String, AstNode> byId,
                              Map<String, AstNode> parents, Map<String, Integer> depths,
                              Map<Integer, List<AstNode>> byLine) {
        byId.put(node.id(), node);
        depths.put(node.id(), depth);
        if (parent != null) {
            parents.put(node.id(), parent);
        }
        if (node.line() > 0) {
            byLine.computeIfAbsent(node.line(), k -> new ArrayList<>()).add(node);
        }
        for (AstNode child : node.children()) {
            index(child, node, depth + 1, byId, parents, depths, byLine);
        }
    }

    public AstNode root() {
        return root;
    }

    public Optional<AstNode> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Optional<AstNode> parentOf(String id) {
        return Optional.ofNullable(parents.get(id));
    }

    public int depthOf(String id) {
        return depths.getOrDefault(id, 0);
    }

    /**
     * Ancestors from the direct parent up to the root.
     */
    public List<AstNode> ancestorsOf(String id) {
        List<AstNode> result = new ArrayList<>();
        AstNode current = parents.get(id);
        while (current != null) {
            result.add(current);
            current = parents.get(current.id());
        }
        return result;
    }

    public List<AstNode> nodesAtLine(int line) {
        return byLine.getOrDefault(line, List.of());
    }

    /**
     * Deepest node that starts on the given line, if any.
     */
    public Optional<AstNode> deepestAtLine(int line) {
        return nodesAtLine(line).stream()
                .max((a, b) -> Integer.compare(depthOf(a.id()), depthOf(b.id())));
    }

    public int size() {
        return byId.size();
    }
}
