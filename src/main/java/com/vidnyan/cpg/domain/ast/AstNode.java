package com.vidnyan.cpg.domain.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Immutable syntax tree node produced by the front-end parser.
 * Payload fields are optional and depend on the {@link AstKind}.
 */
public record AstNode(
    String id,
    AstKind kind,
    SourceLocation location,
    String name,
    Object value,
    String operator,
    List<AstNode> children,
    Map<String, Object> attributes
) {

    public static final String WILDCARD = "_";

    public AstNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        location = location != null ? location : SourceLocation.UNKNOWN;
        children = children != null ? List.copyOf(children) : List.of();
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public AstNode child(int index) {
        if (index < 0 || index >= children.size()) {
            throw new IllegalArgumentException(
                    kind + " node " + id + " has no child at index " + index);
        }
        return children.get(index);
    }

    public Optional<AstNode> firstChildOfKind(AstKind childKind) {
        return children.stream().filter(c -> c.kind == childKind).findFirst();
    }

    public List<AstNode> childrenOfKind(AstKind childKind) {
        return children.stream().filter(c -> c.kind == childKind).toList();
    }

    public AstNode lastChild() {
        return child(children.size() - 1);
    }

    public int line() {
        return location.line();
    }

    public boolean is(AstKind candidate) {
        return kind == candidate;
    }

    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /**
     * Qualifier of a remote call, e.g. {@code Enum} in {@code Enum.map/2}.
     */
    public Optional<String> qualifier() {
        return attribute("module").map(Object::toString);
    }

    /**
     * Qualified call name such as {@code Repo.get} or plain {@code helper}.
     */
    public String qualifiedName() {
        return qualifier().map(q -> q + "." + name).orElse(name);
    }

    /**
     * Number of parameters of a FUNCTION or FN node, taken from the first head.
     */
    public int arity() {
        Object declared = attributes.get("arity");
        if (declared instanceof Number number) {
            return number.intValue();
        }
        Optional<AstNode> params = firstChildOfKind(AstKind.PARAMETERS);
        if (params.isEmpty()) {
            params = firstChildOfKind(AstKind.CLAUSE).flatMap(c -> c.firstChildOfKind(AstKind.PARAMETERS));
        }
        return params.map(p -> p.children().size()).orElse(0);
    }

    /**
     * {@code name/arity} of a function node.
     */
    public String signature() {
        return name + "/" + arity();
    }

    public boolean isWildcard() {
        return kind == AstKind.VARIABLE && WILDCARD.equals(name);
    }

    /**
     * Pre-order traversal of this node and every descendant.
     */
    public Stream<AstNode> stream() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(AstNode::stream));
    }

    /**
     * Full textual form of the subtree: every node with its id, payload, sorted attributes and location.
     * Equal subtrees give equal text.
     */
    public String canonical() {
        StringBuilder out = new StringBuilder();
        appendCanonical(out);
        return out.toString();
    }

    private void appendCanonical(StringBuilder out) {
        out.append('(').append(kind).append(' ').append(id)
                .append(" @").append(location.filePath()).append(':').append(location.line())
                .append(':').append(location.column()).append('-').append(location.endLine())
                .append(':').append(location.endColumn());
        if (name != null) {
            out.append(" name=").append(name);
        }
        if (value != null) {
            out.append(" value=").append(value.getClass().getSimpleName()).append(':').append(value);
        }
        if (operator != null) {
            out.append(" op=").append(operator);
        }
        if (!attributes.isEmpty()) {
            out.append(" attrs=").append(new TreeMap<>(attributes));
        }
        for (AstNode child : children) {
            out.append(' ');
            child.appendCanonical(out);
        }
        out.append(')');
    }

    public static Builder builder(String id, AstKind kind) {
        return new Builder(id, kind);
    }

    public Builder toBuilder() {
        Builder b = new Builder(id, kind)
                .location(location)
                .name(name)
                .value(value)
                .operator(operator)
                .children(children);
        attributes.forEach(b::attribute);
        return b;
    }

    public static class Builder {
        private final String id;
        private final AstKind kind;
        private SourceLocation location = SourceLocation.UNKNOWN;
        private String name;
        private Object value;
        private String operator;
        private final List<AstNode> children = new ArrayList<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(String id, AstKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder location(SourceLocation location) { this.location = location; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder value(Object value) { this.value = value; return this; }
        public Builder operator(String operator) { this.operator = operator; return this; }
        public Builder child(AstNode child) { this.children.add(child); return this; }
        public Builder children(List<AstNode> children) { this.children.addAll(children); return this; }
        public Builder attribute(String key, Object value) {
            if (value != null) {
                this.attributes.put(key, value);
            }
            return this;
        }

        public AstNode build() {
            return new AstNode(id, kind, location, name, value, operator, children, attributes);
        }
    }
}
