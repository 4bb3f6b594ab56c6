package org.pragmatica.lmm.tree;

import java.util.List;
import java.util.Optional;

/**
 * Parsed document root: leading attribute lines plus the top-level nodes.
 */
public record Document(List<Attribute> attrs, List<Node> nodes) {

    public static final Document EMPTY = new Document(List.of(), List.of());

    public Document {
        attrs = List.copyOf(attrs);
        nodes = List.copyOf(nodes);
    }

    public Optional<String> attr(String key) {
        return attrs.stream()
                    .filter(attr -> attr.key().equals(key))
                    .map(Attribute::value)
                    .findFirst();
    }
}
