package org.pragmatica.lmm.tree;

import java.util.List;
import java.util.Optional;

/**
 * Document tree node - either a named {@link Block} or a run of {@link Text} lines.
 */
public sealed interface Node {

    /**
     * Named container: {@code @name args [k=v] + { ... }}.
     *
     * @param name   block identifier
     * @param args   bare tokens following the name
     * @param params bracketed parameters, in source order, duplicates kept
     * @param attrs  attribute lines at the very start of the body
     * @param nodes  child nodes
     * @param span   header span, from {@code @} through the opening brace
     */
    record Block(
    String name,
    List<String> args,
    List<Attribute> params,
    List<Attribute> attrs,
    List<Node> nodes,
    SourceSpan span) implements Node {

        public Block {
            args = List.copyOf(args);
            params = List.copyOf(params);
            attrs = List.copyOf(attrs);
            nodes = List.copyOf(nodes);
        }

        /**
         * Value of the first parameter with the given key.
         */
        public Optional<String> param(String key) {
            return params.stream()
                         .filter(param -> param.key().equals(key))
                         .map(Attribute::value)
                         .findFirst();
        }

        public Optional<String> attr(String key) {
            return attrs.stream()
                        .filter(attr -> attr.key().equals(key))
                        .map(Attribute::value)
                        .findFirst();
        }

        /**
         * Whether the key appears as a parameter key or as a bare argument.
         */
        public boolean hasMarker(String key) {
            return params.stream().anyMatch(param -> param.key().equals(key)) || args.contains(key);
        }

        public String argsText() {
            return String.join(" ", args);
        }

        /**
         * Display title: the args joined by single spaces, or the block name when there are none.
         */
        public String title() {
            return args.isEmpty() ? name : argsText();
        }
    }

    /**
     * Consecutive text lines, comment lines included.
     */
    record Text(List<TextLine> lines) implements Node {

        public Text {
            lines = List.copyOf(lines);
        }

        /**
         * Lines that are rendered, i.e. everything except comments.
         */
        public List<TextLine> visibleLines() {
            return lines.stream()
                        .filter(line -> !line.isComment())
                        .toList();
        }
    }
}
