package dev.catananti.publisher.document;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable document tree in the platform's block/inline model.
 * Block order is significant. An empty document has zero blocks, never null.
 */
public record ContentDocument(List<Block> blocks) {

    private static final ContentDocument EMPTY = new ContentDocument(List.of());

    public ContentDocument {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static ContentDocument empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public int size() {
        return blocks.size();
    }

    /**
     * Flattens the tree to text, one line per block or list item.
     */
    public String plainText() {
        return blocks.stream().map(Block::plainText).collect(Collectors.joining("\n"));
    }
}
