package dev.catananti.publisher.document;

/**
 * Top-level node of a {@link ContentDocument}.
 */
public sealed interface Block permits Heading, Paragraph, BulletList, OrderedList {

    /**
     * Text of the block with all marks dropped.
     */
    String plainText();
}
