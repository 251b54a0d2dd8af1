package dev.catananti.publisher.model;

public enum BodyFormat {
    HTML,
    MARKDOWN
}
