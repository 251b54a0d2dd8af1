package dev.catananti.publisher.service.transport;

/**
 * The two hosts the platform API is spread across.
 */
public enum Endpoint {
    /** Per-publication subdomain: draft lifecycle and note creation. */
    ACCOUNT,
    /** Shared global domain: image upload and share attachments. */
    GLOBAL
}
