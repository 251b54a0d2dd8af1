package dev.catananti.publisher.document;

import java.util.List;

public record ConversionReport(ContentDocument document, List<ConversionDegraded> degradations) {

    public ConversionReport {
        degradations = List.copyOf(degradations);
    }

    public boolean isDegraded() {
        return !degradations.isEmpty();
    }
}
