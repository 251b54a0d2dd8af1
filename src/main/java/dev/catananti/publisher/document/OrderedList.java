package dev.catananti.publisher.document;

import java.util.List;
import java.util.stream.Collectors;

public record OrderedList(List<Paragraph> items) implements Block {

    public OrderedList {
        items = List.copyOf(items);
    }

    @Override
    public String plainText() {
        return items.stream().map(Paragraph::plainText).collect(Collectors.joining("\n"));
    }
}
