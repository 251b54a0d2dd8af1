package dev.catananti.publisher.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps {@link ContentDocument} to and from the platform's JSON document tree
 * ({@code {"type":"doc","content":[...]}}).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentJsonCodec {

    static final String LINK_TARGET = "_blank";
    static final String LINK_REL = "noopener noreferrer nofollow";

    private final ObjectMapper objectMapper;

    public ObjectNode toJson(ContentDocument document) {
        ObjectNode doc = objectMapper.createObjectNode();
        doc.put("type", "doc");
        ArrayNode content = doc.putArray("content");
        for (Block block : document.blocks()) {
            content.add(blockNode(block));
        }
        return doc;
    }

    /**
     * Serialized form sent as the draft body, which the platform expects as a JSON string.
     */
    public String toJsonString(ContentDocument document) {
        try {
            return objectMapper.writeValueAsString(toJson(document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document", e);
        }
    }

    /**
     * Lenient decode of a stored draft body. Accepts either the tree or its string form;
     * unknown node types collapse to a plain paragraph of their text.
     */
    public ContentDocument fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ContentDocument.empty();
        }
        if (node.isTextual()) {
            String raw = node.asText();
            if (raw.isBlank()) {
                return ContentDocument.empty();
            }
            try {
                return fromJson(objectMapper.readTree(raw));
            } catch (JsonProcessingException e) {
                log.warn("Draft body is not valid JSON, ignoring: {}", e.getOriginalMessage());
                return ContentDocument.empty();
            }
        }
        List<Block> blocks = new ArrayList<>();
        for (JsonNode child : node.path("content")) {
            Block block = decodeBlock(child);
            if (block != null) {
                blocks.add(block);
            }
        }
        return new ContentDocument(blocks);
    }

    private ObjectNode blockNode(Block block) {
        ObjectNode node = objectMapper.createObjectNode();
        if (block instanceof Heading heading) {
            node.put("type", "heading");
            node.putObject("attrs").put("level", heading.level());
            node.set("content", inlineNodes(heading.inline()));
        } else if (block instanceof Paragraph paragraph) {
            return paragraphNode(paragraph);
        } else if (block instanceof BulletList list) {
            node.put("type", "bullet_list");
            node.set("content", listItemNodes(list.items()));
        } else if (block instanceof OrderedList list) {
            node.put("type", "ordered_list");
            node.putObject("attrs").put("start", 1).put("order", 1);
            node.set("content", listItemNodes(list.items()));
        }
        return node;
    }

    private ObjectNode paragraphNode(Paragraph paragraph) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "paragraph");
        node.set("content", inlineNodes(paragraph.inline()));
        return node;
    }

    private ArrayNode listItemNodes(List<Paragraph> items) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Paragraph item : items) {
            ObjectNode listItem = array.addObject();
            listItem.put("type", "list_item");
            listItem.putArray("content").add(paragraphNode(item));
        }
        return array;
    }

    private ArrayNode inlineNodes(List<TextRun> runs) {
        ArrayNode array = objectMapper.createArrayNode();
        for (TextRun run : runs) {
            ObjectNode text = array.addObject();
            text.put("type", "text");
            text.put("text", run.text());
            if (!run.marks().isEmpty()) {
                ArrayNode marks = text.putArray("marks");
                for (Mark mark : run.marks()) {
                    ObjectNode markNode = marks.addObject();
                    markNode.put("type", mark.type().getWireName());
                    if (mark.type() == MarkType.LINK) {
                        ObjectNode attrs = markNode.putObject("attrs");
                        attrs.put("href", mark.href());
                        attrs.put("target", LINK_TARGET);
                        attrs.put("rel", LINK_REL);
                        attrs.putNull("class");
                    }
                }
            }
        }
        return array;
    }

    private Block decodeBlock(JsonNode node) {
        String type = node.path("type").asText("");
        switch (type) {
            case "heading": {
                List<TextRun> runs = decodeInline(node.path("content"));
                if (runs.isEmpty()) {
                    return null;
                }
                int level = node.path("attrs").path("level").asInt(Heading.MIN_LEVEL);
                return new Heading(Math.max(Heading.MIN_LEVEL, Math.min(level, Heading.MAX_LEVEL)), runs);
            }
            case "paragraph": {
                List<TextRun> runs = decodeInline(node.path("content"));
                return runs.isEmpty() ? null : new Paragraph(runs);
            }
            case "bullet_list": {
                List<Paragraph> items = decodeItems(node.path("content"));
                return items.isEmpty() ? null : new BulletList(items);
            }
            case "ordered_list": {
                List<Paragraph> items = decodeItems(node.path("content"));
                return items.isEmpty() ? null : new OrderedList(items);
            }
            default: {
                String text = collectText(node, new StringBuilder()).toString().strip();
                return text.isEmpty() ? null : Paragraph.plain(text);
            }
        }
    }

    private List<Paragraph> decodeItems(JsonNode content) {
        List<Paragraph> items = new ArrayList<>();
        for (JsonNode item : content) {
            List<TextRun> runs = new ArrayList<>();
            for (JsonNode child : item.path("content")) {
                runs.addAll(decodeInline(child.path("content")));
            }
            if (!runs.isEmpty()) {
                items.add(new Paragraph(runs));
            }
        }
        return items;
    }

    private List<TextRun> decodeInline(JsonNode content) {
        List<TextRun> runs = new ArrayList<>();
        for (JsonNode child : content) {
            String text = child.path("text").asText("");
            if (text.isEmpty()) {
                continue;
            }
            Set<Mark> marks = new HashSet<>();
            for (JsonNode markNode : child.path("marks")) {
                MarkType type = MarkType.fromWireName(markNode.path("type").asText());
                if (type == MarkType.LINK) {
                    marks.add(Mark.link(markNode.path("attrs").path("href").asText("")));
                } else if (type != null) {
                    marks.add(Mark.of(type));
                }
            }
            runs.add(new TextRun(text, marks));
        }
        return runs;
    }

    private StringBuilder collectText(JsonNode node, StringBuilder sb) {
        if (node.has("text")) {
            sb.append(node.path("text").asText());
        }
        for (JsonNode child : node.path("content")) {
            collectText(child, sb);
        }
        return sb;
    }
}
