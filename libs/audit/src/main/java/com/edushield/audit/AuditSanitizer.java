package com.edushield.audit;

import com.edushield.observability.SensitiveDataRedactor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scrubs audit entries before delivery.
 * <p>
 * Walks the entry's JSON tree: values under sensitive keys are replaced whole and every
 * string leaf is scanned for social security numbers. If anything goes wrong a minimal
 * fallback record is produced instead, so an entry is never dropped.
 */
public class AuditSanitizer {

    private static final Logger log = LoggerFactory.getLogger(AuditSanitizer.class);

    private final SensitiveDataRedactor redactor;

    public AuditSanitizer() {
        this(new SensitiveDataRedactor());
    }

    public AuditSanitizer(SensitiveDataRedactor redactor) {
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.redactor = redactor;
    }

    /**
     * Returns the sanitized record for an entry; falls back on any failure.
     */
    public AuditRecord sanitize(AuditLogEntry entry) {
        try {
            ObjectNode tree = AuditEntrySerializer.toTree(entry);
            scrub(tree);
            return new AuditRecord(entry.traceId(), tree, false);
        } catch (RuntimeException e) {
            log.warn("Audit entry {} could not be sanitized, delivering fallback record", entry.traceId(), e);
            return fallback(entry, e);
        }
    }

    /**
     * Redacts a JSON tree in place.
     */
    public void scrub(JsonNode node) {
        if (node instanceof ObjectNode object) {
            List<Map.Entry<String, JsonNode>> fields = new ArrayList<>();
            object.fields().forEachRemaining(fields::add);
            for (Map.Entry<String, JsonNode> field : fields) {
                Optional<String> replacement = redactor.replacementFor(field.getKey());
                if (replacement.isPresent()) {
                    object.put(field.getKey(), replacement.get());
                } else if (field.getValue().isTextual()) {
                    object.put(field.getKey(), redactor.redactText(field.getValue().asText()));
                } else {
                    scrub(field.getValue());
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                JsonNode item = array.get(i);
                if (item.isTextual()) {
                    array.set(i, TextNode.valueOf(redactor.redactText(item.asText())));
                } else {
                    scrub(item);
                }
            }
        }
    }

    private AuditRecord fallback(AuditLogEntry entry, RuntimeException cause) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("trace_id", redactor.redactText(entry.traceId()));
        node.put("policy_decision", entry.policyDecision().name());
        node.put("error", redactor.redactText("sanitization failed: " + cause.getClass().getSimpleName()));
        return new AuditRecord(entry.traceId(), node, true);
    }
}
