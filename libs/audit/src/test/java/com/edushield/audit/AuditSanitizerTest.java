package com.edushield.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.edushield.access.PolicyDecision;
import com.edushield.access.testing.TestIdentityFactory;
import com.edushield.observability.SensitiveDataRedactor;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuditSanitizer")
class AuditSanitizerTest {

    private final AuditSanitizer sanitizer = new AuditSanitizer();

    private static AuditLogEntry entryWithExplanation(String explanation) {
        var student = TestIdentityFactory.student();
        return new AuditLogEntry("tr-bbbb0001", student.userId(), "Student", "Student", student.clearance(),
                student.session(), AuditEntries.MODEL, List.of("persons"), List.of(), List.of("ssn"),
                PolicyDecision.ALLOW_FULL, explanation, Map.of(), AuditEntries.TIMESTAMP);
    }

    @Test
    @DisplayName("social security numbers in free text are replaced")
    void scrubsSsnInText() {
        AuditRecord record = sanitizer.sanitize(entryWithExplanation("Lookup for 123-45-6789 granted."));

        assertThat(record.payload().get("explanation").asText()).isEqualTo("Lookup for [REDACTED-SSN] granted.");
        assertThat(record.toJsonLine()).doesNotContainPattern("\\d{3}-\\d{2}-\\d{4}");
        assertThat(record.fallback()).isFalse();
    }

    @Test
    @DisplayName("masked field names are kept since they are values, not keys")
    void keepsFieldNames() {
        AuditRecord record = sanitizer.sanitize(entryWithExplanation("ok"));

        assertThat(record.payload().get("fields_masked").get(0).asText()).isEqualTo("ssn");
    }

    @Test
    @DisplayName("values under sensitive keys are replaced at any depth, ignoring case")
    void scrubsSensitiveKeys() {
        ObjectNode node = AuditEntrySerializer.objectMapper().createObjectNode();
        node.put("SSN", "987-65-4321");
        node.putObject("row").put("annual_salary", 72000).put("name", "Dana");
        node.putArray("rows").addObject().put("balance", 4000).put("note", "ssn 111-22-3333");

        sanitizer.scrub(node);

        assertThat(node.get("SSN").asText()).isEqualTo("[REDACTED]");
        assertThat(node.at("/row/annual_salary").asText()).isEqualTo("[REDACTED-FINANCIAL]");
        assertThat(node.at("/row/name").asText()).isEqualTo("Dana");
        assertThat(node.at("/rows/0/balance").asText()).isEqualTo("[REDACTED-FINANCIAL]");
        assertThat(node.at("/rows/0/note").asText()).isEqualTo("ssn [REDACTED-SSN]");
    }

    @Test
    @DisplayName("a sanitizer fault yields a scrubbed fallback record")
    void fallbackOnFault() {
        SensitiveDataRedactor broken = mock(SensitiveDataRedactor.class);
        when(broken.replacementFor(anyString())).thenThrow(new IllegalStateException("table corrupted"));
        when(broken.redactText(anyString())).thenAnswer(inv -> inv.getArgument(0, String.class)
                .replaceAll("\\d{3}-\\d{2}-\\d{4}", "[REDACTED-SSN]"));

        AuditRecord record = new AuditSanitizer(broken).sanitize(entryWithExplanation("123-45-6789"));

        assertThat(record.fallback()).isTrue();
        assertThat(record.traceId()).isEqualTo("tr-bbbb0001");
        assertThat(record.payload().get("trace_id").asText()).isEqualTo("tr-bbbb0001");
        assertThat(record.payload().get("policy_decision").asText()).isEqualTo("ALLOW_FULL");
        assertThat(record.payload().get("error").asText()).contains("sanitization failed");
        assertThat(record.toJsonLine()).doesNotContain("123-45-6789");
    }
}
