package com.edushield.gateway.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.edushield.access.IdentityScope;
import com.edushield.access.PolicyConfiguration;
import com.edushield.access.PolicyDecision;
import com.edushield.access.PolicyEngine;
import com.edushield.access.ResourceRegistry;
import com.edushield.access.freshness.FreshnessState;
import com.edushield.access.freshness.FreshnessTracker;
import com.edushield.access.testing.TestIdentityFactory;
import com.edushield.access.testing.TestInstitutionRecords;
import com.edushield.audit.AuditPipeline;
import com.edushield.audit.AuditPipelineOptions;
import com.edushield.audit.AuditRecord;
import com.edushield.audit.AuditSanitizer;
import com.edushield.audit.sink.InMemoryAuditSink;
import com.edushield.context.ContextPacketBuilder;
import com.edushield.context.ModelDescriptor;
import com.edushield.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

/**
 * Tests for {@link ContextControlEngine} wired by hand, without a Spring context.
 */
@DisplayName("ContextControlEngine")
class ContextControlEngineTest {

    private static final ModelDescriptor MODEL =
            new ModelDescriptor("claude-sonnet-4-20250514", "Anthropic", "SOC2-certified", "low");
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final Map<String, List<Map<String, Object>>> records = TestInstitutionRecords.all();

    private SimpleMeterRegistry meterRegistry;
    private InMemoryAuditSink auditBuffer;
    private AuditPipeline pipeline;
    private ContextControlEngine engine;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T09:30:05Z"), ZoneOffset.UTC);
        PolicyConfiguration configuration = PolicyConfiguration.defaults();
        meterRegistry = new SimpleMeterRegistry();
        MetricFactory metrics = new MetricFactory(meterRegistry, "context-gateway-test");
        auditBuffer = new InMemoryAuditSink();
        pipeline = new AuditPipeline(List.of(auditBuffer), new AuditSanitizer(), metrics,
                new AuditPipelineOptions(100, 3, Duration.ZERO, STOP_TIMEOUT));
        pipeline.start();
        engine = new ContextControlEngine(
                new PolicyEngine(ResourceRegistry.institutionDefaults(), configuration),
                new ContextPacketBuilder(configuration, clock),
                new FreshnessTracker(clock),
                pipeline,
                auditBuffer,
                new ContextPacketStore(100),
                metrics,
                MODEL,
                clock);
    }

    @AfterEach
    void tearDown() {
        pipeline.stop(STOP_TIMEOUT);
    }

    private IccpResponse process(IdentityScope identity, List<String> requested) {
        return engine.process(IccpRequest.of(identity, requested, records));
    }

    @Nested
    @DisplayName("decisions")
    class Decisions {

        @Test
        @DisplayName("student asking for grades and classes gets classes only")
        void studentGradesAndClasses() {
            IccpResponse response = process(TestIdentityFactory.student(), List.of("grades", "classes"));

            assertThat(response.accessLevel()).isEqualTo("partial");
            assertThat(response.contextPacket().authorizedResources()).containsExactly("classes");
            assertThat(response.contextPacket().deniedResources()).containsExactly("grades");
            assertThat(response.contextPacket().policyDecision()).isEqualTo(PolicyDecision.ALLOW_PARTIAL);
            assertThat(response.filteredContext())
                    .contains("=== GRADES ===")
                    .contains("ACCESS DENIED: Student cannot access grades")
                    .contains("=== CLASSES ===");
        }

        @Test
        @DisplayName("admin asking for everything gets everything")
        void adminEverything() {
            IccpResponse response = process(TestIdentityFactory.admin(), List.of());

            assertThat(response.accessLevel()).isEqualTo("full");
            assertThat(response.contextPacket().deniedResources()).isEmpty();
            assertThat(response.contextPacket().authorizedResources())
                    .containsExactly("persons", "financial_information", "grades", "classes", "documents");
        }

        @Test
        @DisplayName("teacher sees only their own salary, with the restriction note")
        void teacherOwnSalary() {
            IccpResponse response = process(TestIdentityFactory.teacher(), List.of("financial_information"));

            var financial = response.filteredView().resource("financial_information").orElseThrow();
            assertThat(financial.rows()).hasSize(1);
            assertThat(financial.rows().get(0)).containsEntry("person_id", TestIdentityFactory.TEACHER_ID);
            assertThat(financial.note()).isEqualTo("Restricted to your own salary only.");
            assertThat(response.contextPacket().constraints().rowRestrictedResources())
                    .containsExactly("financial_information");
        }

        @Test
        @DisplayName("social security numbers are masked in the filtered context")
        void ssnMasked() {
            IccpResponse response = process(TestIdentityFactory.student(), List.of("persons"));

            assertThat(response.contextPacket().maskedFields()).containsExactly("ssn");
            assertThat(response.filteredContext())
                    .doesNotContain(TestInstitutionRecords.STUDENT_SSN)
                    .contains("ssn: [MASKED]");
        }

        @Test
        @DisplayName("an unrecognized role is denied everything")
        void unrecognizedRole() {
            IccpResponse response = process(TestIdentityFactory.unrecognized("Hacker"), List.of("persons", "classes"));

            assertThat(response.accessLevel()).isEqualTo("denied");
            assertThat(response.contextPacket().authorizedResources()).isEmpty();
            assertThat(response.filteredView().granted()).isEmpty();
        }
    }

    @Nested
    @DisplayName("correlation and audit")
    class Correlation {

        @Test
        @DisplayName("every request gets a unique trace id and its packet is retrievable")
        void traceIds() {
            Set<String> traceIds = new HashSet<>();
            for (int i = 0; i < 10; i++) {
                IccpResponse response = process(TestIdentityFactory.teacher(), List.of("classes"));
                traceIds.add(response.traceId());
                assertThat(response.traceId()).matches("tr-[0-9a-f]{8}");
                assertThat(engine.packet(response.traceId())).contains(response.contextPacket());
            }
            assertThat(traceIds).hasSize(10);
        }

        @Test
        @DisplayName("exactly one audit entry is delivered per request, carrying no sensitive values")
        void oneAuditEntryPerRequest() {
            IccpResponse first = process(TestIdentityFactory.student(), List.of("persons", "financial_information"));
            IccpResponse second = process(TestIdentityFactory.admin(), List.of());
            assertThat(first.auditQueued()).isTrue();
            pipeline.stop(STOP_TIMEOUT);

            assertThat(engine.auditEntries()).hasSize(2);
            assertThat(engine.auditEntries()).extracting(AuditRecord::traceId)
                    .containsExactly(first.traceId(), second.traceId());
            AuditRecord record = engine.auditEntry(first.traceId()).orElseThrow();
            assertThat(record.payload().get("policy_decision").asText()).isEqualTo("ALLOW_FULL");
            assertThat(record.payload().get("model_invoked").asText()).isEqualTo(MODEL.modelId());
            assertThat(engine.auditEntries())
                    .allSatisfy(r -> assertThat(r.toJsonLine()).doesNotContainPattern("\\d{3}-\\d{2}-\\d{4}"));
        }

        @Test
        @DisplayName("audit sample returns the most recent entries")
        void auditSample() {
            for (int i = 0; i < 5; i++) {
                process(TestIdentityFactory.student(), List.of("classes"));
            }
            IccpResponse last = process(TestIdentityFactory.admin(), List.of("classes"));
            pipeline.stop(STOP_TIMEOUT);

            assertThat(engine.auditSample(2)).hasSize(2);
            assertThat(engine.auditSample(2).get(1).traceId()).isEqualTo(last.traceId());
            assertThat(engine.auditSample(50)).hasSize(6);
        }

        @Test
        @DisplayName("freshness is reported per authorized resource")
        void freshness() {
            IccpResponse first = process(TestIdentityFactory.admin(), List.of("classes"));
            IccpResponse second = process(TestIdentityFactory.admin(), List.of("classes"));

            assertThat(first.auditEntry().ttlStatus().get("classes").status()).isEqualTo(FreshnessState.REFRESHED);
            assertThat(second.auditEntry().ttlStatus().get("classes").status()).isEqualTo(FreshnessState.CACHED);
        }

        @Test
        @DisplayName("a stopped audit pipeline is reported on the response")
        void auditRejected() {
            pipeline.stop(STOP_TIMEOUT);

            IccpResponse response = process(TestIdentityFactory.admin(), List.of("classes"));

            assertThat(response.auditQueued()).isFalse();
            assertThat(meterRegistry.get("iccp.audit.rejected").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("requests are counted by decision and MDC is cleared afterwards")
        void metricsAndMdc() {
            process(TestIdentityFactory.student(), List.of("grades", "classes"));
            process(TestIdentityFactory.admin(), List.of());

            assertThat(meterRegistry.get("iccp.requests").tag("decision", "partial").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("iccp.requests").tag("decision", "full").counter().count()).isEqualTo(1.0);
            assertThat(MDC.get("traceId")).isNull();
        }
    }
}
