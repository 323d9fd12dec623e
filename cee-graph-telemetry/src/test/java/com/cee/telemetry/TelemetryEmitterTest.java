package com.cee.telemetry;

import com.cee.config.EngineConfig;
import com.cee.config.TelemetrySinkType;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class TelemetryEmitterTest {

    @Test
    void emit_delegatesToSink() {
        List<String> events = new ArrayList<>();
        TelemetryEmitter emitter = new TelemetryEmitter((event, counts) -> events.add(event + ":" + counts.get("error_count")));

        emitter.emit("graph_validator.complete", Map.of("error_count", 3));

        assertEquals(List.of("graph_validator.complete:3"), events);
    }

    @Test
    void emit_sinkFailure_isContained() {
        TelemetryEmitter emitter = new TelemetryEmitter((event, counts) -> {
            throw new IllegalStateException("sink down");
        });

        assertDoesNotThrow(() -> emitter.emit("strp.complete", Map.of("mutation_count", 1)));
    }

    @Test
    void nullSink_fallsBackToNoOp() {
        TelemetryEmitter emitter = new TelemetryEmitter(null);
        assertInstanceOf(NoOpTelemetrySink.class, emitter.getSink());
        assertDoesNotThrow(() -> emitter.emit("strp.complete", Map.of()));
    }

    @Test
    void fromConfig_selectsSinkByType() {
        assertInstanceOf(NoOpTelemetrySink.class,
                TelemetryEmitter.fromConfig(EngineConfig.builder().telemetrySink(TelemetrySinkType.NONE).build()).getSink());
        assertInstanceOf(LoggingTelemetrySink.class,
                TelemetryEmitter.fromConfig(EngineConfig.defaults()).getSink());
        assertInstanceOf(MicrometerTelemetrySink.class,
                TelemetryEmitter.fromConfig(EngineConfig.builder().telemetrySink(TelemetrySinkType.MICROMETER).build()).getSink());
    }

    @Test
    void micrometerSink_recordsCounterAndSummaries() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerTelemetrySink sink = new MicrometerTelemetrySink(registry);
        Map<String, Number> counts = new LinkedHashMap<>();
        counts.put("valid", 0);
        counts.put("error_count", 2);

        sink.emit("graph_validator.complete", counts);
        counts.put("error_count", 4);
        sink.emit("graph_validator.complete", counts);

        assertEquals(2.0, registry.get("cee.graph_validator.complete").counter().count());
        DistributionSummary errors = registry.get("cee.graph_validator.complete.error_count").summary();
        assertNotNull(errors);
        assertEquals(2, errors.count());
        assertEquals(6.0, errors.totalAmount());
    }
}
