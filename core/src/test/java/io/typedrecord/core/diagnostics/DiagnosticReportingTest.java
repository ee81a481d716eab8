package io.typedrecord.core.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.typedrecord.core.engine.SchemaRegistry;
import io.typedrecord.core.engine.TypeValidator;
import io.typedrecord.core.engine.ValidatedRecord;
import io.typedrecord.core.model.RecordType;
import io.typedrecord.core.model.Schema;
import io.typedrecord.core.model.ValidationMode;
import io.typedrecord.core.model.ViolationKind;
import io.typedrecord.core.spi.DiagnosticSink;
import io.typedrecord.core.spi.DiagnosticSink.Diagnostic;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

/** Diagnostic delivery from the validator and records to a {@link DiagnosticSink}. */
@ExtendWith(MockitoExtension.class)
class DiagnosticReportingTest {

    @Mock
    private DiagnosticSink sink;

    private RecordType player;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger validatorLogger;

    @BeforeEach
    void setUp() {
        player = RecordType.of("Player", Schema.builder().field("level", "int").build());
        validatorLogger = (Logger) LoggerFactory.getLogger(TypeValidator.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        validatorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        validatorLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private static Map<String, Object> level(Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("level", value);
        return data;
    }

    @Test
    void strictSetFailureReportsTheMismatch() {
        TypeValidator validator = new TypeValidator(new SchemaRegistry(), sink);
        ValidatedRecord record = new ValidatedRecord(validator, player, level(1), ValidationMode.STRICT);

        record.set("level", "x");

        ArgumentCaptor<Diagnostic> captor = ArgumentCaptor.forClass(Diagnostic.class);
        verify(sink).report(captor.capture());
        Diagnostic diagnostic = captor.getValue();
        assertThat(diagnostic.kind()).isEqualTo(ViolationKind.TYPE_MISMATCH);
        assertThat(diagnostic.field()).isEqualTo("level");
        assertThat(diagnostic.expected()).isEqualTo("int");
        assertThat(diagnostic.actual()).isEqualTo("String");
        assertThat(diagnostic.contextLabel()).isEqualTo("Player");
        assertThat(diagnostic.severity()).isEqualTo(DiagnosticSink.Severity.ERROR);
    }

    @Test
    @DisplayName("a throwing sink is logged and never changes the outcome")
    void throwingSinkIsContained() {
        doThrow(new IllegalStateException("sink down")).when(sink).report(any());
        TypeValidator validator = new TypeValidator(new SchemaRegistry(), sink);
        ValidatedRecord record = new ValidatedRecord(validator, player, level(1), ValidationMode.STRICT);

        assertThat(record.set("level", "x").valid()).isFalse();
        assertThat(record.get("level")).isEqualTo(1);
        assertThat(validator.check(1, "Array<")).isFalse();

        verify(sink, times(2)).report(any());
        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("DiagnosticSink.report failed", "DiagnosticSink.report failed");
    }

    @Test
    void collectingSinkForwardsToDelegate() {
        CollectingDiagnosticSink collecting = new CollectingDiagnosticSink(sink);
        TypeValidator validator = new TypeValidator(new SchemaRegistry(), collecting);

        new ValidatedRecord(validator, player, level("x"), ValidationMode.LOOSE);

        assertThat(collecting.all())
                .extracting(Diagnostic::kind)
                .containsExactly(ViolationKind.TYPE_MISMATCH, ViolationKind.CONSTRUCTION_REJECTED);
        verify(sink, times(2)).report(any());

        collecting.clear();
        assertThat(collecting.last()).isEmpty();
        assertThat(collecting.lastMessage()).isNull();
    }
}
