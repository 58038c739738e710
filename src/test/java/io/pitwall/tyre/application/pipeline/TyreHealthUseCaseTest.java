package io.pitwall.tyre.application.pipeline;

import static io.pitwall.tyre.testutil.LapFixtures.lap;
import static io.pitwall.tyre.testutil.LapFixtures.stint;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.pitwall.tyre.application.model.TyreDegradationModel;
import io.pitwall.tyre.application.port.MetricsPort;
import io.pitwall.tyre.config.ModelConfig;
import io.pitwall.tyre.domain.lap.LapRecord;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class TyreHealthUseCaseTest {
  private final ModelConfig config = ModelConfig.defaults();

  @Test
  void initializeFitsModelAndServesLabels() {
    RecordingMetrics metrics = new RecordingMetrics();
    TyreHealthUseCase useCase = new TyreHealthUseCase(new TyreDegradationModel(), metrics);

    assertTrue(useCase.initialize(stint(config, "VER", "MEDIUM", 1, 2, 10, -0.05)));

    assertTrue(useCase.isInitialized());
    assertEquals(1L, metrics.counter("tyre.session.initialized"));
    assertTrue(useCase.healthFor("VER", 5).isPresent());
    assertEquals("MEDIUM (L4): 94%", useCase.labelFor("VER", 5));
    assertEquals("N/A", useCase.labelFor("HAM", 5));
  }

  @Test
  void emptyOrNullLapTableReportsFailure() {
    RecordingMetrics metrics = new RecordingMetrics();
    TyreHealthUseCase useCase = new TyreHealthUseCase(new TyreDegradationModel(), metrics);

    assertFalse(useCase.initialize(List.of()));
    assertFalse(useCase.initialize(null));

    assertFalse(useCase.isInitialized());
    assertEquals(2L, metrics.counter("tyre.session.failed"));
  }

  @Test
  void tableWithoutUsableLapsReportsFailure() {
    TyreHealthUseCase useCase = new TyreHealthUseCase(new TyreDegradationModel(), MetricsPort.NO_OP);

    assertFalse(useCase.initialize(List.of(lap("VER", 1, 95.0, "SOFT", 1))));
    assertTrue(useCase.healthFor("VER", 1).isEmpty());
  }

  @Test
  void fitFailureIsLoggedAndReported() {
    RecordingMetrics metrics = new RecordingMetrics();
    TyreHealthUseCase useCase = new TyreHealthUseCase(new TyreDegradationModel(), metrics);
    List<LapRecord> broken = new ArrayList<>(stint(config, "VER", "SOFT", 1, 2, 6, 0.05));
    broken.add(null);

    Logger logger = (Logger) LoggerFactory.getLogger(TyreHealthUseCase.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    boolean initialized;
    try {
      initialized = useCase.initialize(broken);
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertFalse(initialized);
    assertEquals(1L, metrics.counter("tyre.session.failed"));
    ILoggingEvent error = appender.list.stream()
        .filter(event -> event.getLevel() == Level.ERROR)
        .findFirst()
        .orElseThrow();
    assertEquals("Tyre model initialization failed", error.getFormattedMessage());
    assertTrue(error.getThrowableProxy() != null);
  }

  @Test
  void queriesBeforeInitializationAreEmpty() {
    TyreHealthUseCase useCase = new TyreHealthUseCase(new TyreDegradationModel(), MetricsPort.NO_OP);

    assertTrue(useCase.healthFor("VER", 10).isEmpty());
    assertEquals("N/A", useCase.labelFor("VER", 10));
  }

  @Test
  void nullDriverYieldsEmpty() {
    TyreHealthUseCase useCase = new TyreHealthUseCase(new TyreDegradationModel(), MetricsPort.NO_OP);
    useCase.initialize(stint(config, "VER", "HARD", 1, 2, 8, 0.01));

    assertTrue(useCase.healthFor(null, 5).isEmpty());
  }

  @Test
  void clearCacheKeepsResultsStable() {
    TyreHealthUseCase useCase = new TyreHealthUseCase(new TyreDegradationModel(), MetricsPort.NO_OP);
    useCase.initialize(stint(config, "VER", "HARD", 1, 2, 8, 0.01));

    String before = useCase.labelFor("VER", 6);
    useCase.clearCache();

    assertEquals(before, useCase.labelFor("VER", 6));
  }

  private static final class RecordingMetrics implements MetricsPort {
    private final Map<String, Long> counters = new HashMap<>();

    @Override
    public void increment(String key) {
      counters.merge(key, 1L, Long::sum);
    }

    @Override
    public void observe(String key, long value) {}

    long counter(String key) {
      return counters.getOrDefault(key, 0L);
    }
  }
}
