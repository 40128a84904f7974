package ca.gc.cra.certifai.config;

import ca.gc.cra.certifai.application.lifecycle.ProvenanceEngine;
import ca.gc.cra.certifai.application.port.AnnotationCodec;
import ca.gc.cra.certifai.application.port.AttributionPort;
import ca.gc.cra.certifai.application.port.ClockPort;
import ca.gc.cra.certifai.application.port.InlineAnnotationWriter;
import ca.gc.cra.certifai.application.port.MetricsPort;
import ca.gc.cra.certifai.application.port.RegistryStore;
import ca.gc.cra.certifai.application.port.SourceScanner;
import ca.gc.cra.certifai.infrastructure.java.CertifaiAnnotationCodec;
import ca.gc.cra.certifai.infrastructure.java.JavaSourceRewriter;
import ca.gc.cra.certifai.infrastructure.java.JavaSourceScanner;
import ca.gc.cra.certifai.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.certifai.infrastructure.registry.YamlRegistryStore;
import ca.gc.cra.certifai.infrastructure.time.SystemClockAdapter;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires the provenance engine to concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from configuration to runnable components in one place.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning scanner, annotation rewriter and registry store.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Instantiate the JavaParser scanner and rewriter from {@link EngineConfig}.</li>
 *   <li>Instantiate the YAML registry store with the configured lock timeout.</li>
 *   <li>Expose shared adapters such as metrics and clock providers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration references; factory methods create new adapter
 * instances and are not synchronized.</p>
 *
 * @since 0.1.0
 * @see ProvenanceEngine
 */
public final class CompositionRoot {
  private final EngineConfig engineConfig;
  private final PolicyConfig policyConfig;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a composition root with OpenTelemetry metrics and the system clock.
   *
   * @param engineConfig engine configuration; must not be {@code null}
   * @param policyConfig policy configuration; must not be {@code null}
   */
  public CompositionRoot(EngineConfig engineConfig, PolicyConfig policyConfig) {
    this(engineConfig, policyConfig, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit metrics and clock adapters.
   *
   * @param engineConfig engine configuration; must not be {@code null}
   * @param policyConfig policy configuration; must not be {@code null}
   * @param metrics metrics adapter used by constructed components; must not be {@code null}
   * @param clock clock used to stamp transitions; must not be {@code null}
   */
  public CompositionRoot(EngineConfig engineConfig, PolicyConfig policyConfig, MetricsPort metrics, ClockPort clock) {
    this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig");
    this.policyConfig = Objects.requireNonNull(policyConfig, "policyConfig");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds a provenance engine bound to the configured root.
   *
   * @return new engine
   * @throws IllegalArgumentException when the configured root is not a directory
   */
  public ProvenanceEngine engine() {
    return new ProvenanceEngine(
        engineConfig.root(),
        sourceScanner(),
        annotationWriter(),
        registryStore(),
        AttributionPort.NONE,
        clock,
        metrics,
        policyConfig);
  }

  public SourceScanner sourceScanner() {
    return new JavaSourceScanner(engineConfig.excludes(), engineConfig.scanThreads(), metrics);
  }

  public InlineAnnotationWriter annotationWriter() {
    return new JavaSourceRewriter(annotationCodec());
  }

  public AnnotationCodec annotationCodec() {
    return new CertifaiAnnotationCodec();
  }

  public RegistryStore registryStore() {
    return new YamlRegistryStore(engineConfig.registryFile(), engineConfig.lockTimeout());
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  public EngineConfig engineConfig() {
    return engineConfig;
  }

  public PolicyConfig policyConfig() {
    return policyConfig;
  }
}
