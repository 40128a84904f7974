package ca.gc.cra.certifai.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Inline provenance record attached to a type, method, or constructor.
 *
 * <p>The annotation is retained in source only; CERTIFAI reads and rewrites it textually. Finalized
 * artifacts carry just {@code done} and {@code humanCertified}; the full record then lives in the
 * registry under {@code .certifai/registry.yml}.</p>
 *
 * <pre>{@code
 * @Certifai(
 *     aiComposed = "gpt-5",
 *     humanCertified = "pending",
 *     scrutiny = "auto",
 *     history = {"2026-10-18T09:00:00Z annotated last_commit=unknown"})
 * public int score(String input) { ... }
 * }</pre>
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR})
public @interface Certifai {
  /** Model or agent that composed the artifact, {@code pending} when unknown. */
  String aiComposed() default "pending";

  /** Human certifier, {@code pending} until certified. */
  String humanCertified() default "pending";

  /** Scrutiny level: {@code auto}, {@code low}, {@code medium} or {@code high}. */
  String scrutiny() default "auto";

  /** ISO-8601 timestamp of the last certification change. */
  String date() default "";

  /** Free-text reviewer notes. */
  String notes() default "";

  /** Append-only lifecycle events, oldest first. */
  String[] history() default {};

  /** Reviewers in approval order. */
  Reviewer[] reviewers() default {};

  /** {@code true} while the artifact is finalized in the registry. */
  boolean done() default false;

  /**
   * One reviewer approval.
   */
  @Documented
  @Retention(RetentionPolicy.SOURCE)
  @Target({})
  @interface Reviewer {
    /** {@code human} or {@code agent}. */
    String kind();

    /** Reviewer identity, opaque to CERTIFAI. */
    String id();

    /** Scrutiny applied by this reviewer. */
    String scrutiny() default "auto";

    /** ISO-8601 approval timestamp. */
    String timestamp() default "";

    /** Reviewer notes. */
    String notes() default "";
  }
}
