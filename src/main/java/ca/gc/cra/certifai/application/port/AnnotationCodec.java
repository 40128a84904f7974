package ca.gc.cra.certifai.application.port;

import ca.gc.cra.certifai.domain.error.AnnotationCorruptionException;
import ca.gc.cra.certifai.domain.model.TagMetadata;

/**
 * Translates between {@link TagMetadata} and its inline source encoding.
 *
 * <p>Lifecycle logic never touches syntax; only implementations of this port do.</p>
 *
 * @since 0.1.0
 */
public interface AnnotationCodec {
  /**
   * Decodes an inline annotation.
   *
   * @param source annotation source text
   * @return decoded metadata, unknown members kept as extras
   * @throws AnnotationCorruptionException when the payload is malformed
   */
  TagMetadata decode(String source) throws AnnotationCorruptionException;

  /**
   * Encodes metadata as annotation source text.
   *
   * @param metadata metadata to encode
   * @param indent indentation of the annotated declaration, used for continuation lines
   * @return annotation source without a trailing line break
   */
  String encode(TagMetadata metadata, String indent);
}
