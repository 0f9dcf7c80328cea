package dev.feedlib.parse;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Static utility for computing SHA-256 digests. Used by {@link FeedChecksum} for story identity
 * and content change detection.
 */
public final class ContentHasher {

  private ContentHasher() {
    // utility class
  }

  /**
   * Compute the SHA-256 hash of the given content, truncated to its leading bytes.
   *
   * @param content the content to hash, encoded as UTF-8
   * @param length number of leading digest bytes to keep (1 to 32)
   * @return the truncated digest
   */
  public static byte[] sha256(String content, int length) {
    if (length < 1 || length > 32) {
      throw new IllegalArgumentException("Digest length must be between 1 and 32, got: " + length);
    }
    return Arrays.copyOf(digest(content), length);
  }

  private static byte[] digest(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(content.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
