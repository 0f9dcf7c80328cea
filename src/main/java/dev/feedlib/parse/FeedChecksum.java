package dev.feedlib.parse;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks the content identity of the stories of one feed across refresh cycles.
 *
 * <p>Maps a digest of each story {@code ident} to a digest of its {@code content}. At most
 * {@link #limit()} identities are kept; when full, the identity updated longest ago is evicted.
 * Digests are truncated SHA-256, stable across runs.
 *
 * <p>Instances are mutable and not thread-safe. {@link #copy()} returns an independent snapshot:
 * {@link FeedParser} works on a copy so the caller's instance only advances when the caller
 * persists the checksum returned in the {@link FeedResult}.
 */
public final class FeedChecksum {

  public static final int DEFAULT_LIMIT = 300;

  static final byte FORMAT_VERSION = 1;
  static final int IDENT_DIGEST_LENGTH = 8;
  static final int CONTENT_DIGEST_LENGTH = 8;

  private static final HexFormat HEX = HexFormat.of();

  private final int limit;
  // insertion order == update order, eldest first
  private final LinkedHashMap<String, String> digests;

  public FeedChecksum() {
    this(DEFAULT_LIMIT);
  }

  public FeedChecksum(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Checksum limit must be positive, got: " + limit);
    }
    this.limit = limit;
    this.digests = new LinkedHashMap<>();
  }

  private FeedChecksum(int limit, LinkedHashMap<String, String> digests) {
    this.limit = limit;
    this.digests = new LinkedHashMap<>(digests);
  }

  /** Returns an independent snapshot; updating either instance never affects the other. */
  public FeedChecksum copy() {
    return new FeedChecksum(limit, digests);
  }

  /**
   * Returns an independent snapshot able to hold at least {@code minLimit} identities.
   *
   * @param minLimit lower bound for the limit of the copy
   * @return a copy whose limit is the larger of this limit and {@code minLimit}
   */
  public FeedChecksum copy(int minLimit) {
    return new FeedChecksum(Math.max(limit, minLimit), digests);
  }

  /**
   * Records the content of a story and reports whether it is new or changed.
   *
   * @param ident story identity
   * @param content story content as received; identity is defined by these bytes only
   * @return true if the story was unknown or its content changed, false if unchanged
   */
  public boolean update(String ident, String content) {
    String key = HEX.formatHex(ContentHasher.sha256(ident, IDENT_DIGEST_LENGTH));
    String value = HEX.formatHex(ContentHasher.sha256(content, CONTENT_DIGEST_LENGTH));
    String previous = digests.get(key);
    if (value.equals(previous)) {
      return false;
    }
    digests.remove(key);
    digests.put(key, value);
    evictOverflow();
    return true;
  }

  public int size() {
    return digests.size();
  }

  public int limit() {
    return limit;
  }

  /**
   * Serializes this checksum to a compact, versioned byte array.
   *
   * @return bytes accepted by {@link #load(byte[])}
   */
  public byte[] dump() {
    int entryLength = IDENT_DIGEST_LENGTH + CONTENT_DIGEST_LENGTH;
    ByteBuffer buffer = ByteBuffer.allocate(1 + 4 + 4 + digests.size() * entryLength);
    buffer.put(FORMAT_VERSION);
    buffer.putInt(limit);
    buffer.putInt(digests.size());
    for (Map.Entry<String, String> entry : digests.entrySet()) {
      buffer.put(HEX.parseHex(entry.getKey()));
      buffer.put(HEX.parseHex(entry.getValue()));
    }
    return buffer.array();
  }

  /**
   * Restores a checksum serialized by {@link #dump()}.
   *
   * @param data serialized checksum
   * @return the restored checksum, with entries in their original update order
   * @throws IllegalArgumentException if the data is truncated or of an unknown format version
   */
  public static FeedChecksum load(byte[] data) {
    ByteBuffer buffer = ByteBuffer.wrap(data);
    try {
      byte version = buffer.get();
      if (version != FORMAT_VERSION) {
        throw new IllegalArgumentException("Unsupported checksum format version: " + version);
      }
      FeedChecksum checksum = new FeedChecksum(buffer.getInt());
      int count = buffer.getInt();
      if (count < 0) {
        throw new IllegalArgumentException("Corrupt checksum: negative entry count " + count);
      }
      for (int i = 0; i < count; i++) {
        byte[] key = new byte[IDENT_DIGEST_LENGTH];
        byte[] value = new byte[CONTENT_DIGEST_LENGTH];
        buffer.get(key);
        buffer.get(value);
        checksum.digests.put(HEX.formatHex(key), HEX.formatHex(value));
      }
      if (buffer.hasRemaining()) {
        throw new IllegalArgumentException(
            "Corrupt checksum: " + buffer.remaining() + " trailing bytes");
      }
      checksum.evictOverflow();
      return checksum;
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("Corrupt checksum: data truncated", e);
    }
  }

  private void evictOverflow() {
    Iterator<String> eldest = digests.keySet().iterator();
    while (digests.size() > limit && eldest.hasNext()) {
      eldest.next();
      eldest.remove();
    }
  }

  @Override
  public String toString() {
    return "FeedChecksum[size=" + digests.size() + ", limit=" + limit + "]";
  }
}
