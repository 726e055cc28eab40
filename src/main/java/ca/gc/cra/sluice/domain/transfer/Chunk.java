package ca.gc.cra.sluice.domain.transfer;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable unit of transferred bytes together with its position in the stream.
 * <p><strong>Why:</strong> Chunks cross component boundaries by value so no stage can observe another
 * stage's buffers.</p>
 * <p><strong>Role:</strong> Domain value emitted by sources and stages and accepted by sinks.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to hand off between threads.</p>
 * <p><strong>Performance:</strong> Copies the payload once on construction; {@link #asReadOnlyBuffer()} is
 * zero-copy.</p>
 * <p><strong>Observability:</strong> {@link #offset()} and {@link #endOffset()} tag backpressure events.</p>
 *
 * @since 0.1.0
 */
public final class Chunk {
  private final long offset;
  private final byte[] payload;

  private Chunk(long offset, byte[] payload) {
    this.offset = offset;
    this.payload = payload;
  }

  /**
   * Creates a chunk by copying {@code length} bytes of {@code source} starting at {@code from}.
   *
   * @param offset stream offset of the first byte; must not be negative
   * @param source backing array owned by the caller; not retained
   * @param from first index to copy
   * @param length number of bytes to copy
   * @return new chunk owning its own copy of the bytes
   * @throws IllegalArgumentException if {@code offset} is negative
   */
  public static Chunk copyOf(long offset, byte[] source, int from, int length) {
    Objects.requireNonNull(source, "source");
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    Objects.checkFromIndexSize(from, length, source.length);
    return new Chunk(offset, Arrays.copyOfRange(source, from, from + length));
  }

  /**
   * Creates a chunk by copying the remaining bytes of {@code buffer} without moving its position.
   *
   * @param offset stream offset of the first byte
   * @param buffer buffer whose remaining bytes form the chunk
   * @return new chunk owning its own copy of the bytes
   */
  public static Chunk copyOf(long offset, ByteBuffer buffer) {
    Objects.requireNonNull(buffer, "buffer");
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    byte[] copy = new byte[buffer.remaining()];
    buffer.duplicate().get(copy);
    return new Chunk(offset, copy);
  }

  /** Stream offset of the first byte in this chunk. */
  public long offset() {
    return offset;
  }

  /** Number of bytes carried by this chunk. */
  public int length() {
    return payload.length;
  }

  /** Stream offset just past the last byte in this chunk. */
  public long endOffset() {
    return offset + payload.length;
  }

  /**
   * Returns a read-only view over the payload; each call yields an independent position.
   *
   * @return read-only buffer positioned at zero
   */
  public ByteBuffer asReadOnlyBuffer() {
    return ByteBuffer.wrap(payload).asReadOnlyBuffer();
  }

  /**
   * Returns a copy of the payload.
   *
   * @return fresh array the caller may mutate
   */
  public byte[] toByteArray() {
    return payload.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Chunk that)) {
      return false;
    }
    return offset == that.offset && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(offset) + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "Chunk{offset=" + offset + ", length=" + payload.length + '}';
  }
}
