package com.questrail.barcode.codec.parse;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.Objects;

/**
 * ByteCursor
 * -----------------------------------------------------------------------------
 * Immutable view over a binary buffer plus a scanning offset.
 *
 * <p>The buffer is held as a read-only Netty {@link ByteBuf} and is only ever
 * accessed through absolute reads, so its reader/writer indices never move.
 * Advancing a cursor returns a new cursor over the same buffer; the original
 * remains valid and positioned where it was.</p>
 *
 * <p>Invariant: {@code 0 <= offset <= length}.</p>
 */
public final class ByteCursor
{
    private final ByteBuf buffer;
    private final int offset;

    private ByteCursor(ByteBuf buffer, int offset)
    {
        this.buffer = buffer;
        this.offset = offset;
    }

    /**
     * Creates a cursor positioned at the first byte of {@code bytes}.
     *
     * <p>The array is copied; later changes by the caller are not observed.</p>
     */
    public static ByteCursor of(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        return new ByteCursor(Unpooled.wrappedBuffer(bytes.clone()).asReadOnly(), 0);
    }

    public int offset()
    {
        return offset;
    }

    public int length()
    {
        return buffer.capacity();
    }

    public int remaining()
    {
        return length() - offset;
    }

    public boolean isExhausted()
    {
        return offset == length();
    }

    /**
     * Returns the unsigned byte at the current offset without advancing.
     *
     * @throws IndexOutOfBoundsException if the cursor is exhausted
     */
    public int peek()
    {
        if (isExhausted()) {
            throw new IndexOutOfBoundsException("Cursor exhausted at offset " + offset);
        }
        return buffer.getUnsignedByte(offset);
    }

    /**
     * Returns a copy of the next {@code count} bytes without advancing.
     *
     * @throws IndexOutOfBoundsException if fewer than {@code count} bytes remain
     */
    public byte[] peek(int count)
    {
        checkAvailable(count);
        return ByteBufUtil.getBytes(buffer, offset, count);
    }

    /**
     * Returns a cursor {@code count} bytes further along the same buffer.
     *
     * @throws IndexOutOfBoundsException if fewer than {@code count} bytes remain
     */
    public ByteCursor advance(int count)
    {
        checkAvailable(count);
        return count == 0 ? this : new ByteCursor(buffer, offset + count);
    }

    private void checkAvailable(int count)
    {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        if (count > remaining()) {
            throw new IndexOutOfBoundsException(
                    "Requested " + count + " bytes at offset " + offset + " but only " + remaining() + " remain");
        }
    }

    @Override
    public String toString()
    {
        return "ByteCursor[offset=" + offset + ", length=" + length() + ']';
    }
}
