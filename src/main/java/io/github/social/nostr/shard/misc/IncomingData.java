package io.github.social.nostr.shard.misc;

/**
 * Growable read buffer for socket input: bytes are appended by the reader and
 * consumed one by one by the HTTP and websocket parsers.
 */
public class IncomingData {
    private static final int ALLOC_SIZE = 1024;

    private byte[] data = new byte[ALLOC_SIZE];
    private int written = 0;
    private int consumed = 0;

    public int write(final byte[] source, final int offset, final int length) {
        if(offset >= source.length) return 0;

        final int srcLen = Math.min(source.length - offset, length);

        final int availableSpace = this.data.length - this.written;
        if( srcLen > availableSpace ) {
            final int allocFactor = (srcLen / ALLOC_SIZE) + 1;
            final byte[] alloc = new byte[this.data.length + (allocFactor * ALLOC_SIZE)];
            System.arraycopy(this.data, 0, alloc, 0, this.written);
            this.data = alloc;
        }

        System.arraycopy(source, offset, this.data, this.written, srcLen);
        this.written += srcLen;

        return srcLen;
    }

    public byte next() {
        if(this.consumed == this.written) {
            throw new IndexOutOfBoundsException("No available data to consume");
        }

        return this.data[this.consumed++];
    }

    public int remaining() {
        return this.written - this.consumed;
    }

    /**
     * Drops consumed bytes.
     */
    public void shrink() {
        final int remaining = this.remaining();
        System.arraycopy(this.data, this.consumed, this.data, 0, remaining);

        this.written = remaining;
        this.consumed = 0;
    }

    public void reset() {
        this.data = new byte[ALLOC_SIZE];
        this.written = 0;
        this.consumed = 0;
    }

}
