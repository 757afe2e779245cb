package io.github.social.nostr.shard.server;

import java.nio.ByteBuffer;

/**
 * Server-to-client frame headers. Server frames are never masked.
 */
final class WebsocketFrames {
	static final int FIN_ON = 0b10000000;
	static final int OPCODE_BITSPACE_FLAG = 0b00001111;

	static final int MAX_SHORT_LENGTH = 125;
	static final int EXTENDED_16 = 126;
	static final int EXTENDED_64 = 127;

	private WebsocketFrames() {}

	static byte[] header(final byte opcode, final long payloadLength) {
		final ByteBuffer header;
		final byte first = (byte) (FIN_ON | (opcode & OPCODE_BITSPACE_FLAG));

		if( payloadLength <= MAX_SHORT_LENGTH ) {
			header = ByteBuffer.allocate(2);
			header.put(first);
			header.put((byte) payloadLength);
		} else if( payloadLength <= 0xFFFF ) {
			header = ByteBuffer.allocate(4);
			header.put(first);
			header.put((byte) EXTENDED_16);
			header.putShort((short) payloadLength);
		} else {
			header = ByteBuffer.allocate(10);
			header.put(first);
			header.put((byte) EXTENDED_64);
			header.putLong(payloadLength);
		}

		return header.array();
	}

}
