package dev.mirror.transport;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Codec that writes and reads frames that start with a four-byte big-endian length followed by
 * UTF-8 encoded JSON text. Relay bodies travel inside the JSON, so frames are bounded by
 * {@link #MAX_FRAME_BYTES} rather than by the size of a single message type.
 */
public final class LengthPrefixedCodec {

    public static final int MAX_FRAME_BYTES = 256 * 1024 * 1024;

    private LengthPrefixedCodec() {
    }

    public static void writeFrame(OutputStream out, String json) throws IOException {
        byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        if (payload.length > MAX_FRAME_BYTES) {
            throw new IOException("Frame too large: " + payload.length);
        }
        byte[] header = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        // one write per frame so concurrent writers guarded by the caller never interleave partially
        byte[] frame = new byte[header.length + payload.length];
        System.arraycopy(header, 0, frame, 0, header.length);
        System.arraycopy(payload, 0, frame, header.length, payload.length);
        out.write(frame);
        out.flush();
    }

    public static String readFrame(InputStream in) throws IOException {
        byte[] header = readFully(in, 4);
        if (header == null) {
            return null; // EOF before header indicates the peer context went away.
        }
        int length = ByteBuffer.wrap(header).order(ByteOrder.BIG_ENDIAN).getInt();
        if (length < 0 || length > MAX_FRAME_BYTES) {
            throw new IOException("Invalid frame length: " + length);
        }
        if (length == 0) {
            return "";
        }
        byte[] payload = readFully(in, length);
        if (payload == null) {
            throw new EOFException("Stream closed while reading frame payload of length " + length);
        }
        return new String(payload, StandardCharsets.UTF_8);
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] buffer = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(buffer, offset, length - offset);
            if (read == -1) {
                if (offset == 0) {
                    return null;
                }
                throw new EOFException("Unexpected end of stream after reading " + offset + " bytes");
            }
            offset += read;
        }
        return buffer;
    }
}
