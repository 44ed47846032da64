package de.bsommerfeld.swiftview.decoder.pool;

import de.bsommerfeld.swiftview.core.domain.DecodeError;
import de.bsommerfeld.swiftview.core.domain.DecodeMode;
import de.bsommerfeld.swiftview.core.domain.PixelBuffer;
import de.bsommerfeld.swiftview.core.domain.TargetSize;
import de.bsommerfeld.swiftview.decoder.EncodedImage;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Binary framing between {@link ProcessDecodePool} and
 * {@link DecodeWorkerMain}, spoken over the worker's stdin and stdout.
 *
 * <pre>
 * handshake   worker -&gt; parent   byte READY
 *
 * request     parent -&gt; worker   byte op (SHUTDOWN | DECODE)
 *                                 DECODE: byte mode, utf path, int width, int height
 *                                         (-1 for both when unconstrained)
 *
 * response    worker -&gt; parent   byte status
 *                                 OK:    byte payload (PIXELS | ENCODED),
 *                                        int width, int height,
 *                                        int sourceWidth, int sourceHeight,
 *                                        int length, byte[length]
 *                                 ERROR: byte kind, utf message
 * </pre>
 *
 * Only primitives and bytes cross the boundary. Pixels travel big-endian,
 * one int per pixel, and are streamed in chunks on both ends so neither side
 * holds a second full-size copy.
 */
final class WorkerProtocol {

    static final int READY = 0x53;

    static final int OP_SHUTDOWN = 0;
    static final int OP_DECODE = 1;

    static final int STATUS_OK = 0;
    static final int STATUS_ERROR = 1;

    static final int PAYLOAD_PIXELS = 0;
    static final int PAYLOAD_ENCODED = 1;

    private static final int NONE = -1;
    private static final int MAX_MESSAGE_LENGTH = 1000;
    private static final int CHUNK_PIXELS = 16 * 1024;

    private WorkerProtocol() {
    }

    // -- Requests --

    static void writeRequest(DataOutputStream out, DecodeTask task) throws IOException {
        out.writeByte(OP_DECODE);
        out.writeByte(task.mode().ordinal());
        out.writeUTF(task.path());
        TargetSize target = task.target();
        out.writeInt(target == null ? NONE : target.width());
        out.writeInt(target == null ? NONE : target.height());
        out.flush();
    }

    static void writeShutdown(DataOutputStream out) throws IOException {
        out.writeByte(OP_SHUTDOWN);
        out.flush();
    }

    /**
     * @return the next task, or {@code null} on shutdown or end of stream
     */
    static DecodeTask readRequest(DataInputStream in) throws IOException {
        int op = in.read();
        if (op == -1 || op == OP_SHUTDOWN)
            return null;
        if (op != OP_DECODE)
            throw new IOException("Unknown worker op: " + op);

        DecodeMode mode = DecodeMode.values()[in.readUnsignedByte()];
        String path = in.readUTF();
        int width = in.readInt();
        int height = in.readInt();
        TargetSize target = width == NONE ? null : TargetSize.of(width, height);
        return new DecodeTask(path, mode, target);
    }

    // -- Responses --

    static void writeResult(DataOutputStream out, DecodeResult result) throws IOException {
        if (result instanceof DecodeResult.Failed failed) {
            out.writeByte(STATUS_ERROR);
            out.writeByte(failed.error().kind().ordinal());
            out.writeUTF(truncate(failed.error().message()));
        } else if (result instanceof DecodeResult.Pixels px) {
            PixelBuffer buffer = px.pixels();
            out.writeByte(STATUS_OK);
            out.writeByte(PAYLOAD_PIXELS);
            out.writeInt(buffer.width());
            out.writeInt(buffer.height());
            out.writeInt(buffer.width());
            out.writeInt(buffer.height());
            writePixels(out, buffer.pixels());
        } else if (result instanceof DecodeResult.Encoded enc) {
            EncodedImage image = enc.image();
            out.writeByte(STATUS_OK);
            out.writeByte(PAYLOAD_ENCODED);
            out.writeInt(image.width());
            out.writeInt(image.height());
            out.writeInt(image.sourceWidth());
            out.writeInt(image.sourceHeight());
            out.writeInt(image.bytes().length);
            out.write(image.bytes());
        }
        out.flush();
    }

    static DecodeResult readResult(DataInputStream in) throws IOException {
        int status = in.read();
        if (status == -1)
            throw new EOFException("Worker closed its output");

        if (status == STATUS_ERROR) {
            DecodeError.Kind kind = DecodeError.Kind.values()[in.readUnsignedByte()];
            return new DecodeResult.Failed(DecodeError.of(kind, in.readUTF()));
        }
        if (status != STATUS_OK)
            throw new IOException("Unknown worker status: " + status);

        int payload = in.readUnsignedByte();
        int width = in.readInt();
        int height = in.readInt();
        int sourceWidth = in.readInt();
        int sourceHeight = in.readInt();
        int length = in.readInt();
        if (length < 0)
            throw new IOException("Negative payload length: " + length);

        if (payload == PAYLOAD_PIXELS) {
            if ((long) width * height * Integer.BYTES != length)
                throw new IOException("Pixel payload of " + length + " bytes does not match " + width + "x" + height);
            return new DecodeResult.Pixels(new PixelBuffer(width, height, readPixels(in, width * height)));
        }
        if (payload == PAYLOAD_ENCODED) {
            byte[] bytes = new byte[length];
            in.readFully(bytes);
            return new DecodeResult.Encoded(new EncodedImage(bytes, width, height, sourceWidth, sourceHeight));
        }
        throw new IOException("Unknown worker payload: " + payload);
    }

    static String truncate(String message) {
        if (message == null)
            return "";
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }

    private static void writePixels(DataOutputStream out, int[] pixels) throws IOException {
        long length = (long) pixels.length * Integer.BYTES;
        if (length > Integer.MAX_VALUE)
            throw new IOException("Pixel payload too large: " + length + " bytes");
        out.writeInt((int) length);

        ByteBuffer chunk = ByteBuffer.allocate(CHUNK_PIXELS * Integer.BYTES);
        for (int offset = 0; offset < pixels.length; offset += CHUNK_PIXELS) {
            int count = Math.min(CHUNK_PIXELS, pixels.length - offset);
            chunk.clear();
            chunk.asIntBuffer().put(pixels, offset, count);
            out.write(chunk.array(), 0, count * Integer.BYTES);
        }
    }

    private static int[] readPixels(DataInputStream in, int count) throws IOException {
        int[] pixels = new int[count];
        ByteBuffer chunk = ByteBuffer.allocate(CHUNK_PIXELS * Integer.BYTES);
        for (int offset = 0; offset < count; offset += CHUNK_PIXELS) {
            int n = Math.min(CHUNK_PIXELS, count - offset);
            in.readFully(chunk.array(), 0, n * Integer.BYTES);
            chunk.clear();
            chunk.asIntBuffer().get(pixels, offset, n);
        }
        return pixels;
    }
}
