package de.bsommerfeld.swiftview.decoder.pool;

import de.bsommerfeld.swiftview.core.domain.DecodeError;
import de.bsommerfeld.swiftview.core.domain.DecodeMode;
import de.bsommerfeld.swiftview.core.domain.PixelBuffer;
import de.bsommerfeld.swiftview.core.domain.TargetSize;
import de.bsommerfeld.swiftview.core.util.PathKeys;
import de.bsommerfeld.swiftview.decoder.ImageIoDecoder;
import de.bsommerfeld.swiftview.decoder.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WorkerProtocolTest {

    @TempDir
    Path tempDir;

    @Test
    void serve_shouldAnswerEachRequestInOrder() throws Exception {
        Path image = TestImages.writePng(tempDir.resolve("a.png"), 300, 150, Color.CYAN);
        String key = PathKeys.dbKey(image);

        ByteArrayOutputStream requests = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(requests);
        WorkerProtocol.writeRequest(out, new DecodeTask(key, DecodeMode.THUMBNAIL, TargetSize.of(100, 100)));
        WorkerProtocol.writeRequest(out, new DecodeTask(key, DecodeMode.FULL, null));
        WorkerProtocol.writeRequest(out, new DecodeTask(key + ".missing", DecodeMode.FULL, null));
        WorkerProtocol.writeShutdown(out);

        ByteArrayOutputStream responses = new ByteArrayOutputStream();
        DecodeWorkerMain.serve(new ByteArrayInputStream(requests.toByteArray()), responses, new ImageIoDecoder());

        DataInputStream in = new DataInputStream(new ByteArrayInputStream(responses.toByteArray()));
        assertEquals(WorkerProtocol.READY, in.read());

        var thumb = assertInstanceOf(DecodeResult.Encoded.class, WorkerProtocol.readResult(in));
        assertEquals(100, thumb.image().width());
        assertEquals(300, thumb.image().sourceWidth());

        var full = assertInstanceOf(DecodeResult.Pixels.class, WorkerProtocol.readResult(in));
        assertEquals(300, full.pixels().width());
        assertEquals(0xFF00FFFF, full.pixels().pixelAt(0, 0));

        var failed = assertInstanceOf(DecodeResult.Failed.class, WorkerProtocol.readResult(in));
        assertEquals(DecodeError.Kind.UNREADABLE, failed.error().kind());

        assertThrows(EOFException.class, () -> WorkerProtocol.readResult(in));
    }

    @Test
    void serve_shouldStopAtEndOfInput() throws Exception {
        ByteArrayOutputStream responses = new ByteArrayOutputStream();

        DecodeWorkerMain.serve(new ByteArrayInputStream(new byte[0]), responses, new ImageIoDecoder());

        assertArrayEquals(new byte[] { WorkerProtocol.READY }, responses.toByteArray());
    }

    @Test
    void readRequest_shouldPreserveUnconstrainedTarget() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        WorkerProtocol.writeRequest(new DataOutputStream(bytes), new DecodeTask("/x/y.png", DecodeMode.FULL, null));

        DecodeTask task = WorkerProtocol.readRequest(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));

        assertNull(task.target());
        assertEquals("/x/y.png", task.path());
    }

    @Test
    void writeResult_shouldTruncateLongErrorMessages() throws Exception {
        String longMessage = "x".repeat(5000);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        WorkerProtocol.writeResult(new DataOutputStream(bytes),
                new DecodeResult.Failed(DecodeError.of(DecodeError.Kind.CORRUPT, longMessage)));

        DecodeResult result = WorkerProtocol.readResult(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));

        var failed = assertInstanceOf(DecodeResult.Failed.class, result);
        assertEquals(1000, failed.error().message().length());
        assertEquals(DecodeError.Kind.CORRUPT, failed.error().kind());
    }

    @Test
    void writeResult_pixelsSpanningSeveralChunks_shouldArriveIntact() throws Exception {
        int width = 300;
        int height = 100;
        int[] pixels = new int[width * height];
        for (int i = 0; i < pixels.length; i++)
            pixels[i] = 0xFF000000 | (i * 7919);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        WorkerProtocol.writeResult(new DataOutputStream(bytes),
                new DecodeResult.Pixels(new PixelBuffer(width, height, pixels.clone())));

        DecodeResult result = WorkerProtocol.readResult(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));

        var decoded = assertInstanceOf(DecodeResult.Pixels.class, result);
        assertEquals(width, decoded.pixels().width());
        assertArrayEquals(pixels, decoded.pixels().pixels());
    }

    @Test
    void readResult_pixelLengthNotMatchingDimensions_shouldThrow() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeByte(WorkerProtocol.STATUS_OK);
        out.writeByte(WorkerProtocol.PAYLOAD_PIXELS);
        out.writeInt(10);
        out.writeInt(10);
        out.writeInt(10);
        out.writeInt(10);
        out.writeInt(12);
        out.write(new byte[12]);

        DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes.toByteArray()));

        assertThrows(IOException.class, () -> WorkerProtocol.readResult(in));
    }
}
