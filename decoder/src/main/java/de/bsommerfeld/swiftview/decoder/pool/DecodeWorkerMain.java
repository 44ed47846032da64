package de.bsommerfeld.swiftview.decoder.pool;

import de.bsommerfeld.swiftview.decoder.Decoder;
import de.bsommerfeld.swiftview.decoder.ImageIoDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;

/**
 * Entry point of an isolated decode worker. Reads {@link DecodeTask}s from
 * stdin and answers each with exactly one {@link DecodeResult} on stdout,
 * until told to shut down or the parent closes the pipe.
 *
 * <p>
 * stdout is the protocol channel. It is captured before anything else runs
 * and {@code System.out} is pointed at stderr, so a stray print from a codec
 * cannot corrupt the stream.
 */
public final class DecodeWorkerMain {

    private DecodeWorkerMain() {
    }

    public static void main(String[] args) {
        run(new ImageIoDecoder());
    }

    /**
     * Serves requests on the process' stdin/stdout with the given decoder.
     * Alternative worker mains call this with a decorated decoder.
     */
    public static void run(Decoder decoder) {
        OutputStream protocolOut = new FileOutputStream(FileDescriptor.out);
        System.setOut(new PrintStream(new FileOutputStream(FileDescriptor.err), true));

        Logger log = LoggerFactory.getLogger(DecodeWorkerMain.class);
        try {
            serve(System.in, protocolOut, decoder);
            log.debug("Decode worker shutting down");
        } catch (IOException e) {
            log.error("Decode worker lost its parent", e);
            System.exit(1);
        }
    }

    static void serve(InputStream input, OutputStream output, Decoder decoder) throws IOException {
        DataInputStream in = new DataInputStream(new BufferedInputStream(input));
        DataOutputStream out = new DataOutputStream(new BufferedOutputStream(output, 64 * 1024));

        out.writeByte(WorkerProtocol.READY);
        out.flush();

        DecodeTask task;
        while ((task = WorkerProtocol.readRequest(in)) != null) {
            WorkerProtocol.writeResult(out, task.runWith(decoder));
        }
    }
}
