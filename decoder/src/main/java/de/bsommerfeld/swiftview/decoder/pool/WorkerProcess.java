package de.bsommerfeld.swiftview.decoder.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Parent-side handle of one decode worker process. Not thread-safe: a worker
 * serves one request at a time and is owned by one pool thread while it
 * does.
 */
final class WorkerProcess {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerProcess.class);

    private final Process process;
    private final DataOutputStream out;
    private final DataInputStream in;

    WorkerProcess(Process process) {
        this.process = process;
        this.out = new DataOutputStream(new BufferedOutputStream(process.getOutputStream()));
        this.in = new DataInputStream(new BufferedInputStream(process.getInputStream(), 64 * 1024));
    }

    /** Blocks until the worker has announced itself. */
    void awaitReady() throws IOException {
        int b = in.read();
        if (b != WorkerProtocol.READY)
            throw new IOException("Worker failed to start (pid " + process.pid() + ", got " + b + ")");
    }

    /**
     * Sends one task and waits for its answer.
     *
     * @throws IOException if the worker died or the stream broke; the worker
     *                     is unusable afterwards
     */
    DecodeResult execute(DecodeTask task) throws IOException {
        WorkerProtocol.writeRequest(out, task);
        return WorkerProtocol.readResult(in);
    }

    boolean isAlive() {
        return process.isAlive();
    }

    long pid() {
        return process.pid();
    }

    /** Asks the worker to exit, killing it if it does not within the grace period. */
    void shutdown() {
        if (process.isAlive()) {
            try {
                WorkerProtocol.writeShutdown(out);
                if (process.waitFor(2, TimeUnit.SECONDS))
                    return;
            } catch (IOException e) {
                LOG.debug("Worker {} did not accept shutdown: {}", process.pid(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        destroy();
    }

    void destroy() {
        process.destroyForcibly();
    }
}
