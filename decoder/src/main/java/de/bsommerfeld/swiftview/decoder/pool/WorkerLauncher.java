package de.bsommerfeld.swiftview.decoder.pool;

import de.bsommerfeld.swiftview.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Spawns decode workers as child JVMs that share the parent's classpath.
 * stdin/stdout carry the {@link WorkerProtocol}; stderr is inherited so the
 * worker's log lines end up next to the parent's.
 */
public class WorkerLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerLauncher.class);

    private final String mainClass;
    private final int heapMb;

    public WorkerLauncher(String mainClass, int heapMb) {
        this.mainClass = mainClass;
        this.heapMb = heapMb;
    }

    public static WorkerLauncher defaults(int heapMb) {
        return new WorkerLauncher(DecodeWorkerMain.class.getName(), heapMb);
    }

    WorkerProcess start() throws IOException {
        ProcessBuilder pb = new ProcessBuilder(buildCommand());
        pb.redirectError(ProcessBuilder.Redirect.INHERIT);

        WorkerProcess worker = new WorkerProcess(pb.start());
        try {
            worker.awaitReady();
        } catch (IOException e) {
            worker.destroy();
            throw e;
        }
        LOG.debug("Started decode worker pid {}", worker.pid());
        return worker;
    }

    List<String> buildCommand() {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolveJava());
        cmd.add("-Xmx" + heapMb + "m");
        cmd.add("-Djava.awt.headless=true");
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add(mainClass);
        return cmd;
    }

    /**
     * The running JVM's own binary, so the worker matches the parent's
     * version. Falls back to {@code java} on the {@code PATH}.
     */
    private static String resolveJava() {
        Path java = Path.of(System.getProperty("java.home"), "bin", StorageUtils.isWindows() ? "java.exe" : "java");
        if (Files.isExecutable(java))
            return java.toString();
        return "java";
    }
}
