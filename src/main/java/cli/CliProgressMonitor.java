package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress lines and an optional heartbeat for batch conversion.
 * The batch runner records the file in hand; the heartbeat thread only reads it.
 */
public final class CliProgressMonitor {

    private static final AtomicInteger currentIndex = new AtomicInteger(0);
    private static volatile String currentFile = "";

    private CliProgressMonitor() {
    }

    public static void setCurrent(String sourceFile, int index1Based) {
        currentFile = sourceFile == null ? "" : sourceFile;
        currentIndex.set(Math.max(0, index1Based));
    }

    /** Starts a daemon heartbeat thread; {@code intervalSec <= 0} disables it and returns null. */
    public static Thread startHeartbeat(int total, int intervalSec) {
        if (intervalSec <= 0) return null;
        long sleepMs = intervalSec * 1000L;
        long t0 = System.nanoTime();
        Thread t = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(sleepMs);
                    long sec = (System.nanoTime() - t0) / 1_000_000_000L;
                    System.out.println("[PROGRESS] converting " + currentIndex.get() + "/" + total
                            + " for " + sec + "s, file=" + currentFile);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "code-convert-heartbeat");
        t.setDaemon(true);
        t.start();
        return t;
    }

    public static void logProgress(int done, int total, int ok, int low, int skip, int fail,
                                   long loopStartNs, String lastFile) {
        long elapsedMs = (System.nanoTime() - loopStartNs) / 1_000_000L;
        double perFile = done == 0 ? 0.0 : (double) elapsedMs / done;

        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);

        System.out.printf(Locale.ROOT,
                "[PROGRESS] %d/%d ok=%d low=%d skip=%d fail=%d elapsed=%dms avg=%.1fms/file heap=%dMB last=%s%n",
                done, total, ok, low, skip, fail, elapsedMs, perFile, usedMb, lastFile);
    }
}
