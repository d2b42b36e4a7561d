package com.example.pawluxe_export.engine;

import com.example.pawluxe_export.exception.RenderCanceledException;
import com.example.pawluxe_export.exception.RenderException;
import com.example.pawluxe_export.exception.RenderTimeoutException;
import com.example.pawluxe_export.exception.TransientRenderFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external command against a shared attempt deadline. On deadline or cancellation the process
 * and its descendants are killed before the method returns.
 */
public class ProcessRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);
    private static final long POLL_SLICE_MS = 200;
    private static final long KILL_GRACE_MS = 5_000;
    private static final int STDERR_TAIL_CHARS = 2_000;

    /**
     * @param deadlineNanos {@link System#nanoTime()} value after which the attempt is over.
     * @param timeout       attempt bound, used for the error message.
     */
    public void run(List<String> cmd, long deadlineNanos, Duration timeout, RenderCancellation cancellation)
            throws RenderException {
        checkpoint(deadlineNanos, timeout, cancellation);
        LOGGER.debug("exec: {}", String.join(" ", cmd));

        Process p;
        try {
            p = new ProcessBuilder(cmd).redirectErrorStream(false).start();
        } catch (IOException e) {
            throw new TransientRenderFailureException("Cannot start " + cmd.get(0) + ": " + e.getMessage(), e);
        }

        StringBuilder errBuf = new StringBuilder();
        Thread tOut = drain(p.getInputStream(), "out", null);
        Thread tErr = drain(p.getErrorStream(), "err", errBuf);

        try {
            while (true) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
                if (p.waitFor(Math.max(0, Math.min(POLL_SLICE_MS, remainingMs)), TimeUnit.MILLISECONDS)) {
                    break;
                }
                if (cancellation != null && cancellation.isCancelled()) {
                    kill(p);
                    throw new RenderCanceledException("render aborted: job no longer owned by this worker");
                }
                if (System.nanoTime() - deadlineNanos >= 0) {
                    kill(p);
                    throw new RenderTimeoutException(timeout);
                }
            }
        } catch (InterruptedException e) {
            kill(p);
            Thread.currentThread().interrupt();
            throw new TransientRenderFailureException("render interrupted", e);
        }

        joinQuietly(tOut);
        joinQuietly(tErr);
        if (p.exitValue() != 0) {
            throw new TransientRenderFailureException(cmd.get(0) + " failed with exit " + p.exitValue()
                    + tail(errBuf));
        }
    }

    private static void checkpoint(long deadlineNanos, Duration timeout, RenderCancellation cancellation)
            throws RenderException {
        if (cancellation != null && cancellation.isCancelled()) {
            throw new RenderCanceledException("render aborted: job no longer owned by this worker");
        }
        if (System.nanoTime() - deadlineNanos >= 0) {
            throw new RenderTimeoutException(timeout);
        }
    }

    private static void kill(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        try {
            if (!p.waitFor(KILL_GRACE_MS, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("process pid={} did not exit after kill", p.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("interrupted while waiting for killed process pid={}", p.pid());
        }
    }

    private static Thread drain(InputStream in, String label, StringBuilder sink) {
        Thread t = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                br.lines().forEach(line -> {
                    LOGGER.debug("[render-{}] {}", label, line);
                    if (sink != null) {
                        synchronized (sink) {
                            sink.append(line).append('\n');
                            if (sink.length() > STDERR_TAIL_CHARS * 2) {
                                sink.delete(0, sink.length() - STDERR_TAIL_CHARS);
                            }
                        }
                    }
                });
            } catch (IOException | UncheckedIOException e) {
                LOGGER.debug("[render-{}] stream closed: {}", label, e.toString());
            }
        }, "render-" + label);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void joinQuietly(Thread t) {
        try {
            t.join(1_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String tail(StringBuilder errBuf) {
        synchronized (errBuf) {
            if (errBuf.length() == 0) {
                return "";
            }
            String s = errBuf.toString().strip();
            if (s.length() > STDERR_TAIL_CHARS) {
                s = s.substring(s.length() - STDERR_TAIL_CHARS);
            }
            return "\n---- stderr ----\n" + s;
        }
    }
}
