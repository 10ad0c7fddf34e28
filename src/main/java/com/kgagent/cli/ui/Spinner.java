package com.kgagent.cli.ui;

import com.kgagent.model.CancellationToken;
import java.io.PrintWriter;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;

/**
 * Shows a spinner with a status label while a query or plan runs in the background.
 */
@Component
public class Spinner {

    private static final char[] FRAMES = {'|', '/', '-', '\\'};

    private final Terminal terminal;

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    public <T> T spin(Supplier<T> task) {
        return spin("Querying...", task);
    }

    public <T> T spin(String label, Supplier<T> task) {
        return spin(label, task, CancellationToken.create());
    }

    /**
     * Runs {@code task} on a worker thread and redraws the spinner every 100ms until it finishes.
     * Exceptions thrown by the task are rethrown unwrapped.
     * <p>
     * When the waiting thread is interrupted (Ctrl-C in the shell) the token is cancelled, so a
     * task that honours it stops its queries, and a {@link CancellationException} is thrown.
     */
    public <T> T spin(String label, Supplier<T> task, CancellationToken cancellation) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<T> future = executor.submit(task::get);
        PrintWriter writer = terminal.writer();
        int frame = 0;

        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clear(writer, label);
                    return result;
                } catch (TimeoutException e) {
                    writer.print("\r\u001B[33m" + label + " " + FRAMES[frame++ % FRAMES.length] + "\u001B[0m");
                    writer.flush();
                }
            }
        } catch (InterruptedException e) {
            cancellation.cancel();
            clear(writer, label);
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Cancelled while waiting for " + label);
            cancelled.initCause(e);
            throw cancelled;
        } catch (Exception e) {
            clear(writer, label);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private void clear(PrintWriter writer, String label) {
        writer.print("\r" + " ".repeat(label.length() + 4) + "\r");
        writer.flush();
    }
}
