package fr.lapetina.resilience.infrastructure.boundary;

import fr.lapetina.resilience.domain.error.ErrorReport;
import fr.lapetina.resilience.infrastructure.handler.ErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Last-resort handler for failures that reach the top of a thread uncaught.
 *
 * <p>Installed once per process from the application's entry point. Uncaught failures are
 * classified through the {@link ErrorHandler}, which also records them in the error metrics.
 * Shutdown requests (an {@link InterruptedException} anywhere in the cause chain) are not
 * classified and go to the previously installed handler.
 *
 * <pre>{@code
 * public static void main(String[] args) {
 *     ProcessFailureBoundary boundary = ProcessFailureBoundary.install(errorHandler);
 *     System.exit(boundary.runMain(() -> app.run(args)));
 * }
 * }</pre>
 */
public final class ProcessFailureBoundary implements Thread.UncaughtExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ProcessFailureBoundary.class);

    private static final Object LOCK = new Object();
    private static ProcessFailureBoundary installed;

    private final ErrorHandler errorHandler;
    private final Thread.UncaughtExceptionHandler previous;

    private ProcessFailureBoundary(ErrorHandler errorHandler, Thread.UncaughtExceptionHandler previous) {
        this.errorHandler = errorHandler;
        this.previous = previous;
    }

    /**
     * Installs the boundary as the default uncaught-exception handler.
     * Subsequent calls return the already installed boundary.
     */
    public static ProcessFailureBoundary install(ErrorHandler errorHandler) {
        synchronized (LOCK) {
            if (installed != null) {
                log.debug("Process failure boundary already installed");
                return installed;
            }
            ProcessFailureBoundary boundary =
                    new ProcessFailureBoundary(errorHandler, Thread.getDefaultUncaughtExceptionHandler());
            Thread.setDefaultUncaughtExceptionHandler(boundary);
            installed = boundary;
            log.info("Process failure boundary installed");
            return boundary;
        }
    }

    /**
     * Restores the handler that was in place before {@link #install(ErrorHandler)}.
     */
    public static void uninstall() {
        synchronized (LOCK) {
            if (installed == null) {
                return;
            }
            if (Thread.getDefaultUncaughtExceptionHandler() == installed) {
                Thread.setDefaultUncaughtExceptionHandler(installed.previous);
            }
            installed = null;
            log.info("Process failure boundary uninstalled");
        }
    }

    public static boolean isInstalled() {
        synchronized (LOCK) {
            return installed != null;
        }
    }

    @Override
    public void uncaughtException(Thread thread, Throwable error) {
        if (isShutdownRequest(error)) {
            passThrough(thread, error);
            return;
        }
        ErrorReport report = errorHandler.handle(error, Map.of("thread", thread.getName(), "source", "uncaught"));
        log.debug("Uncaught failure classified: thread={}, errorId={}", thread.getName(), report.errorId());
    }

    /**
     * Runs the application's main body. A failure escaping it is classified like an
     * uncaught one.
     *
     * @return process exit code: 0 on success, 1 on failure
     */
    public int runMain(Callable<?> main) {
        try {
            main.call();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Main interrupted, shutting down");
            return 1;
        } catch (Exception e) {
            if (isShutdownRequest(e)) {
                log.info("Shutdown requested: {}", e.toString());
                return 1;
            }
            ErrorReport report = errorHandler.handle(e, Map.of("thread", Thread.currentThread().getName(),
                    "source", "main"));
            log.debug("Main failure classified: errorId={}", report.errorId());
            return 1;
        }
    }

    static boolean isShutdownRequest(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private void passThrough(Thread thread, Throwable error) {
        if (previous != null) {
            previous.uncaughtException(thread, error);
            return;
        }
        // Same output as the JVM's own default
        System.err.print("Exception in thread \"" + thread.getName() + "\" ");
        error.printStackTrace(System.err);
    }
}
