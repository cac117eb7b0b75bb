package com.sailfish.taskfactory.wrapper;

import com.sailfish.taskfactory.TaskArguments;
import com.sailfish.taskfactory.TaskCallable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wrapper for shell tasks. The callable returns the command line, which is run with
 * {@code /bin/bash -c} and bounded by the walltime. The keywords {@code stdout} and
 * {@code stderr} name files the process output is appended to; without them output is discarded.
 * The task result is the exit code, which is always {@code 0} for a successful task.
 */
public class BashTaskWrapper extends AbstractTaskWrapper {

    private static final Logger log = LoggerFactory.getLogger(BashTaskWrapper.class);

    public static final String SHELL = "/bin/bash";
    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";

    private static final Set<String> RESERVED = Collections.unmodifiableSet(
            new LinkedHashSet<>(Arrays.asList(OUTPUTS, STDOUT, STDERR)));

    public BashTaskWrapper(TaskCallable callable, TaskWrapperConfig config) {
        super(callable, config);
    }

    @Override
    protected Set<String> reservedKeywords() {
        return RESERVED;
    }

    @Override
    protected Callable<Object> createWork(TaskArguments callArguments, TaskArguments allArguments) {
        Path stdout = toPath(STDOUT, allArguments.getKeyword(STDOUT));
        Path stderr = toPath(STDERR, allArguments.getKeyword(STDERR));
        return () -> run(callArguments, stdout, stderr);
    }

    private Object run(TaskArguments callArguments, Path stdout, Path stderr) throws Exception {
        Object command = callable.call(callArguments);
        if (!(command instanceof String) || ((String) command).trim().isEmpty()) {
            throw new IllegalStateException("Bash task " + callable.getName()
                    + " must return a non-empty command line but returned " + command);
        }

        ProcessBuilder builder = new ProcessBuilder(SHELL, "-c", (String) command);
        builder.redirectOutput(stdout != null ? ProcessBuilder.Redirect.appendTo(stdout.toFile()) : ProcessBuilder.Redirect.DISCARD);
        builder.redirectError(stderr != null ? ProcessBuilder.Redirect.appendTo(stderr.toFile()) : ProcessBuilder.Redirect.DISCARD);

        log.debug("Running bash task {}: {}", callable.getName(), command);
        Process process = builder.start();
        boolean finished;
        try {
            finished = process.waitFor(config.getWalltime().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        }
        if (!finished) {
            process.destroyForcibly();
            throw new TimeoutException("Bash task " + callable.getName() + " exceeded walltime " + config.getWalltime());
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new BashExitFailureException(callable.getName(), exitCode);
        }
        log.info("Bash task {} completed successfully.", callable.getName());
        return exitCode;
    }
}
