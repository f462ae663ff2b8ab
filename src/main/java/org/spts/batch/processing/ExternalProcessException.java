package org.spts.batch.processing;

import java.io.IOException;
import java.util.List;

/**
 * The external program ended with a non-zero exit code.
 */
public class ExternalProcessException extends IOException {

    private final int exitCode;
    private final List<String> outputTail;

    public ExternalProcessException(String fileName, int exitCode, List<String> command, List<String> outputTail) {
        super(String.format("External process for %s exited with code %d%nCommand: %s%nOutput (last %d lines):%n%s",
                fileName, exitCode, String.join(" ", command), outputTail.size(), String.join(System.lineSeparator(), outputTail)));
        this.exitCode = exitCode;
        this.outputTail = List.copyOf(outputTail);
    }

    public int getExitCode() {
        return exitCode;
    }

    public List<String> getOutputTail() {
        return outputTail;
    }
}
