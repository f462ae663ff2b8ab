package org.spts.batch.plugin;

import java.nio.file.Path;

/**
 * Structural validity check run on an input before a job starts. A failing probe skips the job.
 */
@FunctionalInterface
public interface InputProbe {

    boolean isValid(Path input);
}
