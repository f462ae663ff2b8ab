package org.spts.batch.selection;

import org.spts.batch.logbook.ResolutionException;

/**
 * Raised in strict mode when a candidate cannot be resolved; no job of the batch is dispatched.
 */
public class WorkSetBuildException extends Exception {

    public WorkSetBuildException(ResolutionException cause) {
        super("Aborting batch, cannot resolve " + cause.getFileName() + ": " + cause.getMessage(), cause);
    }
}
