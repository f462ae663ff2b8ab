package org.spts.batch.selection;

import org.spts.batch.logbook.FileClass;
import org.spts.batch.logbook.ResolutionException;

import java.util.Locale;

/**
 * Outcome of resolving one candidate's dependencies.
 *
 * @param fileName              the candidate
 * @param status                resolution status
 * @param fileClass             log book classification, null when the candidate has no log entry
 * @param backgroundFile        background file name (convert mode), else null
 * @param backgroundFrameBudget frames of the background to use, 0 when no background applies
 * @param frameCount            frame count of the raw capture (analyze mode), else null
 * @param reason                human-readable reason for DROPPED and UNRESOLVED
 * @param error                 the resolution error for UNRESOLVED, else null
 */
public record CandidateResolution(String fileName, ResolutionStatus status, FileClass fileClass,
                                  String backgroundFile, int backgroundFrameBudget, Integer frameCount,
                                  String reason, ResolutionException error) {

    public static CandidateResolution resolved(String fileName, String backgroundFile, int backgroundFrameBudget,
                                               Integer frameCount) {
        return new CandidateResolution(fileName, ResolutionStatus.RESOLVED, FileClass.NORMAL, backgroundFile,
                backgroundFrameBudget, frameCount, null, null);
    }

    public static CandidateResolution dropped(String fileName, FileClass fileClass) {
        return new CandidateResolution(fileName, ResolutionStatus.DROPPED, fileClass, null, 0, null,
                "classified as " + fileClass.name().toLowerCase(Locale.ROOT), null);
    }

    public static CandidateResolution unresolved(String fileName, FileClass fileClass, ResolutionException error) {
        return new CandidateResolution(fileName, ResolutionStatus.UNRESOLVED, fileClass, null, 0, null,
                error.getMessage(), error);
    }

    public boolean isResolved() {
        return status == ResolutionStatus.RESOLVED;
    }
}
