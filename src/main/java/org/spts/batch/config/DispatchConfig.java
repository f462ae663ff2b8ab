package org.spts.batch.config;

import java.util.List;

public record DispatchConfig(Integer workers, Long jobTimeoutSeconds, Boolean strictResolution,
                             List<String> fatalExceptions, Boolean verboseJobs) {

    public static DispatchConfig empty() {
        return new DispatchConfig(null, null, null, null, null);
    }
}
