package org.spts.batch.config;

import java.util.List;

// Settings of the .cxi analysis driver
public record AnalysisConfig(List<String> command, String saveRoot, String template, Integer windowSize) {

    public static AnalysisConfig empty() {
        return new AnalysisConfig(null, null, null, null);
    }
}
