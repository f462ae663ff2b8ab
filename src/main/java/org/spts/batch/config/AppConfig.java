package org.spts.batch.config;

/**
 * Root of {@code conf/spts-batch.yaml}. Every section and value is optional; command line options
 * override what is set here.
 */
public record AppConfig(DispatchConfig dispatch, ConversionConfig conversion, AnalysisConfig analysis) {

    public AppConfig {
        dispatch = dispatch != null ? dispatch : DispatchConfig.empty();
        conversion = conversion != null ? conversion : ConversionConfig.empty();
        analysis = analysis != null ? analysis : AnalysisConfig.empty();
    }

    public static AppConfig defaults() {
        return new AppConfig(null, null, null);
    }
}
