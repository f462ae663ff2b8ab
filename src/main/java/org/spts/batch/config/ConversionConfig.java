package org.spts.batch.config;

import java.util.List;

// Settings of the .cxd -> .cxi conversion driver
public record ConversionConfig(List<String> command, Integer bgFramesMax, Integer ffFramesMax, Integer roiLowLimit,
                               Double roiFraction, Integer percentileNumber, Integer percentileFrames,
                               String flatfield) {

    public static ConversionConfig empty() {
        return new ConversionConfig(null, null, null, null, null, null, null, null);
    }
}
