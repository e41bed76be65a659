package com.agentscan.probe;

import com.agentscan.model.PageSignals;
import com.agentscan.model.ScanTarget;

/**
 * Page signal extraction (platform, payment processors, structured data, robots.txt, checkout friction).
 */
public interface SignalExtractor {

    PageSignals extract(ScanTarget target) throws Exception;

    /**
     * Extractor used when none is configured: every signal reads as absent.
     */
    static SignalExtractor absent() {
        return target -> PageSignals.absent();
    }
}
