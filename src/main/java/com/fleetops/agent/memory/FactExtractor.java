package com.fleetops.agent.memory;

import java.util.List;

public interface FactExtractor {

    /** Never throws; an extraction that fails yields an empty list. */
    List<ExtractedFact> extract(String content);
}
