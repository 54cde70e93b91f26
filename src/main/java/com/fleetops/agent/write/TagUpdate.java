package com.fleetops.agent.write;

import java.util.List;
import java.util.Map;

/**
 * One entry of a batch tag update. A null tag value removes that key.
 */
public record TagUpdate(List<String> deviceIds, Map<String, String> tags) {
}
