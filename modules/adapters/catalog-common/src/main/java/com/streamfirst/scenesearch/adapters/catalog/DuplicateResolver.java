package com.streamfirst.scenesearch.adapters.catalog;

import com.streamfirst.scenesearch.domain.SceneName;
import com.streamfirst.scenesearch.ports.ProcessingTimeReader;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Collapses reprocessed copies of the same acquisition. Copies share the instrument token and the
 * start and stop times in their product name; of each such group only the most recently processed
 * product is kept.
 */
@Slf4j
@RequiredArgsConstructor
public class DuplicateResolver {

    private final ProcessingTimeReader processingTimes;

    /**
     * Reduces every group of duplicates to its latest processed member. Members of a group need not
     * share a directory. Locations whose name carries no duplicate key are kept unchanged.
     *
     * @param locations scene locations in any order
     * @return the reduced locations in sorted order
     */
    public List<String> resolve(Collection<String> locations) {
        List<String> sorted = locations.stream().distinct().sorted().toList();
        Map<String, List<String>> groups = new LinkedHashMap<>();
        List<String> keep = new ArrayList<>(sorted.size());
        for (String location : sorted) {
            Optional<String> key = SceneName.duplicateKey(location);
            if (key.isPresent()) {
                groups.computeIfAbsent(key.get(), k -> new ArrayList<>()).add(location);
            } else {
                log.warn("No product name found in {}, keeping it as is", location);
                keep.add(location);
            }
        }
        for (List<String> group : groups.values()) {
            keep.add(group.size() > 1 ? latestProcessed(group) : group.get(0));
        }
        keep.sort(null);
        if (keep.size() < sorted.size()) {
            log.info("Removed {} duplicate scene(s)", sorted.size() - keep.size());
        }
        return keep;
    }

    private String latestProcessed(List<String> group) {
        String latest = null;
        LocalDateTime latestTime = null;
        for (String location : group) {
            LocalDateTime processed = processingTimes.processingStart(location);
            if (latestTime == null || processed.isAfter(latestTime)) {
                latest = location;
                latestTime = processed;
            }
        }
        log.debug("Keeping {} out of {} duplicates", latest, group.size());
        return latest;
    }
}
