package com.streamfirst.scenesearch.adapters.safe;

import com.streamfirst.scenesearch.domain.SceneSearchException;
import com.streamfirst.scenesearch.ports.ProcessingTimeReader;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/** Reads the processing start time from the first {@code processing} element of a manifest. */
public class SafeManifestReader implements ProcessingTimeReader {

    @Override
    public LocalDateTime processingStart(String location) {
        SafeManifest manifest = SafeManifest.read(location);
        String start =
                manifest
                        .first("processing")
                        .map(e -> e.getAttribute("start"))
                        .filter(s -> !s.isBlank())
                        .orElseThrow(
                                () -> new SceneSearchException("no processing start in " + manifest.file()));
        try {
            return LocalDateTime.parse(start);
        } catch (DateTimeParseException e) {
            throw new SceneSearchException(
                    "invalid processing start '" + start + "' in " + manifest.file(), e);
        }
    }
}
