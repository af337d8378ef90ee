package com.streamfirst.scenesearch.domain;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fields encoded in a Sentinel-1 product name such as
 * {@code S1A_IW_GRDH_1SDV_20210101T050000_20210101T050025_035948_0434D8_1A2B.SAFE}.
 *
 * @param name product name without directory and extension
 * @param sensor platform code, e.g. {@code S1A}
 * @param acquisitionMode beam mode, e.g. {@code IW} or {@code S3}
 * @param product product type without resolution class, e.g. {@code GRD}
 * @param start acquisition start
 * @param stop acquisition stop
 * @param absoluteOrbit absolute orbit number
 * @param dataTake data-take id as 6-digit hexadecimal string
 */
public record SceneName(
        String name,
        String sensor,
        String acquisitionMode,
        String product,
        String polarizationMode,
        LocalDateTime start,
        LocalDateTime stop,
        int absoluteOrbit,
        String dataTake) {

    private static final Pattern NAME =
            Pattern.compile(
                    "(?<sensor>S1[A-D])_(?<mode>[A-Z0-9]{2})_(?<product>SLC|GRD|OCN|RAW)[FHM_]_"
                            + "[0-9][SA](?<pols>SH|SV|DH|DV|HH|VV|HV|VH)_"
                            + "(?<start>[0-9]{8}T[0-9]{6})_(?<stop>[0-9]{8}T[0-9]{6})_"
                            + "(?<orbit>[0-9]{6})_(?<datatake>[0-9A-F]{6})_[0-9A-F]{4}");

    /** Instrument token, start and stop: equal for reprocessed copies of one acquisition. */
    private static final Pattern DUPLICATE_KEY =
            Pattern.compile("([0-9A-Z_]{16})_([0-9T]{15})_([0-9T]{15})");

    /**
     * Parses the product name contained in a location (path, URL or bare name).
     *
     * @throws ConfigurationException if the location holds no Sentinel-1 product name
     */
    public static SceneName parse(String location) {
        String base = basename(location);
        Matcher m = NAME.matcher(base);
        if (!m.find()) {
            throw new ConfigurationException("not a Sentinel-1 product name: " + location);
        }
        return new SceneName(
                m.group(),
                m.group("sensor"),
                m.group("mode"),
                m.group("product"),
                m.group("pols"),
                SceneTimes.parse(m.group("start")),
                SceneTimes.parse(m.group("stop")),
                Integer.parseInt(m.group("orbit")),
                m.group("datatake"));
    }

    /**
     * The duplicate key of a location: the 16-character instrument token plus start and stop, joined
     * by underscores. Empty if the location basename does not contain such a key.
     */
    public static Optional<String> duplicateKey(String location) {
        Matcher m = DUPLICATE_KEY.matcher(basename(location));
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(m.group(1) + "_" + m.group(2) + "_" + m.group(3));
    }

    /** Last path segment of a location, ignoring a trailing separator. */
    public static String basename(String location) {
        String trimmed = location;
        while (trimmed.endsWith("/") || trimmed.endsWith("\\")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    public int dataTakeId() {
        return Integer.parseInt(dataTake, 16);
    }

    public List<String> polarizations() {
        return switch (polarizationMode) {
            case "SH" -> List.of("HH");
            case "SV" -> List.of("VV");
            case "DH" -> List.of("HH", "HV");
            case "DV" -> List.of("VV", "VH");
            default -> List.of(polarizationMode);
        };
    }
}
