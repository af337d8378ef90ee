package com.streamfirst.scenesearch.domain;

/** Axis-aligned bounding extent in geographic coordinates (longitude = x, latitude = y). */
public record Extent(double xmin, double ymin, double xmax, double ymax) {}
