package dev.inkmatch.profile;

/**
 * A label detected on an uploaded image by the analysis service.
 *
 * @param description label text
 * @param score detection score in [0, 1]
 */
public record ImageLabel(String description, double score) {}
