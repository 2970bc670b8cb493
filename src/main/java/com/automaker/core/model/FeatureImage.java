package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * An image attached to a feature description.
 *
 * @param path     absolute or project-relative path to the image file
 * @param mimeType MIME type such as {@code image/png}
 * @param filename original file name shown in the GUI (nullable)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeatureImage(
    String path,
    String mimeType,
    String filename
) implements Serializable {}
