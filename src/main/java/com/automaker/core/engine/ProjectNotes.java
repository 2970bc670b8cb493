package com.automaker.core.engine;

import java.util.List;

/**
 * Project-level knowledge injected into every prompt.
 *
 * @param memory       lessons learned from previous runs (nullable)
 * @param contextFiles previews of files under {@code .automaker/context/}
 */
public record ProjectNotes(String memory, List<ContextFile> contextFiles) {

    public record ContextFile(String name, String preview, int totalLines) {}

    public static ProjectNotes empty() {
        return new ProjectNotes(null, List.of());
    }

    public ProjectNotes {
        contextFiles = contextFiles == null ? List.of() : List.copyOf(contextFiles);
    }
}
