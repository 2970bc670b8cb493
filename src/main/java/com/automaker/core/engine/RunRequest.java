package com.automaker.core.engine;

import com.automaker.core.model.FeatureImage;

import java.util.List;

/**
 * What kind of conversation the runner should start for a feature.
 *
 * @param mode               fresh run, resume from transcript, or follow-up
 * @param previousTranscript transcript so far (resume and follow-up)
 * @param instructions       follow-up instructions from the user
 * @param images             extra images for a follow-up
 */
public record RunRequest(Mode mode, String previousTranscript, String instructions, List<FeatureImage> images) {

    public enum Mode { INITIAL, RESUME, FOLLOW_UP }

    public RunRequest {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static RunRequest initial() {
        return new RunRequest(Mode.INITIAL, null, null, List.of());
    }

    public static RunRequest resume(String previousTranscript) {
        return new RunRequest(Mode.RESUME, previousTranscript, null, List.of());
    }

    public static RunRequest followUp(String previousTranscript, String instructions, List<FeatureImage> images) {
        return new RunRequest(Mode.FOLLOW_UP, previousTranscript, instructions, images);
    }
}
