package com.jreinhal.scrubber.fusion;

import com.jreinhal.scrubber.model.ExternalCandidate;
import java.util.List;

/**
 * Stand-in for deployments without a recognition model. Finds nothing.
 */
public final class NoOpRecognitionModel implements RecognitionModel {
    public static final NoOpRecognitionModel INSTANCE = new NoOpRecognitionModel();

    private NoOpRecognitionModel() {
    }

    @Override
    public String name() {
        return "none";
    }

    @Override
    public List<ExternalCandidate> recognize(String content) {
        return List.of();
    }
}
