package com.jreinhal.scrubber.detection;

import com.jreinhal.scrubber.model.CandidateEntity;
import java.util.List;

/**
 * Stateless matcher for one entity label. Implementations must be pure functions of their
 * input so they can run concurrently across requests.
 */
public interface EntityDetector {

    String id();

    String label();

    /**
     * Candidates found in {@code content}, with spans relative to {@code content}.
     * Candidates carry no structural coordinate; the caller tags them.
     */
    List<CandidateEntity> scan(String content);
}
