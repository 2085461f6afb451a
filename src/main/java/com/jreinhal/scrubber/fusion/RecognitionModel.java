package com.jreinhal.scrubber.fusion;

import com.jreinhal.scrubber.model.ExternalCandidate;
import java.util.List;

/**
 * Optional learned recognizer. Implementations may be slow or fail; callers go through
 * {@link RecognitionGateway}, which bounds and isolates them.
 */
public interface RecognitionModel {

    String name();

    List<ExternalCandidate> recognize(String content);
}
