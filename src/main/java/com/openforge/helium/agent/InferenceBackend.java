package com.openforge.helium.agent;

import java.util.function.Consumer;

/**
 * Language-model port used by the tool loop.
 *
 * Implementations may stream partial text through {@code onChunk} while the
 * call is in flight and must return only once the completion is final.  If a
 * failed attempt is repeated after chunks were streamed, {@code onRestart} is
 * invoked before the first chunk of the new attempt.
 * Transport failures are thrown as unchecked exceptions.
 */
@FunctionalInterface
public interface InferenceBackend {

    InferenceResponse infer(InferenceRequest request, Consumer<String> onChunk, Runnable onRestart);
}
