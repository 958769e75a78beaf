package com.team.remediation.service.generation;

import reactor.core.publisher.Mono;

/**
 * Text generation backend used to draft fix candidates.
 */
public interface GenerativeBackend {

    /**
     * @return the raw response text; errors with a {@link com.team.remediation.exception.GenerationFailedException}
     *         or a transport error when the call fails
     */
    Mono<String> generate(String prompt, double temperature);

    /**
     * Whether the backend is configured and may be called at all.
     */
    boolean isAvailable();
}
