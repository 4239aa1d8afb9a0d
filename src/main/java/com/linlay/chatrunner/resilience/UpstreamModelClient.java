package com.linlay.chatrunner.resilience;

import com.linlay.chatrunner.model.LlmDelta;
import com.linlay.chatrunner.model.ModelCall;
import reactor.core.publisher.Flux;

/**
 * A raw streaming call to the upstream model, without caching, retry or circuit breaking.
 */
public interface UpstreamModelClient {

    Flux<LlmDelta> stream(ModelCall call);
}
