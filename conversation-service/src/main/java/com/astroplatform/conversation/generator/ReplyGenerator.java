package com.astroplatform.conversation.generator;

import com.astroplatform.common.model.GenerationPayload;
import com.astroplatform.common.model.GeneratorReply;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * One stage of the reply generation chain.
 *
 * <p>Implementations may fail or time out; {@link GeneratorChain} absorbs both and moves
 * to the next stage.
 */
public interface ReplyGenerator {

    /** Label used in logs, metrics and {@link GeneratorReply#provider()}. */
    String name();

    /** False when the stage cannot run (e.g. no API key); the chain skips it. */
    boolean isEnabled();

    /** Upper bound the chain applies to {@link #generate}. */
    Duration timeout();

    Mono<GeneratorReply> generate(GenerationPayload payload);
}
