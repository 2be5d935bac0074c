package com.astroplatform.conversation.generator;

import com.astroplatform.common.exception.PipelineException;
import com.astroplatform.common.model.GenerationPayload;
import com.astroplatform.common.model.GeneratorReply;
import com.astroplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Ordered fallback chain: primary LLM, secondary LLM, then the deterministic stub.
 *
 * <p>Each remote stage runs under its own {@code timeout}. An error, a timeout or an
 * empty reply moves to the next stage; disabled stages are skipped. The returned
 * {@code Mono} never errors, and its reply carries the name of the stage that produced it.
 */
@Service
public class GeneratorChain {

    private static final Logger log = LoggerFactory.getLogger(GeneratorChain.class);

    private final List<ReplyGenerator> providers;
    private final ReplyGenerator       fallback;
    private final GeneratorMetrics     metrics;

    @Autowired
    public GeneratorChain(AnthropicReplyGenerator primary,
                          OpenAiReplyGenerator secondary,
                          StubReplyGenerator fallback,
                          GeneratorMetrics metrics) {
        this(List.of(primary, secondary), fallback, metrics);
    }

    GeneratorChain(List<ReplyGenerator> providers, ReplyGenerator fallback, GeneratorMetrics metrics) {
        this.providers = List.copyOf(providers);
        this.fallback  = fallback;
        this.metrics   = metrics;
    }

    public Mono<GeneratorReply> generate(GenerationPayload payload) {
        return attempt(0, payload);
    }

    private Mono<GeneratorReply> attempt(int index, GenerationPayload payload) {
        if (index >= providers.size()) {
            return useFallback(payload);
        }
        ReplyGenerator generator = providers.get(index);
        if (!generator.isEnabled()) {
            log.warn("[Generator] {} disabled (no API key), moving on", generator.name());
            metrics.recordFallback(generator.name());
            return attempt(index + 1, payload);
        }

        return Mono.defer(() -> {
                metrics.recordCall(generator.name());
                return generator.generate(payload);
            })
            .timeout(generator.timeout())
            .switchIfEmpty(Mono.error(new PipelineException(generator.name(), "empty reply")))
            .map(reply -> reply.withProvider(generator.name()))
            .onErrorResume(e -> Mono.deferContextual(ctx -> {
                String traceId = TraceContextUtil.getTraceId(ctx);
                TraceContextUtil.withMdc(traceId, () ->
                    log.error("[Generator] {} failed, falling back. reason={} traceId={}",
                              generator.name(), e.toString(), traceId));
                metrics.recordError(generator.name());
                metrics.recordFallback(generator.name());
                return attempt(index + 1, payload);
            }));
    }

    private Mono<GeneratorReply> useFallback(GenerationPayload payload) {
        metrics.recordCall(fallback.name());
        return fallback.generate(payload)
            .map(reply -> reply.withProvider(fallback.name()));
    }
}
