package com.astroplatform.conversation.service;

import com.astroplatform.common.classifier.TimeframeClassifier;
import com.astroplatform.common.classifier.TimeframeResult;
import com.astroplatform.common.classifier.TopicClassifier;
import com.astroplatform.common.features.AstroFeatureBuilder;
import com.astroplatform.common.features.AstroFeatures;
import com.astroplatform.common.model.BirthDetails;
import com.astroplatform.common.model.ConversationState;
import com.astroplatform.common.model.GenerationPayload;
import com.astroplatform.common.model.GeneratorReply;
import com.astroplatform.common.model.Mode;
import com.astroplatform.common.model.SuggestedAction;
import com.astroplatform.common.router.ModeRouter;
import com.astroplatform.common.router.RoutingDecision;
import com.astroplatform.common.taxonomy.Topic;
import com.astroplatform.common.trace.TraceContextUtil;
import com.astroplatform.conversation.chart.ChartDataService;
import com.astroplatform.conversation.dto.ChartSummary;
import com.astroplatform.conversation.dto.ChatRequest;
import com.astroplatform.conversation.dto.ChatResponse;
import com.astroplatform.conversation.extractor.BirthDetailsResolver;
import com.astroplatform.conversation.generator.GeneratorChain;
import com.astroplatform.conversation.logger.ChatFlowLogger;
import com.astroplatform.conversation.session.SessionStore;
import com.astroplatform.conversation.session.SessionTurnQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one chat turn end to end.
 *
 * <p><strong>Turn flow:</strong>
 * <ol>
 *   <li>Load or create the session and count the message.</li>
 *   <li>Take pre-supplied birth details, or extract them from the message while the
 *       session has none.</li>
 *   <li>Route the mode, classify topic and timeframe.</li>
 *   <li>Build the feature bundle from the cached chart. Chart failures give an empty
 *       bundle; the turn carries on.</li>
 *   <li>Generate the reply through {@link GeneratorChain} (never errors).</li>
 *   <li>Apply routing to the state, mark the first reading done, persist.</li>
 * </ol>
 *
 * <p>Every state mutation for a session id runs inside {@link SessionTurnQueue}, so turns
 * for one session never interleave while different sessions proceed in parallel.
 */
@Service
public class ChatOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChatOrchestrator.class);

    private final SessionStore         sessionStore;
    private final SessionTurnQueue     turnQueue;
    private final BirthDetailsResolver birthDetailsResolver;
    private final ChartDataService     chartDataService;
    private final GeneratorChain       generatorChain;
    private final ChatFlowLogger       flowLogger;
    private final Clock                clock;

    public ChatOrchestrator(SessionStore sessionStore,
                            SessionTurnQueue turnQueue,
                            BirthDetailsResolver birthDetailsResolver,
                            ChartDataService chartDataService,
                            GeneratorChain generatorChain,
                            ChatFlowLogger flowLogger,
                            Clock clock) {
        this.sessionStore         = sessionStore;
        this.turnQueue            = turnQueue;
        this.birthDetailsResolver = birthDetailsResolver;
        this.chartDataService     = chartDataService;
        this.generatorChain       = generatorChain;
        this.flowLogger           = flowLogger;
        this.clock                = clock;
    }

    // ── chat turn ─────────────────────────────────────────────────────────────

    public Mono<ChatResponse> handleTurn(ChatRequest request) {
        if (request == null || request.sessionId() == null || request.sessionId().isBlank()) {
            return Mono.error(new IllegalArgumentException("sessionId is required"));
        }
        String traceId = UUID.randomUUID().toString();
        Mono<ChatResponse> turn = turnQueue.submit(request.sessionId(), () -> processTurn(request, traceId));
        return TraceContextUtil.withTraceId(turn, traceId);
    }

    private Mono<ChatResponse> processTurn(ChatRequest request, String traceId) {
        Instant now = clock.instant();
        String message = request.message() == null ? "" : request.message();
        ConversationState received = sessionStore.getOrCreate(request.sessionId(), now).withMessageReceived(now);
        flowLogger.logWithTraceId(ChatFlowLogger.TURN_RECEIVED, traceId,
            "sessionId=" + received.sessionId() + " messageCount=" + received.messageCount()
                + " actionId=" + request.actionId());

        return resolveBirthDetails(received, request, message)
            .map(details -> received.withBirthDetails(details, now))
            .defaultIfEmpty(received)
            .doOnNext(state -> flowLogger.logWithTraceId(ChatFlowLogger.BIRTH_DETAILS_RESOLVED, traceId,
                "complete=" + BirthDetails.isComplete(state.birthDetails())))
            .flatMap(state -> respond(state, request, message, now, traceId));
    }

    private Mono<BirthDetails> resolveBirthDetails(ConversationState state, ChatRequest request, String message) {
        if (BirthDetails.isComplete(request.birthDetails())) {
            return Mono.just(request.birthDetails());
        }
        if (BirthDetails.isComplete(state.birthDetails())) {
            return Mono.empty();
        }
        return birthDetailsResolver.resolve(message);
    }

    private Mono<ChatResponse> respond(ConversationState state, ChatRequest request, String message,
                                       Instant now, String traceId) {
        RoutingDecision decision = ModeRouter.route(state, message, request.actionId());
        flowLogger.logWithTraceId(ChatFlowLogger.MODE_ROUTED, traceId,
            "mode=" + decision.mode() + " focus=" + decision.focus() + " firstReading=" + decision.firstReading());

        Topic topic = TopicClassifier.classify(message, request.actionId(), state.activeTopic());
        TimeframeResult timeframe = TimeframeClassifier.classify(message);
        flowLogger.logWithTraceId(ChatFlowLogger.TOPIC_CLASSIFIED, traceId,
            "topic=" + topic.wireId() + " horizonMonths=" + timeframe.horizonMonths());

        return buildFeatures(state, decision.mode(), topic, timeframe, now, traceId)
            .doOnNext(f -> flowLogger.logWithTraceId(ChatFlowLogger.FEATURES_BUILT, traceId,
                "empty=" + f.isEmpty() + " focusFactors=" + f.focusFactors().size()
                    + " transits=" + f.transits().size()))
            .flatMap(features -> generatorChain.generate(
                new GenerationPayload(decision.mode(), topic, message, features)))
            .doOnNext(reply -> flowLogger.logWithTraceId(ChatFlowLogger.REPLY_GENERATED, traceId,
                "provider=" + reply.provider()))
            .map(reply -> persist(state, decision, topic, reply, now, traceId));
    }

    private Mono<AstroFeatures> buildFeatures(ConversationState state, Mode mode, Topic topic,
                                              TimeframeResult timeframe, Instant now, String traceId) {
        if (mode == Mode.NEEDS_BIRTH_DETAILS) {
            return Mono.just(AstroFeatures.empty());
        }
        return chartDataService.ensureChart(state.birthDetails())
            .map(chart -> AstroFeatureBuilder.build(
                chart.profile(), chart.transits(), mode, topic, now, timeframe))
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(traceId, () ->
                    log.error("[ChatOrchestrator] Feature build failed, continuing without chart. sessionId={} reason={}",
                              state.sessionId(), e.getMessage(), e));
                return Mono.just(AstroFeatures.empty());
            });
    }

    private ChatResponse persist(ConversationState state, RoutingDecision decision, Topic topic,
                                 GeneratorReply reply, Instant now, String traceId) {
        ConversationState updated = state.withRouting(decision.mode(), decision.focus(), topic, now);
        if (decision.mode() == Mode.NORMAL_READING && decision.firstReading()) {
            updated = updated.withRetrospectiveDone(now);
        }
        sessionStore.put(updated);
        flowLogger.logWithTraceId(ChatFlowLogger.SESSION_PERSISTED, traceId,
            "sessionId=" + updated.sessionId() + " mode=" + updated.mode());

        List<SuggestedAction> actions = SuggestedActions.forTurn(decision.mode(), topic, decision.firstReading());
        return new ChatResponse(updated.sessionId(), reply, updated.mode(), topic, updated.focus(), actions);
    }

    // ── session management ────────────────────────────────────────────────────

    public Optional<ConversationState> snapshot(String sessionId) {
        return sessionStore.get(sessionId);
    }

    /**
     * Replaces the session's birth details wholesale, creating the session if needed.
     * Incomplete details are rejected with {@link IllegalArgumentException}.
     */
    public Mono<ConversationState> setBirthDetails(String sessionId, BirthDetails details) {
        if (!BirthDetails.isComplete(details)) {
            return Mono.error(new IllegalArgumentException("birth details need date, time and location"));
        }
        return turnQueue.submit(sessionId, () -> Mono.fromCallable(() -> {
            Instant now = clock.instant();
            ConversationState updated = sessionStore.getOrCreate(sessionId, now).withBirthDetails(details, now);
            sessionStore.put(updated);
            log.info("[ChatOrchestrator] Birth details set sessionId={} location={}", sessionId, details.location());
            return updated;
        }));
    }

    /** @return true when a session existed and was dropped */
    public Mono<Boolean> reset(String sessionId) {
        return turnQueue.submit(sessionId, () -> Mono.fromCallable(() -> sessionStore.delete(sessionId)));
    }

    /** Chart summary for the session's birth details; empty when the session has none. */
    public Mono<ChartSummary> chartSummary(String sessionId) {
        return Mono.justOrEmpty(sessionStore.get(sessionId))
            .filter(state -> BirthDetails.isComplete(state.birthDetails()))
            .flatMap(state -> chartDataService.ensureChart(state.birthDetails()))
            .map(ChartSummary::from);
    }
}
