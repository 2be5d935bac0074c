package com.astroplatform.conversation.logger;

import com.astroplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Observability for one chat turn. Pure side effects; no pipeline behaviour lives here.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #TURN_RECEIVED}: message accepted, session loaded</li>
 *   <li>{@link #BIRTH_DETAILS_RESOLVED}: details supplied, extracted or still missing</li>
 *   <li>{@link #MODE_ROUTED}: mode router decided mode and focus</li>
 *   <li>{@link #TOPIC_CLASSIFIED}: topic and timeframe classified</li>
 *   <li>{@link #FEATURES_BUILT}: feature bundle ready (possibly empty)</li>
 *   <li>{@link #REPLY_GENERATED}: generator chain answered</li>
 *   <li>{@link #SESSION_PERSISTED}: updated state stored</li>
 * </ol>
 */
@Component
public class ChatFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ChatFlowLogger.class);

    public static final String TURN_RECEIVED          = "TURN_RECEIVED";
    public static final String BIRTH_DETAILS_RESOLVED = "BIRTH_DETAILS_RESOLVED";
    public static final String MODE_ROUTED            = "MODE_ROUTED";
    public static final String TOPIC_CLASSIFIED       = "TOPIC_CLASSIFIED";
    public static final String FEATURES_BUILT         = "FEATURES_BUILT";
    public static final String REPLY_GENERATED        = "REPLY_GENERATED";
    public static final String SESSION_PERSISTED      = "SESSION_PERSISTED";

    /** Logs a stage with extra {@code key=value} detail when the traceId is already at hand. */
    public void logWithTraceId(String stageName, String traceId, String detail) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[ChatFlow] stage={} {} traceId={}", stageName, detail, traceId)
        );
    }
}
