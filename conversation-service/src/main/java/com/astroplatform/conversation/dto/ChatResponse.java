package com.astroplatform.conversation.dto;

import com.astroplatform.common.model.FocusArea;
import com.astroplatform.common.model.GeneratorReply;
import com.astroplatform.common.model.Mode;
import com.astroplatform.common.model.SuggestedAction;
import com.astroplatform.common.taxonomy.Topic;

import java.util.List;

public record ChatResponse(
    String                sessionId,
    GeneratorReply        reply,
    Mode                  mode,
    Topic                 activeTopic,
    FocusArea             focus,
    List<SuggestedAction> suggestedActions
) {
    public ChatResponse {
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }
}
