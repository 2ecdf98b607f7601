package com.openforge.searchmate.llm;

import com.openforge.searchmate.llm.model.ToolCall;

import java.util.List;

/**
 * Outcome of a non-incremental reasoning call.
 *
 * Answer   : the model replied with text; nothing left to resolve.
 * Decision : the model asked for one or more tool calls. The preamble text
 *            (often null) and the invocations are kept exactly as received.
 */
public sealed interface ReasoningResult permits ReasoningResult.Answer, ReasoningResult.Decision {

    record Answer(String text) implements ReasoningResult {
        public Answer {
            text = text == null ? "" : text;
        }
    }

    record Decision(String text, List<ToolCall> invocations) implements ReasoningResult {
        public Decision {
            if (invocations == null || invocations.isEmpty()) {
                throw new IllegalArgumentException("A decision needs at least one invocation");
            }
            invocations = List.copyOf(invocations);
        }
    }
}
