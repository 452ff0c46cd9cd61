package com.agentcollab.orchestrator.orchestration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;
import java.util.Optional;

/**
 * One round's instruction from the supervisor, parsed from its JSON output:
 * <pre>
 *   {"action":"delegate","target":"agent-id","instructions":"..."}
 *   {"action":"complete","result":"..."}
 *   {"action":"refine","notes":"..."}
 * </pre>
 * The JSON may be wrapped in prose or a code fence; the outermost object is used.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record SupervisorDirective(String action, String target, String instructions, String result, String notes) {

    enum Action { DELEGATE, COMPLETE, REFINE }

    private static final ObjectMapper JSON = new ObjectMapper();

    /** Empty when the output holds no valid directive. */
    static Optional<SupervisorDirective> parse(String output) {
        if (output == null) return Optional.empty();
        int start = output.indexOf('{');
        int end = output.lastIndexOf('}');
        if (start < 0 || end <= start) return Optional.empty();
        try {
            SupervisorDirective d = JSON.readValue(output.substring(start, end + 1), SupervisorDirective.class);
            return d.isValid() ? Optional.of(d) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    Action kind() {
        return Action.valueOf(action.strip().toUpperCase(Locale.ROOT));
    }

    private boolean isValid() {
        if (action == null) return false;
        try {
            return switch (kind()) {
                case DELEGATE -> target != null && !target.isBlank();
                case COMPLETE -> result != null && !result.isBlank();
                case REFINE   -> true;
            };
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
