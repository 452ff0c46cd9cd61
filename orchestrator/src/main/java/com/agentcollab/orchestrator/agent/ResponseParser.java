package com.agentcollab.orchestrator.agent;

import com.agentcollab.orchestrator.model.DelegationRequest;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses model text responses to extract:
 *   1. {@code <delegate to="agent-id">instructions</delegate>} tags, a request to hand work to a teammate
 *   2. {@code <result>} tags, the agent's final answer when it wraps one
 */
public final class ResponseParser {

    private static final Pattern DELEGATE_TAG = Pattern.compile(
            "<delegate\\s+to\\s*=\\s*[\"']([^\"']+)[\"']\\s*>(.*?)</delegate>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE
    );

    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /** The first delegation tag, if the response has one. */
    public static Optional<DelegationRequest> extractDelegation(String response) {
        if (response == null) return Optional.empty();
        Matcher m = DELEGATE_TAG.matcher(response);
        return m.find()
                ? Optional.of(new DelegationRequest(m.group(1).strip(), m.group(2).strip()))
                : Optional.empty();
    }

    /** The response with every delegation tag removed. */
    public static String stripDelegation(String response) {
        if (response == null) return "";
        return DELEGATE_TAG.matcher(response).replaceAll("").strip();
    }

    /**
     * The final answer: the content of the first {@code <result>} tag when
     * there is one, otherwise the whole response. Always stripped.
     */
    public static String extractAnswer(String response) {
        if (response == null) return "";
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? m.group(1).strip() : response.strip();
    }
}
