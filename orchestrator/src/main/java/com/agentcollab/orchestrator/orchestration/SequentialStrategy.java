package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.model.TeamMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Members run one after another, each fed the previous member's output.
 * The last non-empty response is the team's answer.
 */
final class SequentialStrategy implements CollaborationStrategy {

    private static final Logger log = LoggerFactory.getLogger(SequentialStrategy.class);

    @Override
    public PatternOutcome run(AgentTeam team, TeamInput input, OrchestrationContext ctx) {
        boolean tolerate = team.patternConfig().tolerateFailures();
        String previous = null;
        String previousRole = null;

        for (TeamMember member : order(team, ctx)) {
            String message = previous == null
                    ? input.task()
                    : input.task() + "\n\nOutput of the previous agent (" + previousRole + "):\n" + previous;

            AgentExecution child = ctx.runWithDelegation(member.agentId(), member.role(), ctx.inputFor(message));
            if (!child.isCompleted()) {
                if (!tolerate) {
                    throw new AgentFailedException(child);
                }
                log.warn("Agent {} failed, continuing with the next member", member.agentId());
                if (ctx.completeRound(List.of()).shouldStop()) break;
                continue;
            }

            String response = child.response();
            if (response != null && !response.isBlank()) {
                previous     = response;
                previousRole = member.role();
            }
            if (ctx.completeRound(response == null ? List.of() : List.of(response)).shouldStop()) {
                break;
            }
        }
        return PatternOutcome.of(ctx.lastResponse(), ctx.producedArtifacts());
    }

    /**
     * PRIORITY: higher priority first, declaration order on ties.
     * ROUND_ROBIN: declaration order. RANDOM: shuffled with the run's random source.
     */
    static List<TeamMember> order(AgentTeam team, OrchestrationContext ctx) {
        List<TeamMember> members = new ArrayList<>(team.members());
        switch (team.patternConfig().effectiveOrderStrategy()) {
            case PRIORITY    -> members.sort(Comparator.comparingInt(TeamMember::priority).reversed());
            case ROUND_ROBIN -> { }
            case RANDOM      -> Collections.shuffle(members, ctx.random());
        }
        return members;
    }
}
