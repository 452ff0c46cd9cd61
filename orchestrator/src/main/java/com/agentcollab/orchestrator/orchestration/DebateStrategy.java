package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.collaboration.CollaborationEventType;
import com.agentcollab.orchestrator.consensus.ConsensusResult;
import com.agentcollab.orchestrator.consensus.Proposal;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentStatus;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.PatternConfig;
import com.agentcollab.orchestrator.model.SharedContextSnapshot;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.model.TeamMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Members argue in rounds. Every member of a round sees the shared context
 * as it stood when the round began, i.e. all earlier rounds' responses.
 * After each round the answers are tallied; reaching the threshold ends
 * the debate early.
 *
 * Without agreement after {@code maxRounds}, the synthesizer (member with
 * role "synthesizer", else the first member) writes the final answer.
 */
final class DebateStrategy implements CollaborationStrategy {

    private static final Logger log = LoggerFactory.getLogger(DebateStrategy.class);

    @Override
    public PatternOutcome run(AgentTeam team, TeamInput input, OrchestrationContext ctx) {
        if (!team.sharedContext().enabled() || !team.sharedContext().shareResponses()) {
            throw new InvalidTeamConfigurationException(
                    "Debate team " + team.id() + " must share responses between members");
        }
        PatternConfig config = team.patternConfig();
        int maxRounds = config.effectiveMaxRounds();
        double threshold = config.effectiveThreshold();

        ConsensusResult result = null;
        List<Proposal> proposals = List.of();
        int rounds = 0;

        for (int round = 1; round <= maxRounds && !ctx.terminated(); round++) {
            rounds = round;
            String message = round == 1
                    ? input.task()
                    : input.task() + "\n\nThis is round " + round + " of " + maxRounds + " of a debate. "
                      + "Weigh the other agents' positions in the shared context, then state your answer.";
            SharedContextSnapshot roundView = ctx.snapshot();

            proposals = new ArrayList<>();
            List<String> outputs = new ArrayList<>();
            for (TeamMember member : team.members()) {
                ctx.token().throwIfCancelled();
                Agent agent = ctx.agent(member.agentId());
                AgentExecution child = ctx.launch(agent, ctx.inputFor(message), roundView);
                ctx.absorb(child, member.role());
                if (child.getStatus() == AgentStatus.CANCELLED) {
                    throw new ExecutionCancelledException(ctx.token().reason());
                }
                if (OrchestrationContext.answered(child)) {
                    outputs.add(child.response());
                    proposals.add(new Proposal(member.agentId(), child.response(), member.priority()));
                    ctx.record(CollaborationEventType.VOTE, member.agentId(), null, child.response());
                } else {
                    log.warn("Agent {} gave no answer in debate round {}", member.agentId(), round);
                }
            }
            if (outputs.isEmpty()) {
                throw new AgentFailedException(team.members().get(0).agentId(), "ALL_AGENTS_FAILED",
                        "Every agent failed in debate round " + round);
            }

            result = ctx.resolver().resolve(proposals, threshold, ctx.equivalence()).withRounds(round);
            ctx.record(CollaborationEventType.CONSENSUS, null, null, describe(result, threshold));
            if (result.reached()) {
                return new PatternOutcome(result.winner(), ctx.producedArtifacts(), result);
            }
            ctx.completeRound(outputs);
        }

        ConsensusResult closing = result == null ? null : result.withRounds(rounds);
        if (!ctx.mayFinalize()) {
            return new PatternOutcome(ctx.lastResponse(), ctx.producedArtifacts(), closing);
        }

        TeamMember synthesizer = team.memberWithRole("synthesizer").orElse(team.members().get(0));
        AgentExecution synthesis = ctx.run(synthesizer.agentId(), synthesizer.role(),
                ctx.inputFor(synthesisPrompt(input.task(), proposals)));
        boolean synthesized = OrchestrationContext.answered(synthesis);
        String response = synthesized ? synthesis.response() : closing == null ? null : closing.winner();
        if (!synthesized) {
            log.warn("Synthesizer {} failed, falling back to the leading answer", synthesizer.agentId());
        }
        return new PatternOutcome(response, ctx.producedArtifacts(), closing);
    }

    static String describe(ConsensusResult result, double threshold) {
        return "round=%d reached=%s share=%.2f threshold=%.2f votes=%s".formatted(
                result.rounds(), result.reached(), result.share(), threshold, result.votes());
    }

    private static String synthesisPrompt(String task, List<Proposal> proposals) {
        StringBuilder sb = new StringBuilder(task);
        sb.append("\n\nThe debate ended without agreement. Final positions:\n");
        for (Proposal p : proposals) {
            sb.append("- ").append(p.agentId()).append(": ").append(p.answer()).append('\n');
        }
        sb.append("\nWrite the single best final answer.");
        return sb.toString();
    }
}
