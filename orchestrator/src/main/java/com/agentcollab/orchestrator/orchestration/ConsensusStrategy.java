package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.collaboration.CollaborationEventType;
import com.agentcollab.orchestrator.consensus.ConsensusNotReachedException;
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
import com.agentcollab.orchestrator.model.TieBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One proposal round; the answers are tallied. When no candidate reaches
 * the threshold the team's tie breaker picks the winner.
 */
final class ConsensusStrategy implements CollaborationStrategy {

    private static final Logger log = LoggerFactory.getLogger(ConsensusStrategy.class);

    @Override
    public PatternOutcome run(AgentTeam team, TeamInput input, OrchestrationContext ctx) {
        PatternConfig config = team.patternConfig();
        double threshold = config.effectiveThreshold();

        // Everybody proposes against the same view, so no answer is influenced by another.
        SharedContextSnapshot view = ctx.snapshot();
        List<Proposal> proposals = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        for (TeamMember member : team.members()) {
            ctx.token().throwIfCancelled();
            Agent agent = ctx.agent(member.agentId());
            AgentExecution child = ctx.launch(agent, ctx.inputFor(input.task()), view);
            ctx.absorb(child, member.role());
            if (child.getStatus() == AgentStatus.CANCELLED) {
                throw new ExecutionCancelledException(ctx.token().reason());
            }
            if (OrchestrationContext.answered(child)) {
                outputs.add(child.response());
                proposals.add(new Proposal(member.agentId(), child.response(), member.priority()));
                ctx.record(CollaborationEventType.VOTE, member.agentId(), null, child.response());
            }
        }
        if (proposals.isEmpty()) {
            throw new AgentFailedException(team.members().get(0).agentId(), "ALL_AGENTS_FAILED",
                    "No agent produced a proposal");
        }
        ctx.completeRound(outputs);

        ConsensusResult result;
        try {
            result = ctx.resolver().require(proposals, threshold, ctx.equivalence());
        } catch (ConsensusNotReachedException e) {
            TieBreaker breaker = config.effectiveTieBreaker();
            log.warn("{}; falling back to tie breaker {}", e.getMessage(), breaker);
            String winner = breakTie(breaker, team, input, proposals, ctx);
            result = e.result().withWinner(winner);
            ctx.record(CollaborationEventType.INTERVENTION, null, null,
                    "Tie breaker " + breaker + " chose: " + winner);
        }
        ctx.record(CollaborationEventType.CONSENSUS, null, null, DebateStrategy.describe(result, threshold));
        return new PatternOutcome(result.winner(), ctx.producedArtifacts(), result);
    }

    private String breakTie(TieBreaker breaker, AgentTeam team, TeamInput input,
                            List<Proposal> proposals, OrchestrationContext ctx) {
        return switch (breaker) {
            case VOTING     -> ctx.resolver().pickByPriorityWeight(proposals, ctx.equivalence());
            case RANDOM     -> ctx.resolver().pickRandom(proposals, ctx.equivalence());
            case SUPERVISOR -> askSupervisor(team, input, proposals, ctx);
        };
    }

    /**
     * Re-ask the designated agent to choose. An answer that is not one of the
     * candidates, or a run that cannot happen, falls back to voting.
     */
    private String askSupervisor(AgentTeam team, TeamInput input, List<Proposal> proposals, OrchestrationContext ctx) {
        String fallback = ctx.resolver().pickByPriorityWeight(proposals, ctx.equivalence());
        if (!ctx.mayFinalize()) {
            return fallback;
        }
        String judgeId = team.patternConfig().supervisorAgentId() != null
                ? team.patternConfig().supervisorAgentId()
                : team.members().stream().max(Comparator.comparingInt(TeamMember::priority)).orElseThrow().agentId();

        List<String> candidates = distinct(proposals, ctx);
        StringBuilder prompt = new StringBuilder(input.task())
                .append("\n\nThe team could not agree. Candidate answers:\n");
        for (int i = 0; i < candidates.size(); i++) {
            prompt.append(i + 1).append(". ").append(candidates.get(i)).append('\n');
        }
        prompt.append("\nReply with the exact text of the candidate you choose and nothing else.");

        AgentExecution judge = ctx.run(judgeId, ctx.roleOf(judgeId), ctx.inputFor(prompt.toString()));
        if (OrchestrationContext.answered(judge)) {
            for (String candidate : candidates) {
                if (ctx.equivalence().equivalent(candidate, judge.response())) {
                    return candidate;
                }
            }
        }
        log.warn("Supervisor {} did not pick a candidate, using priority-weighted vote", judgeId);
        return fallback;
    }

    private static List<String> distinct(List<Proposal> proposals, OrchestrationContext ctx) {
        List<String> out = new ArrayList<>();
        for (Proposal p : proposals) {
            String answer = p.answer().strip();
            if (answer.isEmpty()) continue;
            if (out.stream().noneMatch(a -> ctx.equivalence().equivalent(a, answer))) {
                out.add(answer);
            }
        }
        return out;
    }
}
