package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.collaboration.CollaborationEventType;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.DelegationRule;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.model.TeamMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The supervisor answers first; its output is matched against the team's
 * ordered delegation rules and the first matching rule picks the next agent,
 * whose output is matched again, and so on. Routing never goes back to the
 * current agent or the supervisor, and never revisits an agent.
 *
 * When anything was delegated, the supervisor gets a final turn to
 * aggregate the sub-results, and that turn is the team's answer.
 */
final class HierarchicalStrategy implements CollaborationStrategy {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalStrategy.class);

    private record CompiledRule(DelegationCondition condition, String targetAgentId) {}

    private record SubResult(String agentId, String role, String response) {}

    @Override
    public PatternOutcome run(AgentTeam team, TeamInput input, OrchestrationContext ctx) {
        TeamMember supervisor = ctx.supervisor();
        List<CompiledRule> rules = team.patternConfig().delegationRules().stream()
                .map(HierarchicalStrategy::compile)
                .toList();
        boolean tolerate = team.patternConfig().tolerateFailures();

        ctx.guard().visit(supervisor.agentId(), supervisor.agentId());
        AgentExecution first = ctx.runWithDelegation(supervisor.agentId(), supervisor.role(), ctx.inputFor(input.task()));
        if (!first.isCompleted()) {
            throw new AgentFailedException(first);
        }

        List<SubResult> subResults = new ArrayList<>();
        String current = first.response();
        String currentAgent = supervisor.agentId();
        ctx.completeRound(List.of(current));

        while (!ctx.terminated()) {
            CompiledRule rule = route(rules, current, currentAgent, supervisor.agentId());
            if (rule == null) break;

            String target = rule.targetAgentId();
            ctx.guard().visit(currentAgent, target);
            ctx.guard().authorize(ctx.agent(currentAgent), target);
            ctx.record(CollaborationEventType.DELEGATION, currentAgent, target,
                    "Rule '" + rule.condition() + "' matched");

            String message = input.task() + "\n\nWork handed over by " + currentAgent + ":\n" + current;
            AgentExecution child = ctx.runWithDelegation(target, ctx.roleOf(target), ctx.inputFor(message));
            if (!child.isCompleted()) {
                if (!tolerate) {
                    throw new AgentFailedException(child);
                }
                log.warn("Agent {} failed, routing stops here", target);
                ctx.completeRound(List.of());
                break;
            }

            current = child.response();
            currentAgent = target;
            subResults.add(new SubResult(target, ctx.roleOf(target), current));
            ctx.completeRound(List.of(current));
        }

        if (subResults.isEmpty()) {
            return PatternOutcome.of(first.response(), ctx.producedArtifacts());
        }
        if (!ctx.mayFinalize()) {
            return PatternOutcome.of(ctx.lastResponse(), ctx.producedArtifacts());
        }

        AgentExecution aggregate = ctx.runWithDelegation(supervisor.agentId(), supervisor.role(),
                ctx.inputFor(aggregationPrompt(input.task(), first.response(), subResults)));
        if (!aggregate.isCompleted()) {
            if (!tolerate) {
                throw new AgentFailedException(aggregate);
            }
            return PatternOutcome.of(current, ctx.producedArtifacts());
        }
        return PatternOutcome.of(aggregate.response(), ctx.producedArtifacts());
    }

    private static CompiledRule compile(DelegationRule rule) {
        return new CompiledRule(DelegationCondition.parse(rule.condition()), rule.targetAgentId());
    }

    private static CompiledRule route(List<CompiledRule> rules, String output, String currentAgent, String supervisorId) {
        for (CompiledRule rule : rules) {
            String target = rule.targetAgentId();
            if (target.equals(currentAgent) || target.equals(supervisorId)) continue;
            if (rule.condition().matches(output)) {
                return rule;
            }
        }
        return null;
    }

    private static String aggregationPrompt(String task, String plan, List<SubResult> subResults) {
        StringBuilder sb = new StringBuilder();
        sb.append(task).append("\n\nYour initial response was:\n").append(plan).append("\n\n");
        sb.append("=== SUB-RESULTS ===\n");
        for (SubResult r : subResults) {
            sb.append("[ ").append(r.agentId()).append(" (").append(r.role()).append(") ]\n")
              .append(r.response()).append("\n\n");
        }
        sb.append("=== END SUB-RESULTS ===\n\n");
        sb.append("Combine the sub-results into the final answer to the task.");
        return sb.toString();
    }
}
