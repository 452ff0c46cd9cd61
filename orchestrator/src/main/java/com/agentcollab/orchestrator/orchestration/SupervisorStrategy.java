package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.collaboration.CollaborationEventType;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.model.TeamMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Each round the supervisor emits one JSON directive: delegate work to a
 * member, refine with notes, or complete with the final result. The round
 * limit is {@code termination.maxIterations}; if the supervisor never
 * completes, a last force-complete turn produces the answer.
 *
 * Output that is not a valid directive is logged as an intervention and
 * costs the round.
 */
final class SupervisorStrategy implements CollaborationStrategy {

    private static final Logger log = LoggerFactory.getLogger(SupervisorStrategy.class);

    @Override
    public PatternOutcome run(AgentTeam team, TeamInput input, OrchestrationContext ctx) {
        TeamMember supervisor = ctx.supervisor();
        String supervisorId = supervisor.agentId();
        List<TeamMember> workers = team.members().stream()
                .filter(m -> !m.agentId().equals(supervisorId))
                .toList();
        boolean tolerate = team.patternConfig().tolerateFailures();
        List<String> progress = new ArrayList<>();

        while (!ctx.terminated()) {
            List<String> outputs = new ArrayList<>();
            AgentExecution turn = ctx.runWithDelegation(supervisorId, supervisor.role(),
                    ctx.inputFor(directivePrompt(input.task(), workers, progress)));
            if (!turn.isCompleted()) {
                if (!tolerate) throw new AgentFailedException(turn);
                ctx.completeRound(outputs);
                continue;
            }
            outputs.add(turn.response());

            Optional<SupervisorDirective> parsed = SupervisorDirective.parse(turn.response());
            if (parsed.isEmpty()) {
                ctx.record(CollaborationEventType.INTERVENTION, null, supervisorId,
                        "Unparseable directive: " + abbreviate(turn.response()));
                progress.add("Your last reply was not a valid directive. Reply with JSON only.");
                ctx.completeRound(outputs);
                continue;
            }

            SupervisorDirective directive = parsed.get();
            switch (directive.kind()) {
                case COMPLETE -> {
                    log.info("Supervisor {} completed after {} rounds", supervisorId, ctx.round() + 1);
                    ctx.completeRound(outputs);
                    return PatternOutcome.of(directive.result(), ctx.producedArtifacts());
                }
                case REFINE -> {
                    String notes = directive.notes() == null ? "" : directive.notes();
                    ctx.record(CollaborationEventType.MESSAGE, supervisorId, null, notes);
                    progress.add("Supervisor notes: " + notes);
                }
                case DELEGATE -> {
                    String target = directive.target().strip();
                    if (workers.stream().noneMatch(w -> w.agentId().equals(target))) {
                        ctx.record(CollaborationEventType.INTERVENTION, null, supervisorId,
                                "Directive targets unknown member '" + target + "'");
                        progress.add("'" + target + "' is not a team member.");
                        break;
                    }
                    ctx.guard().authorize(ctx.agent(supervisorId), target);
                    String instructions = directive.instructions() == null ? input.task() : directive.instructions();
                    ctx.record(CollaborationEventType.DELEGATION, supervisorId, target, instructions);

                    AgentExecution child = ctx.runWithDelegation(target, ctx.roleOf(target), ctx.inputFor(instructions));
                    if (child.isCompleted()) {
                        outputs.add(child.response());
                        progress.add("[ " + target + " ] " + child.response());
                    } else if (tolerate) {
                        progress.add("[ " + target + " ] failed: "
                                + (child.getError() == null ? child.getStatus() : child.getError().message()));
                    } else {
                        throw new AgentFailedException(child);
                    }
                }
            }
            ctx.completeRound(outputs);
        }

        if (!ctx.mayFinalize()) {
            return PatternOutcome.of(ctx.lastResponse(), ctx.producedArtifacts());
        }
        ctx.record(CollaborationEventType.INTERVENTION, null, supervisorId,
                "Round limit reached; asking for a final answer");
        AgentExecution last = ctx.runWithDelegation(supervisorId, supervisor.role(),
                ctx.inputFor(forceCompletePrompt(input.task(), progress)));
        if (!last.isCompleted()) {
            throw new AgentFailedException(last);
        }
        String response = SupervisorDirective.parse(last.response())
                .filter(d -> d.kind() == SupervisorDirective.Action.COMPLETE)
                .map(SupervisorDirective::result)
                .orElse(last.response());
        return PatternOutcome.of(response, ctx.producedArtifacts());
    }

    private static String directivePrompt(String task, List<TeamMember> workers, List<String> progress) {
        StringBuilder sb = new StringBuilder(task).append("\n\nTEAM MEMBERS:\n");
        workers.forEach(w -> sb.append("  ").append(w.agentId()).append(" (").append(w.role()).append(")\n"));
        if (!progress.isEmpty()) {
            sb.append("\nPROGRESS SO FAR:\n");
            progress.forEach(p -> sb.append(p).append('\n'));
        }
        sb.append("""

                Reply with exactly one JSON directive:
                  {"action":"delegate","target":"<member id>","instructions":"<what to do>"}
                  {"action":"refine","notes":"<what to improve>"}
                  {"action":"complete","result":"<final answer>"}
                """);
        return sb.toString();
    }

    private static String forceCompletePrompt(String task, List<String> progress) {
        StringBuilder sb = new StringBuilder(task).append("\n\nNo more delegation rounds are available.\n");
        if (!progress.isEmpty()) {
            sb.append("\nPROGRESS SO FAR:\n");
            progress.forEach(p -> sb.append(p).append('\n'));
        }
        sb.append("\nWrite the final answer now.");
        return sb.toString();
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
