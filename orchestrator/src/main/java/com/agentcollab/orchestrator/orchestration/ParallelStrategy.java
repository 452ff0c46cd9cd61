package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentInput;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.Artifact;
import com.agentcollab.orchestrator.model.SharedContextSnapshot;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.model.TeamMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Members run concurrently on a pool of at most {@code maxConcurrent}
 * threads created for this run. Each finished child is absorbed on the
 * coordinating thread as it completes; duration, token and stop-phrase
 * limits are checked before every launch.
 *
 * The response joins every answer in member order as {@code role: response}.
 * The run fails only if every launched member failed.
 */
final class ParallelStrategy implements CollaborationStrategy {

    private static final Logger log = LoggerFactory.getLogger(ParallelStrategy.class);

    @Override
    public PatternOutcome run(AgentTeam team, TeamInput input, OrchestrationContext ctx) {
        List<TeamMember> members = team.members();
        int workers = team.patternConfig().effectiveMaxConcurrent(members.size());

        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory(team.id()));
        CompletionService<AgentExecution> completion = new ExecutorCompletionService<>(pool);
        Map<Future<AgentExecution>, Integer> launched = new HashMap<>();
        AgentExecution[] results = new AgentExecution[members.size()];
        List<String> outputs = new ArrayList<>();

        try {
            int next = 0;
            boolean launching = true;
            while (true) {
                while (launching && launched.size() < workers && next < members.size()) {
                    if (ctx.token().isCancelled() || ctx.checkLimits(outputs).shouldStop()) {
                        launching = false;
                        break;
                    }
                    TeamMember member = members.get(next);
                    Agent agent = ctx.agent(member.agentId());
                    AgentInput agentInput = ctx.inputFor(input.task());
                    SharedContextSnapshot snapshot = ctx.snapshot();
                    Map<String, String> mdc = MDC.getCopyOfContextMap();

                    Future<AgentExecution> f = completion.submit(() -> {
                        if (mdc != null) MDC.setContextMap(mdc);
                        try {
                            return ctx.launch(agent, agentInput, snapshot);
                        } finally {
                            MDC.clear();
                        }
                    });
                    launched.put(f, next);
                    next++;
                }
                if (launched.isEmpty()) break;

                Future<AgentExecution> done = completion.take();
                int index = launched.remove(done);
                AgentExecution child = done.get();
                results[index] = child;
                ctx.absorb(child, members.get(index).role());
                if (OrchestrationContext.answered(child)) {
                    outputs.add(child.response());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.token().cancel("Coordinator interrupted");
            throw new ExecutionCancelledException("Coordinator interrupted");
        } catch (ExecutionException e) {
            ctx.token().cancel("Agent task crashed");
            throw new OrchestrationException("INTERNAL_ERROR", "Agent task crashed: " + e.getCause(), null, e.getCause());
        } finally {
            pool.shutdownNow();
        }

        ctx.token().throwIfCancelled();
        if (!ctx.terminated()) {
            ctx.completeRound(outputs);
        }
        return outcome(members, results);
    }

    private static PatternOutcome outcome(List<TeamMember> members, AgentExecution[] results) {
        List<Artifact> artifacts = new ArrayList<>();
        List<String> parts = new ArrayList<>();
        AgentExecution lastFailure = null;
        int ran = 0;
        int completed = 0;
        for (int i = 0; i < members.size(); i++) {
            AgentExecution child = results[i];
            if (child == null) continue;
            ran++;
            if (!child.isCompleted()) {
                lastFailure = child;
                continue;
            }
            completed++;
            if (OrchestrationContext.answered(child)) {
                TeamMember member = members.get(i);
                artifacts.add(new Artifact("response", child.response(), member.agentId()));
                parts.add(member.role() + ": " + child.response());
            }
        }
        if (ran > 0 && completed == 0) {
            log.warn("All {} parallel members failed", ran);
            String last = lastFailure.getError() == null ? lastFailure.getStatus().name() : lastFailure.getError().code();
            throw new AgentFailedException(lastFailure.getAgentId(), "ALL_AGENTS_FAILED",
                    "All " + ran + " agents failed; last error " + last);
        }
        String response = parts.isEmpty() ? null : String.join("\n\n", parts);
        return PatternOutcome.of(response, artifacts);
    }

    private static ThreadFactory threadFactory(String teamId) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "team-" + teamId + "-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
