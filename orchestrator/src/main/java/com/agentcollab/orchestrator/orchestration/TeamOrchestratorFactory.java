package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.agent.AgentExecutor;
import com.agentcollab.orchestrator.collaboration.CollaborationLog;
import com.agentcollab.orchestrator.collaboration.OrchestratorClock;
import com.agentcollab.orchestrator.consensus.AnswerEquivalence;
import com.agentcollab.orchestrator.consensus.ConsensusResolver;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.DelegationRule;
import com.agentcollab.orchestrator.model.TeamExecution;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.model.TeamMember;
import com.agentcollab.orchestrator.persistence.ExecutionStore;
import com.agentcollab.orchestrator.support.CancellationToken;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Builds one {@link TeamOrchestrator} per team execution, wiring in the
 * shared collaborators. Holds no per-run state itself.
 */
@Component
public class TeamOrchestratorFactory {

    private final AgentExecutor     executor;
    private final ExecutionStore    store;
    private final ConsensusResolver resolver;
    private final AnswerEquivalence equivalence;
    private final Random            random;
    private final Clock             clock;
    private final MeterRegistry     meterRegistry;

    public TeamOrchestratorFactory(AgentExecutor executor,
                                   ExecutionStore store,
                                   ConsensusResolver resolver,
                                   AnswerEquivalence equivalence,
                                   Random random,
                                   Clock clock,
                                   MeterRegistry meterRegistry) {
        this.executor      = executor;
        this.store         = store;
        this.resolver      = resolver;
        this.equivalence   = equivalence;
        this.random        = random;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Validate the team, resolve its members and register a new execution
     * with the store.
     *
     * @throws InvalidTeamConfigurationException if the team cannot run at all
     */
    public TeamOrchestrator create(AgentTeam team, TeamInput input) {
        Map<String, Agent> agents = validate(team);

        String id = UUID.randomUUID().toString();
        OrchestratorClock runClock = new OrchestratorClock(clock);
        CollaborationLog log = new CollaborationLog(runClock, entry -> store.appendLogEntry(id, entry));
        TeamExecution execution = new TeamExecution(id, team, input, log);
        store.saveExecution(execution);

        CancellationToken token = new CancellationToken();
        OrchestrationContext ctx = new OrchestrationContext(
                team, execution, agents, executor, store, runClock, token, resolver, equivalence, random);
        return new TeamOrchestrator(team, execution, ctx, token, runClock, store, meterRegistry);
    }

    private Map<String, Agent> validate(AgentTeam team) {
        if (!team.enabled()) {
            throw new InvalidTeamConfigurationException("Team " + team.id() + " is disabled");
        }
        if (team.members().isEmpty()) {
            throw new InvalidTeamConfigurationException("Team " + team.id() + " has no members");
        }
        Map<String, Agent> agents = new LinkedHashMap<>();
        for (TeamMember member : team.members()) {
            Agent agent = store.getAgent(member.agentId()).orElseThrow(() -> new InvalidTeamConfigurationException(
                    "Team " + team.id() + " references unknown agent " + member.agentId()));
            agents.put(agent.id(), agent);
        }
        String supervisorId = team.patternConfig().supervisorAgentId();
        if (supervisorId != null && !agents.containsKey(supervisorId)) {
            store.getAgent(supervisorId).ifPresentOrElse(a -> agents.put(a.id(), a), () -> {
                throw new InvalidTeamConfigurationException(
                        "Team " + team.id() + " names unknown supervisor " + supervisorId);
            });
        }
        for (DelegationRule rule : team.patternConfig().delegationRules()) {
            DelegationCondition.parse(rule.condition());
            String target = rule.targetAgentId();
            if (target == null || (!agents.containsKey(target) && store.getAgent(target).isEmpty())) {
                throw new InvalidTeamConfigurationException(
                        "Delegation rule '" + rule.condition() + "' targets unknown agent " + target);
            }
        }
        return agents;
    }
}
