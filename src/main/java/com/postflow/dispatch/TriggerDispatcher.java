package com.postflow.dispatch;

import com.postflow.condition.ConditionEvaluator;
import com.postflow.core.Event;
import com.postflow.debounce.DebounceTicket;
import com.postflow.debounce.QuietPeriodDebouncer;
import com.postflow.exception.TaskRejectedException;
import com.postflow.guardrail.GuardrailDecision;
import com.postflow.guardrail.GuardrailEvaluator;
import com.postflow.job.Job;
import com.postflow.job.JobSpec;
import com.postflow.job.JobState;
import com.postflow.job.JobStore;
import com.postflow.job.JobTransitionListener;
import com.postflow.queue.SchedulingQueue;
import com.postflow.rule.ConditionSpec;
import com.postflow.rule.Rule;
import com.postflow.schedule.ActiveHoursEvaluator;
import com.postflow.store.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Matches events against enabled rules and turns the survivors into jobs.
 * <p>
 * Rules are handled one after another in dispatch order (priority, compile time, id),
 * so a higher-priority rule's job always exists before a lower one's. Guardrail
 * results come back on the probe pool and are posted to the engine executor before
 * any job is created. Events for one subject are dispatched strictly in arrival order:
 * an event waits until the previous event for the same subject has its report.
 * Must be driven from the engine thread.
 */
public class TriggerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TriggerDispatcher.class);

    private final RuleStore ruleStore;
    private final ConditionEvaluator conditionEvaluator;
    private final GuardrailEvaluator guardrailEvaluator;
    private final QuietPeriodDebouncer<Event> debouncer;
    private final JobStore jobStore;
    private final SchedulingQueue queue;
    private final FireScheduler fireScheduler;
    private final Executor engineExecutor;
    private final Clock clock;
    private final ZoneId zoneId;
    private final Supplier<String> jobIdGenerator;
    private final JobTransitionListener transitionListener;
    private final Map<String, CompletableFuture<DispatchReport>> subjectTails = new HashMap<>();

    public TriggerDispatcher(RuleStore ruleStore,
                             ConditionEvaluator conditionEvaluator,
                             GuardrailEvaluator guardrailEvaluator,
                             QuietPeriodDebouncer<Event> debouncer,
                             JobStore jobStore,
                             SchedulingQueue queue,
                             FireScheduler fireScheduler,
                             Executor engineExecutor,
                             Clock clock,
                             ZoneId zoneId,
                             Supplier<String> jobIdGenerator,
                             JobTransitionListener transitionListener) {
        this.ruleStore = ruleStore;
        this.conditionEvaluator = conditionEvaluator;
        this.guardrailEvaluator = guardrailEvaluator;
        this.debouncer = debouncer;
        this.jobStore = jobStore;
        this.queue = queue;
        this.fireScheduler = fireScheduler;
        this.engineExecutor = engineExecutor;
        this.clock = clock;
        this.zoneId = zoneId;
        this.jobIdGenerator = jobIdGenerator;
        this.transitionListener = transitionListener;
    }

    /**
     * Dispatch one event to every enabled rule with a matching trigger.
     */
    public CompletableFuture<DispatchReport> dispatch(Event event) {
        String subject = event.subjectId();
        CompletableFuture<DispatchReport> previous = subjectTails.get(subject);
        CompletableFuture<DispatchReport> report;
        if (previous == null || previous.isDone()) {
            report = dispatchNow(event);
        } else {
            log.debug("Event {} on {} waits for the previous event on that subject", event.trigger().wireName(),
                    subject);
            report = previous
                    .handleAsync((ignored, error) -> event, engineExecutor)
                    .thenCompose(this::dispatchNow);
        }
        if (!report.isDone()) {
            CompletableFuture<DispatchReport> tail = report;
            subjectTails.put(subject, tail);
            tail.whenCompleteAsync((ignored, error) -> subjectTails.remove(subject, tail), engineExecutor);
        }
        return report;
    }

    private CompletableFuture<DispatchReport> dispatchNow(Event event) {
        List<Rule> candidates = matchingRules(event);
        log.debug("Event {} on {}: {} candidate rule(s)", event.trigger().wireName(), event.subjectId(),
                candidates.size());

        CompletableFuture<List<RuleOutcome>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (Rule rule : candidates) {
            chain = chain.thenCompose(outcomes -> dispatchRule(rule, event).thenApply(outcome -> {
                outcomes.add(outcome);
                return outcomes;
            }));
        }
        return chain.thenApply(outcomes -> new DispatchReport(event.trigger(), event.subjectId(), outcomes));
    }

    /**
     * Dry run of one rule against an event at a given instant. Reads live state for
     * guardrails but creates no jobs and no debounce state.
     */
    public CompletableFuture<EvaluationTrace> testRule(Rule rule, Event event, Instant asOf) {
        Optional<ConditionSpec> failed = firstFailedCondition(rule, event);
        boolean activeHoursMatch = ActiveHoursEvaluator.matches(rule.activeHours(), asOf.atZone(zoneId));
        return guardrailEvaluator.evaluate(rule.guardrails(), queue.size(), queue.runningCount())
                .thenApply(decision -> {
                    boolean conditionsMatched = failed.isEmpty();
                    return new EvaluationTrace(
                            rule.id(),
                            conditionsMatched,
                            failed.orElse(null),
                            rule.hasQuietPeriod(),
                            rule.quietPeriodSec(),
                            activeHoursMatch,
                            decision.isBlocked(),
                            decision.getReason(),
                            conditionsMatched && activeHoursMatch && decision.isAllowed(),
                            rule.actions());
                });
    }

    private List<Rule> matchingRules(Event event) {
        List<Rule> rules = new ArrayList<>();
        for (Rule rule : ruleStore.listEnabledRules()) {
            if (rule.enabled() && rule.trigger() == event.trigger()) {
                rules.add(rule);
            }
        }
        rules.sort(Rule.DISPATCH_ORDER);
        return rules;
    }

    private CompletableFuture<RuleOutcome> dispatchRule(Rule rule, Event event) {
        Optional<ConditionSpec> failed = firstFailedCondition(rule, event);
        if (failed.isPresent()) {
            log.debug("Rule {} skipped for {}: condition {} failed", rule.id(), event.subjectId(), failed.get());
            return CompletableFuture.completedFuture(
                    RuleOutcome.skipped(rule.id(), DispatchOutcome.SKIPPED_CONDITIONS, failed.get().toString()));
        }

        Instant now = clock.instant();
        if (!ActiveHoursEvaluator.matches(rule.activeHours(), now.atZone(zoneId))) {
            log.debug("Rule {} skipped for {}: outside active hours", rule.id(), event.subjectId());
            return CompletableFuture.completedFuture(
                    RuleOutcome.skipped(rule.id(), DispatchOutcome.SKIPPED_ACTIVE_HOURS, null));
        }

        if (rule.hasQuietPeriod()) {
            Duration quietPeriod = Duration.ofSeconds(rule.quietPeriodSec());
            DebounceTicket ticket = debouncer.register(rule.id(), event.subjectId(), quietPeriod, event, now);
            fireScheduler.schedule(() -> onQuietPeriodElapsed(ticket), quietPeriod);
            return CompletableFuture.completedFuture(
                    RuleOutcome.skipped(rule.id(), DispatchOutcome.DEBOUNCED, ticket.deadline().toString()));
        }

        return admit(rule, event);
    }

    private void onQuietPeriodElapsed(DebounceTicket ticket) {
        Optional<Event> latest = debouncer.fire(ticket);
        if (latest.isEmpty()) {
            return;
        }
        Optional<Rule> current = ruleStore.getRule(ticket.key().ruleId()).filter(Rule::enabled);
        if (current.isEmpty()) {
            log.info("Rule {} deleted or disabled during quiet period, dropping fire for {}",
                    ticket.key().ruleId(), ticket.key().subjectId());
            return;
        }
        admit(current.get(), latest.get()).whenComplete((outcome, error) -> {
            if (error != null) {
                log.error("Quiet-period fire of rule {} for {} failed: {}", ticket.key().ruleId(),
                        ticket.key().subjectId(), error.getMessage(), error);
            } else {
                log.debug("Quiet-period fire of rule {} for {}: {}", ticket.key().ruleId(),
                        ticket.key().subjectId(), outcome.outcome());
            }
        });
    }

    /**
     * Run guardrails and create the job, queued or deferred.
     */
    private CompletableFuture<RuleOutcome> admit(Rule rule, Event event) {
        return guardrailEvaluator.evaluate(rule.guardrails(), queue.size(), queue.runningCount())
                .thenApplyAsync(decision -> createJob(rule, event, decision), engineExecutor);
    }

    private RuleOutcome createJob(Rule rule, Event event, GuardrailDecision decision) {
        Instant now = clock.instant();
        JobSpec spec = JobSpec.of(jobIdGenerator.get(), rule, event.subjectId(), event.payload());

        if (decision.isBlocked()) {
            Job job = Job.deferred(spec, now, decision.getReason(), now.plus(decision.getRetryDelay()));
            jobStore.add(job);
            transitionListener.onTransition(job.snapshot(), null);
            log.info("Job {} for rule {} deferred: {} (recheck at {})", job.getId(), rule.id(),
                    decision.getReason(), job.getNextRunAt());
            return new RuleOutcome(rule.id(), DispatchOutcome.DEFERRED, job.getId(), decision.getReason());
        }

        Job job = Job.queued(spec, now);
        jobStore.add(job);
        transitionListener.onTransition(job.snapshot(), null);
        try {
            queue.submit(job);
        } catch (TaskRejectedException e) {
            log.warn("Job {} for rule {} rejected: {}", job.getId(), rule.id(), e.getMessage());
            job.fail("queue_full", clock.instant());
            transitionListener.onTransition(job.snapshot(), JobState.QUEUED);
            return new RuleOutcome(rule.id(), DispatchOutcome.REJECTED, job.getId(), "queue_full");
        }
        log.info("Job {} for rule {} queued on {}", job.getId(), rule.id(), event.subjectId());
        return new RuleOutcome(rule.id(), DispatchOutcome.QUEUED, job.getId(), null);
    }

    private Optional<ConditionSpec> firstFailedCondition(Rule rule, Event event) {
        for (ConditionSpec condition : rule.conditions()) {
            if (!conditionEvaluator.evaluate(condition, event)) {
                return Optional.of(condition);
            }
        }
        return Optional.empty();
    }

    /**
     * Drop pending quiet-period fires of a rule.
     */
    public int cancelPendingFires(String ruleId) {
        return debouncer.cancelRule(ruleId);
    }

    public int pendingFires() {
        return debouncer.pendingCount();
    }
}
