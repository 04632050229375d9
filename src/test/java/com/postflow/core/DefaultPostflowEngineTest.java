package com.postflow.core;

import com.postflow.config.EngineSettings;
import com.postflow.compiler.RuleCompiler;
import com.postflow.dispatch.DispatchOutcome;
import com.postflow.dispatch.DispatchReport;
import com.postflow.dispatch.EvaluationTrace;
import com.postflow.exception.JobNotFoundException;
import com.postflow.exception.JobStateException;
import com.postflow.exception.TaskRejectedException;
import com.postflow.job.BulkResult;
import com.postflow.job.JobFilter;
import com.postflow.job.JobSnapshot;
import com.postflow.job.JobSort;
import com.postflow.job.JobState;
import com.postflow.job.Page;
import com.postflow.job.PageRequest;
import com.postflow.notify.EngineNotification;
import com.postflow.notify.NotificationType;
import com.postflow.recheck.RecheckSummary;
import com.postflow.rule.Rule;
import com.postflow.rule.TriggerType;
import com.postflow.store.InMemoryRuleStore;
import com.postflow.support.Await;
import com.postflow.support.ControllableJobExecutor;
import com.postflow.support.MutableClock;
import com.postflow.support.StubLiveStateProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultPostflowEngine.
 * The recheck timer is not started; tests drive rechecks with recheckNow() and a manual clock.
 */
class DefaultPostflowEngineTest {

    // Friday noon
    private static final Instant T0 = Instant.parse("2024-05-03T12:00:00Z");

    private MutableClock clock;
    private InMemoryRuleStore ruleStore;
    private StubLiveStateProvider liveState;
    private ControllableJobExecutor executor;
    private RuleCompiler compiler;
    private DefaultPostflowEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0, ZoneOffset.UTC);
        ruleStore = new InMemoryRuleStore();
        liveState = StubLiveStateProvider.idle();
        executor = new ControllableJobExecutor();
        compiler = new RuleCompiler(clock);
        engine = createEngine(EngineSettings.defaults().withMaxConcurrency(1).withProbeTimeoutMillis(500));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (engine != null && !engine.isShutdown()) {
            engine.shutdown();
            engine.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private DefaultPostflowEngine createEngine(EngineSettings settings) {
        AtomicInteger ids = new AtomicInteger(0);
        return new DefaultPostflowEngine(settings, ruleStore, liveState, executor, clock,
                () -> "job-" + ids.incrementAndGet());
    }

    // =====================================================================
    // Dispatch
    // =====================================================================

    @Test
    @DisplayName("Higher-priority rule's job runs first when slots are scarce")
    void priorityWins() throws Exception {
        addRule("proxy-low", 20, Map.of());
        addRule("remux-high", 80, Map.of());

        DispatchReport report = submit("asset-1");

        assertEquals(List.of("remux-high", "proxy-low"),
                report.outcomes().stream().map(o -> o.ruleId()).toList());
        assertEquals(List.of("job-1", "job-2"), report.jobIds());
        assertTrue(executor.awaitStarted(1, 5, TimeUnit.SECONDS));
        assertEquals(List.of("job-1"), executor.started());
        assertEquals(JobState.QUEUED, job("job-2").state());

        executor.complete("job-1");

        assertTrue(executor.awaitStarted(2, 5, TimeUnit.SECONDS));
        assertEquals(List.of("job-1", "job-2"), executor.started());
    }

    @Test
    @DisplayName("Failing condition skips the rule")
    void conditionSkip() throws Exception {
        Map<String, Object> document = ruleDocument("remux-mkv", 50);
        document.put("conditions", List.of(Map.of("type", "extension_in",
                "params", Map.of("extensions", List.of("mkv")))));
        ruleStore.save(compiler.compileOrThrow(document));

        DispatchReport report = engine.submitEvent(new Event(TriggerType.FILE_CLOSED, "asset-1", T0,
                Map.of("path", "/media/clip.mov"))).get(5, TimeUnit.SECONDS);

        assertEquals(DispatchOutcome.SKIPPED_CONDITIONS, report.outcomeFor("remux-mkv").orElseThrow().outcome());
        assertTrue(jobs().isEmpty());
    }

    @Test
    @DisplayName("Rules for other triggers are not considered")
    void otherTrigger() throws Exception {
        addRule("remux", 50, Map.of());

        DispatchReport report = engine.submitEvent(Event.of(TriggerType.RECORDING_STARTED, "obs", T0))
                .get(5, TimeUnit.SECONDS);

        assertTrue(report.matchedNothing());
    }

    @Test
    @DisplayName("Active hours are checked against the engine clock")
    void activeHours() throws Exception {
        Map<String, Object> document = ruleDocument("nightly", 50);
        document.put("active_hours", Map.of("enabled", true, "start", "22:00", "end", "06:00",
                "days", List.of(1, 2, 3, 4, 5, 6, 7)));
        ruleStore.save(compiler.compileOrThrow(document));

        DispatchReport noon = submit("asset-1");
        clock.set(Instant.parse("2024-05-03T23:00:00Z"));
        DispatchReport night = submit("asset-1");

        assertEquals(DispatchOutcome.SKIPPED_ACTIVE_HOURS, noon.outcomeFor("nightly").orElseThrow().outcome());
        assertEquals(DispatchOutcome.QUEUED, night.outcomeFor("nightly").orElseThrow().outcome());
    }

    @Test
    @DisplayName("Events inside the quiet period collapse into one job with the latest event")
    void quietPeriod() throws Exception {
        Map<String, Object> document = ruleDocument("settle", 50);
        document.put("quiet_period_sec", 1);
        ruleStore.save(compiler.compileOrThrow(document));

        DispatchReport first = engine.submitEvent(new Event(TriggerType.FILE_CLOSED, "asset-1", T0,
                Map.of("size_bytes", 100))).get(5, TimeUnit.SECONDS);
        DispatchReport second = engine.submitEvent(new Event(TriggerType.FILE_CLOSED, "asset-1", T0,
                Map.of("size_bytes", 200))).get(5, TimeUnit.SECONDS);

        assertEquals(DispatchOutcome.DEBOUNCED, first.outcomeFor("settle").orElseThrow().outcome());
        assertEquals(DispatchOutcome.DEBOUNCED, second.outcomeFor("settle").orElseThrow().outcome());
        assertEquals(1, engine.getStats().pendingFires());
        assertTrue(jobs().isEmpty());

        Await.until(() -> jobs().size() == 1, 5000, "debounced job to be created");
        Thread.sleep(300);

        List<JobSnapshot> jobs = jobs();
        assertEquals(1, jobs.size());
        assertEquals(200, jobs.get(0).eventPayload().get("size_bytes"));
        assertEquals(0, engine.getStats().pendingFires());
    }

    @Test
    @DisplayName("A slow guardrail check does not let a later event for the same subject overtake")
    void sameSubjectEventsKeepOrder() throws Exception {
        addRule("gate", 80, Map.of("type", "pause_if_recording"));
        Map<String, Object> settle = ruleDocument("settle", 20);
        settle.put("quiet_period_sec", 1);
        ruleStore.save(compiler.compileOrThrow(settle));
        liveState.delayNext(300);

        CompletableFuture<DispatchReport> first = engine.submitEvent(new Event(TriggerType.FILE_CLOSED, "asset-1", T0,
                Map.of("size_bytes", 100)));
        CompletableFuture<DispatchReport> second = engine.submitEvent(new Event(TriggerType.FILE_CLOSED, "asset-1",
                T0, Map.of("size_bytes", 200)));

        assertEquals(List.of("job-1"), first.get(5, TimeUnit.SECONDS).jobIds());
        assertEquals(List.of("job-2"), second.get(5, TimeUnit.SECONDS).jobIds());
        assertEquals(100, job("job-1").eventPayload().get("size_bytes"));
        assertEquals(200, job("job-2").eventPayload().get("size_bytes"));

        Await.until(() -> jobs().size() == 3, 5000, "debounced job to be created");
        JobSnapshot settled = job("job-3");
        assertEquals("settle", settled.ruleId());
        assertEquals(200, settled.eventPayload().get("size_bytes"));
    }

    @Test
    @DisplayName("Events for different subjects are not held back by each other")
    void otherSubjectsNotBlocked() throws Exception {
        addRule("gate", 80, Map.of("type", "pause_if_recording"));
        liveState.delayNext(300);

        CompletableFuture<DispatchReport> slow = engine.submitEvent(event("asset-1"));
        DispatchReport fast = engine.submitEvent(event("asset-2")).get(5, TimeUnit.SECONDS);

        assertFalse(slow.isDone());
        assertEquals(DispatchOutcome.QUEUED, fast.outcomeFor("gate").orElseThrow().outcome());
        assertEquals(DispatchOutcome.QUEUED, slow.get(5, TimeUnit.SECONDS).outcomeFor("gate").orElseThrow().outcome());
    }

    @Test
    @DisplayName("Deleting a rule drops its pending quiet-period fire")
    void ruleDeletedDuringQuietPeriod() throws Exception {
        Map<String, Object> document = ruleDocument("settle", 50);
        document.put("quiet_period_sec", 1);
        ruleStore.save(compiler.compileOrThrow(document));

        submit("asset-1");
        ruleStore.delete("settle");

        Await.until(() -> engine.getStats().pendingFires() == 0, 5000, "pending fire to be dropped");
        Thread.sleep(1300);
        assertTrue(jobs().isEmpty());
    }

    @Test
    @DisplayName("Disabling a rule drops its pending quiet-period fire")
    void ruleDisabledDuringQuietPeriod() throws Exception {
        Map<String, Object> document = ruleDocument("settle", 50);
        document.put("quiet_period_sec", 1);
        ruleStore.save(compiler.compileOrThrow(document));

        submit("asset-1");
        document.put("enabled", false);
        ruleStore.save(compiler.compileOrThrow(document));

        Thread.sleep(1300);
        assertTrue(jobs().isEmpty());
    }

    @Test
    @DisplayName("Full queue rejects the job and records it as failed")
    void queueFull() throws Exception {
        engine.shutdown();
        engine = createEngine(EngineSettings.defaults().withMaxConcurrency(1).withQueueCapacity(1)
                .withProbeTimeoutMillis(500));
        addRule("a", 90, Map.of());
        addRule("b", 80, Map.of());
        addRule("c", 70, Map.of());

        DispatchReport report = submit("asset-1");

        assertEquals(DispatchOutcome.REJECTED, report.outcomeFor("c").orElseThrow().outcome());
        JobSnapshot rejected = job(report.outcomeFor("c").orElseThrow().jobId());
        assertEquals(JobState.FAILED, rejected.state());
        assertEquals("queue_full", rejected.error());
    }

    @Test
    @DisplayName("Events are refused after shutdown")
    void submitAfterShutdown() {
        engine.shutdown();

        assertThrows(TaskRejectedException.class, () -> engine.submitEvent(Event.of(TriggerType.MANUAL, "a", T0)));
    }

    // =====================================================================
    // Guardrails and rechecks
    // =====================================================================

    @Test
    @DisplayName("Recording defers the job until a recheck finds it clear")
    void deferredUntilClear() throws Exception {
        addRule("remux", 50, Map.of("type", "pause_if_recording"));
        liveState.setRecording(true);

        DispatchReport report = submit("asset-1");

        assertEquals(DispatchOutcome.DEFERRED, report.outcomeFor("remux").orElseThrow().outcome());
        JobSnapshot deferred = job("job-1");
        assertEquals(JobState.DEFERRED, deferred.state());
        assertEquals("recording", deferred.blockedReason());
        assertEquals(T0.plusSeconds(60), deferred.nextRunAt());

        // Not due yet
        assertEquals(RecheckSummary.empty(), engine.recheckNow().get(5, TimeUnit.SECONDS));

        clock.advance(Duration.ofSeconds(60));
        RecheckSummary stillBlocked = engine.recheckNow().get(5, TimeUnit.SECONDS);
        assertEquals(1, stillBlocked.redeferred());
        assertEquals(1, job("job-1").attempts());
        assertEquals(T0.plusSeconds(120), job("job-1").nextRunAt());

        liveState.setRecording(false);
        clock.advance(Duration.ofSeconds(60));
        RecheckSummary cleared = engine.recheckNow().get(5, TimeUnit.SECONDS);

        assertEquals(1, cleared.promoted());
        assertTrue(executor.awaitStarted(1, 5, TimeUnit.SECONDS));
        assertEquals(JobState.RUNNING, job("job-1").state());
        assertNull(job("job-1").blockedReason());
    }

    @Test
    @DisplayName("A job that stays blocked is rechecked less and less often, up to the ceiling")
    void recheckBacksOff() throws Exception {
        addRule("remux", 50, Map.of("type", "pause_if_recording"));
        liveState.setRecording(true);
        submit("asset-1");

        List<Long> gaps = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Instant due = job("job-1").nextRunAt();
            clock.set(due);
            assertEquals(1, engine.recheckNow().get(5, TimeUnit.SECONDS).redeferred());
            gaps.add(Duration.between(due, job("job-1").nextRunAt()).toSeconds());
        }

        assertEquals(List.of(60L, 120L, 240L, 300L, 300L), gaps);
        assertEquals(5, job("job-1").attempts());
        assertEquals(JobState.DEFERRED, job("job-1").state());
    }

    @Test
    @DisplayName("Unavailable live state defers instead of running")
    void probeFailureDefers() throws Exception {
        addRule("remux", 50, Map.of("type", "pause_if_streaming"));
        liveState.failWith(new IllegalStateException("OBS unreachable"));

        DispatchReport report = submit("asset-1");

        assertEquals(DispatchOutcome.DEFERRED, report.outcomeFor("remux").orElseThrow().outcome());
        assertEquals("probe_unavailable", job("job-1").blockedReason());
        assertFalse(executor.wasStarted("job-1"));
    }

    @Test
    @DisplayName("Rechecks use the rule's current guardrails")
    void recheckUsesCurrentRule() throws Exception {
        addRule("remux", 50, Map.of("type", "pause_if_recording"));
        liveState.setRecording(true);
        submit("asset-1");

        addRule("remux", 50, Map.of("type", "pause_if_cpu_pct_above", "params", Map.of("threshold", 90)));
        clock.advance(Duration.ofSeconds(60));

        assertEquals(1, engine.recheckNow().get(5, TimeUnit.SECONDS).promoted());
    }

    @Test
    @DisplayName("Force run skips guardrails for a deferred job only")
    void forceRun() throws Exception {
        addRule("remux", 50, Map.of("type", "pause_if_recording"));
        liveState.setRecording(true);
        submit("asset-1");

        JobSnapshot forced = engine.forceRunJob("job-1");

        assertNotEquals(JobState.DEFERRED, forced.state());
        assertTrue(executor.awaitStarted(1, 5, TimeUnit.SECONDS));

        executor.complete("job-1");
        Await.until(() -> job("job-1").state() == JobState.COMPLETED, 5000, "job-1 to complete");
        assertThrows(JobStateException.class, () -> engine.forceRunJob("job-1"));
    }

    // =====================================================================
    // Job operations
    // =====================================================================

    @Test
    @DisplayName("Cancelled queued job never runs")
    void cancelQueued() throws Exception {
        addRule("a", 80, Map.of());
        addRule("b", 20, Map.of());
        submit("asset-1");

        JobSnapshot cancelled = engine.cancelJob("job-2");
        executor.complete("job-1");

        assertEquals(JobState.CANCELED, cancelled.state());
        Await.until(() -> job("job-1").state() == JobState.COMPLETED, 5000, "job-1 to complete");
        assertFalse(executor.wasStarted("job-2"));
    }

    @Test
    @DisplayName("Failed job can be retried; other states cannot")
    void retry() throws Exception {
        addRule("remux", 50, Map.of());
        submit("asset-1");
        assertTrue(executor.awaitStarted(1, 5, TimeUnit.SECONDS));

        assertThrows(JobStateException.class, () -> engine.retryJob("job-1"));

        executor.fail("job-1", "ffmpeg exited with 1");
        Await.until(() -> job("job-1").state() == JobState.FAILED, 5000, "job-1 to fail");
        assertEquals("ffmpeg exited with 1", job("job-1").error());

        engine.retryJob("job-1");

        assertTrue(executor.awaitStarted(2, 5, TimeUnit.SECONDS));
        assertNull(job("job-1").error());
    }

    @Test
    @DisplayName("Only finished jobs can be deleted")
    void delete() throws Exception {
        addRule("remux", 50, Map.of());
        submit("asset-1");
        assertTrue(executor.awaitStarted(1, 5, TimeUnit.SECONDS));

        assertThrows(JobStateException.class, () -> engine.deleteJob("job-1"));

        executor.complete("job-1");
        Await.until(() -> job("job-1").state() == JobState.COMPLETED, 5000, "job-1 to complete");
        engine.deleteJob("job-1");

        assertTrue(engine.getJob("job-1").isEmpty());
    }

    @Test
    @DisplayName("Unknown job ids are reported")
    void unknownJob() {
        assertTrue(engine.getJob("nope").isEmpty());
        JobNotFoundException ex = assertThrows(JobNotFoundException.class, () -> engine.cancelJob("nope"));
        assertEquals("Job not found: nope", ex.getMessage());
    }

    @Test
    @DisplayName("Bulk operations are best effort per id")
    void bulkCancel() throws Exception {
        addRule("a", 80, Map.of());
        addRule("b", 20, Map.of());
        submit("asset-1");

        BulkResult result = engine.cancelJobs(List.of("job-2", "nope", "job-1"));

        assertEquals("cancel", result.operation());
        assertEquals(2, result.succeeded());
        assertEquals(1, result.failed());
        assertFalse(result.items().get(1).ok());
        assertEquals("Job not found: nope", result.items().get(1).error());
        assertEquals(JobState.CANCELED, job("job-1").state());
        assertEquals(JobState.CANCELED, job("job-2").state());
    }

    @Test
    @DisplayName("Jobs can be filtered, sorted and paged")
    void listJobs() throws Exception {
        addRule("a", 80, Map.of());
        addRule("b", 20, Map.of());
        submit("asset-1");
        submit("asset-2");

        Page<JobSnapshot> queued = engine.listJobs(JobFilter.byState(JobState.QUEUED), JobSort.PRIORITY_DESC,
                PageRequest.first(2));
        Page<JobSnapshot> ofRuleB = engine.listJobs(JobFilter.byRule("b"), JobSort.CREATED_ASC,
                PageRequest.first(10));

        assertEquals(3, queued.totalElements());
        assertEquals(2, queued.items().size());
        assertTrue(queued.hasNext());
        assertEquals(80, queued.items().get(0).priority());
        assertEquals(List.of("job-2", "job-4"), ofRuleB.items().stream().map(JobSnapshot::id).toList());
    }

    @Test
    @DisplayName("Missing filter, sort and page fall back to defaults")
    void listJobsDefaults() throws Exception {
        addRule("a", 80, Map.of());
        submit("asset-1");
        clock.advance(Duration.ofSeconds(1));
        submit("asset-2");

        Page<JobSnapshot> page = engine.listJobs(null, null, null);

        assertEquals(0, page.page());
        assertEquals(PageRequest.DEFAULT_SIZE, page.size());
        assertEquals(2, page.totalElements());
        assertEquals(List.of("job-2", "job-1"), page.items().stream().map(JobSnapshot::id).toList());
    }

    // =====================================================================
    // Queue controls
    // =====================================================================

    @Test
    @DisplayName("clearQueued cancels waiting jobs and leaves the running one")
    void clearQueued() throws Exception {
        addRule("a", 90, Map.of());
        addRule("b", 50, Map.of());
        addRule("c", 10, Map.of());
        submit("asset-1");
        assertTrue(executor.awaitStarted(1, 5, TimeUnit.SECONDS));

        assertEquals(2, engine.clearQueued());

        EngineStats stats = engine.getStats();
        assertEquals(0, stats.queued());
        assertEquals(1, stats.running());
        assertEquals(2, stats.canceled());
    }

    @Test
    @DisplayName("Paused queue holds jobs until resumed")
    void pauseResume() throws Exception {
        addRule("remux", 50, Map.of());
        engine.pauseQueue();

        submit("asset-1");

        assertTrue(engine.getStats().paused());
        assertEquals(JobState.QUEUED, job("job-1").state());

        engine.resumeQueue();

        assertTrue(executor.awaitStarted(1, 5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Listeners receive job and queue notifications")
    void notifications() throws Exception {
        List<EngineNotification> received = new CopyOnWriteArrayList<>();
        engine.addListener(received::add);
        addRule("remux", 50, Map.of());

        submit("asset-1");
        assertTrue(executor.awaitStarted(1, 5, TimeUnit.SECONDS));
        engine.pauseQueue();
        engine.resumeQueue();
        engine.clearQueued();

        List<String> jobChanges = received.stream()
                .filter(n -> n.type() == NotificationType.JOB_STATE_CHANGED)
                .map(n -> n.previousState() + "->" + n.job().state())
                .toList();
        assertEquals(List.of("null->QUEUED", "QUEUED->RUNNING"), jobChanges);

        List<NotificationType> queueEvents = received.stream()
                .map(EngineNotification::type)
                .filter(type -> type != NotificationType.JOB_STATE_CHANGED)
                .toList();
        assertEquals(List.of(NotificationType.QUEUE_PAUSED, NotificationType.QUEUE_RESUMED,
                NotificationType.QUEUE_CLEARED), queueEvents);
        assertEquals(0, received.get(received.size() - 1).details().get("cleared"));
    }

    // =====================================================================
    // Dry run
    // =====================================================================

    @Test
    @DisplayName("testRule reports what would happen without creating anything")
    void testRuleDryRun() throws Exception {
        Map<String, Object> document = ruleDocument("remux", 50);
        document.put("quiet_period_sec", 30);
        document.put("guardrails", List.of(Map.of("type", "pause_if_recording")));
        Rule rule = compiler.compileOrThrow(document);
        liveState.setRecording(true);

        EvaluationTrace trace = engine.testRule(rule, event("asset-1"), T0).get(5, TimeUnit.SECONDS);

        assertTrue(trace.conditionsMatched());
        assertNull(trace.failedCondition());
        assertTrue(trace.quietPeriodActive());
        assertEquals(30, trace.quietPeriodSec());
        assertTrue(trace.activeHoursMatch());
        assertTrue(trace.wouldBlock());
        assertEquals("recording", trace.blockReason());
        assertFalse(trace.shouldExecute());
        assertEquals(1, trace.actions().size());

        assertTrue(jobs().isEmpty());
        assertEquals(0, engine.getStats().pendingFires());
    }

    @Test
    @DisplayName("testRule accepts a draft document")
    void testRuleDraft() throws Exception {
        Map<String, Object> draft = ruleDocument("draft", 50);
        draft.put("conditions", List.of(Map.of("type", "greater_than",
                "params", Map.of("field", "size_bytes", "value", 1000))));

        EvaluationTrace trace = engine.testRule(draft, new Event(TriggerType.FILE_CLOSED, "asset-1", T0,
                Map.of("size_bytes", 10)), T0).get(5, TimeUnit.SECONDS);

        assertFalse(trace.conditionsMatched());
        assertEquals("greater_than", trace.failedCondition().type().wireName());
        assertFalse(trace.shouldExecute());
    }

    // ----- helpers -----

    private Map<String, Object> ruleDocument(String id, int priority) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", id);
        document.put("name", "Rule " + id);
        document.put("priority", priority);
        document.put("trigger", "file_closed");
        document.put("actions", List.of(Map.of("type", "index_asset")));
        return document;
    }

    private void addRule(String id, int priority, Map<String, Object> guardrail) {
        Map<String, Object> document = ruleDocument(id, priority);
        if (!guardrail.isEmpty()) {
            document.put("guardrails", List.of(guardrail));
        }
        ruleStore.save(compiler.compileOrThrow(document));
    }

    private static Event event(String subject) {
        return new Event(TriggerType.FILE_CLOSED, subject, T0, Map.of("path", "/media/" + subject + ".mkv"));
    }

    private DispatchReport submit(String subject) throws Exception {
        return engine.submitEvent(event(subject)).get(5, TimeUnit.SECONDS);
    }

    private JobSnapshot job(String jobId) {
        return engine.getJob(jobId).orElseThrow();
    }

    private List<JobSnapshot> jobs() {
        return engine.listJobs(JobFilter.all(), JobSort.CREATED_ASC, PageRequest.first(100)).items();
    }
}
