package com.example.ttlreaper.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.ttlreaper.TestResources;
import com.example.ttlreaper.models.DeletionOutcome;
import com.example.ttlreaper.models.ReaperPolicy;
import com.example.ttlreaper.models.ResourceKey;
import com.example.ttlreaper.models.ResourceLocator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class ExpirationSchedulerTest {

    private static final Instant T0 = Instant.parse("2025-08-27T21:00:00Z");
    private static final Clock CLOCK = Clock.fixed(T0.plusSeconds(30), ZoneOffset.UTC);
    private static final ResourceLocator JOBS = new ResourceLocator("batch", "v1", "jobs");
    private static final String PATH = ReaperPolicy.DEFAULT_TTL_FIELD_PATH;
    private static final ResourceKey JOB_A = new ResourceKey("batch", "Job", "job-a");

    private static final ReaperPolicy POLICY = ReaperPolicy.builder()
            .name("jobs-ttl")
            .targetKind("Job")
            .targetApiVersion("batch/v1")
            .targetNamespace("batch")
            .build();

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private DeletionExecutor deletionExecutor;

    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private ExpirationScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ExpirationScheduler(CLOCK, taskScheduler, new CompletionClassifier(), deletionExecutor);
    }

    private void stubTimers() {
        when(taskScheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(inv -> {
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            futures.add(future);
            return future;
        });
    }

    private List<Runnable> scheduledTasks(int expected) {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler, times(expected)).schedule(captor.capture(), any(Instant.class));
        return captor.getAllValues();
    }

    @Test
    @DisplayName("A finished instance whose TTL has not elapsed gets a timer at completion + TTL")
    void schedulesFutureExpiration() {
        stubTimers();

        ExpirationScheduler.Decision decision =
                scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-a", 60, T0), PATH);

        assertEquals(ExpirationScheduler.Decision.SCHEDULED, decision);
        verify(taskScheduler).schedule(any(Runnable.class), eq(T0.plusSeconds(60)));
        assertEquals(T0.plusSeconds(60), scheduler.scheduledExpiration(JOB_A).orElseThrow());
        verify(deletionExecutor, never()).delete(any(), any(), any());
    }

    @Test
    @DisplayName("An already expired instance is deleted synchronously without a timer")
    void deletesImmediatelyWhenExpired() {
        when(deletionExecutor.delete("jobs-ttl", JOBS, JOB_A)).thenReturn(DeletionOutcome.DELETED);

        ExpirationScheduler.Decision decision =
                scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-a", 30, T0), PATH);

        assertEquals(ExpirationScheduler.Decision.DELETED, decision);
        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    @DisplayName("Deletion outcomes map onto decisions")
    void mapsDeletionOutcomes() {
        when(deletionExecutor.delete(eq("jobs-ttl"), eq(JOBS), any()))
                .thenReturn(DeletionOutcome.ALREADY_GONE)
                .thenReturn(DeletionOutcome.DENIED)
                .thenReturn(DeletionOutcome.TRANSIENT);

        assertEquals(ExpirationScheduler.Decision.ALREADY_GONE,
                scheduler.schedule("jobs-ttl", JOBS, new ResourceKey("batch", "Job", "gone"), T0));
        assertEquals(ExpirationScheduler.Decision.DENIED,
                scheduler.schedule("jobs-ttl", JOBS, new ResourceKey("batch", "Job", "forbidden"), T0));
        assertEquals(ExpirationScheduler.Decision.DELETE_FAILED,
                scheduler.schedule("jobs-ttl", JOBS, new ResourceKey("batch", "Job", "flaky"), T0));
    }

    @Test
    @DisplayName("A denied key is not deleted again by the same policy until cleared; transient failures are")
    void deniedKeysRemembered() {
        ResourceKey flaky = new ResourceKey("batch", "Job", "flaky");
        when(deletionExecutor.delete("jobs-ttl", JOBS, JOB_A)).thenReturn(DeletionOutcome.DENIED);
        when(deletionExecutor.delete("jobs-ttl", JOBS, flaky)).thenReturn(DeletionOutcome.TRANSIENT);

        assertEquals(ExpirationScheduler.Decision.DENIED, scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0));
        assertEquals(ExpirationScheduler.Decision.PREVIOUSLY_DENIED, scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0));
        scheduler.schedule("jobs-ttl", JOBS, flaky, T0);
        scheduler.schedule("jobs-ttl", JOBS, flaky, T0);

        verify(deletionExecutor, times(1)).delete("jobs-ttl", JOBS, JOB_A);
        verify(deletionExecutor, times(2)).delete("jobs-ttl", JOBS, flaky);
        assertEquals(1, scheduler.deniedCount("jobs-ttl"));
        assertEquals(0, scheduler.deniedCount("other"));

        assertEquals(1, scheduler.clearDenied("jobs-ttl"));
        assertEquals(ExpirationScheduler.Decision.DENIED, scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0));
        verify(deletionExecutor, times(2)).delete("jobs-ttl", JOBS, JOB_A);
    }

    @Test
    @DisplayName("A timer that fires for a denied key does not delete")
    void timerSkipsDeniedKey() {
        stubTimers();
        when(deletionExecutor.delete("jobs-ttl", JOBS, JOB_A)).thenReturn(DeletionOutcome.DENIED);
        scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0);
        scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0.plusSeconds(600));

        scheduledTasks(1).get(0).run();

        verify(deletionExecutor, times(1)).delete("jobs-ttl", JOBS, JOB_A);
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    @DisplayName("Scheduling the same key twice leaves one live timer with the second expiration")
    void atMostOneTimerPerKey() {
        stubTimers();

        assertEquals(ExpirationScheduler.Decision.SCHEDULED,
                scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0.plusSeconds(100)));
        assertEquals(ExpirationScheduler.Decision.RESCHEDULED,
                scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0.plusSeconds(200)));

        verify(futures.get(0)).cancel(false);
        verify(futures.get(1), never()).cancel(false);
        assertEquals(1, scheduler.pendingCount());
        assertEquals(T0.plusSeconds(200), scheduler.scheduledExpiration(JOB_A).orElseThrow());
    }

    @Test
    @DisplayName("A superseded timer that fires anyway does nothing; the live one deletes")
    void staleTimerIgnored() {
        stubTimers();
        scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0.plusSeconds(100));
        scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0.plusSeconds(200));
        List<Runnable> tasks = scheduledTasks(2);

        tasks.get(0).run();
        verify(deletionExecutor, never()).delete(any(), any(), any());

        tasks.get(1).run();
        verify(deletionExecutor).delete("jobs-ttl", JOBS, JOB_A);
        assertEquals(0, scheduler.pendingCount());

        tasks.get(1).run();
        verify(deletionExecutor, times(1)).delete("jobs-ttl", JOBS, JOB_A);
    }

    @Test
    @DisplayName("Expiring immediately cancels a pending timer for the same key")
    void immediateDeleteSupersedesTimer() {
        stubTimers();
        when(deletionExecutor.delete("jobs-ttl", JOBS, JOB_A)).thenReturn(DeletionOutcome.DELETED);
        scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0.plusSeconds(100));

        scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0);

        verify(futures.get(0)).cancel(false);
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    @DisplayName("TTL \"120\" is honored exactly like 120")
    void numericStringTtl() {
        stubTimers();
        scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-int", 120, T0), PATH);
        scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-str", "120", T0), PATH);

        assertEquals(T0.plusSeconds(120),
                scheduler.scheduledExpiration(new ResourceKey("batch", "Job", "job-int")).orElseThrow());
        assertEquals(T0.plusSeconds(120),
                scheduler.scheduledExpiration(new ResourceKey("batch", "Job", "job-str")).orElseThrow());
    }

    @Test
    @DisplayName("Invalid TTLs skip the instance without scheduling or deleting")
    void invalidTtlSkipped() {
        for (Object ttl : new Object[] {-5, "soon", 1.5, true}) {
            ExpirationScheduler.Decision decision =
                    scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-a", ttl, T0), PATH);
            assertEquals(ExpirationScheduler.Decision.INVALID_TTL, decision, String.valueOf(ttl));
        }
        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        verify(deletionExecutor, never()).delete(any(), any(), any());
    }

    @Test
    @DisplayName("No TTL at the configured path means the instance is left alone")
    void noTtl() {
        assertEquals(ExpirationScheduler.Decision.NO_TTL,
                scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-a", null, T0), PATH));
        assertEquals(ExpirationScheduler.Decision.NO_TTL,
                scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-a", 60, T0), "spec.ttl"));
    }

    @Test
    @DisplayName("An instance that is no longer finished loses its timer")
    void unfinishedCancelsTimer() {
        stubTimers();
        scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-a", 60, T0), PATH);

        ExpirationScheduler.Decision decision =
                scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-a", 60, null), PATH);

        assertEquals(ExpirationScheduler.Decision.UNFINISHED, decision);
        verify(futures.get(0)).cancel(false);
        assertTrue(scheduler.scheduledExpiration(JOB_A).isEmpty());
    }

    @Test
    @DisplayName("Without a completion timestamp the creation time anchors the TTL")
    void creationTimeFallback() {
        ResourceKey key = new ResourceKey("batch", "Pod", "worker-0");
        when(deletionExecutor.delete("jobs-ttl", JOBS, key)).thenReturn(DeletionOutcome.DELETED);

        ExpirationScheduler.Decision decision = scheduler.evaluate(POLICY, JOBS,
                TestResources.phaseOnly("v1", "Pod", "batch", "worker-0", "Succeeded", T0.minusSeconds(100), 60),
                PATH);

        assertEquals(ExpirationScheduler.Decision.DELETED, decision);
    }

    @Test
    @DisplayName("Finished with no timestamp at all is skipped")
    void noTimestampAtAll() {
        ExpirationScheduler.Decision decision = scheduler.evaluate(POLICY, JOBS,
                TestResources.phaseOnly("v1", "Pod", "batch", "worker-0", "Failed", null, 60), PATH);

        assertEquals(ExpirationScheduler.Decision.NO_COMPLETION_TIME, decision);
        verify(deletionExecutor, never()).delete(any(), any(), any());
    }

    @Test
    @DisplayName("cancel and cancelForPolicy remove only the matching timers")
    void cancellation() {
        stubTimers();
        ResourceKey other = new ResourceKey("batch", "Job", "job-b");
        ResourceKey foreign = new ResourceKey("ci", "Job", "job-c");
        scheduler.schedule("jobs-ttl", JOBS, JOB_A, T0.plusSeconds(100));
        scheduler.schedule("jobs-ttl", JOBS, other, T0.plusSeconds(100));
        scheduler.schedule("ci-jobs", JOBS, foreign, T0.plusSeconds(100));

        assertTrue(scheduler.cancel(JOB_A, "test"));
        assertFalse(scheduler.cancel(JOB_A, "test"));
        assertEquals(1, scheduler.cancelForPolicy("jobs-ttl"));

        assertEquals(1, scheduler.pendingCount());
        assertTrue(scheduler.scheduledExpiration(foreign).isPresent());
        verify(futures.get(2), never()).cancel(false);
    }

    @Test
    @DisplayName("Expired iff now >= completion + ttl")
    void expiry() {
        long[] ttls = {0, 1, 59, 60, 61, 3600};
        long[] offsets = {-1, 0, 1, 59, 60, 61, 3601};
        for (long ttl : ttls) {
            for (long offset : offsets) {
                Instant now = T0.plusSeconds(offset);
                assertEquals(offset >= ttl, ExpirationScheduler.isExpired(T0.plusSeconds(ttl), now), ttl + "/" + offset);
            }
        }
    }

    @Test
    @DisplayName("At exactly completion + TTL the instance is deleted, one second earlier it is scheduled")
    void expiryBoundaryThroughEvaluate() {
        stubTimers();
        when(deletionExecutor.delete(eq("jobs-ttl"), eq(JOBS), any())).thenReturn(DeletionOutcome.DELETED);

        assertEquals(ExpirationScheduler.Decision.DELETED,
                scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-a", 30, T0), PATH));
        assertEquals(ExpirationScheduler.Decision.SCHEDULED,
                scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-b", 31, T0), PATH));
        verify(taskScheduler).schedule(any(Runnable.class), eq(T0.plusSeconds(31)));
    }

    @Test
    @DisplayName("A TTL too large to add to the completion time is invalid, not an error")
    void overflowingTtl() {
        for (Object ttl : new Object[] {Long.MAX_VALUE, "40000000000000000"}) {
            assertEquals(ExpirationScheduler.Decision.INVALID_TTL,
                    scheduler.evaluate(POLICY, JOBS, TestResources.job("batch", "job-a", ttl, T0), PATH),
                    String.valueOf(ttl));
        }
        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        verify(deletionExecutor, never()).delete(any(), any(), any());
    }

    @Test
    @DisplayName("TTL coercion accepts integers, whole floats and numeric strings")
    void coercion() {
        assertEquals(60, ExpirationScheduler.coerceTtlSeconds(IntNode.valueOf(60), PATH));
        assertEquals(60, ExpirationScheduler.coerceTtlSeconds(DoubleNode.valueOf(60.0), PATH));
        assertEquals(120, ExpirationScheduler.coerceTtlSeconds(TextNode.valueOf(" 120 "), PATH));
        assertEquals(0, ExpirationScheduler.coerceTtlSeconds(TextNode.valueOf("0"), PATH));

        for (JsonNode bad : new JsonNode[] {IntNode.valueOf(-1), DoubleNode.valueOf(0.5), TextNode.valueOf("1e3"),
                TextNode.valueOf("-3"), BooleanNode.TRUE, TestResources.MAPPER.createObjectNode()}) {
            TtlReaperException ex = assertThrows(TtlReaperException.class,
                    () -> ExpirationScheduler.coerceTtlSeconds(bad, PATH), bad.toString());
            assertEquals(TtlReaperException.Code.INVALID_TTL_VALUE, ex.getCode());
        }
    }
}
