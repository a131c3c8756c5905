package mytrader.worker.model;

import org.junit.jupiter.api.*;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskModelTest {

    @Test
    void statusCodesRoundTrip() {
        for (TaskStatus status : TaskStatus.values()) {
            assertEquals(status, TaskStatus.fromCode(status.code()));
        }
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromCode("cancelled"));
    }

    @Test
    void terminalStatuses() {
        assertTrue(TaskStatus.COMPLETED.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertTrue(TaskStatus.STOPPED.isTerminal());
        assertFalse(TaskStatus.PENDING.isTerminal());
        assertFalse(TaskStatus.PAUSED.isTerminal());
        assertFalse(TaskStatus.unfinished().contains(TaskStatus.PENDING));
    }

    @Test
    void statsArithmetic() {
        TaskStats stats = TaskStats.ZERO.plus(StatKey.SUCCESS, 3).plus(StatKey.SKIPPED, 1);

        assertEquals(new TaskStats(3, 0, 1), stats);
        assertEquals(4, stats.total());
        assertEquals(1, stats.get(StatKey.SKIPPED));
        assertEquals(StatKey.FAILED, StatKey.of("failed"));
        assertThrows(IllegalArgumentException.class, () -> new TaskStats(-1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> StatKey.of("errors"));
    }

    @Test
    void checkpointDefaults() {
        Checkpoint checkpoint = new Checkpoint("t1", 4, null, null, null);

        assertEquals(TaskStats.ZERO, checkpoint.stats());
        assertEquals(Checkpoint.DEFAULT_STAGE, checkpoint.stage());
    }

    @Test
    void updateValidatesProgress() {
        assertThrows(IllegalArgumentException.class, () -> TaskUpdate.builder().progress(101));
        assertThrows(IllegalArgumentException.class, () -> TaskUpdate.builder().progress(-1));
        assertTrue(TaskUpdate.builder().build().isEmpty());
        assertFalse(TaskUpdate.message("hi").isEmpty());
    }

    @Test
    void taskShortIdAndIdentity() {
        Task a = Task.builder().id("0123456789abcdef").taskType("test_handler").createdAt(Instant.now()).build();
        Task b = a.toBuilder().progress(50).build();

        assertEquals("01234567", a.shortId());
        assertEquals("abc", Task.shortId("abc"));
        assertEquals(a, b);
        assertFalse(a.isTerminal());
    }
}
