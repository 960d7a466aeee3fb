package com.hubframe.core.install;

import com.hubframe.api.model.InstallType;
import com.hubframe.api.model.JobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InstallJob 单元测试")
public class InstallJobTest {

    private final Instant t0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    @DisplayName("状态只能逐级前进")
    void advancesInOrder() {
        InstallJob job = newJob();

        assertFalse(job.advance(JobStatus.RUNNING, t0));
        assertTrue(job.advance(JobStatus.SENT, t0));
        assertFalse(job.advance(JobStatus.SENT, t0));
        assertTrue(job.advance(JobStatus.RUNNING, t0.plusSeconds(1)));
        assertFalse(job.advance(JobStatus.PENDING, t0));
        assertTrue(job.advance(JobStatus.SUCCESS, t0.plusSeconds(2)));

        assertEquals(t0.plusSeconds(1), job.getStartedAt());
        assertEquals(t0.plusSeconds(2), job.getFinishedAt());
        assertEquals(List.of(JobStatus.PENDING, JobStatus.SENT, JobStatus.RUNNING, JobStatus.SUCCESS),
                job.getStatusHistory());
    }

    @Test
    @DisplayName("失败只能通过 fail 且只生效一次")
    void failIsTerminal() {
        InstallJob job = newJob();

        assertFalse(job.advance(JobStatus.FAILED, t0));
        assertTrue(job.fail(InstallFailureReason.TIMEOUT, "slow", t0));
        assertFalse(job.fail(InstallFailureReason.CANCELLED, "again", t0));
        assertFalse(job.advance(JobStatus.SENT, t0));

        assertTrue(job.isTerminal());
        assertEquals(InstallFailureReason.TIMEOUT, job.getFailureReason());
        assertEquals("slow", job.getError());
    }

    @Test
    @DisplayName("负载被复制且不可修改")
    void payloadIsImmutable() {
        InstallJob job = newJob();

        assertThrows(UnsupportedOperationException.class, () -> job.getPayload().put("x", 1));
        assertEquals("http://hub/lights.zip", job.getPayload().get("url"));
    }

    private InstallJob newJob() {
        return new InstallJob("job-1", "lights", JobOperation.INSTALL, InstallType.URL,
                Map.of("url", "http://hub/lights.zip"), t0);
    }
}
