package io.pulse4j.web;

import io.pulse4j.Scheduler;
import io.pulse4j.core.JobRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Objects;

@RestController
@RequestMapping("/pulse/admin/jobs")
public class SchedulerAdminController {
    private static final Logger log = LoggerFactory.getLogger(SchedulerAdminController.class);

    static final int MAX_HISTORY_LIMIT = 500;

    private final Scheduler scheduler;

    public SchedulerAdminController(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    @GetMapping
    public List<JobStatusView> listJobs() {
        return scheduler.jobNames().stream()
                .sorted()
                .map(scheduler::status)
                .map(JobStatusView::from)
                .toList();
    }

    @GetMapping("/{name}")
    public JobStatusView getJob(@PathVariable String name) {
        return JobStatusView.from(scheduler.status(name));
    }

    @GetMapping("/{name}/runs")
    public List<JobRun> runs(@PathVariable String name, @RequestParam(defaultValue = "20") int limit) {
        if (limit <= 0 || limit > MAX_HISTORY_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        return scheduler.history(name, limit);
    }

    @PostMapping("/{name}/run")
    public JobRun run(@PathVariable String name) {
        log.info("Manual run requested name={}", name);
        return scheduler.runNow(name);
    }

    @PostMapping("/{name}/start")
    public JobStatusView start(@PathVariable String name) {
        scheduler.start(name);
        return JobStatusView.from(scheduler.status(name));
    }

    @PostMapping("/{name}/stop")
    public JobStatusView stop(@PathVariable String name) {
        scheduler.stop(name);
        return JobStatusView.from(scheduler.status(name));
    }
}
