package com.example.loankeeper.http;

import com.example.loankeeper.models.JobType;
import com.example.loankeeper.models.Schedule;
import com.example.loankeeper.requests.CreateScheduleHttpRequest;
import com.example.loankeeper.requests.CreateScheduleServiceRequest;
import com.example.loankeeper.requests.UpdateScheduleHttpRequest;
import com.example.loankeeper.requests.UpdateScheduleServiceRequest;
import com.example.loankeeper.scheduling.LaunchResult;
import com.example.loankeeper.scheduling.LoanScheduler;
import com.example.loankeeper.service.LoanKeeperException;
import com.example.loankeeper.service.ScheduleService;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative CRUD for job schedules, plus run-now. Changes take effect in the scheduler as
 * soon as they are stored.
 */
@RestController
@RequestMapping("/admin/schedules")
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final LoanScheduler scheduler;

    public ScheduleController(ScheduleService scheduleService, LoanScheduler scheduler) {
        this.scheduleService = scheduleService;
        this.scheduler = scheduler;
    }

    @GetMapping
    public ResponseEntity<List<ScheduleResponse>> list() {
        return ResponseEntity.ok(scheduleService.list().stream()
                .map(this::map)
                .toList());
    }

    @PostMapping
    public ResponseEntity<ScheduleResponse> create(@Valid @RequestBody CreateScheduleHttpRequest request) {
        Schedule schedule = scheduleService.create(new CreateScheduleServiceRequest(
                parseJobType(request.jobType()),
                request.cronExpression(),
                request.enabled() == null || request.enabled()));
        return ResponseEntity.status(HttpStatus.CREATED).body(map(schedule));
    }

    @GetMapping("/{scheduleId}")
    public ResponseEntity<ScheduleResponse> get(@PathVariable String scheduleId) {
        return ResponseEntity.ok(map(scheduleService.get(scheduleId)));
    }

    @PatchMapping("/{scheduleId}")
    public ResponseEntity<ScheduleResponse> update(@PathVariable String scheduleId,
                                                   @Valid @RequestBody UpdateScheduleHttpRequest request) {
        Schedule schedule = scheduleService.update(scheduleId, new UpdateScheduleServiceRequest(
                request.jobType() != null ? parseJobType(request.jobType()) : null,
                request.cronExpression(),
                request.enabled()));
        return ResponseEntity.ok(map(schedule));
    }

    @DeleteMapping("/{scheduleId}")
    public ResponseEntity<Void> delete(@PathVariable String scheduleId) {
        scheduleService.delete(scheduleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{scheduleId}/run")
    public ResponseEntity<RunNowResponse> runNow(@PathVariable String scheduleId) {
        LaunchResult result = scheduleService.runNow(scheduleId);
        HttpStatus status = result.status() == LaunchResult.Status.REJECTED
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(new RunNowResponse(
                scheduleId,
                result.jobType(),
                result.status().name().toLowerCase(Locale.ROOT),
                result.detail()));
    }

    private JobType parseJobType(String jobType) {
        try {
            return JobType.fromString(jobType);
        } catch (IllegalArgumentException ex) {
            throw LoanKeeperException.configError(ex.getMessage());
        }
    }

    private ScheduleResponse map(Schedule schedule) {
        return new ScheduleResponse(
                schedule.getScheduleId(),
                schedule.getJobType(),
                schedule.getCronExpression(),
                schedule.getEnabled(),
                schedule.getCreatedAt(),
                schedule.getUpdatedAt(),
                scheduler.nextFireTime(schedule.getScheduleId()).map(Instant::toString).orElse(null)
        );
    }
}
