package io.github.drompincen.javacron.gateway.controller;

import io.github.drompincen.javacron.protocol.api.ExecutionResult;
import io.github.drompincen.javacron.protocol.api.RunEventRequest;
import io.github.drompincen.javacron.protocol.api.ScheduleStatusResponse;
import io.github.drompincen.javacron.protocol.api.TriggeredBy;
import io.github.drompincen.javacron.runtime.scheduler.SchedulerService;
import io.github.drompincen.javacron.runtime.store.EventNotFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/events/{eventId}")
public class EventScheduleController {

    private final SchedulerService schedulerService;

    public EventScheduleController(SchedulerService schedulerService) {
        this.schedulerService = schedulerService;
    }

    @PostMapping("/run")
    public ResponseEntity<ExecutionResult> run(@PathVariable String eventId,
                                               @RequestBody(required = false) RunEventRequest req) {
        Map<String, Object> input = req != null && req.input() != null ? req.input() : Map.of();
        boolean wait = req != null && Boolean.TRUE.equals(req.waitForCompletion());
        try {
            return ResponseEntity.ok(schedulerService.runNow(eventId, TriggeredBy.MANUAL, input, wait));
        } catch (EventNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping("/reschedule")
    public ResponseEntity<ScheduleStatusResponse> reschedule(@PathVariable String eventId) {
        schedulerService.reschedule(eventId);
        return ResponseEntity.ok(schedulerService.status(eventId));
    }

    @DeleteMapping("/schedule")
    public ResponseEntity<Void> unschedule(@PathVariable String eventId) {
        schedulerService.unschedule(eventId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/schedule")
    public ScheduleStatusResponse status(@PathVariable String eventId) {
        return schedulerService.status(eventId);
    }
}
