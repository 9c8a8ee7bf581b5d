package com.herzen.maxviews.api;

import com.herzen.maxviews.log.LogModels;
import com.herzen.maxviews.log.LogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/log")
public class LogController {
    private final LogService logService;

    public LogController(LogService logService) {
        this.logService = logService;
    }

    @PostMapping("/events")
    public ResponseEntity<LogModels.EventAck> ingest(@RequestBody LogModels.EventIngestRequest request) {
        return ResponseEntity.ok(logService.recordEvents(request));
    }
}
