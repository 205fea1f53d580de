package com.bqwatch.backend.logging;

import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/logs", produces = MediaType.TEXT_PLAIN_VALUE)
public class LogController {

    private static final Logger LOGGER = LoggerFactory.getLogger(LogController.class);

    private final CheckLogger checkLogger;

    public LogController(CheckLogger checkLogger) {
        this.checkLogger = checkLogger;
    }

    @GetMapping("/checks")
    public ResponseEntity<String> getCheckLog(@RequestParam(name = "lines", required = false) Integer lines) {
        try {
            String content = checkLogger.recent(lines).stream()
                    .map(entry -> entry.timestamp() + " " + entry.message())
                    .collect(Collectors.joining(System.lineSeparator()));
            return ResponseEntity.ok(content);
        } catch (IllegalArgumentException ex) {
            LOGGER.debug("Invalid 'lines' parameter received: {}", lines, ex);
            return ResponseEntity.badRequest().body(ex.getMessage());
        } catch (CheckLogException ex) {
            LOGGER.error("Failed to read the check log", ex);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Unable to read the check log. Check server logs for details.");
        }
    }
}
