package com.bqwatch.backend.checks;

import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/checks")
@ConditionalOnProperty(prefix = "bqwatch.bigquery", name = "enabled", havingValue = "true")
public class CheckRunController {

    private final CheckOrchestrator orchestrator;

    public CheckRunController(CheckOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping
    public List<CheckDefinition> listDefinitions() {
        return orchestrator.definitions();
    }

    @PostMapping("/run")
    public CheckRunSummary run() {
        return orchestrator.runAll();
    }
}
