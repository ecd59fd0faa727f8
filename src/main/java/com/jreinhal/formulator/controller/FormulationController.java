package com.jreinhal.formulator.controller;

import com.jreinhal.formulator.execution.ExecutionResult;
import com.jreinhal.formulator.mcts.SearchReport;
import com.jreinhal.formulator.service.FormulationSearchService;
import com.jreinhal.formulator.service.SearchOutcome;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/formulation")
public class FormulationController {

    private final FormulationSearchService searchService;

    public FormulationController(FormulationSearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        SearchOutcome outcome = searchService.search(request.problem(), request.expectedAnswer());
        SearchReport report = outcome.report();
        ExecutionResult result = report.result();
        return ResponseEntity.ok(new SearchResponse(
                result.success(),
                result.stdout(),
                result.stderr(),
                outcome.predictedAnswer(),
                outcome.correct(),
                report.foundCorrect(),
                report.iterations().size(),
                report.treeSize(),
                report.iterations()));
    }

    public record SearchRequest(String problem, Double expectedAnswer) {
    }

    public record SearchResponse(boolean success, String output, String error, Double predictedAnswer,
                                 Boolean correct, boolean foundCorrect, int iterations, int treeSize,
                                 List<SearchReport.IterationRecord> trace) {
    }
}
