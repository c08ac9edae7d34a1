package com.eainde.research.controller;

import com.eainde.research.report.MarkdownReportRenderer;
import com.eainde.research.report.Report;
import com.eainde.research.workflow.ResearchEngine;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/research")
public class ResearchController {

    static final MediaType TEXT_MARKDOWN = new MediaType("text", "markdown", StandardCharsets.UTF_8);

    private final ResearchEngine engine;
    private final MarkdownReportRenderer markdownRenderer;

    public ResearchController(ResearchEngine engine, MarkdownReportRenderer markdownRenderer) {
        this.engine = engine;
        this.markdownRenderer = markdownRenderer;
    }

    @PostMapping
    public Report research(@RequestBody ResearchRequest request) {
        return engine.run(request.toQuery());
    }

    @PostMapping("/markdown")
    public ResponseEntity<String> researchMarkdown(@RequestBody ResearchRequest request) {
        Report report = engine.run(request.toQuery());
        return ResponseEntity.ok()
                .contentType(TEXT_MARKDOWN)
                .body(markdownRenderer.render(report));
    }
}
