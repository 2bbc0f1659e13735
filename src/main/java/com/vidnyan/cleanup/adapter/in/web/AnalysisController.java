package com.vidnyan.cleanup.adapter.in.web;

import com.vidnyan.cleanup.application.port.in.AnalyzeSubmissionUseCase;
import com.vidnyan.cleanup.application.port.out.FindingStore;
import com.vidnyan.cleanup.application.service.StoreTopology;
import com.vidnyan.cleanup.domain.finding.AnalysisReport;
import com.vidnyan.cleanup.domain.finding.Category;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * REST API for submitting code and reading back merged reports.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalyzeSubmissionUseCase analyzeSubmissionUseCase;
    private final StoreTopology storeTopology;

    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisReport analyze(@RequestBody AnalyzeRequest request) {
        log.info("Received analysis request for {}", request.filename());
        return analyzeSubmissionUseCase.submit(request.content(), request.filename());
    }

    @PostMapping(value = "/analyze/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AnalysisReport upload(@RequestParam("file") MultipartFile file) throws IOException {
        log.info("Received upload {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        String content = new String(file.getBytes(), StandardCharsets.UTF_8);
        return analyzeSubmissionUseCase.submit(content, file.getOriginalFilename());
    }

    @GetMapping("/submissions/{id}/report")
    public ResponseEntity<AnalysisReport> report(@PathVariable("id") long id) {
        return analyzeSubmissionUseCase.report(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/status")
    public StatusResponse status() {
        List<StoreStatus> stores = new ArrayList<>();
        for (FindingStore store : storeTopology.distinctStores()) {
            List<String> analyzers = new ArrayList<>();
            for (Category category : Category.values()) {
                if (storeTopology.storeFor(category) == store) {
                    analyzers.add(category.key());
                }
            }
            stores.add(new StoreStatus(store.name(), store.ping(), analyzers));
        }
        return new StatusResponse(storeTopology.mode().key(), stores);
    }

    public record AnalyzeRequest(
        String filename,
        String content
    ) {}

    public record StoreStatus(
        String name,
        boolean reachable,
        List<String> analyzers
    ) {}

    public record StatusResponse(
        String mode,
        List<StoreStatus> stores
    ) {}
}
