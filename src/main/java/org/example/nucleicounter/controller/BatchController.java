package org.example.nucleicounter.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.example.nucleicounter.dto.request.CreateBatchRequest;
import org.example.nucleicounter.dto.response.BatchSessionResponse;
import org.example.nucleicounter.dto.response.ImageOutcomeResponse;
import org.example.nucleicounter.model.BatchSession;
import org.example.nucleicounter.service.BatchService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/batches")
@RequiredArgsConstructor
public class BatchController {

    private final BatchService batchService;

    @PostMapping
    public ResponseEntity<BatchSessionResponse> create(@Valid @RequestBody CreateBatchRequest request) {
        BatchSession s = batchService.submit(request.getImages(), request.getRunMode());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(BatchSessionResponse.from(s, List.of()));
    }

    @GetMapping("/{id}")
    public BatchSessionResponse get(@PathVariable Long id) throws IOException {
        BatchSession s = batchService.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "batch not found"));
        List<ImageOutcomeResponse> outcomes = batchService.readOutcomes(id).stream()
                .map(ImageOutcomeResponse::from)
                .toList();
        return BatchSessionResponse.from(s, outcomes);
    }

    @GetMapping(value = "/{id}/log", produces = MediaType.TEXT_PLAIN_VALUE)
    public String log(@PathVariable Long id) throws IOException {
        return batchService.readLog(id);
    }

    @PostMapping("/{id}/cancel")
    public BatchSessionResponse cancel(@PathVariable Long id) {
        return BatchSessionResponse.from(batchService.cancel(id), List.of());
    }
}
