package org.example.nucleicounter.controller;

import lombok.RequiredArgsConstructor;
import org.example.nucleicounter.dto.response.HistoryEntryResponse;
import org.example.nucleicounter.service.HistoryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
public class HistoryController {

    private final HistoryService historyService;

    @GetMapping
    public List<HistoryEntryResponse> recent(@RequestParam(defaultValue = "100") int limit) {
        return historyService.recent(limit).stream()
                .map(HistoryEntryResponse::from)
                .toList();
    }
}
