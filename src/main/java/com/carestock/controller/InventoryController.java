package com.carestock.controller;

import com.carestock.dto.DepletionForecast;
import com.carestock.dto.InventoryItemRequest;
import com.carestock.dto.InventoryItemResponse;
import com.carestock.dto.StockUsageRequest;
import com.carestock.service.StockCatalogService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final StockCatalogService catalogService;

    @PostMapping("/items")
    public ResponseEntity<InventoryItemResponse> createItem(@Valid @RequestBody InventoryItemRequest request) {
        log.info("POST /inventory/items | name={} | category={}", request.getName(), request.getCategory());
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createItem(request));
    }

    @GetMapping("/items")
    public ResponseEntity<List<InventoryItemResponse>> listItems(
            @RequestParam(required = false) Long facilityId) {
        return ResponseEntity.ok(catalogService.listItems(facilityId));
    }

    @GetMapping("/items/{id}")
    public ResponseEntity<InventoryItemResponse> getItem(@PathVariable Long id) {
        return ResponseEntity.ok(catalogService.getItem(id));
    }

    @PutMapping("/items/{id}")
    public ResponseEntity<InventoryItemResponse> updateItem(
            @PathVariable Long id, @Valid @RequestBody InventoryItemRequest request) {
        log.info("PUT /inventory/items/{} | stock={} | dailyUsage={}",
                 id, request.getCurrentStock(), request.getDailyUsage());
        return ResponseEntity.ok(catalogService.updateItem(id, request));
    }

    @GetMapping("/items/{id}/forecast")
    public ResponseEntity<DepletionForecast> forecast(@PathVariable Long id) {
        return ResponseEntity.ok(catalogService.forecast(id));
    }

    @PostMapping("/usage")
    public ResponseEntity<List<InventoryItemResponse>> recordUsage(
            @Valid @RequestBody @NotEmpty(message = "usage must not be empty") List<@Valid StockUsageRequest> usage) {
        log.info("POST /inventory/usage | entries={}", usage.size());
        return ResponseEntity.ok(catalogService.recordUsage(usage));
    }

    @GetMapping("/low-stock")
    public ResponseEntity<List<InventoryItemResponse>> lowStock(
            @RequestParam(defaultValue = "5") @Min(0) @Max(365) int thresholdDays,
            @RequestParam(required = false) Long facilityId) {
        return ResponseEntity.ok(catalogService.lowStock(thresholdDays, facilityId));
    }
}
