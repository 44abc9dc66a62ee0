package com.carestock.service;

import com.carestock.dto.DepletionForecast;
import com.carestock.dto.InventoryItemRequest;
import com.carestock.dto.InventoryItemResponse;
import com.carestock.dto.StockUsageRequest;
import com.carestock.entity.InventoryItem;
import com.carestock.exception.ItemNotFoundException;
import com.carestock.exception.StockValidationException;
import com.carestock.repository.InventoryItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class StockCatalogService {

    private final InventoryItemRepository itemRepository;
    private final DepletionForecaster     forecaster;

    @Transactional
    public InventoryItemResponse createItem(InventoryItemRequest req) {
        validateLevels(req.getCurrentStock(), req.getDailyUsage());
        InventoryItem saved = itemRepository.save(InventoryItem.builder()
            .facilityId(req.getFacilityId())
            .name(req.getName()).category(req.getCategory()).unit(req.getUnit())
            .currentStock(req.getCurrentStock()).dailyUsage(req.getDailyUsage())
            .build());
        log.info("Item created | id={} | name={} | stock={} | dailyUsage={}",
                 saved.getId(), saved.getName(), saved.getCurrentStock(), saved.getDailyUsage());
        return toResponse(saved);
    }

    @Transactional
    public InventoryItemResponse updateItem(Long itemId, InventoryItemRequest req) {
        validateLevels(req.getCurrentStock(), req.getDailyUsage());
        InventoryItem item = lockItem(itemId);
        int previousStock = item.getCurrentStock();
        item.setFacilityId(req.getFacilityId());
        item.setName(req.getName());
        item.setCategory(req.getCategory());
        item.setUnit(req.getUnit());
        item.setCurrentStock(req.getCurrentStock());
        item.setDailyUsage(req.getDailyUsage());
        InventoryItem saved = itemRepository.save(item);
        log.info("Item updated | id={} | stock={}->{} | dailyUsage={}",
                 itemId, previousStock, saved.getCurrentStock(), saved.getDailyUsage());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public InventoryItemResponse getItem(Long itemId) {
        return toResponse(requireItem(itemId));
    }

    @Transactional(readOnly = true)
    public List<InventoryItemResponse> listItems(Long facilityId) {
        return findItems(facilityId).stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public DepletionForecast forecast(Long itemId) {
        return forecaster.forecast(requireItem(itemId));
    }

    /**
     * Items whose forecast is known and at or below {@code thresholdDays}, soonest first.
     * Items without a usage signal never appear.
     */
    @Transactional(readOnly = true)
    public List<InventoryItemResponse> lowStock(int thresholdDays, Long facilityId) {
        if (thresholdDays < 0) {
            throw new StockValidationException("thresholdDays must be >= 0");
        }
        return findItems(facilityId).stream()
            .map(this::toResponse)
            .filter(r -> r.getForecast().isKnown() && r.getForecast().getRemainingDays() <= thresholdDays)
            .sorted(Comparator.comparing((InventoryItemResponse r) -> r.getForecast().getRemainingDays())
                .thenComparing(InventoryItemResponse::getId))
            .toList();
    }

    /**
     * Applies a batch of consumption entries. Entries for the same item are summed. The batch
     * is all-or-nothing: an unknown item or a total that exceeds stock rejects every entry.
     */
    @Transactional
    public List<InventoryItemResponse> recordUsage(List<StockUsageRequest> usage) {
        if (usage == null || usage.isEmpty()) {
            throw new StockValidationException("usage batch must not be empty");
        }
        Map<Long, Long> totals = new TreeMap<>();
        for (StockUsageRequest entry : usage) {
            if (entry.getItemId() == null) {
                throw new StockValidationException("itemId is required");
            }
            if (entry.getQuantityUsed() < 0) {
                throw new StockValidationException("quantityUsed must be >= 0 for item '" + entry.getItemId() + "'");
            }
            totals.merge(entry.getItemId(), (long) entry.getQuantityUsed(), Long::sum);
        }

        // Locks are taken in id order so concurrent batches cannot deadlock.
        List<InventoryItem> locked = new ArrayList<>();
        for (Map.Entry<Long, Long> total : totals.entrySet()) {
            InventoryItem item = lockItem(total.getKey());
            if (total.getValue() > item.getCurrentStock()) {
                throw new StockValidationException(
                    "Usage of " + total.getValue() + " exceeds stock of " + item.getCurrentStock()
                        + " for item '" + item.getId() + "'");
            }
            locked.add(item);
        }

        List<InventoryItemResponse> updated = new ArrayList<>();
        for (InventoryItem item : locked) {
            long used = totals.get(item.getId());
            item.setCurrentStock((int) (item.getCurrentStock() - used));
            updated.add(toResponse(itemRepository.save(item)));
        }
        log.info("Usage recorded | entries={} | items={}", usage.size(), locked.size());
        return updated;
    }

    /** Adds delivered stock. Joins the caller's transaction so the ledger can pair it with a status change. */
    @Transactional
    public InventoryItem replenish(Long itemId, int quantity) {
        if (quantity < 1) {
            throw new StockValidationException("replenish quantity must be >= 1");
        }
        InventoryItem item = lockItem(itemId);
        long newStock = (long) item.getCurrentStock() + quantity;
        if (newStock > Integer.MAX_VALUE) {
            throw new StockValidationException("Replenishing item '" + itemId + "' by " + quantity + " overflows stock");
        }
        item.setCurrentStock((int) newStock);
        return itemRepository.save(item);
    }

    @Transactional
    public InventoryItem lockItem(Long itemId) {
        return itemRepository.findByIdForUpdate(itemId)
            .orElseThrow(() -> new ItemNotFoundException(itemId));
    }

    @Transactional(readOnly = true)
    public InventoryItem requireItem(Long itemId) {
        return itemRepository.findById(itemId)
            .orElseThrow(() -> new ItemNotFoundException(itemId));
    }

    @Transactional(readOnly = true)
    public List<InventoryItem> snapshot() {
        return itemRepository.findAllByOrderByIdAsc();
    }

    public InventoryItemResponse toResponse(InventoryItem item) {
        return InventoryItemResponse.builder()
            .id(item.getId()).facilityId(item.getFacilityId())
            .name(item.getName()).category(item.getCategory()).unit(item.getUnit())
            .currentStock(item.getCurrentStock()).dailyUsage(item.getDailyUsage())
            .forecast(forecaster.forecast(item))
            .createdAt(item.getCreatedAt()).updatedAt(item.getUpdatedAt())
            .build();
    }

    private List<InventoryItem> findItems(Long facilityId) {
        return facilityId != null
            ? itemRepository.findByFacilityIdOrderByIdAsc(facilityId)
            : itemRepository.findAllByOrderByIdAsc();
    }

    private void validateLevels(int currentStock, double dailyUsage) {
        if (currentStock < 0) {
            throw new StockValidationException("currentStock must be >= 0");
        }
        if (Double.isNaN(dailyUsage) || Double.isInfinite(dailyUsage) || dailyUsage < 0.0) {
            throw new StockValidationException("dailyUsage must be a finite number >= 0");
        }
    }
}
