package com.carestock.service;

import com.carestock.dto.DepletionForecast;
import com.carestock.dto.RestockRequestResponse;
import com.carestock.dto.RestockRequestSpec;
import com.carestock.dto.SkipReason;
import com.carestock.dto.SweepMode;
import com.carestock.dto.SweepResultResponse;
import com.carestock.entity.InventoryItem;
import com.carestock.entity.RestockRequest;
import com.carestock.exception.DuplicateOpenRequestException;
import com.carestock.exception.ItemNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One evaluation pass over the whole catalog. PREVIEW and COMMIT share the forecast and
 * policy steps; only COMMIT writes to the ledger, one transaction per created request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestockSweepService {

    private final StockCatalogService  catalog;
    private final DepletionForecaster  forecaster;
    private final RestockPolicy        policy;
    private final RestockRequestLedger ledger;
    private final Clock                clock;

    public SweepResultResponse preview() {
        return run(SweepMode.PREVIEW);
    }

    public SweepResultResponse commit() {
        return run(SweepMode.COMMIT);
    }

    public SweepResultResponse run(SweepMode mode) {
        Instant startedAt = clock.instant();
        List<InventoryItem> items = catalog.snapshot();
        Map<Long, RestockRequest> openByItem = ledger.openRequestsByItem();

        List<RestockRequestResponse> created = new ArrayList<>();
        List<RestockRequestSpec> proposed = new ArrayList<>();
        List<SweepResultResponse.SkippedItem> skipped = new ArrayList<>();

        for (InventoryItem item : items) {
            DepletionForecast forecast = forecaster.forecast(item);
            RestockPolicy.Decision decision =
                policy.decide(item, forecast, Optional.ofNullable(openByItem.get(item.getId())));

            if (!decision.shouldCreate()) {
                skipped.add(skip(item.getId(), decision.skipReason()));
                continue;
            }
            if (mode == SweepMode.PREVIEW) {
                proposed.add(decision.spec());
                continue;
            }
            try {
                created.add(ledger.create(decision.spec()));
            } catch (DuplicateOpenRequestException ex) {
                // Another writer got there between the snapshot and the insert.
                log.warn("Sweep skipped item with concurrent open request | itemId={} | openRequestId={}",
                         ex.getItemId(), ex.getOpenRequestId());
                skipped.add(skip(item.getId(), SkipReason.OPEN_REQUEST_EXISTS));
            } catch (ItemNotFoundException ex) {
                log.warn("Sweep skipped item deleted after snapshot | itemId={}", item.getId());
                skipped.add(skip(item.getId(), SkipReason.ITEM_REMOVED));
            }
        }

        log.info("Restock sweep finished | mode={} | evaluated={} | created={} | proposed={} | skipped={}",
                 mode, items.size(), created.size(), proposed.size(), skipped.size());

        return SweepResultResponse.builder()
            .mode(mode)
            .startedAt(startedAt)
            .evaluatedCount(items.size())
            .created(created)
            .proposed(proposed)
            .skipped(skipped)
            .build();
    }

    private SweepResultResponse.SkippedItem skip(Long itemId, SkipReason reason) {
        return SweepResultResponse.SkippedItem.builder().itemId(itemId).reason(reason).build();
    }
}
