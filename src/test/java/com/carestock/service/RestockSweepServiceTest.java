package com.carestock.service;

import com.carestock.dto.RequestOrigin;
import com.carestock.dto.RestockPriority;
import com.carestock.dto.RestockRequestResponse;
import com.carestock.dto.RestockRequestSpec;
import com.carestock.dto.RestockStatus;
import com.carestock.dto.SkipReason;
import com.carestock.dto.SweepMode;
import com.carestock.dto.SweepResultResponse;
import com.carestock.entity.InventoryItem;
import com.carestock.entity.RestockRequest;
import com.carestock.exception.DuplicateOpenRequestException;
import com.carestock.exception.ItemNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RestockSweepServiceTest {

    @Mock StockCatalogService  catalog;
    @Mock RestockRequestLedger ledger;

    private RestockSweepService sweepService;

    @BeforeEach
    void setUp() {
        sweepService = new RestockSweepService(catalog, new DepletionForecaster(), new RestockPolicy(), ledger,
            Clock.fixed(Instant.parse("2026-03-01T06:00:00Z"), ZoneOffset.UTC));
    }

    private InventoryItem item(long id, int stock, double usage) {
        return InventoryItem.builder().id(id).name("Item-" + id).category("Supply")
            .unit("boxes").currentStock(stock).dailyUsage(usage).build();
    }

    private RestockRequestResponse createdFrom(RestockRequestSpec spec) {
        return RestockRequestResponse.builder().id(500L + spec.getItemId()).itemId(spec.getItemId())
            .quantity(spec.getQuantity()).priority(spec.getPriority()).status(RestockStatus.PENDING)
            .origin(spec.getOrigin()).build();
    }

    @Test
    void commit_createsCriticalRequestAndSkipsNormalItem() {
        when(catalog.snapshot()).thenReturn(List.of(item(1L, 45, 10), item(2L, 120, 10)));
        when(ledger.openRequestsByItem()).thenReturn(Map.of());
        when(ledger.create(any())).thenAnswer(inv -> createdFrom(inv.getArgument(0)));

        SweepResultResponse result = sweepService.commit();

        ArgumentCaptor<RestockRequestSpec> captor = ArgumentCaptor.forClass(RestockRequestSpec.class);
        verify(ledger, times(1)).create(captor.capture());
        assertThat(captor.getValue().getItemId()).isEqualTo(1L);
        assertThat(captor.getValue().getPriority()).isEqualTo(RestockPriority.CRITICAL);
        assertThat(captor.getValue().getOrigin()).isEqualTo(RequestOrigin.AUTOMATIC);

        assertThat(result.getMode()).isEqualTo(SweepMode.COMMIT);
        assertThat(result.getEvaluatedCount()).isEqualTo(2);
        assertThat(result.getCreated()).extracting(RestockRequestResponse::getItemId).containsExactly(1L);
        assertThat(result.getSkipped()).singleElement().satisfies(s -> {
            assertThat(s.getItemId()).isEqualTo(2L);
            assertThat(s.getReason()).isEqualTo(SkipReason.BELOW_TRIGGER);
        });
    }

    @Test
    void preview_sharesDecisionsButNeverWrites() {
        when(catalog.snapshot()).thenReturn(List.of(item(1L, 45, 10), item(2L, 80, 10), item(3L, 10, 0)));
        when(ledger.openRequestsByItem()).thenReturn(Map.of());

        SweepResultResponse result = sweepService.preview();

        verify(ledger, never()).create(any());
        assertThat(result.getCreated()).isEmpty();
        assertThat(result.getProposed()).extracting(RestockRequestSpec::getPriority)
            .containsExactly(RestockPriority.CRITICAL, RestockPriority.HIGH);
        assertThat(result.getSkipped()).extracting(SweepResultResponse.SkippedItem::getReason)
            .containsExactly(SkipReason.UNKNOWN_USAGE);
    }

    @Test
    void commit_itemWithOpenRequest_isSkipped() {
        RestockRequest open = RestockRequest.builder().id(9L).itemId(1L).status(RestockStatus.PENDING).build();
        when(catalog.snapshot()).thenReturn(List.of(item(1L, 45, 10)));
        when(ledger.openRequestsByItem()).thenReturn(Map.of(1L, open));

        SweepResultResponse result = sweepService.commit();

        verify(ledger, never()).create(any());
        assertThat(result.getCreated()).isEmpty();
        assertThat(result.getSkipped()).extracting(SweepResultResponse.SkippedItem::getReason)
            .containsExactly(SkipReason.OPEN_REQUEST_EXISTS);
    }

    @Test
    void commit_lostDuplicateRace_becomesSkipNotError() {
        when(catalog.snapshot()).thenReturn(List.of(item(1L, 45, 10), item(2L, 30, 10)));
        when(ledger.openRequestsByItem()).thenReturn(Map.of());
        when(ledger.create(any())).thenAnswer(inv -> {
            RestockRequestSpec spec = inv.getArgument(0);
            if (spec.getItemId() == 1L) {
                throw new DuplicateOpenRequestException(1L, 77L);
            }
            return createdFrom(spec);
        });

        SweepResultResponse result = sweepService.commit();

        assertThat(result.getCreated()).extracting(RestockRequestResponse::getItemId).containsExactly(2L);
        assertThat(result.getSkipped()).singleElement().satisfies(s -> {
            assertThat(s.getItemId()).isEqualTo(1L);
            assertThat(s.getReason()).isEqualTo(SkipReason.OPEN_REQUEST_EXISTS);
        });
    }

    @Test
    void commit_itemDeletedAfterSnapshot_isSkippedAndOthersStillCreated() {
        when(catalog.snapshot()).thenReturn(List.of(item(1L, 45, 10), item(2L, 30, 10), item(3L, 20, 10)));
        when(ledger.openRequestsByItem()).thenReturn(Map.of());
        when(ledger.create(any())).thenAnswer(inv -> {
            RestockRequestSpec spec = inv.getArgument(0);
            if (spec.getItemId() == 2L) {
                throw new ItemNotFoundException(2L);
            }
            return createdFrom(spec);
        });

        SweepResultResponse result = sweepService.commit();

        assertThat(result.getCreated()).extracting(RestockRequestResponse::getItemId).containsExactly(1L, 3L);
        assertThat(result.getSkipped()).singleElement().satisfies(s -> {
            assertThat(s.getItemId()).isEqualTo(2L);
            assertThat(s.getReason()).isEqualTo(SkipReason.ITEM_REMOVED);
        });
    }

    @Test
    void commit_emptyCatalog_evaluatesNothing() {
        when(catalog.snapshot()).thenReturn(List.of());
        when(ledger.openRequestsByItem()).thenReturn(Map.of());

        SweepResultResponse result = sweepService.commit();

        assertThat(result.getEvaluatedCount()).isZero();
        assertThat(result.getCreated()).isEmpty();
        assertThat(result.getSkipped()).isEmpty();
    }
}
