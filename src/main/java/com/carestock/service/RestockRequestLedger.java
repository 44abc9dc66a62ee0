package com.carestock.service;

import com.carestock.dto.DepletionForecast;
import com.carestock.dto.ManualRestockRequest;
import com.carestock.dto.RequestOrigin;
import com.carestock.dto.RestockPriority;
import com.carestock.dto.RestockRequestResponse;
import com.carestock.dto.RestockRequestSpec;
import com.carestock.dto.RestockStatus;
import com.carestock.entity.InventoryItem;
import com.carestock.entity.RestockRequest;
import com.carestock.exception.DuplicateOpenRequestException;
import com.carestock.exception.InvalidTransitionException;
import com.carestock.exception.RestockRequestNotFoundException;
import com.carestock.exception.StockValidationException;
import com.carestock.repository.RestockRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns restock requests and their lifecycle:
 * <pre>
 *   PENDING -> APPROVED -> FULFILLED
 *   PENDING -> DECLINED
 * </pre>
 * At most one PENDING or APPROVED request exists per item. Creation holds the item's row
 * lock while checking for an open request, so concurrent callers cannot both insert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestockRequestLedger {

    private final RestockRequestRepository requestRepository;
    private final StockCatalogService      catalog;
    private final DepletionForecaster      forecaster;
    private final Clock                    clock;

    @Transactional
    public RestockRequestResponse create(RestockRequestSpec spec) {
        if (spec.getItemId() == null) {
            throw new StockValidationException("itemId is required");
        }
        if (spec.getQuantity() < 1) {
            throw new StockValidationException("quantity must be >= 1");
        }
        if (spec.getPriority() == null) {
            throw new StockValidationException("priority is required");
        }

        InventoryItem item = catalog.lockItem(spec.getItemId());
        requestRepository.findFirstByItemIdAndStatusIn(item.getId(), RestockStatus.OPEN)
            .ifPresent(open -> {
                throw new DuplicateOpenRequestException(item.getId(), open.getId());
            });

        RestockRequest saved = requestRepository.save(RestockRequest.builder()
            .itemId(item.getId())
            .facilityId(item.getFacilityId())
            .quantity(spec.getQuantity())
            .priority(spec.getPriority())
            .status(RestockStatus.PENDING)
            .origin(spec.getOrigin() != null ? spec.getOrigin() : RequestOrigin.MANUAL)
            .daysRemaining(spec.getDaysRemaining())
            .requestedAt(clock.instant())
            .comments(spec.getComments())
            .build());
        log.info("Restock request created | id={} | itemId={} | quantity={} | priority={} | origin={}",
                 saved.getId(), saved.getItemId(), saved.getQuantity(), saved.getPriority(), saved.getOrigin());
        return toResponse(saved);
    }

    /** Operator request: skips the policy but not the duplicate guard. */
    @Transactional
    public RestockRequestResponse createManual(ManualRestockRequest req) {
        DepletionForecast forecast = forecaster.forecast(catalog.requireItem(req.getItemId()));
        RestockPriority priority = req.getPriority() != null
            ? req.getPriority()
            : RestockPriority.fromTier(forecast.getTier());
        return create(RestockRequestSpec.builder()
            .itemId(req.getItemId())
            .quantity(req.getQuantity())
            .priority(priority)
            .daysRemaining(forecast.getRemainingDays())
            .origin(RequestOrigin.MANUAL)
            .comments(req.getComments())
            .build());
    }

    @Transactional
    public RestockRequestResponse approve(Long requestId, String comments) {
        return decide(requestId, RestockStatus.APPROVED, comments);
    }

    @Transactional
    public RestockRequestResponse decline(Long requestId, String comments) {
        return decide(requestId, RestockStatus.DECLINED, comments);
    }

    /** Stock increment and status change commit together or not at all. */
    @Transactional
    public RestockRequestResponse fulfill(Long requestId, String comments) {
        RestockRequest request = lockRequest(requestId);
        if (request.getStatus() != RestockStatus.APPROVED) {
            throw new InvalidTransitionException(requestId, request.getStatus(), RestockStatus.FULFILLED);
        }
        InventoryItem item = catalog.replenish(request.getItemId(), request.getQuantity());
        request.setStatus(RestockStatus.FULFILLED);
        request.setFulfilledAt(clock.instant());
        applyComments(request, comments);
        RestockRequest saved = requestRepository.save(request);
        log.info("Restock request fulfilled | id={} | itemId={} | quantity={} | newStock={}",
                 requestId, item.getId(), saved.getQuantity(), item.getCurrentStock());
        return toResponse(saved);
    }

    @Transactional
    public RestockRequestResponse transition(Long requestId, RestockStatus target, String comments) {
        return switch (target) {
            case APPROVED -> approve(requestId, comments);
            case DECLINED -> decline(requestId, comments);
            case FULFILLED -> fulfill(requestId, comments);
            case PENDING -> {
                RestockRequest request = requireRequest(requestId);
                throw new InvalidTransitionException(requestId, request.getStatus(), RestockStatus.PENDING);
            }
        };
    }

    @Transactional(readOnly = true)
    public RestockRequestResponse get(Long requestId) {
        return toResponse(requireRequest(requestId));
    }

    @Transactional(readOnly = true)
    public List<RestockRequestResponse> list(RestockStatus status, Long facilityId) {
        return requestRepository.search(status, facilityId).stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public Optional<RestockRequest> findOpenRequest(Long itemId) {
        return requestRepository.findFirstByItemIdAndStatusIn(itemId, RestockStatus.OPEN);
    }

    @Transactional(readOnly = true)
    public Map<Long, RestockRequest> openRequestsByItem() {
        return requestRepository.findByStatusIn(RestockStatus.OPEN).stream()
            .collect(Collectors.toMap(RestockRequest::getItemId, Function.identity(), (a, b) -> a));
    }

    public RestockRequestResponse toResponse(RestockRequest r) {
        return RestockRequestResponse.builder()
            .id(r.getId()).itemId(r.getItemId()).facilityId(r.getFacilityId())
            .quantity(r.getQuantity()).priority(r.getPriority())
            .status(r.getStatus()).origin(r.getOrigin())
            .daysRemaining(r.getDaysRemaining())
            .requestedAt(r.getRequestedAt()).decidedAt(r.getDecidedAt()).fulfilledAt(r.getFulfilledAt())
            .comments(r.getComments())
            .build();
    }

    private RestockRequestResponse decide(Long requestId, RestockStatus target, String comments) {
        RestockRequest request = lockRequest(requestId);
        if (request.getStatus() != RestockStatus.PENDING) {
            throw new InvalidTransitionException(requestId, request.getStatus(), target);
        }
        request.setStatus(target);
        request.setDecidedAt(clock.instant());
        applyComments(request, comments);
        RestockRequest saved = requestRepository.save(request);
        log.info("Restock request {} | id={} | itemId={}", target, requestId, saved.getItemId());
        return toResponse(saved);
    }

    private void applyComments(RestockRequest request, String comments) {
        if (comments != null) {
            request.setComments(comments);
        }
    }

    private RestockRequest lockRequest(Long requestId) {
        return requestRepository.findByIdForUpdate(requestId)
            .orElseThrow(() -> new RestockRequestNotFoundException(requestId));
    }

    private RestockRequest requireRequest(Long requestId) {
        return requestRepository.findById(requestId)
            .orElseThrow(() -> new RestockRequestNotFoundException(requestId));
    }
}
