package com.example.rota.shift;

import com.example.rota.exception.ResourceNotFoundException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read side: paginated listings and single-shift lookup. Every call goes to
 * the repository; rows with equal sort keys come back in no defined order.
 */
@Service
@Transactional(readOnly = true)
public class ShiftQueryService {

    private final ShiftRepository shiftRepository;

    public ShiftQueryService(ShiftRepository shiftRepository) {
        this.shiftRepository = shiftRepository;
    }

    public ShiftView get(Long shiftId) {
        return shiftRepository.findById(shiftId)
                .map(ShiftView::from)
                .orElseThrow(() -> ResourceNotFoundException.shift(shiftId));
    }

    public ShiftPage findAll(ShiftPageQuery query) {
        return findAll(query, Sort.Direction.DESC);
    }

    public ShiftPage findAll(ShiftPageQuery query, Sort.Direction defaultDirection) {
        return findPage(null, query, defaultDirection);
    }

    public ShiftPage findForWorker(Long workerId, ShiftPageQuery query) {
        return findForWorker(workerId, query, Sort.Direction.DESC);
    }

    public ShiftPage findForWorker(Long workerId, ShiftPageQuery query, Sort.Direction defaultDirection) {
        if (workerId == null) {
            throw new IllegalArgumentException("Worker id is required");
        }
        return findPage(workerId, query, defaultDirection);
    }

    private ShiftPage findPage(Long workerId, ShiftPageQuery query, Sort.Direction defaultDirection) {
        ShiftPageQuery q = query == null ? ShiftPageQuery.defaults() : query;
        int page = q.pageOrDefault();
        int limit = q.limitOrDefault();
        if ((long) (page - 1) * limit > Integer.MAX_VALUE) {
            // offset beyond what the store can skip to; nothing can be there
            return new ShiftPage(List.of(), ShiftPage.Pagination.of(page, limit, count(workerId, q.status())));
        }
        Pageable pageable = PageRequest.of(page - 1, limit, q.toSort(defaultDirection));

        Page<Shift> result;
        if (workerId == null) {
            result = q.status() == null
                    ? shiftRepository.findAll(pageable)
                    : shiftRepository.findByStatus(q.status(), pageable);
        } else {
            result = q.status() == null
                    ? shiftRepository.findByWorker_Id(workerId, pageable)
                    : shiftRepository.findByWorker_IdAndStatus(workerId, q.status(), pageable);
        }

        List<ShiftView> shifts = result.getContent().stream().map(ShiftView::from).toList();
        return new ShiftPage(shifts, ShiftPage.Pagination.of(page, limit, result.getTotalElements()));
    }

    private long count(Long workerId, ShiftStatus status) {
        if (workerId == null) {
            return status == null ? shiftRepository.count() : shiftRepository.countByStatus(status);
        }
        return status == null
                ? shiftRepository.countByWorker_Id(workerId)
                : shiftRepository.countByWorker_IdAndStatus(workerId, status);
    }
}
