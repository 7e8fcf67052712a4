package com.example.rota.shift;

import com.example.rota.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconciles a mixed list of creates and updates.
 * <p>
 * Items run strictly in input order, each in its own transaction through
 * {@link ShiftCommandService}. A failing item is recorded under {@code errors}
 * with its input index and the batch carries on; nothing already committed is
 * rolled back. This class is not transactional.
 */
@Service
public class ShiftBatchService {

    private static final Logger logger = LoggerFactory.getLogger(ShiftBatchService.class);

    static final String UNKNOWN_ERROR = "UNKNOWN_ERROR";

    private final ShiftCommandService commandService;

    public ShiftBatchService(ShiftCommandService commandService) {
        this.commandService = commandService;
    }

    public BatchShiftResult reconcile(List<BatchShiftItem> items) {
        List<ShiftView> created = new ArrayList<>();
        List<ShiftView> updated = new ArrayList<>();
        List<BatchShiftResult.ItemError> errors = new ArrayList<>();

        for (int i = 0; i < items.size(); i++) {
            BatchShiftItem item = items.get(i);
            try {
                if (item.isUpdate()) {
                    updated.add(commandService.update(item.id(), item.toPatch()));
                } else {
                    created.add(commandService.create(item.toRequest()));
                }
            } catch (BusinessException e) {
                errors.add(new BatchShiftResult.ItemError(i, item,
                        new BatchShiftResult.ErrorDetail(e.getMessage(), e.getErrorCode())));
            } catch (RuntimeException e) {
                logger.warn("Batch item {} failed unexpectedly", i, e);
                errors.add(new BatchShiftResult.ItemError(i, item,
                        new BatchShiftResult.ErrorDetail(e.getMessage(), UNKNOWN_ERROR)));
            }
        }

        logger.info("Batch processed: items={}, created={}, updated={}, errors={}",
                items.size(), created.size(), updated.size(), errors.size());
        return new BatchShiftResult(created, updated, errors);
    }
}
