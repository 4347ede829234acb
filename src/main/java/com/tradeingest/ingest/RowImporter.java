package com.tradeingest.ingest;

import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.domain.model.NormalizedOrder;
import com.tradeingest.domain.model.NormalizedTrade;
import com.tradeingest.entity.OrderEntity;
import com.tradeingest.entity.TradeEntity;
import com.tradeingest.mapper.OrderMapper;
import com.tradeingest.mapper.TradeMapper;
import com.tradeingest.repository.jpa.OrderJpaRepository;
import com.tradeingest.repository.jpa.TradeJpaRepository;
import com.tradeingest.transform.MappedRow;
import com.tradeingest.transform.MappingApplier;
import com.tradeingest.transform.OrderNormalizer;
import com.tradeingest.transform.RowRejectedException;
import com.tradeingest.transform.StandardTradeNormalizer;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Writes the rows of one batch. Each row is normalized, checked against already-imported records and
 * saved on its own, so a bad row only adds an error to the tally and never aborts the batch.
 */
@Component
public class RowImporter {

    private static final Logger log = LoggerFactory.getLogger(RowImporter.class);

    private final MappingApplier mappingApplier;
    private final OrderNormalizer orderNormalizer;
    private final StandardTradeNormalizer standardTradeNormalizer;
    private final DuplicateGuard duplicateGuard;
    private final OrderJpaRepository orderJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;
    private final OrderMapper orderMapper;
    private final TradeMapper tradeMapper;

    public RowImporter(
            MappingApplier mappingApplier,
            OrderNormalizer orderNormalizer,
            StandardTradeNormalizer standardTradeNormalizer,
            DuplicateGuard duplicateGuard,
            OrderJpaRepository orderJpaRepository,
            TradeJpaRepository tradeJpaRepository,
            OrderMapper orderMapper,
            TradeMapper tradeMapper) {
        this.mappingApplier = mappingApplier;
        this.orderNormalizer = orderNormalizer;
        this.standardTradeNormalizer = standardTradeNormalizer;
        this.duplicateGuard = duplicateGuard;
        this.orderJpaRepository = orderJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
        this.orderMapper = orderMapper;
        this.tradeMapper = tradeMapper;
    }

    /** Applies the column mappings to every row and stores the resulting orders. */
    public void importMappedRows(
            ImportContext context, List<Map<String, String>> rows, List<ColumnMapping> mappings, ImportTally tally) {
        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            try {
                MappedRow mapped = mappingApplier.apply(rows.get(i), mappings);
                NormalizedOrder order = orderNormalizer.normalize(mapped, context.accountTags());
                if (order.getOrderId() == null) {
                    order.setOrderId(context.batchId() + "-" + rowNumber);
                }
                saveOrder(context, order, tally);
            } catch (RowRejectedException e) {
                tally.rowError(rowNumber, e.getMessage());
            } catch (DataAccessException e) {
                log.error("Failed to store row {} of batch {}", rowNumber, context.batchId(), e);
                tally.rowError(rowNumber, "Could not be stored: " + e.getMostSpecificCause().getMessage());
            }
        }
    }

    /** Stores orders already normalized by a section parser. {@code label} names the section in errors. */
    public void importOrders(ImportContext context, List<NormalizedOrder> orders, String label, ImportTally tally) {
        for (int i = 0; i < orders.size(); i++) {
            NormalizedOrder order = orders.get(i);
            List<String> tags = new ArrayList<>(order.getTags());
            tags.addAll(context.accountTags());
            order.setTags(tags);
            if (order.getOrderId() == null) {
                String section = label.replace(' ', '-').toLowerCase(Locale.ROOT);
                order.setOrderId(context.batchId() + "-" + section + "-" + (i + 1));
            }
            try {
                saveOrder(context, order, tally);
            } catch (DataAccessException e) {
                log.error("Failed to store {} row {} of batch {}", label, i + 1, context.batchId(), e);
                tally.error(label + " row " + (i + 1) + ": Could not be stored: "
                        + e.getMostSpecificCause().getMessage());
            }
        }
    }

    /** Stores rows of the fixed standard schema as trades. */
    public void importStandardTrades(ImportContext context, List<Map<String, String>> rows, ImportTally tally) {
        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            try {
                NormalizedTrade trade = standardTradeNormalizer.normalize(rows.get(i), context.accountTags());
                if (duplicateGuard.isDuplicate(context.userId(), trade, context.brokerType())) {
                    log.debug("Skipping duplicate trade: batch={} row={} symbol={}",
                            context.batchId(), rowNumber, trade.getSymbol());
                    tally.duplicate();
                    continue;
                }
                TradeEntity entity =
                        tradeMapper.toEntity(trade, context.userId(), context.batchId(), context.brokerType());
                entity.setId(UUID.randomUUID().toString());
                entity.setCreatedAt(LocalDateTime.now());
                tradeJpaRepository.save(entity);
                tally.success();
            } catch (RowRejectedException e) {
                tally.rowError(rowNumber, e.getMessage());
            } catch (DataAccessException e) {
                log.error("Failed to store row {} of batch {}", rowNumber, context.batchId(), e);
                tally.rowError(rowNumber, "Could not be stored: " + e.getMostSpecificCause().getMessage());
            }
        }
    }

    private void saveOrder(ImportContext context, NormalizedOrder order, ImportTally tally) {
        if (duplicateGuard.isDuplicate(context.userId(), order, context.brokerType())) {
            log.debug("Skipping duplicate order: batch={} symbol={} orderId={}",
                    context.batchId(), order.getSymbol(), order.getOrderId());
            tally.duplicate();
            return;
        }
        OrderEntity entity = orderMapper.toEntity(order, context.userId(), context.batchId(), context.brokerType());
        entity.setId(UUID.randomUUID().toString());
        entity.setResolvedExecutionTime(DuplicateGuard.resolvedExecutionTime(order));
        entity.setCreatedAt(LocalDateTime.now());
        orderJpaRepository.save(entity);
        tally.success();
    }
}
