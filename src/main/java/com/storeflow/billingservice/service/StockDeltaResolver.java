package com.storeflow.billingservice.service;

import com.storeflow.billingservice.exception.InvalidRequestException;
import com.storeflow.billingservice.exception.StockShortfall;
import com.storeflow.common.model.InvoiceLine;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Works out how stock must move when a bill goes from one set of lines to another.
 * A negative delta takes units out of stock, a positive one puts them back.
 */
@Component
public class StockDeltaResolver {

    /**
     * @param previousLines the lines already committed, empty for a new bill
     * @param targetLines   the lines the bill should end up with, empty when deleting it
     * @return non-zero deltas keyed by product id, in first-seen order
     */
    public Map<String, Integer> resolveDeltas(List<InvoiceLine> previousLines, List<InvoiceLine> targetLines) {
        Map<String, Integer> previous = quantitiesByProduct(previousLines);
        Map<String, Integer> target = quantitiesByProduct(targetLines);

        Set<String> productIds = new LinkedHashSet<>(previous.keySet());
        productIds.addAll(target.keySet());

        Map<String, Integer> deltas = new LinkedHashMap<>();
        for (String productId : productIds) {
            int delta = previous.getOrDefault(productId, 0) - target.getOrDefault(productId, 0);
            if (delta != 0) {
                deltas.put(productId, delta);
            }
        }
        return deltas;
    }

    /**
     * Lists every product whose stock would drop below zero. Products absent from
     * {@code currentStock} are treated as having none.
     */
    public List<StockShortfall> findShortfalls(Map<String, Integer> deltas, Map<String, Integer> currentStock) {
        List<StockShortfall> shortfalls = new ArrayList<>();
        deltas.forEach((productId, delta) -> {
            int available = currentStock.getOrDefault(productId, 0);
            if ((long) available + delta < 0) {
                shortfalls.add(new StockShortfall(productId, -delta, available));
            }
        });
        return shortfalls;
    }

    /** Sums quantities per product, ignoring lines with a zero or negative quantity. */
    public Map<String, Integer> quantitiesByProduct(List<InvoiceLine> lines) {
        if (lines == null || lines.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Integer> quantities = new LinkedHashMap<>();
        for (InvoiceLine line : lines) {
            if (line.getQuantity() <= 0) {
                continue;
            }
            if (!StringUtils.hasText(line.getProductId())) {
                throw new InvalidRequestException("Every bill item must reference a product");
            }
            try {
                quantities.merge(line.getProductId(), line.getQuantity(), Math::addExact);
            } catch (ArithmeticException e) {
                throw new InvalidRequestException("Total quantity for product " + line.getProductId() + " is too large");
            }
        }
        return quantities;
    }

    /** Stock level after applying {@code delta}, rejecting results that do not fit in an {@code int}. */
    public int applyDelta(String productId, int currentStock, int delta) {
        try {
            return Math.addExact(currentStock, delta);
        } catch (ArithmeticException e) {
            throw new InvalidRequestException("Stock for product " + productId + " would exceed the supported maximum");
        }
    }
}
