package com.storeflow.billingservice.service;

import com.storeflow.billingservice.config.BillingProperties;
import com.storeflow.billingservice.exception.InsufficientStockException;
import com.storeflow.billingservice.exception.InvalidRequestException;
import com.storeflow.billingservice.exception.ResourceNotFoundException;
import com.storeflow.billingservice.exception.StockShortfall;
import com.storeflow.common.model.Customer;
import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceLine;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.model.Product;
import com.storeflow.common.repository.CustomerRepository;
import com.storeflow.common.repository.InvoiceRepository;
import com.storeflow.common.repository.ProductRepository;
import com.storeflow.common.store.ConflictException;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.util.IdGenerator;
import com.storeflow.common.util.IsoDates;
import com.storeflow.common.util.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creates, edits and deletes bills. Each operation reads the invoice, the customer and every
 * affected product, checks stock, prices the lines and writes the invoice together with the new
 * stock levels in a single store transaction, so either all of it lands or none of it does.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillTransactionCoordinator {

    private final DocumentStore documentStore;
    private final InvoiceRepository invoiceRepository;
    private final ProductRepository productRepository;
    private final CustomerRepository customerRepository;
    private final StockDeltaResolver stockDeltaResolver;
    private final TaxCalculator taxCalculator;
    private final BillingProperties properties;
    private final Clock clock;

    public Invoice createBill(String customerId, List<InvoiceLine> items, String userId) {
        return commitBill(BillCommand.builder()
                .customerId(customerId)
                .targetLines(items)
                .taxInputs(defaultTaxInputs())
                .userId(userId)
                .build());
    }

    public Invoice updateBill(String invoiceId, String customerId, List<InvoiceLine> expectedPreviousItems,
                              List<InvoiceLine> items, String userId) {
        return commitBill(BillCommand.builder()
                .invoiceId(invoiceId)
                .customerId(customerId)
                .expectedPreviousLines(expectedPreviousItems)
                .targetLines(items)
                .taxInputs(defaultTaxInputs())
                .userId(userId)
                .build());
    }

    public Invoice commitBill(BillCommand command) {
        List<InvoiceLine> targetLines = validate(command);
        TaxInputs taxInputs = command.getTaxInputs() != null ? command.getTaxInputs() : defaultTaxInputs();
        boolean editing = command.getInvoiceId() != null;

        try {
            Invoice committed = documentStore.runTransaction(transaction -> {
                // ===================================================================
                // PHASE 1: ALL DATABASE READS
                // ===================================================================
                Invoice existing = null;
                List<InvoiceLine> previousLines = Collections.emptyList();
                if (editing) {
                    existing = invoiceRepository.findById(transaction, command.getInvoiceId())
                            .orElseThrow(() -> new ResourceNotFoundException("Invoice with ID " + command.getInvoiceId() + " not found."));
                    if (existing.getStatus() == InvoiceStatus.CANCELLED) {
                        throw new IllegalStateException("Cannot edit invoice " + existing.getInvoiceNumber() + " because it has been cancelled.");
                    }
                    previousLines = existing.getLines() == null ? Collections.emptyList() : existing.getLines();
                    if (command.getExpectedPreviousLines() != null && !sameQuantities(command.getExpectedPreviousLines(), previousLines)) {
                        throw new ConflictException("Invoice " + existing.getInvoiceId() + " was changed since it was loaded. Reload it and try again.");
                    }
                }

                Map<String, Integer> deltas = stockDeltaResolver.resolveDeltas(previousLines, targetLines);
                Set<String> productIds = new LinkedHashSet<>();
                targetLines.forEach(line -> productIds.add(line.getProductId()));
                productIds.addAll(deltas.keySet());
                Map<String, Product> products = productRepository.findAllById(transaction, productIds);

                Customer customer = customerRepository.findById(transaction, command.getCustomerId())
                        .orElseThrow(() -> new ResourceNotFoundException("Customer with ID " + command.getCustomerId() + " not found."));

                // --- All database reads are now complete. ---

                // ===================================================================
                // PHASE 2: IN-MEMORY VALIDATION AND CALCULATION
                // ===================================================================
                for (InvoiceLine line : targetLines) {
                    if (!products.containsKey(line.getProductId())) {
                        throw new ResourceNotFoundException("Product with ID " + line.getProductId() + " not found.");
                    }
                }

                Map<String, Integer> currentStock = new HashMap<>();
                products.forEach((id, product) -> currentStock.put(id, product.getStock()));
                List<StockShortfall> shortfalls = stockDeltaResolver.findShortfalls(deltas, currentStock);
                if (!shortfalls.isEmpty()) {
                    throw new InsufficientStockException(shortfalls);
                }

                Map<String, BigDecimal> previousPrices = new HashMap<>();
                for (InvoiceLine line : previousLines) {
                    previousPrices.putIfAbsent(line.getProductId(), line.getUnitPrice());
                }

                List<InvoiceLine> pricedLines = new ArrayList<>();
                BigDecimal subTotal = BigDecimal.ZERO;
                for (InvoiceLine line : targetLines) {
                    Product product = products.get(line.getProductId());
                    BigDecimal unitPrice = resolveUnitPrice(line, previousPrices.get(line.getProductId()), product);
                    BigDecimal lineTotal = unitPrice.multiply(BigDecimal.valueOf(line.getQuantity()));
                    subTotal = subTotal.add(lineTotal);
                    pricedLines.add(InvoiceLine.builder()
                            .productId(product.getProductId())
                            .name(product.getName())
                            .unitOfMeasure(product.getUnitOfMeasure())
                            .quantity(line.getQuantity())
                            .unitPrice(Money.round(unitPrice))
                            .lineTotal(Money.round(lineTotal))
                            .build());
                }
                subTotal = Money.round(subTotal);
                TaxBreakdown tax = taxCalculator.computeTax(subTotal, customer.getJurisdictionCode(), taxInputs);

                String now = IsoDates.now(clock);
                Invoice.InvoiceBuilder invoice = existing != null
                        ? existing.toBuilder().updatedIsoDate(now)
                        : Invoice.builder()
                            .invoiceId(IdGenerator.newId("inv"))
                            .invoiceNumber(IdGenerator.newInvoiceNumber(clock))
                            .status(InvoiceStatus.PENDING)
                            .createdIsoDate(now)
                            .createdBy(command.getUserId());
                Invoice result = invoice
                        .customerId(customer.getCustomerId())
                        .customerName(customer.getName())
                        .lines(pricedLines)
                        .subTotal(subTotal)
                        .cgst(tax.getCgst())
                        .sgst(tax.getSgst())
                        .igst(tax.getIgst())
                        .grandTotal(subTotal.add(tax.getTotal()))
                        .build();

                // ===================================================================
                // PHASE 3: STAGE ALL WRITES
                // ===================================================================
                deltas.forEach((productId, delta) -> {
                    Product product = products.get(productId);
                    if (product == null) {
                        log.warn("Product {} no longer exists; {} unit(s) not returned to stock", productId, delta);
                        return;
                    }
                    productRepository.updateStockInTransaction(transaction, productId,
                            stockDeltaResolver.applyDelta(productId, product.getStock(), delta));
                });
                invoiceRepository.saveInTransaction(transaction, result);
                return result;
            });

            log.info("{} invoice {} ({}) for customer {}: {} line(s), grand total {}",
                    editing ? "Updated" : "Created", committed.getInvoiceNumber(), committed.getInvoiceId(),
                    committed.getCustomerId(), committed.getLines().size(), committed.getGrandTotal());
            return committed;
        } catch (InsufficientStockException | ConflictException e) {
            log.warn("Bill commit rejected for customer {}: {}", command.getCustomerId(), e.getMessage());
            throw e;
        }
    }

    /**
     * Deletes a bill and returns every billed unit to stock. Products that have since been removed
     * from the catalog are skipped.
     */
    public void deleteBill(String invoiceId) {
        documentStore.runTransaction(transaction -> {
            Invoice invoice = invoiceRepository.findById(transaction, invoiceId)
                    .orElseThrow(() -> new ResourceNotFoundException("Invoice with ID " + invoiceId + " not found."));
            List<InvoiceLine> lines = invoice.getLines() == null ? Collections.emptyList() : invoice.getLines();
            Map<String, Integer> deltas = stockDeltaResolver.resolveDeltas(lines, Collections.emptyList());
            Map<String, Product> products = productRepository.findAllById(transaction, deltas.keySet());

            deltas.forEach((productId, delta) -> {
                Product product = products.get(productId);
                if (product == null) {
                    log.warn("Product {} from invoice {} no longer exists; skipping stock restore", productId, invoiceId);
                    return;
                }
                productRepository.updateStockInTransaction(transaction, productId,
                            stockDeltaResolver.applyDelta(productId, product.getStock(), delta));
            });
            invoiceRepository.deleteInTransaction(transaction, invoiceId);
            return null;
        });
        log.info("Deleted invoice {} and restored its stock", invoiceId);
    }

    private List<InvoiceLine> validate(BillCommand command) {
        if (!StringUtils.hasText(command.getCustomerId())) {
            throw new InvalidRequestException("No customer selected");
        }
        if (command.getInvoiceId() != null && !StringUtils.hasText(command.getInvoiceId())) {
            throw new InvalidRequestException("Invoice id must not be blank");
        }
        List<InvoiceLine> lines = command.getTargetLines() == null ? Collections.emptyList()
                : command.getTargetLines().stream()
                    .filter(line -> line.getQuantity() > 0)
                    .collect(Collectors.toList());
        if (lines.isEmpty()) {
            throw new InvalidRequestException("A bill needs at least one item with a positive quantity");
        }
        for (InvoiceLine line : lines) {
            if (!StringUtils.hasText(line.getProductId())) {
                throw new InvalidRequestException("Every bill item must reference a product");
            }
            if (line.getUnitPrice() != null && line.getUnitPrice().signum() < 0) {
                throw new InvalidRequestException("Unit price for product " + line.getProductId() + " cannot be negative");
            }
        }
        // Rejects duplicate lines whose combined quantity overflows before anything is read.
        stockDeltaResolver.quantitiesByProduct(lines);
        return lines;
    }

    private boolean sameQuantities(List<InvoiceLine> expected, List<InvoiceLine> stored) {
        return stockDeltaResolver.quantitiesByProduct(expected).equals(stockDeltaResolver.quantitiesByProduct(stored));
    }

    private static BigDecimal resolveUnitPrice(InvoiceLine line, BigDecimal previousPrice, Product product) {
        if (line.getUnitPrice() != null) {
            return line.getUnitPrice();
        }
        if (previousPrice != null) {
            return previousPrice;
        }
        return Money.nullToZero(product.getUnitPrice());
    }

    private TaxInputs defaultTaxInputs() {
        return new TaxInputs(properties.getHomeJurisdiction(), properties.getGstRate());
    }
}
