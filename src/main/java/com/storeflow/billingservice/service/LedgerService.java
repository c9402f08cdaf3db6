package com.storeflow.billingservice.service;

import com.storeflow.billingservice.config.BillingProperties;
import com.storeflow.billingservice.dto.request.BillItemDto;
import com.storeflow.billingservice.dto.request.CreateLedgerEntryRequest;
import com.storeflow.billingservice.exception.InsufficientStockException;
import com.storeflow.billingservice.exception.InvalidRequestException;
import com.storeflow.billingservice.exception.ResourceNotFoundException;
import com.storeflow.billingservice.exception.StockShortfall;
import com.storeflow.common.model.Customer;
import com.storeflow.common.model.InvoiceLine;
import com.storeflow.common.model.LedgerEntityType;
import com.storeflow.common.model.LedgerEntry;
import com.storeflow.common.model.LedgerEntryType;
import com.storeflow.common.model.Product;
import com.storeflow.common.repository.CustomerRepository;
import com.storeflow.common.repository.LedgerEntryRepository;
import com.storeflow.common.repository.ProductRepository;
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
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The daily ledger: counter sales and stock purchases recorded outside of invoicing. A sale takes
 * its items out of stock and is taxed at the full GST rate; a purchase puts them back untaxed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    static final String UNKNOWN_CUSTOMER = "Unknown Customer";

    private final DocumentStore documentStore;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final ProductRepository productRepository;
    private final CustomerRepository customerRepository;
    private final StockDeltaResolver stockDeltaResolver;
    private final BillingProperties properties;
    private final Clock clock;

    public LedgerEntry recordEntry(CreateLedgerEntryRequest request, String userId) {
        List<InvoiceLine> items = request.getItems() == null ? Collections.emptyList()
                : request.getItems().stream()
                    .map(BillItemDto::toLine)
                    .filter(line -> line.getQuantity() > 0)
                    .collect(Collectors.toList());
        if (items.isEmpty()) {
            throw new InvalidRequestException("A ledger entry needs at least one item with a positive quantity");
        }
        boolean sale = request.getType() == LedgerEntryType.SALE;
        LocalDate date = request.getDate() != null ? request.getDate() : IsoDates.today(clock);

        LedgerEntry entry = documentStore.runTransaction(transaction -> {
            // Sales consume stock; purchases restock.
            Map<String, Integer> deltas = sale
                    ? stockDeltaResolver.resolveDeltas(Collections.emptyList(), items)
                    : stockDeltaResolver.resolveDeltas(items, Collections.emptyList());
            Set<String> productIds = new LinkedHashSet<>();
            items.forEach(line -> productIds.add(line.getProductId()));
            Map<String, Product> products = productRepository.findAllById(transaction, productIds);

            Optional<Customer> customer = Optional.empty();
            if (request.getEntityType() == LedgerEntityType.CUSTOMER && StringUtils.hasText(request.getEntityId())) {
                customer = customerRepository.findById(transaction, request.getEntityId());
            }

            for (String productId : productIds) {
                if (!products.containsKey(productId)) {
                    throw new ResourceNotFoundException("Product with ID " + productId + " not found.");
                }
            }
            Map<String, Integer> currentStock = new HashMap<>();
            products.forEach((id, product) -> currentStock.put(id, product.getStock()));
            List<StockShortfall> shortfalls = stockDeltaResolver.findShortfalls(deltas, currentStock);
            if (!shortfalls.isEmpty()) {
                throw new InsufficientStockException(shortfalls);
            }

            List<InvoiceLine> pricedItems = new ArrayList<>();
            BigDecimal subTotal = BigDecimal.ZERO;
            for (InvoiceLine line : items) {
                Product product = products.get(line.getProductId());
                BigDecimal unitPrice = line.getUnitPrice() != null ? line.getUnitPrice() : Money.nullToZero(product.getUnitPrice());
                BigDecimal lineTotal = unitPrice.multiply(BigDecimal.valueOf(line.getQuantity()));
                subTotal = subTotal.add(lineTotal);
                pricedItems.add(InvoiceLine.builder()
                        .productId(product.getProductId())
                        .name(product.getName())
                        .unitOfMeasure(product.getUnitOfMeasure())
                        .quantity(line.getQuantity())
                        .unitPrice(Money.round(unitPrice))
                        .lineTotal(Money.round(lineTotal))
                        .build());
            }
            subTotal = Money.round(subTotal);
            BigDecimal taxAmount = sale ? Money.round(subTotal.multiply(properties.getGstRate())) : Money.ZERO;

            LedgerEntry result = LedgerEntry.builder()
                    .entryId(IdGenerator.newId("led"))
                    .date(date.toString())
                    .type(request.getType())
                    .entityType(request.getEntityType())
                    .entityId(request.getEntityId())
                    .entityName(resolveEntityName(request, customer))
                    .items(pricedItems)
                    .subTotal(subTotal)
                    .taxAmount(taxAmount)
                    .grandTotal(subTotal.add(taxAmount))
                    .paymentMethod(request.getPaymentMethod())
                    .paymentStatus(request.getPaymentStatus())
                    .notes(request.getNotes())
                    .createdBy(userId)
                    .createdIsoDate(IsoDates.now(clock))
                    .build();

            deltas.forEach((productId, delta) ->
                    productRepository.updateStockInTransaction(transaction, productId,
                            stockDeltaResolver.applyDelta(productId, products.get(productId).getStock(), delta)));
            ledgerEntryRepository.saveInTransaction(transaction, result);
            return result;
        });

        log.info("Recorded {} ledger entry {} for {}: grand total {}", entry.getType(), entry.getEntryId(),
                entry.getEntityName(), entry.getGrandTotal());
        return entry;
    }

    public List<LedgerEntry> listEntries(LocalDate date) {
        return ledgerEntryRepository.findAllByDate(date.toString()).stream()
                .sorted(Comparator.comparing(LedgerEntry::getCreatedIsoDate, Comparator.nullsFirst(Comparator.<String>naturalOrder())).reversed())
                .collect(Collectors.toList());
    }

    private static String resolveEntityName(CreateLedgerEntryRequest request, Optional<Customer> customer) {
        if (request.getEntityType() == LedgerEntityType.UNKNOWN_CUSTOMER) {
            return UNKNOWN_CUSTOMER;
        }
        if (customer.isPresent()) {
            return customer.get().getName();
        }
        if (StringUtils.hasText(request.getEntityName())) {
            return request.getEntityName();
        }
        return request.getEntityType() == LedgerEntityType.CUSTOMER ? UNKNOWN_CUSTOMER : null;
    }
}
