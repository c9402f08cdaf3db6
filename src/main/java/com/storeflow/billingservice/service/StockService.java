package com.storeflow.billingservice.service;

import com.storeflow.billingservice.dto.request.StockAdjustmentRequest;
import com.storeflow.billingservice.dto.response.ProductStockResponse;
import com.storeflow.billingservice.exception.InvalidRequestException;
import com.storeflow.billingservice.exception.ResourceNotFoundException;
import com.storeflow.common.model.Product;
import com.storeflow.common.repository.ProductRepository;
import com.storeflow.common.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class StockService {

    private final DocumentStore documentStore;
    private final ProductRepository productRepository;
    private final StatusProjection statusProjection;

    public List<ProductStockResponse> listStock() {
        return productRepository.findAll().stream()
                .sorted(Comparator.comparing(Product::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
                .map(product -> ProductStockResponse.from(product, statusProjection.stockStatus(product.getStock())))
                .collect(Collectors.toList());
    }

    /**
     * Applies a manual stock correction. Subtracting more than is on hand leaves the product at zero.
     */
    public ProductStockResponse adjustStock(String productId, StockAdjustmentRequest request) {
        Product adjusted = documentStore.runTransaction(transaction -> {
            Product product = productRepository.findById(transaction, productId)
                    .orElseThrow(() -> new ResourceNotFoundException("Product with ID " + productId + " not found."));
            int newStock;
            switch (request.getMode()) {
                case SET:
                    newStock = request.getValue();
                    break;
                case ADD:
                    try {
                        newStock = Math.addExact(product.getStock(), request.getValue());
                    } catch (ArithmeticException e) {
                        throw new InvalidRequestException("Stock for product " + productId + " would exceed the supported maximum");
                    }
                    break;
                case SUBTRACT:
                    newStock = Math.max(0, product.getStock() - request.getValue());
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported adjustment mode: " + request.getMode());
            }
            productRepository.updateStockInTransaction(transaction, productId, newStock);
            return product.toBuilder().stock(newStock).build();
        });
        log.info("Stock for product {} adjusted ({} {}) to {}", productId, request.getMode(), request.getValue(), adjusted.getStock());
        return ProductStockResponse.from(adjusted, statusProjection.stockStatus(adjusted.getStock()));
    }
}
