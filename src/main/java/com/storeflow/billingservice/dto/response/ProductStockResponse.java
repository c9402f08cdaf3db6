package com.storeflow.billingservice.dto.response;

import com.storeflow.common.model.Product;
import com.storeflow.common.model.StockStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class ProductStockResponse {

    private String productId;
    private String name;
    private String sku;
    private String category;
    private String unitOfMeasure;
    private BigDecimal unitPrice;
    private int stock;
    private StockStatus stockStatus;

    public static ProductStockResponse from(Product product, StockStatus stockStatus) {
        return ProductStockResponse.builder()
                .productId(product.getProductId())
                .name(product.getName())
                .sku(product.getSku())
                .category(product.getCategory())
                .unitOfMeasure(product.getUnitOfMeasure())
                .unitPrice(product.getUnitPrice())
                .stock(product.getStock())
                .stockStatus(stockStatus)
                .build();
    }
}
