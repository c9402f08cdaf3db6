package com.storeflow.billingservice.service;

import com.storeflow.billingservice.dto.request.StockAdjustmentRequest;
import com.storeflow.billingservice.dto.response.ProductStockResponse;
import com.storeflow.billingservice.exception.InvalidRequestException;
import com.storeflow.billingservice.exception.ResourceNotFoundException;
import com.storeflow.common.model.StockAdjustmentMode;
import com.storeflow.common.model.StockStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StockServiceTest {

    private BillingTestFixture fixture;
    private StockService stockService;

    @BeforeEach
    void setUp() {
        fixture = new BillingTestFixture();
        stockService = fixture.stockService();
        fixture.product("b", "10.00", 25);
        fixture.product("a", "10.00", 4);
        fixture.product("c", "10.00", 0);
    }

    @Test
    void listStock_projectsStatusForEveryProduct() {
        List<ProductStockResponse> stock = stockService.listStock();

        assertThat(stock).extracting(ProductStockResponse::getProductId).containsExactly("a", "b", "c");
        assertThat(stock).extracting(ProductStockResponse::getStockStatus)
                .containsExactly(StockStatus.LOW_STOCK, StockStatus.IN_STOCK, StockStatus.OUT_OF_STOCK);
    }

    @Test
    void adjustStock_setAddAndSubtract() {
        assertThat(stockService.adjustStock("a", new StockAdjustmentRequest(StockAdjustmentMode.SET, 12)).getStock()).isEqualTo(12);
        assertThat(stockService.adjustStock("a", new StockAdjustmentRequest(StockAdjustmentMode.ADD, 3)).getStock()).isEqualTo(15);
        ProductStockResponse after = stockService.adjustStock("a", new StockAdjustmentRequest(StockAdjustmentMode.SUBTRACT, 6));

        assertThat(after.getStock()).isEqualTo(9);
        assertThat(after.getStockStatus()).isEqualTo(StockStatus.LOW_STOCK);
        assertThat(fixture.stockOf("a")).isEqualTo(9);
    }

    @Test
    void adjustStock_subtractMoreThanOnHand_clampsAtZero() {
        ProductStockResponse after = stockService.adjustStock("a", new StockAdjustmentRequest(StockAdjustmentMode.SUBTRACT, 10));

        assertThat(after.getStock()).isZero();
        assertThat(after.getStockStatus()).isEqualTo(StockStatus.OUT_OF_STOCK);
        assertThat(fixture.stockOf("a")).isZero();
    }

    @Test
    void adjustStock_addBeyondIntRange_isRejected() {
        assertThatThrownBy(() -> stockService.adjustStock("b", new StockAdjustmentRequest(StockAdjustmentMode.ADD, Integer.MAX_VALUE)))
                .isInstanceOf(InvalidRequestException.class);

        assertThat(fixture.stockOf("b")).isEqualTo(25);
    }

    @Test
    void adjustStock_unknownProduct_isNotFound() {
        assertThatThrownBy(() -> stockService.adjustStock("zzz", new StockAdjustmentRequest(StockAdjustmentMode.ADD, 1)))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
