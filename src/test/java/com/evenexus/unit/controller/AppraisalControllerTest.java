package com.evenexus.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.evenexus.api.controller.AppraisalController;
import com.evenexus.appraisal.AppraisalService;
import com.evenexus.appraisal.DiscountSetting;
import com.evenexus.appraisal.ValuationPresenter;
import com.evenexus.config.AppraisalConfig;
import com.evenexus.domain.model.ItemValuation;
import com.evenexus.domain.model.PortfolioValuation;
import com.evenexus.domain.model.TradingHub;
import com.evenexus.exception.GlobalExceptionHandler;
import com.evenexus.exception.MarketDataException;
import com.evenexus.exception.ValuationCancelledException;
import com.evenexus.mapper.AppraisalResponseMapper;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for AppraisalController: response envelope, request validation,
 * discount resolution, and error mapping.
 */
@ExtendWith(MockitoExtension.class)
class AppraisalControllerTest {

    @Mock
    private AppraisalService appraisalService;

    @Mock
    private DiscountSetting discountSetting;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AppraisalConfig config = new AppraisalConfig();
        AppraisalController controller = new AppraisalController(
                appraisalService,
                discountSetting,
                new ValuationPresenter(config),
                Mappers.getMapper(AppraisalResponseMapper.class),
                config);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("POST /api/appraisals")
    class Appraise {

        @Test
        @DisplayName("Returns wrapped totals for the default hub")
        void appraisesAtDefaultHub() throws Exception {
            when(discountSetting.resolve(null)).thenReturn(100);
            when(appraisalService.valuate(anyList(), eq(TradingHub.jita()), eq(100))).thenReturn(valuation());

            mockMvc.perform(post("/api/appraisals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"items":[{"typeId":34,"quantity":10},{"typeId":35,"quantity":5}]}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.totalBuyExecution").value(1000.5))
                    .andExpect(jsonPath("$.data.totalSellExecution").value(1100.5))
                    .andExpect(jsonPath("$.data.totalMidExecution").value(1050.5))
                    .andExpect(jsonPath("$.data.hasInsufficientLiquidity").value(true))
                    .andExpect(jsonPath("$.data.itemsWithoutOrders").value(1))
                    .andExpect(jsonPath("$.data.regionId").value(10000002))
                    .andExpect(jsonPath("$.data.systemId").value(30000142))
                    .andExpect(jsonPath("$.data.items.length()").value(2))
                    .andExpect(jsonPath("$.data.items[1].averageBuyPrice").doesNotExist())
                    .andExpect(jsonPath("$.warnings.length()").value(3))
                    .andExpect(jsonPath("$.warnings[0]").value("INSUFFICIENT_BUY_LIQUIDITY"))
                    .andExpect(jsonPath("$.warnings[1]").value("INSUFFICIENT_SELL_LIQUIDITY"))
                    .andExpect(jsonPath("$.warnings[2]").value("ITEMS_WITHOUT_ORDERS"));
        }

        @Test
        @DisplayName("Fully filled valuation carries no warnings")
        void liquidValuationHasNoWarnings() throws Exception {
            PortfolioValuation liquid = valuation().toBuilder()
                    .insufficientLiquidity(false)
                    .insufficientBuyLiquidity(false)
                    .insufficientSellLiquidity(false)
                    .itemsWithoutOrders(0)
                    .build();
            when(discountSetting.resolve(null)).thenReturn(100);
            when(appraisalService.valuate(anyList(), eq(TradingHub.jita()), eq(100))).thenReturn(liquid);

            mockMvc.perform(post("/api/appraisals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"items":[{"typeId":34,"quantity":10}]}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.warnings").doesNotExist());
        }

        @Test
        @DisplayName("Sell-side shortfall alone reports only the sell warning")
        void sellShortfallOnly() throws Exception {
            PortfolioValuation sellShort = valuation().toBuilder()
                    .insufficientBuyLiquidity(false)
                    .itemsWithoutOrders(0)
                    .build();
            when(discountSetting.resolve(null)).thenReturn(100);
            when(appraisalService.valuate(anyList(), eq(TradingHub.jita()), eq(100))).thenReturn(sellShort);

            mockMvc.perform(post("/api/appraisals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"items":[{"typeId":34,"quantity":10}]}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.warnings.length()").value(1))
                    .andExpect(jsonPath("$.warnings[0]").value("INSUFFICIENT_SELL_LIQUIDITY"));
        }

        @Test
        @DisplayName("Explicit hub and discount are passed through")
        void explicitHubAndDiscount() throws Exception {
            when(discountSetting.resolve(80)).thenReturn(80);
            when(appraisalService.valuate(anyList(), eq(TradingHub.of(10_000_043, 30_002_187)), eq(80)))
                    .thenReturn(valuation());

            mockMvc.perform(post("/api/appraisals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"items":[{"typeId":34,"quantity":1}],"regionId":10000043,"systemId":30002187,"discountPercent":80}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.regionId").value(10000043));

            verify(appraisalService).valuate(anyList(), eq(TradingHub.of(10_000_043, 30_002_187)), eq(80));
        }

        @Test
        @DisplayName("Empty item list is a validation error")
        void emptyItems() throws Exception {
            mockMvc.perform(post("/api/appraisals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"items":[]}
                            """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.status").value(400))
                    .andExpect(jsonPath("$.error.retryable").value(false))
                    .andExpect(jsonPath("$.error.details.items").exists());
            verifyNoInteractions(appraisalService);
        }

        @Test
        @DisplayName("Negative quantity is a validation error")
        void negativeQuantity() throws Exception {
            mockMvc.perform(post("/api/appraisals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"items":[{"typeId":34,"quantity":-1}]}
                            """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
            verifyNoInteractions(appraisalService);
        }

        @Test
        @DisplayName("Non-positive region is a validation error")
        void invalidRegion() throws Exception {
            mockMvc.perform(post("/api/appraisals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"items":[{"typeId":34,"quantity":1}],"regionId":0}
                            """))
                    .andExpect(status().isBadRequest());
            verifyNoInteractions(appraisalService);
        }

        @Test
        @DisplayName("Malformed JSON is a bad request")
        void malformedBody() throws Exception {
            mockMvc.perform(post("/api/appraisals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"items\":"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
        }

        @Test
        @DisplayName("Cancelled valuation maps to VALUATION_CANCELLED")
        void cancelled() throws Exception {
            when(discountSetting.resolve(null)).thenReturn(100);
            when(appraisalService.valuate(anyList(), any(TradingHub.class), eq(100)))
                    .thenThrow(new ValuationCancelledException("Order book fetch interrupted"));

            mockMvc.perform(post("/api/appraisals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"items":[{"typeId":34,"quantity":1}]}
                            """))
                    .andExpect(status().is(499))
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("VALUATION_CANCELLED"))
                    .andExpect(jsonPath("$.error.status").value(499))
                    .andExpect(jsonPath("$.error.retryable").value(true))
                    .andExpect(jsonPath("$.data").doesNotExist())
                    .andExpect(jsonPath("$.error.path").value("/api/appraisals"));
        }

        @Test
        @DisplayName("Market data failure maps to 502")
        void marketDataFailure() throws Exception {
            when(discountSetting.resolve(null)).thenReturn(100);
            when(appraisalService.valuate(anyList(), any(TradingHub.class), eq(100)))
                    .thenThrow(new MarketDataException("ESI unavailable"));

            mockMvc.perform(post("/api/appraisals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"items":[{"typeId":34,"quantity":1}]}
                            """))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.error.code").value("MARKET_DATA_ERROR"))
                    .andExpect(jsonPath("$.error.status").value(502))
                    .andExpect(jsonPath("$.error.retryable").value(true));
        }
    }

    @Nested
    @DisplayName("Discount endpoints")
    class Discount {

        @Test
        @DisplayName("GET returns the session percent, cap and multiplier")
        void getDiscount() throws Exception {
            when(discountSetting.getPercent()).thenReturn(90);

            mockMvc.perform(get("/api/appraisals/discount"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.percent").value(90))
                    .andExpect(jsonPath("$.data.effectivePercent").value(90))
                    .andExpect(jsonPath("$.data.cap").value(99999))
                    .andExpect(jsonPath("$.data.multiplier").value(0.9));
        }

        @Test
        @DisplayName("PUT with valid text reports accepted")
        void acceptsValid() throws Exception {
            when(discountSetting.accept("50")).thenReturn(true);
            when(discountSetting.getPercent()).thenReturn(50);

            mockMvc.perform(put("/api/appraisals/discount")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"value":"50"}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.accepted").value(true))
                    .andExpect(jsonPath("$.data.percent").value(50))
                    .andExpect(jsonPath("$.data.multiplier").value(0.5))
                    .andExpect(jsonPath("$.warnings").doesNotExist());
        }

        @Test
        @DisplayName("PUT with invalid text keeps the previous percent and still returns 200")
        void rejectsInvalid() throws Exception {
            when(discountSetting.accept("150000")).thenReturn(false);
            when(discountSetting.getPercent()).thenReturn(50);

            mockMvc.perform(put("/api/appraisals/discount")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"value":"150000"}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.accepted").value(false))
                    .andExpect(jsonPath("$.data.percent").value(50))
                    .andExpect(jsonPath("$.warnings[0]").value("DISCOUNT_REJECTED"));
        }

        @Test
        @DisplayName("PUT without a value is a validation error")
        void missingValue() throws Exception {
            mockMvc.perform(put("/api/appraisals/discount")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest());
            verifyNoInteractions(discountSetting);
        }
    }

    private static PortfolioValuation valuation() {
        ItemValuation filled = ItemValuation.builder()
                .typeId(34)
                .demandedQuantity(10)
                .buyExecutionTotal(new BigDecimal("1000.5"))
                .sellExecutionTotal(new BigDecimal("1100.5"))
                .filledBuyQuantity(10)
                .filledSellQuantity(10)
                .hubOrdersPresent(true)
                .build();
        return PortfolioValuation.builder()
                .totalBuyExecution(new BigDecimal("1000.5"))
                .totalSellExecution(new BigDecimal("1100.5"))
                .totalMidExecution(new BigDecimal("1050.5"))
                .insufficientLiquidity(true)
                .insufficientBuyLiquidity(true)
                .insufficientSellLiquidity(true)
                .itemsWithoutOrders(1)
                .discountPercent(100)
                .items(List.of(filled, ItemValuation.empty(35, 5)))
                .build();
    }
}
