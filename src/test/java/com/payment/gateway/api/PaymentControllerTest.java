package com.payment.gateway.api;

import com.payment.gateway.capability.BarcodePaymentService;
import com.payment.gateway.capability.BillDownloadService;
import com.payment.gateway.capability.PagePaymentService;
import com.payment.gateway.capability.ScanPaymentService;
import com.payment.gateway.capability.TradeService;
import com.payment.gateway.core.AuxiliaryValidationException;
import com.payment.gateway.core.GatewayOperationException;
import com.payment.gateway.domain.Auxiliary;
import com.payment.gateway.domain.AuxiliaryType;
import com.payment.gateway.domain.BarcodePaymentResult;
import com.payment.gateway.domain.BillFile;
import com.payment.gateway.domain.Notify;
import com.payment.gateway.domain.Order;
import com.payment.gateway.domain.PaymentOutcome;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.client.ResourceAccessException;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for PaymentController using MockMvc.
 */
@WebMvcTest(controllers = PaymentController.class)
class PaymentControllerTest {

    private static final String ORDER = """
            {
              "outTradeNo": "T100",
              "totalAmount": 88.88,
              "subject": "Coffee"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PagePaymentService pagePaymentService;
    @MockitoBean
    private ScanPaymentService scanPaymentService;
    @MockitoBean
    private BarcodePaymentService barcodePaymentService;
    @MockitoBean
    private TradeService tradeService;
    @MockitoBean
    private BillDownloadService billDownloadService;

    @Test
    void formReturnsHtmlPayload() throws Exception {
        when(pagePaymentService.buildFormPayment(any())).thenReturn("<form id='gatewayForm'></form>");

        mockMvc.perform(post("/api/v1/payments/form").contentType(MediaType.APPLICATION_JSON).content(ORDER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outTradeNo").value("T100"))
                .andExpect(jsonPath("$.mode").value("FORM"))
                .andExpect(jsonPath("$.payload").value("<form id='gatewayForm'></form>"));

        ArgumentCaptor<Order> order = ArgumentCaptor.forClass(Order.class);
        verify(pagePaymentService).buildFormPayment(order.capture());
        assertThat(order.getValue().getTotalAmount()).isEqualByComparingTo("88.88");
    }

    @Test
    void scanReturnsQrCode() throws Exception {
        when(scanPaymentService.buildScanPayment(any())).thenReturn("https://qr.alipay.com/bax01234");

        mockMvc.perform(post("/api/v1/payments/scan").contentType(MediaType.APPLICATION_JSON).content(ORDER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("SCAN"))
                .andExpect(jsonPath("$.payload").value("https://qr.alipay.com/bax01234"));
    }

    @Test
    void invalidOrderIsRejectedBeforeSigning() throws Exception {
        mockMvc.perform(post("/api/v1/payments/url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outTradeNo\": \"T100\", \"totalAmount\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.subject").exists())
                .andExpect(jsonPath("$.details.totalAmount").exists());

        verifyNoInteractions(pagePaymentService);
    }

    @Test
    void barcodeReturnsOutcome() throws Exception {
        Notify notify = new Notify();
        notify.setTradeStatus("TRADE_SUCCESS");
        when(barcodePaymentService.pay(any())).thenReturn(BarcodePaymentResult.builder()
                .outcome(PaymentOutcome.SUCCEEDED)
                .outTradeNo("T100")
                .tradeNo("2024010222002")
                .pollAttempts(3)
                .notify(notify)
                .build());

        mockMvc.perform(post("/api/v1/payments/barcode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outTradeNo\": \"T100\", \"totalAmount\": 88.88, \"subject\": \"Coffee\", \"authCode\": \"283612345678901234\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("SUCCEEDED"))
                .andExpect(jsonPath("$.tradeNo").value("2024010222002"))
                .andExpect(jsonPath("$.tradeStatus").value("TRADE_SUCCESS"))
                .andExpect(jsonPath("$.pollAttempts").value(3));
    }

    @Test
    void barcodeRequiresAuthCode() throws Exception {
        mockMvc.perform(post("/api/v1/payments/barcode").contentType(MediaType.APPLICATION_JSON).content(ORDER))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));

        verifyNoInteractions(barcodePaymentService);
    }

    @Test
    void providerFailureMapsToBadGateway() throws Exception {
        when(tradeService.query(any(Auxiliary.class)))
                .thenThrow(new GatewayOperationException("40004", "ACQ.TRADE_NOT_EXIST", "Trade does not exist"));

        mockMvc.perform(post("/api/v1/payments/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outTradeNo\": \"T404\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("GATEWAY_OPERATION_FAILED"))
                .andExpect(jsonPath("$.code").value("40004"))
                .andExpect(jsonPath("$.subCode").value("ACQ.TRADE_NOT_EXIST"))
                .andExpect(jsonPath("$.message").value("Trade does not exist"));
    }

    @Test
    void auxiliaryValidationMapsToBadRequest() throws Exception {
        when(tradeService.refund(any(Auxiliary.class)))
                .thenThrow(new AuxiliaryValidationException(AuxiliaryType.REFUND, List.of("refundAmount is required")));

        mockMvc.perform(post("/api/v1/payments/refund")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outTradeNo\": \"T100\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.violations[0]").value("refundAmount is required"));
    }

    @Test
    void transportFailureMapsToServiceUnavailable() throws Exception {
        when(tradeService.cancel(any(Auxiliary.class))).thenThrow(new ResourceAccessException("Read timed out"));

        mockMvc.perform(post("/api/v1/payments/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tradeNo\": \"2024010222002\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("TRANSPORT_ERROR"));
    }

    @Test
    void refundReturnsTradeFields() throws Exception {
        Notify notify = new Notify();
        notify.setCode("10000");
        notify.setOutTradeNo("T100");
        notify.setRefundFee("10.00");
        notify.setFundChange("Y");
        when(tradeService.refund(any(Auxiliary.class))).thenReturn(notify);

        mockMvc.perform(post("/api/v1/payments/refund")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outTradeNo\": \"T100\", \"refundAmount\": 10.00}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refundFee").value("10.00"))
                .andExpect(jsonPath("$.fundChange").value("Y"))
                .andExpect(jsonPath("$.tradeStatus").doesNotExist());

        ArgumentCaptor<Auxiliary> auxiliary = ArgumentCaptor.forClass(Auxiliary.class);
        verify(tradeService).refund(auxiliary.capture());
        assertThat(auxiliary.getValue().getRefundAmount()).isEqualByComparingTo(new BigDecimal("10.00"));
    }

    @Test
    void billStreamsArchiveAsAttachment() throws Exception {
        when(billDownloadService.downloadBill(any(Auxiliary.class)))
                .thenReturn(new BillFile("20240102110405.csv.zip", "https://dwbillcenter.alipay.com/x", new byte[]{1, 2, 3}));

        mockMvc.perform(post("/api/v1/payments/bill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"billType\": \"trade\", \"billDate\": \"2024-01-01\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"20240102110405.csv.zip\""))
                .andExpect(content().bytes(new byte[]{1, 2, 3}));
    }
}
