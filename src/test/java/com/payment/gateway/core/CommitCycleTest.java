package com.payment.gateway.core;

import com.payment.gateway.compliance.ComplianceAuditLogger;
import com.payment.gateway.domain.Auxiliary;
import com.payment.gateway.domain.Merchant;
import com.payment.gateway.domain.Notify;
import lombok.Data;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CommitCycle against a stubbed transport. Keys are real; no network.
 */
@ExtendWith(MockitoExtension.class)
class CommitCycleTest {

    private static final String GATEWAY = "https://openapi.alipay.com";
    private static final String REQUEST_URL = GATEWAY + "/gateway.do?charset=UTF-8";

    @Mock
    private GatewayTransport transport;

    private final RsaSigner signer = new RsaSigner();
    private final Merchant merchant = TestKeys.merchant();
    private CommitCycle commitCycle;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneId.of("Asia/Shanghai"));
        commitCycle = new CommitCycle(merchant, new GatewayEndpoint(GATEWAY), transport, signer, clock, new ComplianceAuditLogger());
    }

    @Test
    void commitReturnsUnwrappedResultOnSuccessCode() {
        when(transport.post(eq(REQUEST_URL), anyString())).thenReturn("""
                {"alipay_trade_query_response":{"code":"10000","msg":"Success","trade_no":"2024010222001","out_trade_no":"T100","trade_status":"TRADE_SUCCESS","total_amount":"88.88"},"sign":"ENVELOPE_SIGN"}
                """);

        Notify notify = commitCycle.commit(GatewayMethod.QUERY, Auxiliary.builder().outTradeNo("T100").build());

        assertThat(notify.getCode()).isEqualTo("10000");
        assertThat(notify.getTradeNo()).isEqualTo("2024010222001");
        assertThat(notify.getTradeStatus()).isEqualTo("TRADE_SUCCESS");
        assertThat(notify.getTotalAmount()).isEqualTo("88.88");
        assertThat(notify.getSign()).isEqualTo("ENVELOPE_SIGN");
    }

    @Test
    void commitThrowsWithProviderCodesOnFailure() {
        when(transport.post(eq(REQUEST_URL), anyString())).thenReturn("""
                {"alipay_trade_query_response":{"code":"40004","msg":"Business Failed","sub_code":"ORDER_NOT_EXIST","sub_msg":"Order does not exist"},"sign":"x"}
                """);

        assertThatThrownBy(() -> commitCycle.commit(GatewayMethod.QUERY, Auxiliary.builder().outTradeNo("T404").build()))
                .isInstanceOf(GatewayOperationException.class)
                .hasMessage("Order does not exist")
                .satisfies(e -> {
                    GatewayOperationException failure = (GatewayOperationException) e;
                    assertThat(failure.getCode()).isEqualTo("40004");
                    assertThat(failure.getSubCode()).isEqualTo("ORDER_NOT_EXIST");
                });
    }

    @Test
    void commitUncheckedReturnsNonSuccessResult() {
        when(transport.post(eq(REQUEST_URL), anyString())).thenReturn("""
                {"alipay_trade_pay_response":{"code":"10003","msg":"Waiting for user","trade_no":"2024010222002","out_trade_no":"T200"}}
                """);

        Notify notify = commitCycle.commitUnchecked(GatewayMethod.BARCODE, Auxiliary.builder().outTradeNo("T200").build());

        assertThat(notify.getCode()).isEqualTo("10003");
        assertThat(notify.getTradeNo()).isEqualTo("2024010222002");
        assertThat(notify.getSign()).isNull();
    }

    @Test
    void unparseableOrUnexpectedEnvelopeIsMalformed() {
        when(transport.post(eq(REQUEST_URL), anyString()))
                .thenReturn("<html>Bad Gateway</html>")
                .thenReturn("{\"error_response\":{\"code\":\"40002\"}}");
        Auxiliary auxiliary = Auxiliary.builder().outTradeNo("T1").build();

        assertThatThrownBy(() -> commitCycle.commit(GatewayMethod.QUERY, auxiliary))
                .isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> commitCycle.commit(GatewayMethod.QUERY, auxiliary))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("alipay_trade_query_response");
    }

    @Test
    void transportFailurePropagatesUnchanged() {
        ResourceAccessException timeout = new ResourceAccessException("Read timed out");
        when(transport.post(eq(REQUEST_URL), anyString())).thenThrow(timeout);

        assertThatThrownBy(() -> commitCycle.commit(GatewayMethod.QUERY, Auxiliary.builder().outTradeNo("T1").build()))
                .isSameAs(timeout);
    }

    @Test
    void submittedBodyIsSignedOverItsCanonicalString() {
        when(transport.post(eq(REQUEST_URL), anyString())).thenReturn("""
                {"alipay_trade_close_response":{"code":"10000","msg":"Success","out_trade_no":"T300"}}
                """);

        commitCycle.commit(GatewayMethod.CLOSE, Auxiliary.builder().outTradeNo("T300").build());

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(transport).post(eq(REQUEST_URL), body.capture());
        GatewayData submitted = new GatewayData().fromUrl(body.getValue());

        assertThat(submitted.asMap().keySet()).containsExactly(
                "app_id", "biz_content", "charset", "format", "method", "notify_url", "return_url",
                "sign_type", "timestamp", "version", "sign");
        assertThat(submitted.getString("method")).isEqualTo("alipay.trade.close");
        assertThat(submitted.getString("biz_content")).isEqualTo("{\"out_trade_no\":\"T300\"}");
        assertThat(submitted.getString("timestamp")).isEqualTo("2024-01-02 11:04:05");
        assertThat(submitted.getString("sign_type")).isEqualTo("RSA2");
        assertThat(signer.verify(submitted.toCanonicalString(false), submitted.getString("sign"),
                TestKeys.publicKey(TestKeys.MERCHANT), SignType.RSA2)).isTrue();
    }

    @Test
    void executeReadsAnyMethodIntoTheRequestedType() {
        String response = "{\"alipay_fund_trans_uni_transfer_response\":{\"code\":\"10000\",\"order_id\":\"20240102\"},\"sign\":\"S\"}";
        when(transport.post(eq(REQUEST_URL), anyString())).thenReturn(response);

        TransferResult result = commitCycle.execute(GatewayRequest.of("alipay.fund.trans.uni.transfer",
                Map.of("out_biz_no", "B1"), TransferResult.class));

        assertThat(result.getCode()).isEqualTo("10000");
        assertThat(result.getOrderId()).isEqualTo("20240102");
        assertThat(result.getSign()).isEqualTo("S");
        assertThat(result.getBody()).isEqualTo(response);
    }

    @Test
    void sdkExecuteReturnsSignedOrderStringWithoutSubmitting() {
        String orderString = commitCycle.sdkExecute(GatewayRequest.of("alipay.trade.app.pay", "{\"out_trade_no\":\"T1\"}", Notify.class));

        GatewayData data = new GatewayData().fromUrl(orderString);
        assertThat(data.getString("biz_content")).isEqualTo("{\"out_trade_no\":\"T1\"}");
        assertThat(data.contains("sign")).isTrue();
        verifyNoInteractions(transport);
    }

    @Data
    public static class TransferResult {
        private String code;
        private String orderId;
        private String sign;
        private String body;
    }
}
