package com.payment.gateway.core;

import com.payment.gateway.domain.Notify;
import com.payment.gateway.domain.Order;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GatewayDataTest {

    @Test
    void canonicalStringIsDeterministicForSameInsertionOrder() {
        GatewayData first = new GatewayData().add("app_id", "2021").add("method", "alipay.trade.query").add("version", "1.0");
        GatewayData second = new GatewayData().add("app_id", "2021").add("method", "alipay.trade.query").add("version", "1.0");

        assertThat(first.toCanonicalString(false)).isEqualTo(second.toCanonicalString(false));
        assertThat(first.toCanonicalString(false)).isEqualTo("app_id=2021&method=alipay.trade.query&version=1.0");
    }

    @Test
    void canonicalStringFollowsInsertionOrder() {
        GatewayData ab = new GatewayData().add("a", "1").add("b", "2");
        GatewayData ba = new GatewayData().add("b", "2").add("a", "1");

        assertThat(ab.toCanonicalString(false)).isEqualTo("a=1&b=2");
        assertThat(ba.toCanonicalString(false)).isEqualTo("b=2&a=1");
    }

    @Test
    void signatureFieldsAreExcludedWhereverTheyAppear() {
        GatewayData data = new GatewayData()
                .add("sign_type", "RSA2")
                .add("app_id", "2021")
                .add("sign", "abc")
                .add("method", "alipay.trade.query");

        assertThat(data.toCanonicalString(false)).isEqualTo("app_id=2021&method=alipay.trade.query");
        assertThat(data.toUrlEncodedBody()).isEqualTo("sign_type=RSA2&app_id=2021&sign=abc&method=alipay.trade.query");
    }

    @Test
    void valuesAreUrlEncoded() {
        GatewayData data = new GatewayData()
                .add("timestamp", "2024-01-02 03:04:05")
                .add("biz_content", "{\"out_trade_no\":\"T&1\"}");

        assertThat(data.toCanonicalString(false))
                .isEqualTo("timestamp=2024-01-02+03%3A04%3A05&biz_content=%7B%22out_trade_no%22%3A%22T%261%22%7D");
    }

    @Test
    void nullAndEmptyValuesAreSkipped() {
        GatewayData data = new GatewayData().add("a", null).add("b", "").add("c", "x");

        assertThat(data.size()).isEqualTo(1);
        assertThat(data.contains("a")).isFalse();
        assertThat(data.getString("c")).isEqualTo("x");
    }

    @Test
    void emptyValueRemovesExistingEntry() {
        GatewayData data = new GatewayData()
                .add("app_id", "2021")
                .add("notify_url", "https://shop.example/notify")
                .add("notify_url", "");

        assertThat(data.contains("notify_url")).isFalse();
        assertThat(data.toCanonicalString(false)).isEqualTo("app_id=2021");
    }

    @Test
    void addObjectRenamesPropertiesToSnakeCaseInDeclarationOrder() {
        Order order = Order.builder()
                .totalAmount(new BigDecimal("88.80"))
                .subject("Coffee")
                .outTradeNo("T100")
                .build();

        GatewayData data = new GatewayData().addAll(order, StringCase.SNAKE);

        assertThat(data.asMap().keySet()).containsExactly("total_amount", "subject", "out_trade_no");
        assertThat(data.getString("total_amount")).isEqualTo("88.80");
    }

    @Test
    void fromJsonKeepsNestedObjectsAsJsonText() {
        GatewayData data = new GatewayData().fromJson(
                "{\"alipay_trade_query_response\":{\"code\":\"10000\",\"trade_no\":\"2024\"},\"sign\":\"xyz\"}");

        assertThat(data.getString("sign")).isEqualTo("xyz");
        assertThat(new GatewayData().fromJson(data.getString("alipay_trade_query_response")).getString("trade_no"))
                .isEqualTo("2024");
    }

    @Test
    void fromJsonRejectsGarbageAndNonObjects() {
        assertThatThrownBy(() -> new GatewayData().fromJson("<html>502</html>"))
                .isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> new GatewayData().fromJson("[1,2]"))
                .isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> new GatewayData().fromJson(" "))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void fromStructuredKeepsMapOrder() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("notify_time", "2024-01-02 03:04:05");
        parameters.put("trade_no", "2024");
        parameters.put("app_id", "2021");

        GatewayData data = new GatewayData().fromStructured(parameters);

        assertThat(data.asMap().keySet()).containsExactly("notify_time", "trade_no", "app_id");
    }

    @Test
    void fromUrlReadsQueryParameters() {
        GatewayData data = new GatewayData().fromUrl(
                "https://dwbillcenter.alipay.com/downloadBillFile.resource?bizType=trade&fileType=csv.zip&downloadFileName=20240101.csv.zip");

        assertThat(data.getString("fileType")).isEqualTo("csv.zip");
        assertThat(data.getString("bizType")).isEqualTo("trade");
    }

    @Test
    void toObjectReadsSnakeCaseKeys() {
        Notify notify = new GatewayData()
                .add("code", "10000")
                .add("out_trade_no", "T100")
                .add("trade_status", "TRADE_SUCCESS")
                .add("unknown_field", "ignored")
                .toObject(Notify.class, StringCase.SNAKE);

        assertThat(notify.getCode()).isEqualTo("10000");
        assertThat(notify.getOutTradeNo()).isEqualTo("T100");
        assertThat(notify.getTradeStatus()).isEqualTo("TRADE_SUCCESS");
    }

    @Test
    void toFormPostsEveryEntryToTheUrl() {
        String form = new GatewayData().add("app_id", "2021").add("sign", "a'b").toForm("https://gw/gateway.do?charset=UTF-8");

        assertThat(form).contains("action='https://gw/gateway.do?charset=UTF-8'");
        assertThat(form).contains("name='app_id' value='2021'");
        assertThat(form).contains("name='sign' value='a&#39;b'");
        assertThat(form).contains("document.forms['gatewayForm'].submit()");
    }
}
