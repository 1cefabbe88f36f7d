package com.payment.gateway.config;

import com.payment.gateway.core.GatewayEndpoint;
import com.payment.gateway.core.GatewayTransport;
import com.payment.gateway.core.PollingPolicy;
import com.payment.gateway.core.RestTemplateGatewayTransport;
import com.payment.gateway.core.SignType;
import com.payment.gateway.core.Sleeper;
import com.payment.gateway.domain.Merchant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Wires the merchant credentials, the gateway transport and the polling policy from
 * {@code alipay.*} properties.
 */
@Slf4j
@Configuration
public class GatewayConfig {

    @Bean
    public Merchant merchant(@Value("${alipay.app-id}") String appId,
                             @Value("${alipay.private-key}") String privateKey,
                             @Value("${alipay.alipay-public-key}") String alipayPublicKey,
                             @Value("${alipay.sign-type:RSA2}") SignType signType,
                             @Value("${alipay.notify-url:}") String notifyUrl,
                             @Value("${alipay.return-url:}") String returnUrl) {
        log.info("Configured merchant appId={} signType={}", appId, signType);
        return Merchant.builder()
                .appId(appId)
                .privateKey(privateKey)
                .alipayPublicKey(alipayPublicKey)
                .signType(signType)
                .notifyUrl(notifyUrl)
                .returnUrl(returnUrl)
                .build();
    }

    @Bean
    public GatewayEndpoint gatewayEndpoint(@Value("${alipay.gateway-url:https://openapi.alipay.com}") String gatewayUrl) {
        return new GatewayEndpoint(gatewayUrl);
    }

    @Bean
    public RestTemplate gatewayRestTemplate(@Value("${alipay.http.connect-timeout-ms:5000}") int connectTimeoutMs,
                                            @Value("${alipay.http.read-timeout-ms:15000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }

    @Bean
    public GatewayTransport gatewayTransport(RestTemplate gatewayRestTemplate) {
        return new RestTemplateGatewayTransport(gatewayRestTemplate);
    }

    /** Request timestamps are read in the provider's time zone. */
    @Bean
    public Clock gatewayClock(@Value("${alipay.time-zone:Asia/Shanghai}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }

    @Bean
    public PollingPolicy pollingPolicy(@Value("${alipay.poll.max-attempts:5}") int maxAttempts,
                                       @Value("${alipay.poll.interval-ms:5000}") long intervalMs) {
        return PollingPolicy.fixed(maxAttempts, Duration.ofMillis(intervalMs));
    }

    @Bean
    public Sleeper pollSleeper() {
        return Sleeper.SYSTEM;
    }
}
