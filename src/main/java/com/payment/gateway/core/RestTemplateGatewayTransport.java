package com.payment.gateway.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link GatewayTransport} on Spring's {@link RestTemplate}. URLs are passed as {@link URI}
 * so already-encoded query strings are not encoded twice.
 */
@Slf4j
@RequiredArgsConstructor
public class RestTemplateGatewayTransport implements GatewayTransport {

    private final RestTemplate restTemplate;

    @Override
    public String post(String url, String formBody) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(new MediaType(MediaType.APPLICATION_FORM_URLENCODED, StandardCharsets.UTF_8));
        headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.TEXT_PLAIN));
        long start = System.currentTimeMillis();
        String body = restTemplate.postForObject(URI.create(url), new HttpEntity<>(formBody, headers), String.class);
        log.debug("POST {} completed in {}ms", url, System.currentTimeMillis() - start);
        return body;
    }

    @Override
    public byte[] download(String url) {
        long start = System.currentTimeMillis();
        byte[] content = restTemplate.getForObject(URI.create(url), byte[].class);
        log.debug("GET {} completed in {}ms, bytes={}", url, System.currentTimeMillis() - start,
                content != null ? content.length : 0);
        return content != null ? content : new byte[0];
    }
}
