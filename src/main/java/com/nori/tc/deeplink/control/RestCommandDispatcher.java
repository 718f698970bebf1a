package com.nori.tc.deeplink.control;

import com.nori.tc.deeplink.error.CommandException;
import com.nori.tc.deeplink.logging.StructuredLog;
import com.nori.tc.deeplink.runtime.HostPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * RestCommandDispatcher
 *
 * ECP(HTTP, 기본 8060) 구현.
 *
 * 타임아웃:
 * - launch / input: 10s (deepLinkTemplate)
 * - keypress / 문자: 5s (keyTemplate)
 *
 * URL 인코딩:
 * - path segment / 쿼리는 여기서 직접 인코딩하고 URI 객체로 넘긴다(RestTemplate 이중 인코딩 방지).
 */
public class RestCommandDispatcher implements CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RestCommandDispatcher.class);

    public static final Duration DEEP_LINK_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration KEY_TIMEOUT = Duration.ofSeconds(5);

    private final String baseUrl;
    private final RestTemplate deepLinkTemplate;
    private final RestTemplate keyTemplate;

    public RestCommandDispatcher(HostPort control, RestTemplate deepLinkTemplate, RestTemplate keyTemplate) {
        this.baseUrl = Objects.requireNonNull(control, "control must not be null").httpBaseUrl();
        this.deepLinkTemplate = Objects.requireNonNull(deepLinkTemplate, "deepLinkTemplate must not be null");
        this.keyTemplate = Objects.requireNonNull(keyTemplate, "keyTemplate must not be null");
    }

    public static RestCommandDispatcher create(HostPort control, RestTemplateBuilder builder) {
        RestTemplate deepLink = builder
                .setConnectTimeout(DEEP_LINK_TIMEOUT)
                .setReadTimeout(DEEP_LINK_TIMEOUT)
                .build();
        RestTemplate key = builder
                .setConnectTimeout(KEY_TIMEOUT)
                .setReadTimeout(KEY_TIMEOUT)
                .build();
        return new RestCommandDispatcher(control, deepLink, key);
    }

    @Override
    public void launch(String appId, DeepLinkParams params) {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("appId is blank");
        }
        URI uri = withQuery(UriComponentsBuilder.fromUriString(baseUrl)
                .path("/launch/")
                .path(UriUtils.encodePathSegment(appId.trim(), StandardCharsets.UTF_8)), params);
        post("launch", uri, deepLinkTemplate, false);
    }

    @Override
    public void input(DeepLinkParams params) {
        URI uri = withQuery(UriComponentsBuilder.fromUriString(baseUrl).path("/input"), params);
        post("input", uri, deepLinkTemplate, false);
    }

    @Override
    public void keypress(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is blank");
        }
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/keypress/")
                .path(UriUtils.encodePathSegment(key.trim(), StandardCharsets.UTF_8))
                .build(true)
                .toUri();
        post("keypress", uri, keyTemplate, false);
    }

    @Override
    public void enterCharacter(String character) {
        if (character == null || character.isEmpty()) {
            throw new IllegalArgumentException("character is empty");
        }
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/keypress/")
                .path("Lit_" + UriUtils.encode(character, StandardCharsets.UTF_8))
                .build(true)
                .toUri();
        post("keypress_lit", uri, keyTemplate, true);
    }

    private static URI withQuery(UriComponentsBuilder builder, DeepLinkParams params) {
        if (params != null && !params.isEmpty()) {
            for (Map.Entry<String, String> e : params.toQueryParams().entrySet()) {
                builder.queryParam(e.getKey(), UriUtils.encodeQueryParam(e.getValue(), StandardCharsets.UTF_8));
            }
        }
        return builder.build(true).toUri();
    }

    /**
     * @param sensitive true면 로그에 URL 대신 마스킹 값을 남긴다(문자 입력은 비밀번호일 수 있음)
     */
    private void post(String command, URI uri, RestTemplate template, boolean sensitive) {
        Object shown = sensitive ? "Lit_***" : uri;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        log.debug(StructuredLog.event("ecp_send", "command", command, "url", shown));

        ResponseEntity<Void> response;
        try {
            response = template.exchange(uri, HttpMethod.POST, new HttpEntity<>("", headers), Void.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            log.warn(StructuredLog.event("ecp_rejected", "command", command, "url", shown, "status", status));
            throw new CommandException(command, status,
                    "ECP " + command + " rejected with HTTP " + status + ": " + shown, e);
        } catch (RestClientException e) {
            log.warn(StructuredLog.event("ecp_failed", "command", command, "url", shown, "error", e.getMessage()));
            throw new CommandException(command, null,
                    "ECP " + command + " failed: " + e.getMessage(), e);
        }

        int status = response.getStatusCode().value();
        if (!response.getStatusCode().is2xxSuccessful()) {
            log.warn(StructuredLog.event("ecp_rejected", "command", command, "url", shown, "status", status));
            throw new CommandException(command, status,
                    "ECP " + command + " rejected with HTTP " + status + ": " + shown, null);
        }
        if (sensitive) {
            log.debug(StructuredLog.event("ecp_sent", "command", command, "status", status));
        } else {
            log.info(StructuredLog.event("ecp_sent", "command", command, "url", shown, "status", status));
        }
    }
}
