package com.arbitration.award.gateway;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.signing.Rfc3161Codec;
import com.arbitration.award.signing.TimestampToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * RFC 3161 client over HTTP. Disabled unless {@code award.timestamp.enabled=true}.
 */
@Component
public class HttpTimestampAuthority implements TimestampAuthority {

    private static final Logger log = LoggerFactory.getLogger(HttpTimestampAuthority.class);
    private static final MediaType TIMESTAMP_QUERY = MediaType.parseMediaType("application/timestamp-query");
    private static final MediaType TIMESTAMP_REPLY = MediaType.parseMediaType("application/timestamp-reply");
    private static final DateTimeFormatter GENERALIZED_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final AwardConfig.Timestamp config;
    private final RestTemplate restTemplate;
    private final SecureRandom random = new SecureRandom();

    public HttpTimestampAuthority(AwardConfig awardConfig, RestTemplateBuilder restTemplateBuilder) {
        this.config = awardConfig.getTimestamp();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build();
        log.info("Timestamp authority {} ({})", config.isEnabled() ? "ENABLED" : "DISABLED", config.getUrl());
    }

    @Override
    public TimestampToken timestamp(byte[] sha256Digest) {
        if (!config.isEnabled()) {
            return TimestampToken.notGranted(config.getAuthorityName());
        }

        try {
            byte[] request = Rfc3161Codec.encodeRequest(sha256Digest, new BigInteger(63, random));

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(TIMESTAMP_QUERY);
            headers.setAccept(List.of(TIMESTAMP_REPLY));

            ResponseEntity<byte[]> response = restTemplate.postForEntity(
                    config.getUrl(), new HttpEntity<>(request, headers), byte[].class);
            byte[] body = response.getBody();
            if (body == null || body.length == 0) {
                log.warn("Timestamp authority {} returned an empty response", config.getAuthorityName());
                return TimestampToken.notGranted(config.getAuthorityName());
            }

            Rfc3161Codec.Response parsed = Rfc3161Codec.decodeResponse(body);
            if (!parsed.granted()) {
                log.warn("Timestamp authority {} refused request, status={}", config.getAuthorityName(), parsed.status());
                return TimestampToken.notGranted(config.getAuthorityName());
            }

            return new TimestampToken(true, parsed.token(), genTime(parsed.token()), config.getAuthorityName());
        } catch (Exception e) {
            log.warn("Timestamp request to {} failed: {}", config.getAuthorityName(), e.getMessage());
            return TimestampToken.notGranted(config.getAuthorityName());
        }
    }

    private static Long genTime(byte[] token) {
        String text = Rfc3161Codec.findGeneralizedTime(token);
        if (text == null) {
            return System.currentTimeMillis();
        }
        LocalDateTime time = LocalDateTime.parse(text.substring(0, 14), GENERALIZED_TIME);
        return time.toInstant(ZoneOffset.UTC).toEpochMilli();
    }
}
