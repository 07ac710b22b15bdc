package com.genji.queue.infra.api;

import com.genji.queue.common.exception.ApiHttpException;
import com.genji.queue.usecase.consumer.port.IdempotencyClaimClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class HttpIdempotencyClaimClient implements IdempotencyClaimClient {

    static final String CLAIM_PATH = "/internal/idempotency/claim";

    private final GenjiApiClient apiClient;

    @Override
    public ClaimResult claim(String messageId) {
        ResponseEntity<ClaimResult> res =
                apiClient.exchange(HttpMethod.POST, CLAIM_PATH, new ClaimRequest(messageId), ClaimResult.class);
        ClaimResult body = res.getBody();
        if (body == null) {
            throw new ApiHttpException(res.getStatusCode().value(), "empty claim response. key=" + messageId, null);
        }
        log.debug("[Idempotency] claim key={} claimed={}", messageId, body.claimed());
        return body;
    }

    @Override
    public void deleteClaim(String messageId) {
        try {
            apiClient.exchange(HttpMethod.DELETE, CLAIM_PATH, new ClaimRequest(messageId), Void.class);
        } catch (ApiHttpException e) {
            if (e.getStatus() == HttpStatus.NOT_FOUND.value()) {
                log.debug("[Idempotency] claim already gone. key={}", messageId);
                return;
            }
            throw e;
        }
    }

    record ClaimRequest(String key) {
    }
}
