package com.genji.queue.infra.api;

import com.genji.queue.common.exception.ApiHttpException;
import com.genji.queue.common.exception.ApiUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Genji API 공통 호출. 헬스체크가 내려갔다고 판단한 동안에는 요청을 보내지 않는다.
 * <p> 연결 실패는 {@link ApiUnavailableException}, 2xx 가 아니면 {@link ApiHttpException}.
 */
@Slf4j
@Component
public class GenjiApiClient {

    private final RestTemplate restTemplate;
    private final ApiAvailability availability;
    private final GenjiApiProperties props;

    public GenjiApiClient(@Qualifier("genjiApiRestTemplate") RestTemplate restTemplate,
                          ApiAvailability availability,
                          GenjiApiProperties props) {
        this.restTemplate = restTemplate;
        this.availability = availability;
        this.props = props;
    }

    public <T> ResponseEntity<T> exchange(HttpMethod method, String path, Object body,
                                          Class<T> responseType, Object... uriVariables) {
        // 헬스체크가 꺼져 있으면 복구해 줄 주체가 없으므로 차단하지 않는다
        if (props.getHealth().isEnabled()) {
            availability.ensureAvailable();
        }
        HttpEntity<?> entity = body == null ? HttpEntity.EMPTY : new HttpEntity<>(body);
        try {
            return restTemplate.exchange(path, method, entity, responseType, uriVariables);
        } catch (ResourceAccessException e) {
            availability.markUnavailable(e.getMessage());
            throw new ApiUnavailableException("Genji API connection failed. " + method + " " + path, e);
        } catch (HttpStatusCodeException e) {
            log.debug("[GenjiApi] {} {} -> {}", method, path, e.getStatusCode().value());
            throw new ApiHttpException(e.getStatusCode().value(),
                    method + " " + path + " failed: " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        }
    }
}
