package com.feedrelay.webhook;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Performs the HTTP POST for one webhook attempt.
 *
 * <p>Any HTTP answer, 2xx or not, comes back as a {@link SendResult}; only transport-level
 * failures raise {@link WebhookTransportException}. One {@link RestTemplate} is kept per distinct
 * timeout value, with the timeout applied to both connect and read.
 */
@Component
public class WebhookSender {

    private final Function<Duration, RestTemplate> restTemplateFactory;
    private final Map<Duration, RestTemplate> restTemplates = new ConcurrentHashMap<>();

    @Autowired
    public WebhookSender() {
        this(WebhookSender::createRestTemplate);
    }

    /** Uses {@code restTemplateFactory} to build the template for each distinct timeout. */
    public WebhookSender(Function<Duration, RestTemplate> restTemplateFactory) {
        this.restTemplateFactory = restTemplateFactory;
    }

    public SendResult post(String url, String body, HttpHeaders headers, Duration timeout)
            throws WebhookTransportException {
        RestTemplate restTemplate = restTemplates.computeIfAbsent(timeout, restTemplateFactory);
        try {
            ResponseEntity<String> response =
                    restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
            return new SendResult(response.getStatusCode().value(), response.getBody());
        } catch (RestClientResponseException e) {
            return new SendResult(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new WebhookTransportException("Timeout", e);
            }
            throw new WebhookTransportException(describe(e), e);
        } catch (RestClientException e) {
            throw new WebhookTransportException(describe(e), e);
        }
    }

    private static String describe(Exception e) {
        Throwable root = e.getCause() != null ? e.getCause() : e;
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private static RestTemplate createRestTemplate(Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return new RestTemplate(requestFactory);
    }

    public record SendResult(int statusCode, String body) {

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
