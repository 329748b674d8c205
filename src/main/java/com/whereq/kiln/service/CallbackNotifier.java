package com.whereq.kiln.service;

import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.model.BuildResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Posts final build results to the callback URL supplied with the job
 */
@Slf4j
@Service
public class CallbackNotifier {

    @Autowired
    private WebClient.Builder webClientBuilder;

    @Autowired
    private KilnProperties properties;

    /**
     * Send the result as JSON. Never retried; errors and non-2xx answers are only logged.
     *
     * @param callbackUrl target URL, nothing is sent when empty
     * @param result the final build result
     * @return Mono that completes once the attempt is over, never with an error
     */
    public Mono<Void> notify(String callbackUrl, BuildResult result) {
        if (callbackUrl == null || callbackUrl.isBlank()) {
            return Mono.empty();
        }

        String apiKey = properties.getCallback().getApiKey();

        return webClientBuilder.build()
            .post()
            .uri(callbackUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .headers(headers -> {
                if (apiKey != null && !apiKey.isBlank()) {
                    headers.setBearerAuth(apiKey);
                }
            })
            .bodyValue(result)
            .exchangeToMono(response -> {
                if (response.statusCode().is2xxSuccessful()) {
                    log.info("Callback for job {} delivered to {}: {}",
                        result.getJobId(), callbackUrl, response.statusCode().value());
                } else {
                    log.warn("Callback for job {} to {} answered {}",
                        result.getJobId(), callbackUrl, response.statusCode().value());
                }
                return response.releaseBody();
            })
            .timeout(properties.getCallback().getTimeout())
            .doOnError(error -> log.error("Failed to deliver callback for job {} to {}: {}",
                result.getJobId(), callbackUrl, error.getMessage()))
            .onErrorResume(e -> Mono.empty());
    }
}
