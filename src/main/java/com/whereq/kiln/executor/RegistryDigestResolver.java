package com.whereq.kiln.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.kiln.config.KilnProperties;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks up the manifest digest of a pushed tag through the registry HTTP API.
 *
 * Sends {@code HEAD /v2/{repository}/manifests/{tag}} with basic credentials when
 * configured. Registries that answer 401 with a Bearer challenge get a token request
 * against the advertised realm, then a second HEAD with that token.
 */
@Slf4j
@Component
public class RegistryDigestResolver {

    static final String DIGEST_HEADER = "Docker-Content-Digest";

    static final String MANIFEST_ACCEPT = String.join(", ",
        "application/vnd.oci.image.index.v1+json",
        "application/vnd.oci.image.manifest.v1+json",
        "application/vnd.docker.distribution.manifest.list.v2+json",
        "application/vnd.docker.distribution.manifest.v2+json");

    private static final Pattern CHALLENGE_PARAM = Pattern.compile("(\\w+)=\"([^\"]*)\"");

    @Autowired
    private WebClient.Builder webClientBuilder;

    @Autowired
    private KilnProperties properties;

    /**
     * Resolve the digest for an image tag.
     *
     * @param imageTag full reference, e.g. ghcr.io/acme/api:abc123de
     * @return the digest, or empty when the registry does not report one
     */
    public Mono<String> resolve(String imageTag) {
        ImageReference reference = ImageReference.parse(imageTag);
        String manifestUrl = scheme() + "://" + reference.getRegistry()
            + "/v2/" + reference.getRepository() + "/manifests/" + reference.getTag();

        WebClient webClient = webClientBuilder.build();

        return headManifest(webClient, manifestUrl, this::basicAuth)
            .flatMap(head -> {
                if (head.getStatus() == HttpStatus.UNAUTHORIZED.value()) {
                    return fetchBearerToken(webClient, head.getChallenge())
                        .flatMap(token -> headManifest(webClient, manifestUrl, headers -> headers.setBearerAuth(token)));
                }
                return Mono.just(head);
            })
            .flatMap(head -> {
                if (head.getStatus() < 200 || head.getStatus() >= 300) {
                    return Mono.error(new IllegalStateException(
                        "registry answered " + head.getStatus() + " for " + manifestUrl));
                }
                return Mono.justOrEmpty(head.getDigest());
            })
            .timeout(properties.getRegistry().getDigestTimeout())
            .doOnNext(digest -> log.debug("Resolved {} to {}", imageTag, digest));
    }

    private Mono<ManifestHead> headManifest(WebClient webClient, String url, Consumer<HttpHeaders> auth) {
        return webClient.head()
            .uri(url)
            .header(HttpHeaders.ACCEPT, MANIFEST_ACCEPT)
            .headers(auth)
            .exchangeToMono(response -> {
                HttpHeaders headers = response.headers().asHttpHeaders();
                ManifestHead head = new ManifestHead(response.statusCode().value(),
                    headers.getFirst(DIGEST_HEADER), headers.getFirst(HttpHeaders.WWW_AUTHENTICATE));
                return response.releaseBody().thenReturn(head);
            });
    }

    /**
     * Exchange the Bearer challenge for a token at the realm it names
     */
    private Mono<String> fetchBearerToken(WebClient webClient, String challenge) {
        if (challenge == null || !challenge.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return Mono.error(new IllegalStateException("registry requires unsupported authentication: " + challenge));
        }

        Map<String, String> params = parseChallenge(challenge.substring(7));
        String realm = params.get("realm");
        if (realm == null) {
            return Mono.error(new IllegalStateException("Bearer challenge without realm"));
        }

        UriComponentsBuilder tokenUri = UriComponentsBuilder.fromHttpUrl(realm);
        if (params.containsKey("service")) {
            tokenUri.queryParam("service", params.get("service"));
        }
        if (params.containsKey("scope")) {
            tokenUri.queryParam("scope", params.get("scope"));
        }

        return webClient.get()
            .uri(tokenUri.build().toUri())
            .headers(this::basicAuth)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .flatMap(body -> {
                JsonNode token = body.hasNonNull("token") ? body.get("token") : body.get("access_token");
                return token != null ? Mono.just(token.asText()) : Mono.error(
                    new IllegalStateException("token response from " + realm + " carries no token"));
            });
    }

    static Map<String, String> parseChallenge(String parameters) {
        Map<String, String> params = new HashMap<>();
        Matcher matcher = CHALLENGE_PARAM.matcher(parameters);
        while (matcher.find()) {
            params.put(matcher.group(1), matcher.group(2));
        }
        return params;
    }

    private void basicAuth(HttpHeaders headers) {
        KilnProperties.RegistryConfig registry = properties.getRegistry();
        if (registry.getUsername() != null && !registry.getUsername().isBlank()) {
            headers.setBasicAuth(registry.getUsername(), registry.getPassword() != null ? registry.getPassword() : "");
        }
    }

    private String scheme() {
        return properties.getRegistry().isInsecure() ? "http" : "https";
    }

    @Value
    private static class ManifestHead {
        int status;
        String digest;
        String challenge;
    }
}
