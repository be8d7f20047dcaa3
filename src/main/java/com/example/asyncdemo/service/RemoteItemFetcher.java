package com.example.asyncdemo.service;

import com.example.asyncdemo.exception.RemoteFetchException;
import com.example.asyncdemo.model.RemoteItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Fetches todo items from the external JSON API.
 *
 * The {@link WebClient} is created once at startup (see
 * {@code WebClientConfig}) and shared by every call; each invocation opens its
 * own exchange on the pooled connector. No caching, no retries.
 */
@Service
public class RemoteItemFetcher {

    private static final Logger log = LoggerFactory.getLogger(RemoteItemFetcher.class);

    static final String TODO_PATH = "/todos/{id}";

    private final WebClient todoApiClient;

    public RemoteItemFetcher(WebClient todoApiClient) {
        this.todoApiClient = todoApiClient;
    }

    /**
     * Issues one GET against {@code {base}/todos/{id}}.
     *
     * @param id positive item id
     * @return Mono emitting the decoded item, or failing with {@link RemoteFetchException}
     */
    public Mono<RemoteItem> fetchRemoteItem(int id) {
        return Mono.defer(() -> {
            long startTime = System.currentTimeMillis();
            log.debug("[{}] Calling todo API for id={}", Thread.currentThread().getName(), id);

            return todoApiClient.get()
                .uri(TODO_PATH, id)
                .retrieve()
                .bodyToMono(RemoteItem.class)
                .switchIfEmpty(Mono.error(() -> new RemoteFetchException(id, "Todo API returned an empty body for id=" + id)))
                .onErrorMap(ex -> !(ex instanceof RemoteFetchException), ex -> translate(id, ex))
                .doOnNext(item -> log.debug("[{}] Todo API responded for id={} in {}ms",
                    Thread.currentThread().getName(), id, System.currentTimeMillis() - startTime))
                .doOnError(ex -> log.warn("Todo API call failed for id={}: {}", id, ex.getMessage()));
        });
    }

    private static RemoteFetchException translate(int id, Throwable ex) {
        if (ex instanceof WebClientResponseException responseEx) {
            return new RemoteFetchException(id,
                "Todo API answered " + responseEx.getStatusCode().value() + " for id=" + id, ex);
        }
        if (ex instanceof WebClientRequestException) {
            return new RemoteFetchException(id, "Todo API unreachable for id=" + id + ": " + ex.getMessage(), ex);
        }
        if (ex instanceof CodecException) {
            return new RemoteFetchException(id, "Todo API body could not be decoded for id=" + id, ex);
        }
        return new RemoteFetchException(id, "Todo API call failed for id=" + id + ": " + ex.getMessage(), ex);
    }
}
