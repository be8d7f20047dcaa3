package com.example.asyncdemo.service;

import com.example.asyncdemo.exception.UpstreamException;
import com.example.asyncdemo.model.CombinedResult;
import com.example.asyncdemo.model.ProductRecord;
import com.example.asyncdemo.model.RemoteItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fans out to the product lookup and the todo API, then joins.
 *
 * Timeline:
 * [subscribe] → [product lookup ~500ms]
 *             → [todo API call   ~Nms ]  → [join] → [CombinedResult]
 *
 * Both branches are subscribed at the same time, so the cost is the slower of
 * the two, not their sum. The join always waits for both branches; if either
 * failed, the caller gets an {@link UpstreamException} and never a half-filled
 * result.
 */
@Service
public class CombinedRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(CombinedRequestHandler.class);

    public static final String MESSAGE = "This is an example of async/await that keeps the server responsive.";

    private final ProductDataProvider productDataProvider;
    private final RemoteItemFetcher remoteItemFetcher;

    public CombinedRequestHandler(ProductDataProvider productDataProvider,
                                  RemoteItemFetcher remoteItemFetcher) {
        this.productDataProvider = productDataProvider;
        this.remoteItemFetcher = remoteItemFetcher;
    }

    public Mono<CombinedResult> handle(int id) {
        return Mono.defer(() -> {
            Mono<ProductRecord> product = productDataProvider.fetchProduct(id);
            Mono<RemoteItem> remoteItem = remoteItemFetcher.fetchRemoteItem(id);

            // zipDelayError lets the slower branch finish before any error is surfaced
            return Mono.zipDelayError(product, remoteItem)
                .map(both -> new CombinedResult(both.getT1(), both.getT2(), MESSAGE))
                .onErrorMap(ex -> toUpstreamException(id, ex));
        });
    }

    private static UpstreamException toUpstreamException(int id, Throwable ex) {
        List<Throwable> failures = Exceptions.unwrapMultiple(ex);
        UpstreamException upstream = new UpstreamException(id, failures.get(0));
        for (Throwable other : failures.subList(1, failures.size())) {
            upstream.addSuppressed(other);
        }
        log.warn("Combined lookup for id={} failed with {} branch error(s)", id, failures.size());
        return upstream;
    }
}
