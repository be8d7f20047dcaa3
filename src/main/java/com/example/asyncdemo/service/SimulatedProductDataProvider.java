package com.example.asyncdemo.service;

import com.example.asyncdemo.model.ProductRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Simulated product storage.
 *
 * The storage round trip is modelled with a timer rather than Thread.sleep(),
 * so the calling thread is free while the "query" is in flight. The result is
 * fully determined by the id.
 */
@Service
public class SimulatedProductDataProvider implements ProductDataProvider {

    private static final Logger log = LoggerFactory.getLogger(SimulatedProductDataProvider.class);

    private final Duration databaseDelay;

    public SimulatedProductDataProvider(@Value("${app.product-delay:500ms}") Duration databaseDelay) {
        this.databaseDelay = databaseDelay;
    }

    @Override
    public Mono<ProductRecord> fetchProduct(int id) {
        return Mono.defer(() -> {
            long startTime = System.currentTimeMillis();
            log.debug("[{}] Starting product lookup for id={}", Thread.currentThread().getName(), id);

            return Mono.delay(databaseDelay)
                .map(tick -> ProductRecord.of(id))
                .doOnNext(product -> log.debug("[{}] Completed product lookup for id={} in {}ms",
                    Thread.currentThread().getName(), id, System.currentTimeMillis() - startTime));
        });
    }
}
