package com.example.asyncdemo.controller;

import com.example.asyncdemo.model.CombinedResult;
import com.example.asyncdemo.service.CombinedRequestHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Combined endpoint demonstrating concurrent fan-out within one request.
 *
 * Compare with a blocking controller: there the servlet thread would sit in
 * each call in turn. Here the handler method returns a Mono straight away,
 * Spring MVC parks the request asynchronously, and the servlet thread goes
 * back to the pool while both calls are in flight.
 */
@RestController
public class AsyncDemoController {

    private static final Logger log = LoggerFactory.getLogger(AsyncDemoController.class);

    private final CombinedRequestHandler combinedRequestHandler;

    public AsyncDemoController(CombinedRequestHandler combinedRequestHandler) {
        this.combinedRequestHandler = combinedRequestHandler;
    }

    /**
     * Timeline:
     * [Request] → [start product lookup] + [start todo API call] → [release thread]
     *           ... max(500ms, API latency) ... → [join] → [Response]
     */
    @GetMapping(path = {"/combined/{id}", "/api/asyncdemo/combined/{id}"},
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<CombinedResult> getCombinedData(@PathVariable int id) {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be a positive integer, got " + id);
        }

        String threadName = Thread.currentThread().getName();
        long startTime = System.currentTimeMillis();
        log.info("[{}] REQUEST START: GET /combined/{}", threadName, id);

        Mono<CombinedResult> result = combinedRequestHandler.handle(id)
            .doOnSubscribe(subscription -> log.info("[{}] Both lookups started for id={}",
                Thread.currentThread().getName(), id))
            .doOnSuccess(combined -> log.info("[{}] REQUEST END: id={} completed in {}ms on {}",
                threadName, id, System.currentTimeMillis() - startTime, Thread.currentThread().getName()))
            .doOnCancel(() -> log.info("[{}] REQUEST CANCELLED: id={} after {}ms",
                threadName, id, System.currentTimeMillis() - startTime));

        log.info("[{}] Returning Mono, lookups start when MVC subscribes", threadName);
        return result;
    }
}
