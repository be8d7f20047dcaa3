package com.example.asyncdemo.service;

import com.example.asyncdemo.exception.RemoteFetchException;
import com.example.asyncdemo.exception.UpstreamException;
import com.example.asyncdemo.model.CombinedResult;
import com.example.asyncdemo.model.ProductRecord;
import com.example.asyncdemo.model.RemoteItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CombinedRequestHandlerTest {

    @Mock
    private ProductDataProvider productDataProvider;
    @Mock
    private RemoteItemFetcher remoteItemFetcher;

    @InjectMocks
    private CombinedRequestHandler handler;

    @Test
    void handle_composesBothResultsWithFixedMessage() {
        ProductRecord product = ProductRecord.of(1);
        RemoteItem item = new RemoteItem(1, 1, "delectus aut autem", false);
        when(productDataProvider.fetchProduct(1)).thenReturn(Mono.just(product));
        when(remoteItemFetcher.fetchRemoteItem(1)).thenReturn(Mono.just(item));

        StepVerifier.create(handler.handle(1))
            .expectNext(new CombinedResult(product, item,
                "This is an example of async/await that keeps the server responsive."))
            .verifyComplete();
    }

    @Test
    void handle_takesTheSlowerBranchLatencyNotTheSum() {
        when(productDataProvider.fetchProduct(1))
            .thenReturn(Mono.just(ProductRecord.of(1)).delayElement(Duration.ofMillis(500)));
        when(remoteItemFetcher.fetchRemoteItem(1))
            .thenReturn(Mono.just(new RemoteItem(1, 1, "t", false)).delayElement(Duration.ofMillis(300)));

        long start = System.nanoTime();
        CombinedResult result = handler.handle(1).block(Duration.ofSeconds(5));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result).isNotNull();
        assertThat(elapsedMs)
            .as("fan-out should cost ~max(500, 300), not 800")
            .isGreaterThanOrEqualTo(450)
            .isLessThan(750);
    }

    @Test
    void handle_startsBothBranchesBeforeEitherCompletes() {
        AtomicBoolean remoteSubscribedWhileProductPending = new AtomicBoolean();
        AtomicBoolean productDone = new AtomicBoolean();
        when(productDataProvider.fetchProduct(4))
            .thenReturn(Mono.just(ProductRecord.of(4))
                .delayElement(Duration.ofMillis(200))
                .doOnNext(p -> productDone.set(true)));
        when(remoteItemFetcher.fetchRemoteItem(4))
            .thenReturn(Mono.just(new RemoteItem(4, 1, "t", true))
                .doOnSubscribe(s -> remoteSubscribedWhileProductPending.set(!productDone.get())));

        StepVerifier.create(handler.handle(4))
            .expectNextCount(1)
            .verifyComplete();

        assertThat(remoteSubscribedWhileProductPending).isTrue();
    }

    @Test
    void handle_failsWithUpstreamExceptionAndNoPartialResultWhenRemoteFails() {
        when(productDataProvider.fetchProduct(2))
            .thenReturn(Mono.just(ProductRecord.of(2)).delayElement(Duration.ofMillis(100)));
        RemoteFetchException remoteFailure = new RemoteFetchException(2, "Todo API answered 500 for id=2");
        when(remoteItemFetcher.fetchRemoteItem(2)).thenReturn(Mono.error(remoteFailure));

        StepVerifier.create(handler.handle(2))
            .expectErrorSatisfies(ex -> {
                assertThat(ex).isInstanceOf(UpstreamException.class);
                assertThat(ex.getCause()).isSameAs(remoteFailure);
                assertThat(((UpstreamException) ex).getRequestId()).isEqualTo(2);
            })
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void handle_waitsForTheSlowerBranchBeforeReportingAFastFailure() {
        when(productDataProvider.fetchProduct(3))
            .thenReturn(Mono.just(ProductRecord.of(3)).delayElement(Duration.ofMillis(300)));
        when(remoteItemFetcher.fetchRemoteItem(3))
            .thenReturn(Mono.error(new RemoteFetchException(3, "Todo API unreachable for id=3")));

        long start = System.nanoTime();
        StepVerifier.create(handler.handle(3))
            .expectError(UpstreamException.class)
            .verify(Duration.ofSeconds(5));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(250);
    }

    @Test
    void handle_keepsEveryBranchFailureWhenBothFail() {
        IllegalStateException productFailure = new IllegalStateException("storage down");
        RemoteFetchException remoteFailure = new RemoteFetchException(5, "Todo API answered 503 for id=5");
        when(productDataProvider.fetchProduct(5)).thenReturn(Mono.error(productFailure));
        when(remoteItemFetcher.fetchRemoteItem(5)).thenReturn(Mono.error(remoteFailure));

        StepVerifier.create(handler.handle(5))
            .expectErrorSatisfies(ex -> {
                assertThat(ex).isInstanceOf(UpstreamException.class);
                List<Throwable> branchFailures = new ArrayList<>();
                branchFailures.add(ex.getCause());
                branchFailures.addAll(Arrays.asList(ex.getSuppressed()));
                assertThat(branchFailures).containsExactlyInAnyOrder(productFailure, remoteFailure);
            })
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void handle_cancelsBothBranchesWhenTheCallerCancels() {
        AtomicBoolean productCancelled = new AtomicBoolean();
        AtomicBoolean remoteCancelled = new AtomicBoolean();
        when(productDataProvider.fetchProduct(7))
            .thenReturn(Mono.<ProductRecord>never().doOnCancel(() -> productCancelled.set(true)));
        when(remoteItemFetcher.fetchRemoteItem(7))
            .thenReturn(Mono.<RemoteItem>never().doOnCancel(() -> remoteCancelled.set(true)));

        StepVerifier.create(handler.handle(7))
            .expectSubscription()
            .thenCancel()
            .verify(Duration.ofSeconds(5));

        assertThat(productCancelled).isTrue();
        assertThat(remoteCancelled).isTrue();
    }

    @Test
    void handle_isLazyUntilSubscribed() {
        handler.handle(6);

        verify(productDataProvider, never()).fetchProduct(anyInt());
        verify(remoteItemFetcher, never()).fetchRemoteItem(anyInt());
    }

    @Test
    void handle_concurrentCallsWithDifferentIdsDoNotInterfere() throws Exception {
        CombinedRequestHandler realProducts = new CombinedRequestHandler(
            new SimulatedProductDataProvider(Duration.ofMillis(200)), remoteItemFetcher);
        when(remoteItemFetcher.fetchRemoteItem(anyInt())).thenAnswer(invocation -> {
            int id = invocation.getArgument(0);
            return Mono.just(new RemoteItem(id, id * 10, "todo " + id, id % 2 == 0))
                .delayElement(Duration.ofMillis(100));
        });

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<CombinedResult>> futures = IntStream.rangeClosed(1, 8)
                .mapToObj(id -> CompletableFuture.supplyAsync(
                    () -> realProducts.handle(id).block(Duration.ofSeconds(5)), callers))
                .toList();

            for (int i = 0; i < futures.size(); i++) {
                int id = i + 1;
                CombinedResult result = futures.get(i).get(10, TimeUnit.SECONDS);
                assertThat(result.product()).isEqualTo(ProductRecord.of(id));
                assertThat(result.remoteItem().id()).isEqualTo(id);
                assertThat(result.remoteItem().ownerId()).isEqualTo(id * 10);
                assertThat(result.remoteItem().title()).isEqualTo("todo " + id);
            }
        } finally {
            callers.shutdownNow();
        }
    }
}
