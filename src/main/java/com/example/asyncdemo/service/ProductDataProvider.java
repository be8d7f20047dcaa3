package com.example.asyncdemo.service;

import com.example.asyncdemo.model.ProductRecord;
import reactor.core.publisher.Mono;

/**
 * Source of product records. Implementations may be slow but must not block
 * the subscribing thread.
 */
public interface ProductDataProvider {

    /**
     * Looks up a product. Any id is accepted.
     *
     * @param id product id
     * @return a lazy Mono emitting the product once the lookup completes
     */
    Mono<ProductRecord> fetchProduct(int id);
}
