package com.flagship.settlement_engine.marketplace;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * An item offered for sale at a fixed price.
 *
 * {@code owner} starts as the seller and becomes the buyer on sale;
 * {@code seller} never changes.
 */
@Value
public class Listing {
    long id;
    String name;
    String description;
    BigInteger price;
    String seller;
    String owner;
    boolean available;
    Instant listedAt;
    Instant soldAt;
}
