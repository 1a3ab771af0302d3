package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.marketplace.Listing;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

@Value
@Builder
public class ListingResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("price")
    BigInteger price;

    @JsonProperty("seller")
    String seller;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("available")
    boolean available;

    @JsonProperty("listed_at")
    Instant listedAt;

    @JsonProperty("sold_at")
    Instant soldAt;

    public static ListingResponse from(Listing listing) {
        return ListingResponse.builder()
            .id(listing.getId())
            .name(listing.getName())
            .description(listing.getDescription())
            .price(listing.getPrice())
            .seller(listing.getSeller())
            .owner(listing.getOwner())
            .available(listing.isAvailable())
            .listedAt(listing.getListedAt())
            .soldAt(listing.getSoldAt())
            .build();
    }
}
