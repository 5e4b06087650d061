package com.finexec.adapter.in.web.edit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request bodies of the per-activity edit endpoints.
 * Amounts are taken as raw JSON and parsed leniently.
 */
public final class EditRequests {

    private EditRequests() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AmountRequest(@JsonProperty("amount") Object amount) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommentRequest(@JsonProperty("comment") String comment) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaymentRequest(
            @JsonProperty("paymentStatus") String paymentStatus,
            @JsonProperty("amountPaid") Object amountPaid
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VatExpenseRequest(
            @JsonProperty("netAmount") Object netAmount,
            @JsonProperty("vatAmount") Object vatAmount
    ) {}
}
