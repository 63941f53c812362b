package io.asyncly.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Jackson mixin for `Journal`: only the `entries` component is written.
@JsonIgnoreProperties(
        value = {"empty"},
        ignoreUnknown = true)
public abstract class JournalMixin {}
