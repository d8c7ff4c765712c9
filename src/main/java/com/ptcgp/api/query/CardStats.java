package com.ptcgp.api.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Totals over the whole card collection.
 * Each table maps a label, as spelled in the data, to the number of cards carrying it.
 */
public record CardStats(
    @JsonProperty("total_cards") int total,
    Map<String, Integer> types,
    Map<String, Integer> rarities,
    Map<String, Integer> sets
) {}
