package com.xammer.spectre.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.SortedMap;
import java.util.TreeMap;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryResult {
    private DiscoverySummary summary = new DiscoverySummary();
    private SortedMap<String, BucketDiscovery> buckets = new TreeMap<>();
}
