package com.xammer.spectre.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.SortedMap;
import java.util.TreeMap;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanResult {
    private ScanSummary summary = new ScanSummary();
    private SortedMap<String, BucketAnalysis> buckets = new TreeMap<>();
}
