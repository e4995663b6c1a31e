package com.xammer.spectre.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.spectre.dto.BaselineDiff;
import com.xammer.spectre.dto.BucketAnalysis;
import com.xammer.spectre.dto.BucketDiscovery;
import com.xammer.spectre.dto.BucketStatus;
import com.xammer.spectre.dto.DiscoveryReport;
import com.xammer.spectre.dto.Finding;
import com.xammer.spectre.dto.PrefixAnalysis;
import com.xammer.spectre.dto.ScanReport;
import com.xammer.spectre.exception.BaselineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compares the findings of a run with those of an earlier JSON report so CI only reacts to new drift.
 */
@Service
public class BaselineService {

    private static final Logger logger = LoggerFactory.getLogger(BaselineService.class);

    private final ObjectMapper objectMapper;

    public BaselineService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Every non-OK bucket and prefix of a scan report, in bucket order. */
    public List<Finding> flatten(ScanReport report) {
        List<Finding> findings = new ArrayList<>();
        if (report.getBuckets() == null) {
            return findings;
        }
        report.getBuckets().forEach((name, analysis) -> {
            if (analysis.getStatus() != null && analysis.getStatus() != BucketStatus.OK) {
                findings.add(Finding.bucket(analysis.getStatus(), name));
            }
            for (PrefixAnalysis prefix : prefixesOf(analysis)) {
                if (prefix.getStatus() != null && prefix.getStatus() != BucketStatus.OK) {
                    findings.add(Finding.prefix(prefix.getStatus(), name, prefix.getPrefix()));
                }
            }
        });
        return findings;
    }

    public List<Finding> flatten(DiscoveryReport report) {
        List<Finding> findings = new ArrayList<>();
        if (report.getBuckets() == null) {
            return findings;
        }
        for (BucketDiscovery discovery : report.getBuckets().values()) {
            if (discovery.getStatus() != null && discovery.getStatus() != BucketStatus.OK) {
                findings.add(Finding.bucket(discovery.getStatus(), discovery.getName()));
            }
        }
        return findings;
    }

    public List<Finding> loadScanBaseline(Path path) {
        return flatten(read(path, ScanReport.class));
    }

    public List<Finding> loadDiscoveryBaseline(Path path) {
        return flatten(read(path, DiscoveryReport.class));
    }

    /**
     * Set difference on (type, bucket, prefix). Order follows {@code current} for added and
     * unchanged findings and {@code baseline} for resolved ones.
     */
    public BaselineDiff diff(List<Finding> current, List<Finding> baseline) {
        Set<Finding> baselineSet = new LinkedHashSet<>(baseline);
        Set<Finding> currentSet = new LinkedHashSet<>(current);

        List<Finding> added = new ArrayList<>();
        List<Finding> unchanged = new ArrayList<>();
        for (Finding finding : currentSet) {
            if (baselineSet.contains(finding)) {
                unchanged.add(finding);
            } else {
                added.add(finding);
            }
        }
        List<Finding> resolved = new ArrayList<>();
        for (Finding finding : baselineSet) {
            if (!currentSet.contains(finding)) {
                resolved.add(finding);
            }
        }
        return new BaselineDiff(added, resolved, unchanged);
    }

    private <T> T read(Path path, Class<T> type) {
        byte[] raw;
        try {
            raw = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new BaselineException("read baseline: " + e.getMessage(), e);
        }
        try {
            T report = objectMapper.readValue(raw, type);
            logger.debug("Loaded baseline {}", path);
            return report;
        } catch (IOException e) {
            throw new BaselineException("parse baseline: " + e.getMessage(), e);
        }
    }

    private static List<PrefixAnalysis> prefixesOf(BucketAnalysis analysis) {
        return analysis.getPrefixes() == null ? List.of() : analysis.getPrefixes();
    }
}
