package com.xammer.spectre.dto;

import java.util.List;

/**
 * @param added     findings present now but not in the baseline
 * @param resolved  baseline findings that no longer occur
 * @param unchanged findings present in both
 */
public record BaselineDiff(List<Finding> added, List<Finding> resolved, List<Finding> unchanged) {
}
