package com.xammer.spectre.service;

import java.util.List;

/**
 * Which regions an audit covers. An explicit list beats {@code allRegions}, which beats the default region.
 */
public record RegionSelection(List<String> regions, boolean allRegions, String defaultRegion) {

    public RegionSelection {
        regions = regions == null ? List.of() : List.copyOf(regions);
    }

    public static RegionSelection explicit(List<String> regions) {
        return new RegionSelection(regions, false, null);
    }

    public static RegionSelection allEnabled() {
        return new RegionSelection(List.of(), true, null);
    }

    public static RegionSelection defaultOnly(String defaultRegion) {
        return new RegionSelection(List.of(), false, defaultRegion);
    }
}
