package com.xammer.spectre.scanner;

import com.xammer.spectre.dto.Reference;

import java.util.List;

/**
 * Pulls bucket references out of one kind of file.
 */
public interface ReferenceExtractor {

    /**
     * @param fileName lower-cased file name, e.g. {@code main.tf}
     */
    boolean supports(String fileName);

    /**
     * @param file  path reported on each reference
     * @param lines file content, one entry per line
     */
    List<Reference> extract(String file, List<String> lines);
}
