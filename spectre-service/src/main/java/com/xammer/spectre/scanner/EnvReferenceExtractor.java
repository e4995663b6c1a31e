package com.xammer.spectre.scanner;

import com.xammer.spectre.dto.Reference;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Dotenv-style files such as {@code prod.env}; comment lines are ignored.
 */
@Component
@Order(4)
public class EnvReferenceExtractor implements ReferenceExtractor {

    static final String CONTEXT = "env";

    @Override
    public boolean supports(String fileName) {
        return fileName.endsWith(".env");
    }

    @Override
    public List<Reference> extract(String file, List<String> lines) {
        List<Reference> refs = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.startsWith("#")) {
                continue;
            }
            Matcher url = S3Patterns.S3_URL.matcher(line);
            while (url.find()) {
                refs.add(Reference.of(url.group(1), S3Patterns.emptyToNull(url.group(2)), file, i + 1, CONTEXT));
            }
            Matcher assignment = S3Patterns.ENV_BUCKET.matcher(line);
            while (assignment.find()) {
                refs.add(Reference.of(assignment.group(1), null, file, i + 1, CONTEXT));
            }
        }
        return refs;
    }
}
