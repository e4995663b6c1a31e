package com.xammer.spectre.scanner;

import com.xammer.spectre.dto.Reference;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

@Component
@Order(3)
public class JsonReferenceExtractor implements ReferenceExtractor {

    static final String CONTEXT = "json";

    @Override
    public boolean supports(String fileName) {
        return fileName.endsWith(".json");
    }

    @Override
    public List<Reference> extract(String file, List<String> lines) {
        List<Reference> refs = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;
            Matcher url = S3Patterns.S3_URL.matcher(line);
            while (url.find()) {
                refs.add(Reference.of(url.group(1), S3Patterns.emptyToNull(url.group(2)), file, lineNumber, CONTEXT));
            }
            Matcher http = S3Patterns.S3_HTTP_URL.matcher(line);
            while (http.find()) {
                refs.add(Reference.of(http.group(1), S3Patterns.emptyToNull(http.group(3)), file, lineNumber, CONTEXT));
            }
            Matcher assignment = S3Patterns.BUCKET_ASSIGNMENT.matcher(line);
            while (assignment.find()) {
                refs.add(Reference.of(assignment.group(1), null, file, lineNumber, CONTEXT));
            }
        }
        return refs;
    }
}
