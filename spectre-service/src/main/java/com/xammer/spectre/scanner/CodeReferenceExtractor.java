package com.xammer.spectre.scanner;

import com.xammer.spectre.dto.Reference;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Source code and shell scripts. The access context is guessed from the verbs on the line.
 */
@Component
@Order(5)
public class CodeReferenceExtractor implements ReferenceExtractor {

    private static final Set<String> EXTENSIONS = Set.of(".py", ".js", ".ts", ".go", ".java", ".sh");

    @Override
    public boolean supports(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.contains(fileName.substring(dot));
    }

    @Override
    public List<Reference> extract(String file, List<String> lines) {
        List<Reference> refs = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;
            String context = S3Patterns.detectContext(line);
            int firstOnLine = refs.size();

            Matcher url = S3Patterns.S3_URL.matcher(line);
            while (url.find()) {
                refs.add(new Reference(url.group(1), S3Patterns.emptyToNull(url.group(2)),
                        S3Patterns.emptyToNull(url.group(3)), file, lineNumber, context));
            }
            Matcher http = S3Patterns.S3_HTTP_URL.matcher(line);
            while (http.find()) {
                refs.add(new Reference(http.group(1), S3Patterns.emptyToNull(http.group(3)),
                        S3Patterns.emptyToNull(http.group(4)), file, lineNumber, context));
            }
            Matcher assignment = S3Patterns.BUCKET_ASSIGNMENT.matcher(line);
            while (assignment.find()) {
                String bucket = assignment.group(1);
                if (!seenOnLine(refs, firstOnLine, bucket)) {
                    refs.add(Reference.of(bucket, null, file, lineNumber, context));
                }
            }
        }
        return refs;
    }

    private static boolean seenOnLine(List<Reference> refs, int from, String bucket) {
        for (int i = from; i < refs.size(); i++) {
            if (refs.get(i).bucket().equals(bucket)) {
                return true;
            }
        }
        return false;
    }
}
