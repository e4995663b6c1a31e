package com.xammer.spectre.scanner;

import com.xammer.spectre.dto.Reference;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Terraform and HCL. Picks up {@code bucket = "..."} inside S3 bucket/object resource blocks,
 * reported on the line that opens the block, plus any {@code s3://} URL.
 */
@Component
@Order(1)
public class TerraformReferenceExtractor implements ReferenceExtractor {

    static final String CONTEXT = "terraform";

    @Override
    public boolean supports(String fileName) {
        return fileName.endsWith(".tf") || fileName.endsWith(".hcl");
    }

    @Override
    public List<Reference> extract(String file, List<String> lines) {
        List<Reference> refs = new ArrayList<>();
        boolean inResource = false;
        String currentBucket = null;
        int resourceLine = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String trimmed = line.trim();
            int lineNumber = i + 1;

            if (S3Patterns.TF_BUCKET_RESOURCE.matcher(trimmed).find()
                    || S3Patterns.TF_OBJECT_RESOURCE.matcher(trimmed).find()) {
                inResource = true;
                resourceLine = lineNumber;
                currentBucket = null;
                continue;
            }
            if (inResource && "}".equals(trimmed)) {
                if (currentBucket != null) {
                    refs.add(Reference.of(currentBucket, null, file, resourceLine, CONTEXT));
                }
                inResource = false;
                currentBucket = null;
                continue;
            }
            if (inResource) {
                Matcher attribute = S3Patterns.TF_BUCKET_ATTRIBUTE.matcher(trimmed);
                if (attribute.find()) {
                    currentBucket = attribute.group(1);
                }
            }

            Matcher url = S3Patterns.S3_URL.matcher(line);
            while (url.find()) {
                refs.add(Reference.of(url.group(1), S3Patterns.emptyToNull(url.group(2)), file, lineNumber, CONTEXT));
            }
        }
        return refs;
    }
}
