package com.xammer.spectre.scanner;

import com.xammer.spectre.dto.Reference;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

@Component
@Order(2)
public class YamlReferenceExtractor implements ReferenceExtractor {

    static final String CONTEXT = "yaml";

    @Override
    public boolean supports(String fileName) {
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }

    @Override
    public List<Reference> extract(String file, List<String> lines) {
        List<Reference> refs = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher url = S3Patterns.S3_URL.matcher(line);
            while (url.find()) {
                refs.add(Reference.of(url.group(1), S3Patterns.emptyToNull(url.group(2)), file, i + 1, CONTEXT));
            }
            Matcher key = S3Patterns.YAML_BUCKET_KEY.matcher(line);
            while (key.find()) {
                refs.add(Reference.of(key.group(1), null, file, i + 1, CONTEXT));
            }
        }
        return refs;
    }
}
