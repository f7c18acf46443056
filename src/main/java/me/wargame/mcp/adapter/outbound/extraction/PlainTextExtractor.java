package me.wargame.mcp.adapter.outbound.extraction;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.ExtractedDocument;
import me.wargame.mcp.domain.model.exception.ExtractionException;
import me.wargame.mcp.port.outbound.TextExtractorPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts plain text and Markdown files. A leading YAML front matter block is
 * stripped from the text and reported as embedded metadata.
 */
@Component
@Slf4j
public class PlainTextExtractor implements TextExtractorPort {

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---\\s*\\n(.*?)\\n---\\s*\\n(.*)$", Pattern.DOTALL);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("txt", "md", "markdown");
    }

    @Override
    public ExtractedDocument extract(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExtractionException("Cannot read " + path.getFileName() + ": " + e.getMessage(), e);
        }
        if (!content.isEmpty() && content.charAt(0) == '\uFEFF') {
            content = content.substring(1);
        }
        content = content.replace("\r\n", "\n");

        Map<String, Object> embedded = new HashMap<>();
        Matcher matcher = FRONTMATTER_PATTERN.matcher(content);
        if (matcher.matches()) {
            embedded.putAll(parseFrontMatter(matcher.group(1), path));
            content = matcher.group(2);
        }
        return ExtractedDocument.builder()
                .text(content)
                .embeddedMetadata(embedded)
                .build();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parseFrontMatter(String yaml, Path path) {
        try {
            Object parsed = yamlMapper.readValue(yaml, Object.class);
            if (parsed instanceof Map<?, ?> map) {
                return (Map<String, Object>) map;
            }
        } catch (JsonProcessingException e) {
            log.debug("[Extract] Ignoring malformed front matter in {}: {}", path.getFileName(),
                    e.getOriginalMessage());
        }
        return Map.of();
    }
}
