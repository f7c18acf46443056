package me.wargame.mcp.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.ExtractedDocument;
import me.wargame.mcp.domain.model.exception.ExtractionException;
import me.wargame.mcp.port.outbound.TextExtractorPort;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Routes a file to the extractor registered for its extension.
 */
@Service
@Slf4j
public class TextExtractionService {

    private final Map<String, TextExtractorPort> extractorsByExtension = new TreeMap<>();

    public TextExtractionService(List<TextExtractorPort> extractors) {
        for (TextExtractorPort extractor : extractors) {
            for (String extension : extractor.getSupportedExtensions()) {
                TextExtractorPort previous = extractorsByExtension.put(extension.toLowerCase(Locale.ROOT), extractor);
                if (previous != null) {
                    log.warn("[Extract] Extension '{}' claimed by both {} and {}", extension,
                            previous.getClass().getSimpleName(), extractor.getClass().getSimpleName());
                }
            }
        }
        log.info("[Extract] Registered extractors for {}", extractorsByExtension.keySet());
    }

    public boolean supports(Path path) {
        return extensionOf(path).map(extractorsByExtension::containsKey).orElse(false);
    }

    public Set<String> getSupportedExtensions() {
        return Collections.unmodifiableSet(extractorsByExtension.keySet());
    }

    public ExtractedDocument extract(Path path) {
        String extension = extensionOf(path)
                .orElseThrow(() -> new ExtractionException("File has no extension: " + path.getFileName()));
        TextExtractorPort extractor = extractorsByExtension.get(extension);
        if (extractor == null) {
            throw new ExtractionException("Unsupported file type: ." + extension);
        }
        return extractor.extract(path);
    }

    static Optional<String> extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
