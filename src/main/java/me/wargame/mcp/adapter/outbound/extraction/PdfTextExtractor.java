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

import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.ExtractedDocument;
import me.wargame.mcp.domain.model.exception.ExtractionException;
import me.wargame.mcp.port.outbound.TextExtractorPort;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Calendar;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Extracts text and document information from PDF files with PDFBox.
 *
 * <p>
 * A PDF without a text layer yields blank text; the ingestor then reports it as
 * having no indexable text. No OCR is attempted.
 */
@Component
@Slf4j
public class PdfTextExtractor implements TextExtractorPort {

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("pdf");
    }

    @Override
    public ExtractedDocument extract(Path path) {
        try (PDDocument doc = Loader.loadPDF(path.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = stripper.getText(doc);
            return ExtractedDocument.builder()
                    .text(text)
                    .embeddedMetadata(readInfo(doc.getDocumentInformation()))
                    .build();
        } catch (IOException e) {
            log.debug("[Extract] PDF extraction failed for {}", path.getFileName(), e);
            throw new ExtractionException("PDF extraction failed for " + path.getFileName() + ": " + e.getMessage(),
                    e);
        }
    }

    private Map<String, Object> readInfo(PDDocumentInformation info) {
        Map<String, Object> metadata = new HashMap<>();
        if (info == null) {
            return metadata;
        }
        if (info.getTitle() != null && !info.getTitle().isBlank()) {
            metadata.put("title", info.getTitle().trim());
        }
        if (info.getKeywords() != null && !info.getKeywords().isBlank()) {
            metadata.put("tags", info.getKeywords());
        }
        Calendar created = info.getCreationDate();
        if (created != null) {
            metadata.put("year", created.get(Calendar.YEAR));
        }
        return metadata;
    }
}
