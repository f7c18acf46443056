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

import me.wargame.mcp.domain.model.ExtractedDocument;
import me.wargame.mcp.domain.model.exception.ExtractionException;
import me.wargame.mcp.port.outbound.TextExtractorPort;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Extracts paragraph text from OOXML word documents by streaming
 * {@code word/document.xml}. Each {@code w:p} becomes one line, table rows are
 * rendered pipe-separated so the segmenter keeps them whole.
 */
@Component
public class DocxTextExtractor implements TextExtractorPort {

    private static final String DOCUMENT_ENTRY = "word/document.xml";
    private static final String WORD_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

    private final XMLInputFactory xmlInputFactory;

    public DocxTextExtractor() {
        this.xmlInputFactory = XMLInputFactory.newInstance();
        xmlInputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        xmlInputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("docx");
    }

    @Override
    public ExtractedDocument extract(Path path) {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            ZipEntry entry = zip.getEntry(DOCUMENT_ENTRY);
            if (entry == null) {
                throw new ExtractionException(path.getFileName() + " has no " + DOCUMENT_ENTRY);
            }
            try (InputStream in = zip.getInputStream(entry)) {
                return ExtractedDocument.builder().text(readBody(in)).build();
            }
        } catch (IOException | XMLStreamException e) {
            throw new ExtractionException("DOCX extraction failed for " + path.getFileName() + ": " + e.getMessage(),
                    e);
        }
    }

    private String readBody(InputStream in) throws XMLStreamException {
        XMLStreamReader reader = xmlInputFactory.createXMLStreamReader(in);
        StringBuilder text = new StringBuilder();
        StringBuilder paragraph = new StringBuilder();
        boolean inText = false;
        int tableDepth = 0;
        boolean firstCell = true;
        try {
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT && WORD_NS.equals(reader.getNamespaceURI())) {
                    switch (reader.getLocalName()) {
                    case "t" -> inText = true;
                    case "tab" -> paragraph.append('\t');
                    case "br" -> paragraph.append('\n');
                    case "tbl" -> tableDepth++;
                    case "tr" -> {
                        paragraph.setLength(0);
                        firstCell = true;
                    }
                    case "tc" -> {
                        paragraph.append(firstCell ? "| " : " | ");
                        firstCell = false;
                    }
                    default -> {
                        // formatting elements carry no text
                    }
                    }
                } else if (event == XMLStreamConstants.CHARACTERS && inText) {
                    paragraph.append(reader.getText());
                } else if (event == XMLStreamConstants.END_ELEMENT && WORD_NS.equals(reader.getNamespaceURI())) {
                    switch (reader.getLocalName()) {
                    case "t" -> inText = false;
                    case "p" -> {
                        if (tableDepth == 0) {
                            text.append(paragraph).append("\n\n");
                            paragraph.setLength(0);
                        }
                    }
                    case "tr" -> {
                        text.append(paragraph).append(" |\n");
                        paragraph.setLength(0);
                    }
                    case "tbl" -> {
                        tableDepth--;
                        text.append('\n');
                    }
                    default -> {
                        // nothing to close
                    }
                    }
                }
            }
        } finally {
            reader.close();
        }
        return text.toString().strip();
    }
}
