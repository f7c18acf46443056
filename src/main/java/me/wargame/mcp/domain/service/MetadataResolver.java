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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.Doctrine;
import me.wargame.mcp.domain.model.DocumentCollection;
import me.wargame.mcp.domain.model.DocumentMetadata;
import me.wargame.mcp.domain.model.ExtractedDocument;
import me.wargame.mcp.domain.model.MetadataWarning;
import me.wargame.mcp.domain.model.ResolvedMetadata;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves per-document metadata through a fallback chain: sidecar YAML file,
 * metadata embedded in the document, filename heuristics, defaults.
 *
 * <p>
 * Invalid values degrade to defaults and are reported as
 * {@link MetadataWarning}s; resolution never fails.
 */
@Service
@Slf4j
public class MetadataResolver {

    static final String KEY_TITLE = "title";
    static final String KEY_DOCUMENT_ID = "document_id";
    static final String KEY_COLLECTION = "collection";
    static final String KEY_YEAR = "year";
    static final String KEY_DOCTRINE = "doctrine";
    static final String KEY_TAGS = "tags";

    private static final Pattern YEAR_IN_NAME = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");
    private static final Pattern NAME_SEPARATORS = Pattern.compile("[^\\p{Alnum}]+");
    private static final Map<String, DocumentCollection> COLLECTION_KEYWORDS = new LinkedHashMap<>();

    static {
        COLLECTION_KEYWORDS.put("doctrine", DocumentCollection.DOCTRINE);
        COLLECTION_KEYWORDS.put("aar", DocumentCollection.AAR);
        COLLECTION_KEYWORDS.put("aars", DocumentCollection.AAR);
        COLLECTION_KEYWORDS.put("scenario", DocumentCollection.SCENARIO);
        COLLECTION_KEYWORDS.put("scenarios", DocumentCollection.SCENARIO);
        COLLECTION_KEYWORDS.put("intel", DocumentCollection.INTEL);
    }

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final String sidecarSuffix;

    @Autowired
    public MetadataResolver(WargameProperties properties) {
        this(properties.getIngestion().getSidecarSuffix());
    }

    public MetadataResolver(String sidecarSuffix) {
        this.sidecarSuffix = sidecarSuffix;
    }

    public boolean isSidecar(Path path) {
        return path.getFileName() != null && path.getFileName().toString().endsWith(sidecarSuffix);
    }

    public Path sidecarFor(Path document) {
        return document.resolveSibling(document.getFileName().toString() + sidecarSuffix);
    }

    public ResolvedMetadata resolve(Path path, ExtractedDocument extracted) {
        List<MetadataWarning> warnings = new ArrayList<>();
        Map<String, Object> sidecar = loadSidecar(path, warnings);
        Map<String, Object> embedded = extracted != null && extracted.getEmbeddedMetadata() != null
                ? extracted.getEmbeddedMetadata()
                : Map.of();
        Map<String, Object> heuristics = fromFilename(path);
        List<Map<String, Object>> chain = List.of(sidecar, embedded, heuristics);

        String title = firstString(chain, KEY_TITLE).orElse(null);
        String normalizedPath = normalizePath(path);
        String contentHash = HashSupport.sha256Hex(extracted != null ? extracted.getText() : "");
        String documentId = firstString(List.of(sidecar, embedded), KEY_DOCUMENT_ID)
                .orElseGet(() -> buildDocumentId(title, normalizedPath, contentHash));

        DocumentMetadata metadata = DocumentMetadata.builder()
                .documentId(documentId)
                .sourcePath(normalizedPath)
                .title(title)
                .collection(resolveCollection(first(chain, KEY_COLLECTION), warnings))
                .year(resolveYear(first(chain, KEY_YEAR), warnings))
                .doctrine(resolveDoctrine(first(chain, KEY_DOCTRINE), warnings))
                .tags(mergeTags(chain.stream().map(source -> source.get(KEY_TAGS)).toList()))
                .build();

        for (MetadataWarning warning : warnings) {
            log.debug("[Metadata] {}: {} - {}", path, warning.field(), warning.message());
        }
        return new ResolvedMetadata(metadata, warnings);
    }

    public static String buildDocumentId(String title, String normalizedPath, String contentHash) {
        String hash = HashSupport.shortHash(normalizedPath + "|" + contentHash);
        String slug = HashSupport.slugify(title);
        return slug.isEmpty() ? "doc-" + hash : slug + "-" + hash;
    }

    public static String normalizePath(Path path) {
        return path.toAbsolutePath().normalize().toString().replace('\\', '/');
    }

    public static List<String> mergeTags(List<?> sources) {
        Set<String> merged = new LinkedHashSet<>();
        for (Object source : sources) {
            for (String tag : toStringList(source)) {
                String trimmed = tag.trim();
                if (!trimmed.isEmpty()) {
                    merged.add(trimmed);
                }
            }
        }
        return new ArrayList<>(merged);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> loadSidecar(Path path, List<MetadataWarning> warnings) {
        Path sidecarPath = sidecarFor(path);
        if (!Files.isRegularFile(sidecarPath)) {
            return Map.of();
        }
        try {
            String content = Files.readString(sidecarPath, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return Map.of();
            }
            Object parsed = yamlMapper.readValue(content, Object.class);
            if (parsed instanceof Map<?, ?> map) {
                return (Map<String, Object>) map;
            }
            warnings.add(new MetadataWarning("sidecar", "sidecar is not a mapping, ignored"));
        } catch (JsonProcessingException e) {
            warnings.add(new MetadataWarning("sidecar", "unparseable sidecar: " + e.getOriginalMessage()));
        } catch (IOException e) {
            warnings.add(new MetadataWarning("sidecar", "unreadable sidecar: " + e.getMessage()));
        }
        return Map.of();
    }

    private Map<String, Object> fromFilename(Path path) {
        Map<String, Object> values = new LinkedHashMap<>();
        String fileName = path.getFileName() != null ? path.getFileName().toString() : "";
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;

        String title = stem.replace('_', ' ').replace('-', ' ').trim();
        if (!title.isEmpty()) {
            values.put(KEY_TITLE, title);
        }

        Matcher matcher = YEAR_IN_NAME.matcher(stem);
        while (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            if (DocumentMetadata.isValidYear(year)) {
                values.put(KEY_YEAR, year);
                break;
            }
        }

        collectionKeyword(path.getParent() != null ? path.getParent().getFileName() : null)
                .or(() -> collectionKeyword(Path.of(stem)))
                .ifPresent(collection -> values.put(KEY_COLLECTION, collection.getValue()));
        return values;
    }

    private Optional<DocumentCollection> collectionKeyword(Path name) {
        if (name == null) {
            return Optional.empty();
        }
        String lowered = name.toString().toLowerCase(Locale.ROOT);
        if (lowered.contains("after-action") || lowered.contains("after_action")) {
            return Optional.of(DocumentCollection.AAR);
        }
        return Arrays.stream(NAME_SEPARATORS.split(lowered))
                .map(COLLECTION_KEYWORDS::get)
                .filter(Objects::nonNull)
                .findFirst();
    }

    private DocumentCollection resolveCollection(Object raw, List<MetadataWarning> warnings) {
        if (raw == null || raw.toString().isBlank()) {
            return DocumentCollection.OTHER;
        }
        Optional<DocumentCollection> collection = DocumentCollection.fromValue(raw.toString());
        if (collection.isEmpty()) {
            warnings.add(new MetadataWarning(KEY_COLLECTION, "unknown collection '" + raw + "', using other"));
            return DocumentCollection.OTHER;
        }
        return collection.get();
    }

    private Doctrine resolveDoctrine(Object raw, List<MetadataWarning> warnings) {
        if (raw == null || raw.toString().isBlank()) {
            return null;
        }
        Optional<Doctrine> doctrine = Doctrine.fromValue(raw.toString());
        if (doctrine.isEmpty()) {
            warnings.add(new MetadataWarning(KEY_DOCTRINE, "unknown doctrine '" + raw + "', using other"));
            return Doctrine.OTHER;
        }
        return doctrine.get();
    }

    private Integer resolveYear(Object raw, List<MetadataWarning> warnings) {
        if (raw == null) {
            return null;
        }
        Integer year;
        if (raw instanceof Number number) {
            year = number.intValue();
        } else {
            try {
                year = Integer.valueOf(raw.toString().trim());
            } catch (NumberFormatException e) {
                warnings.add(new MetadataWarning(KEY_YEAR, "year '" + raw + "' is not a number, cleared"));
                return null;
            }
        }
        if (!DocumentMetadata.isValidYear(year)) {
            warnings.add(new MetadataWarning(KEY_YEAR, "year " + year + " outside "
                    + DocumentMetadata.MIN_YEAR + "-" + DocumentMetadata.MAX_YEAR + ", cleared"));
            return null;
        }
        return year;
    }

    private static Object first(List<Map<String, Object>> chain, String key) {
        for (Map<String, Object> source : chain) {
            Object value = source.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static Optional<String> firstString(List<Map<String, Object>> chain, String key) {
        return Optional.ofNullable(first(chain, key)).map(value -> value.toString().trim());
    }

    private static List<String> toStringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().filter(Objects::nonNull).map(Object::toString).toList();
        }
        return Arrays.asList(value.toString().split(","));
    }
}
