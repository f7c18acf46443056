package me.wargame.mcp.port.outbound;

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

import java.nio.file.Path;
import java.util.Set;

/**
 * Port for pulling raw text out of one file format.
 */
public interface TextExtractorPort {

    /**
     * Lower-case file extensions without the dot.
     */
    Set<String> getSupportedExtensions();

    /**
     * @throws me.wargame.mcp.domain.model.exception.ExtractionException
     *             when the file cannot be read or parsed
     */
    ExtractedDocument extract(Path path);
}
