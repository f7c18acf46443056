package me.wargame.mcp.domain.chunking;

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

import java.util.List;

/**
 * Splits text into tokens for window sizing. Implementations must be
 * deterministic and return spans in ascending, non-overlapping order.
 */
public interface Tokenizer {

    String getName();

    List<TokenSpan> tokenize(String text);

    default int count(String text) {
        return text == null || text.isEmpty() ? 0 : tokenize(text).size();
    }
}
