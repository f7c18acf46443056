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

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * BPE tokenizer of an OpenAI embedding model, backed by JTokkit.
 *
 * <p>
 * Character offsets are recovered by decoding each token to its UTF-8 bytes
 * and walking the byte prefix. A token that ends inside a multi-byte character
 * is extended to the end of that character, so the following token may come
 * out as an empty span.
 */
@Slf4j
public class ModelTokenizer implements Tokenizer {

    private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final String model;
    private final Encoding encoding;

    public ModelTokenizer(String model) {
        this.model = model;
        this.encoding = REGISTRY.getEncodingForModel(model).orElseGet(() -> {
            log.warn("[Chunking] No tokenizer registered for model '{}', using cl100k_base", model);
            return REGISTRY.getEncoding(EncodingType.CL100K_BASE);
        });
    }

    public String getModel() {
        return model;
    }

    public String getEncodingName() {
        return encoding.getName();
    }

    @Override
    public String getName() {
        return "model";
    }

    @Override
    public int count(String text) {
        return text == null || text.isEmpty() ? 0 : encoding.countTokensOrdinary(text);
    }

    @Override
    public List<TokenSpan> tokenize(String text) {
        List<TokenSpan> spans = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return spans;
        }
        int[] charAtByte = charOffsetsByByte(text);
        IntArrayList tokens = encoding.encodeOrdinary(text);
        IntArrayList single = new IntArrayList(1);
        int bytePos = 0;
        int charPos = 0;
        for (int i = 0; i < tokens.size(); i++) {
            single.clear();
            single.add(tokens.get(i));
            bytePos = Math.min(bytePos + encoding.decodeBytes(single).length, charAtByte.length - 1);
            int end = Math.max(charPos, charAtByte[bytePos]);
            spans.add(new TokenSpan(charPos, end));
            charPos = end;
        }
        return spans;
    }

    /**
     * Maps every UTF-8 byte offset of {@code text} to a char offset. Offsets
     * inside a multi-byte character map to the end of that character.
     */
    static int[] charOffsetsByByte(String text) {
        int[] offsets = new int[text.getBytes(StandardCharsets.UTF_8).length + 1];
        int bytePos = 0;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            int next = i + Character.charCount(codePoint);
            int width = utf8Width(codePoint);
            offsets[bytePos] = i;
            for (int k = 1; k < width; k++) {
                offsets[bytePos + k] = next;
            }
            bytePos += width;
            i = next;
        }
        offsets[bytePos] = text.length();
        return offsets;
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE) {
            // unpaired surrogate, encoded as '?'
            return 1;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
