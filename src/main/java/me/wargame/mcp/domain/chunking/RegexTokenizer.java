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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer where every regex match is one token.
 */
public class RegexTokenizer implements Tokenizer {

    private final String name;
    private final Pattern pattern;

    public RegexTokenizer(String name, Pattern pattern) {
        this.name = name;
        this.pattern = pattern;
    }

    /**
     * Words and single punctuation marks.
     */
    public static RegexTokenizer words() {
        return new RegexTokenizer("word", Pattern.compile("\\w+|[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS));
    }

    /**
     * Runs of non-whitespace characters.
     */
    public static RegexTokenizer whitespace() {
        return new RegexTokenizer("whitespace", Pattern.compile("\\S+"));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<TokenSpan> tokenize(String text) {
        List<TokenSpan> spans = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return spans;
        }
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            spans.add(new TokenSpan(matcher.start(), matcher.end()));
        }
        return spans;
    }
}
