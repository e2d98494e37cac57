/* Copyright (C) 2024 DetLib contributors
 * This file is part of DetLib.
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
 */
package de.detlib.examples;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import net.automatalib.words.Word;

/**
 * Enumerates test words.
 */
public final class Words {

    private Words() {
        // prevent instantiation
    }

    /**
     * Lists all words over the given symbols with a length of at most {@code maxLength}, shortest first, starting with
     * the empty word.
     *
     * @param symbols
     *         the symbols to build the words from
     * @param maxLength
     *         the maximal word length
     *
     * @return the words
     */
    public static <I> List<Word<I>> allWords(Collection<? extends I> symbols, int maxLength) {
        final List<Word<I>> result = new ArrayList<>();
        List<Word<I>> layer = new ArrayList<>();
        layer.add(Word.epsilon());
        result.addAll(layer);

        for (int len = 1; len <= maxLength; len++) {
            final List<Word<I>> next = new ArrayList<>(layer.size() * symbols.size());
            for (Word<I> prefix : layer) {
                for (I symbol : symbols) {
                    next.add(prefix.append(symbol));
                }
            }
            result.addAll(next);
            layer = next;
        }

        return result;
    }
}
