package fr.lapetina.advisor.llm.engine.bigram;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Token table with greedy longest-match encoding.
 *
 * Tokens carry their own whitespace (for example {@code " market"}), so
 * decoding is plain concatenation. Special tokens are matched like any other
 * token when encoding and dropped when decoding.
 */
public final class Vocabulary {

    private final String[] tokens;
    private final Map<String, Integer> ids;
    private final boolean[] special;
    private final boolean[] stop;
    private final int unknownId;
    private final int maxTokenLength;

    /**
     * @param tokens        token strings indexed by id, unique and non-empty
     * @param specialTokens tokens skipped when decoding
     * @param stopTokens    tokens ending generation
     * @param unknownToken  token emitted for unmatched characters, or {@code null} to skip them
     */
    public Vocabulary(
            List<String> tokens,
            Collection<String> specialTokens,
            Collection<String> stopTokens,
            String unknownToken
    ) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("Vocabulary must not be empty");
        }
        this.tokens = tokens.toArray(new String[0]);
        this.ids = new HashMap<>(tokens.size() * 2);
        int longest = 0;
        for (int id = 0; id < this.tokens.length; id++) {
            String token = this.tokens[id];
            if (token == null || token.isEmpty()) {
                throw new IllegalArgumentException("Empty token at id " + id);
            }
            if (ids.putIfAbsent(token, id) != null) {
                throw new IllegalArgumentException("Duplicate token: '" + token + "'");
            }
            longest = Math.max(longest, token.length());
        }
        this.maxTokenLength = longest;
        this.special = flags(specialTokens, "special");
        this.stop = flags(stopTokens, "stop");
        if (unknownToken != null) {
            this.unknownId = requireId(unknownToken, "unknown");
            this.special[unknownId] = true;
        } else {
            this.unknownId = -1;
        }
    }

    public int[] encode(String text) {
        int[] out = new int[text.length()];
        int count = 0;
        int pos = 0;
        while (pos < text.length()) {
            int matched = -1;
            int matchedLength = 0;
            for (int len = Math.min(maxTokenLength, text.length() - pos); len > 0; len--) {
                Integer id = ids.get(text.substring(pos, pos + len));
                if (id != null) {
                    matched = id;
                    matchedLength = len;
                    break;
                }
            }
            if (matched >= 0) {
                out[count++] = matched;
                pos += matchedLength;
            } else {
                if (unknownId >= 0) {
                    out[count++] = unknownId;
                }
                pos += Character.charCount(text.codePointAt(pos));
            }
        }
        return Arrays.copyOf(out, count);
    }

    public String decode(int[] tokenIds, int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            int id = tokenIds[i];
            if (id < 0 || id >= tokens.length) {
                throw new IllegalArgumentException("Unknown token id: " + id);
            }
            if (!special[id]) {
                sb.append(tokens[id]);
            }
        }
        return sb.toString();
    }

    public OptionalInt id(String token) {
        Integer id = ids.get(token);
        return id != null ? OptionalInt.of(id) : OptionalInt.empty();
    }

    public String token(int id) {
        return tokens[id];
    }

    public boolean isStop(int id) {
        return stop[id];
    }

    public int size() {
        return tokens.length;
    }

    long approximateBytes() {
        long bytes = (long) tokens.length * (16 + 2 + 2);
        for (String token : tokens) {
            bytes += 40L + 2L * token.length();
        }
        return bytes;
    }

    private boolean[] flags(Collection<String> selected, String kind) {
        boolean[] flags = new boolean[tokens.length];
        if (selected != null) {
            for (String token : selected) {
                flags[requireId(token, kind)] = true;
            }
        }
        return flags;
    }

    private int requireId(String token, String kind) {
        Integer id = ids.get(token);
        if (id == null) {
            throw new IllegalArgumentException("The " + kind + " token is not in the vocabulary: '" + token + "'");
        }
        return id;
    }
}
