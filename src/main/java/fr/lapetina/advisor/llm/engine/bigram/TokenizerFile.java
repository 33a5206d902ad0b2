package fr.lapetina.advisor.llm.engine.bigram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk layout of {@code tokenizer.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenizerFile {

    private List<String> tokens;

    @JsonProperty("special_tokens")
    private List<String> specialTokens;

    @JsonProperty("stop_tokens")
    private List<String> stopTokens;

    @JsonProperty("unk_token")
    private String unknownToken;

    public List<String> getTokens() { return tokens; }
    public void setTokens(List<String> tokens) { this.tokens = tokens; }

    public List<String> getSpecialTokens() { return specialTokens; }
    public void setSpecialTokens(List<String> specialTokens) { this.specialTokens = specialTokens; }

    public List<String> getStopTokens() { return stopTokens; }
    public void setStopTokens(List<String> stopTokens) { this.stopTokens = stopTokens; }

    public String getUnknownToken() { return unknownToken; }
    public void setUnknownToken(String unknownToken) { this.unknownToken = unknownToken; }

    Vocabulary toVocabulary() {
        return new Vocabulary(tokens, specialTokens, stopTokens, unknownToken);
    }
}
