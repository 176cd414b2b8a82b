package com.gsdorchestrator.verbosity;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tagged block of diagnostic output, shown once the verbosity level reaches {@code minLevel}.
 */
public class OutputSection {

    private String tag;
    private String content;
    private int minLevel = VerbosityLevel.DEFAULT.getValue();
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public OutputSection() {}

    public OutputSection(String tag, String content, int minLevel) {
        this.tag = tag;
        this.content = content;
        setMinLevel(minLevel);
    }

    public OutputSection(String tag, String content) {
        this(tag, content, VerbosityLevel.DEFAULT.getValue());
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public int getMinLevel() {
        return minLevel;
    }

    public void setMinLevel(int minLevel) {
        this.minLevel = VerbosityLevel.fromValue(minLevel).getValue();
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }
}
