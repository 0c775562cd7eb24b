package com.arbor.jackson.mixins;

import com.arbor.ast.SourceSpan;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(value = {"empty", "valid"}, ignoreUnknown = true)
public abstract class SourceSpanMixin {

    @JsonCreator
    SourceSpanMixin(@JsonProperty("file") String file,
                    @JsonProperty("start") SourceSpan.Position start,
                    @JsonProperty("end") SourceSpan.Position end) {
    }

    public abstract static class PositionMixin {
        @JsonCreator
        PositionMixin(@JsonProperty("line") int line, @JsonProperty("column") int column) {
        }
    }
}
