package com.example.ttlreaper.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@JsonInclude(Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
@EqualsAndHashCode
@ToString
public class LabelSelector {

    @Default
    private Map<String, String> matchLabels = new LinkedHashMap<>();

    @Default
    private List<Requirement> matchExpressions = new ArrayList<>();

    public boolean isEmpty() {
        return (matchLabels == null || matchLabels.isEmpty())
                && (matchExpressions == null || matchExpressions.isEmpty());
    }

    @JsonInclude(Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @Getter @Setter
    @EqualsAndHashCode
    @ToString
    public static class Requirement {
        private String key;
        private String operator;
        private List<String> values;
    }
}
