package com.lunaindex.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({ "purpose", "keyComponents", "dependencies", "publicAPI", "codeLinks", "usedBy", "implementationNotes" })
public final class SummaryContent {
    private final String purpose;
    private final List<KeyComponent> keyComponents;
    private final DependencySet dependencies;
    private final List<ApiEntry> publicApi;
    private final List<CodeLink> codeLinks;
    private final List<UsedByEntry> usedBy;
    private final String implementationNotes;
    private final Map<String, Object> additionalFields = new LinkedHashMap<>();

    public SummaryContent(
            String purpose,
            List<KeyComponent> keyComponents,
            DependencySet dependencies,
            List<ApiEntry> publicApi,
            List<CodeLink> codeLinks,
            String implementationNotes) {
        this(purpose, keyComponents, dependencies, publicApi, codeLinks, List.of(), implementationNotes);
    }

    @JsonCreator
    public SummaryContent(
            @JsonProperty("purpose") String purpose,
            @JsonProperty("keyComponents") List<KeyComponent> keyComponents,
            @JsonProperty("dependencies") DependencySet dependencies,
            @JsonProperty("publicAPI") List<ApiEntry> publicApi,
            @JsonProperty("codeLinks") List<CodeLink> codeLinks,
            @JsonProperty("usedBy") List<UsedByEntry> usedBy,
            @JsonProperty("implementationNotes") String implementationNotes) {
        this.purpose = purpose == null ? "" : purpose;
        this.keyComponents = keyComponents == null ? List.of() : List.copyOf(keyComponents);
        this.dependencies = dependencies == null ? DependencySet.empty() : dependencies;
        this.publicApi = publicApi == null ? List.of() : List.copyOf(publicApi);
        this.codeLinks = codeLinks == null ? List.of() : List.copyOf(codeLinks);
        this.usedBy = usedBy == null ? List.of() : List.copyOf(usedBy);
        this.implementationNotes = implementationNotes == null ? "" : implementationNotes;
    }

    @JsonProperty("purpose")
    public String purpose() {
        return purpose;
    }

    @JsonProperty("keyComponents")
    public List<KeyComponent> keyComponents() {
        return keyComponents;
    }

    @JsonProperty("dependencies")
    public DependencySet dependencies() {
        return dependencies;
    }

    @JsonProperty("publicAPI")
    public List<ApiEntry> publicApi() {
        return publicApi;
    }

    @JsonProperty("codeLinks")
    public List<CodeLink> codeLinks() {
        return codeLinks;
    }

    @JsonProperty("usedBy")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<UsedByEntry> usedBy() {
        return usedBy;
    }

    @JsonProperty("implementationNotes")
    public String implementationNotes() {
        return implementationNotes;
    }

    @JsonAnyGetter
    public Map<String, Object> additionalFields() {
        return Collections.unmodifiableMap(additionalFields);
    }

    // only called while deserializing
    @JsonAnySetter
    void putAdditionalField(String name, Object value) {
        additionalFields.put(name, value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        SummaryContent that = (SummaryContent) other;
        return purpose.equals(that.purpose)
                && keyComponents.equals(that.keyComponents)
                && dependencies.equals(that.dependencies)
                && publicApi.equals(that.publicApi)
                && codeLinks.equals(that.codeLinks)
                && usedBy.equals(that.usedBy)
                && implementationNotes.equals(that.implementationNotes)
                && additionalFields.equals(that.additionalFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(purpose, keyComponents, dependencies, publicApi, codeLinks, usedBy, implementationNotes,
                additionalFields);
    }
}
