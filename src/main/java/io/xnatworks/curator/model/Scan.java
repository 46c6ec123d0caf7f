/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One acquired series within an imaging session, as recorded in XNAT.
 * Instances are immutable snapshots of the archive state at fetch time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Scan {

    private final String id;
    private final String type;
    private final String seriesDescription;
    private final String modality;
    private final Integer frames;
    private final String quality;
    private final String xsiType;

    private Scan(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.seriesDescription = builder.seriesDescription;
        this.modality = builder.modality;
        this.frames = builder.frames;
        this.quality = builder.quality;
        this.xsiType = builder.xsiType;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    /**
     * Current scan type, the field assessors key on.
     */
    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("seriesDescription")
    public String getSeriesDescription() {
        return seriesDescription;
    }

    @JsonProperty("modality")
    public String getModality() {
        return modality;
    }

    /**
     * Frame count, or null when the archive does not report one.
     */
    @JsonProperty("frames")
    public Integer getFrames() {
        return frames;
    }

    /**
     * Recorded quality rating (usable, questionable, unusable).
     */
    @JsonProperty("quality")
    public String getQuality() {
        return quality;
    }

    @JsonProperty("xsiType")
    public String getXsiType() {
        return xsiType;
    }

    /**
     * Current value of a writable scan field.
     */
    public String valueOf(ScanField field) {
        switch (field) {
            case TYPE:
                return type;
            case QUALITY:
                return quality;
            default:
                throw new IllegalArgumentException("Unknown scan field: " + field);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Scan)) return false;
        Scan other = (Scan) o;
        return Objects.equals(id, other.id)
                && Objects.equals(type, other.type)
                && Objects.equals(seriesDescription, other.seriesDescription)
                && Objects.equals(modality, other.modality)
                && Objects.equals(frames, other.frames)
                && Objects.equals(quality, other.quality)
                && Objects.equals(xsiType, other.xsiType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, seriesDescription, modality, frames, quality, xsiType);
    }

    @Override
    public String toString() {
        return String.format("Scan{id=%s, type='%s', desc='%s', mod=%s, frames=%s}",
                id, type, seriesDescription, modality, frames);
    }

    public static class Builder {
        private final String id;
        private String type;
        private String seriesDescription;
        private String modality;
        private Integer frames;
        private String quality;
        private String xsiType;

        private Builder(String id) {
            this.id = id;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder seriesDescription(String seriesDescription) {
            this.seriesDescription = seriesDescription;
            return this;
        }

        public Builder modality(String modality) {
            this.modality = modality;
            return this;
        }

        public Builder frames(Integer frames) {
            this.frames = frames;
            return this;
        }

        public Builder quality(String quality) {
            this.quality = quality;
            return this;
        }

        public Builder xsiType(String xsiType) {
            this.xsiType = xsiType;
            return this;
        }

        public Scan build() {
            return new Scan(this);
        }
    }
}
