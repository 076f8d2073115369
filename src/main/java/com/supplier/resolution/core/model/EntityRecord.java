package com.supplier.resolution.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A supplier or reference company record.
 * Immutable once built; all string fields are stored as given (null is kept as null).
 */
public final class EntityRecord {
    private final String key;
    private final String name;
    private final String country;
    private final String city;
    private final String street;
    private final String postcode;
    private final String companyType;
    private final String websiteUrl;
    private final List<String> socialUrls;
    private final Instant lastUpdatedAt;
    private final String malformedReason;

    private EntityRecord(Builder builder) {
        this.key = builder.key;
        this.name = builder.name;
        this.country = builder.country;
        this.city = builder.city;
        this.street = builder.street;
        this.postcode = builder.postcode;
        this.companyType = builder.companyType;
        this.websiteUrl = builder.websiteUrl;
        this.socialUrls = List.copyOf(builder.socialUrls);
        this.lastUpdatedAt = builder.lastUpdatedAt;
        this.malformedReason = builder.malformedReason;
    }

    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    public String getCountry() {
        return country;
    }

    public String getCity() {
        return city;
    }

    public String getStreet() {
        return street;
    }

    public String getPostcode() {
        return postcode;
    }

    public String getCompanyType() {
        return companyType;
    }

    public String getWebsiteUrl() {
        return websiteUrl;
    }

    public List<String> getSocialUrls() {
        return socialUrls;
    }

    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    /**
     * Reason a loader could not parse this row, or null for a well-formed row.
     */
    public String getMalformedReason() {
        return malformedReason;
    }

    public boolean hasWebsite() {
        return !isBlank(websiteUrl);
    }

    public boolean hasSocialPresence() {
        return socialUrls.stream().anyMatch(url -> !isBlank(url));
    }

    /**
     * Returns the reason this record cannot be resolved, or null when it can.
     * A record needs a row key and a name to take part in matching.
     */
    public String validationProblem() {
        if (malformedReason != null) {
            return malformedReason;
        }
        if (isBlank(key)) {
            return "missing row key";
        }
        if (isBlank(name)) {
            return "missing company name";
        }
        return null;
    }

    public boolean isMalformed() {
        return validationProblem() != null;
    }

    /**
     * Trims and lower-cases a value for comparison. Null becomes the empty string.
     */
    public static String normalize(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityRecord that = (EntityRecord) o;
        return Objects.equals(key, that.key)
                && Objects.equals(name, that.name)
                && Objects.equals(country, that.country)
                && Objects.equals(city, that.city)
                && Objects.equals(street, that.street)
                && Objects.equals(postcode, that.postcode)
                && Objects.equals(companyType, that.companyType)
                && Objects.equals(websiteUrl, that.websiteUrl)
                && Objects.equals(socialUrls, that.socialUrls)
                && Objects.equals(lastUpdatedAt, that.lastUpdatedAt)
                && Objects.equals(malformedReason, that.malformedReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, name, country, city);
    }

    @Override
    public String toString() {
        return "EntityRecord{" +
                "key='" + key + '\'' +
                ", name='" + name + '\'' +
                ", country='" + country + '\'' +
                ", city='" + city + '\'' +
                (malformedReason != null ? ", malformed='" + malformedReason + '\'' : "") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String key;
        private String name;
        private String country;
        private String city;
        private String street;
        private String postcode;
        private String companyType;
        private String websiteUrl;
        private final List<String> socialUrls = new ArrayList<>();
        private Instant lastUpdatedAt;
        private String malformedReason;

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder street(String street) {
            this.street = street;
            return this;
        }

        public Builder postcode(String postcode) {
            this.postcode = postcode;
            return this;
        }

        public Builder companyType(String companyType) {
            this.companyType = companyType;
            return this;
        }

        public Builder websiteUrl(String websiteUrl) {
            this.websiteUrl = websiteUrl;
            return this;
        }

        public Builder socialUrl(String socialUrl) {
            if (socialUrl != null) {
                this.socialUrls.add(socialUrl);
            }
            return this;
        }

        public Builder socialUrls(List<String> socialUrls) {
            this.socialUrls.clear();
            if (socialUrls != null) {
                socialUrls.forEach(this::socialUrl);
            }
            return this;
        }

        public Builder lastUpdatedAt(Instant lastUpdatedAt) {
            this.lastUpdatedAt = lastUpdatedAt;
            return this;
        }

        public Builder malformedReason(String malformedReason) {
            this.malformedReason = malformedReason;
            return this;
        }

        public EntityRecord build() {
            return new EntityRecord(this);
        }
    }
}
