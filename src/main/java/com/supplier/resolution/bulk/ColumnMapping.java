package com.supplier.resolution.bulk;

import com.supplier.resolution.core.model.EntityRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Column (or JSON field) names used to build an {@code EntityRecord} from a tabular row.
 *
 * <p>The presets follow the candidate-pairs export layout, where every row carries the
 * submitted supplier under {@code input_*} columns next to one reference company:</p>
 * <pre>
 * input_row_key,input_company_name,input_main_country_code,input_main_city,veridion_id,company_name,main_country_code,...
 * </pre>
 */
public record ColumnMapping(
        String keyColumn,
        String nameColumn,
        String countryColumn,
        String cityColumn,
        String streetColumn,
        String postcodeColumn,
        String companyTypeColumn,
        String websiteColumn,
        List<String> socialColumns,
        String lastUpdatedColumn
) {
    private static final List<String> SOCIAL_COLUMNS = List.of(
            "linkedin_url", "facebook_url", "twitter_url", "youtube_url", "instagram_url", "tiktok_url");

    public ColumnMapping {
        Objects.requireNonNull(keyColumn, "keyColumn is required");
        Objects.requireNonNull(nameColumn, "nameColumn is required");
        socialColumns = socialColumns != null ? List.copyOf(socialColumns) : List.of();
    }

    /**
     * Reference-company columns.
     */
    public static ColumnMapping reference() {
        return new ColumnMapping("veridion_id", "company_name", "main_country_code", "main_city",
                "main_street", "main_postcode", "company_type", "website_url", SOCIAL_COLUMNS,
                "last_updated_at");
    }

    /**
     * Submitted-supplier columns: the reference names prefixed with {@code input_},
     * keyed by {@code input_row_key}.
     */
    public static ColumnMapping input() {
        ColumnMapping ref = reference();
        return new ColumnMapping("input_row_key",
                "input_" + ref.nameColumn,
                "input_" + ref.countryColumn,
                "input_" + ref.cityColumn,
                "input_" + ref.streetColumn,
                "input_" + ref.postcodeColumn,
                "input_" + ref.companyTypeColumn,
                "input_" + ref.websiteColumn,
                ref.socialColumns.stream().map(c -> "input_" + c).toList(),
                "input_" + ref.lastUpdatedColumn);
    }

    /**
     * Columns that must be present for any row to be resolvable.
     */
    public List<String> requiredColumns() {
        return List.of(keyColumn, nameColumn);
    }

    /**
     * Every mapped column, required ones first.
     */
    public List<String> allColumns() {
        List<String> columns = new ArrayList<>(requiredColumns());
        for (String column : new String[]{countryColumn, cityColumn, streetColumn, postcodeColumn,
                companyTypeColumn, websiteColumn}) {
            if (column != null) {
                columns.add(column);
            }
        }
        columns.addAll(socialColumns);
        if (lastUpdatedColumn != null) {
            columns.add(lastUpdatedColumn);
        }
        return columns;
    }

    /**
     * Builds a record from a row, looking each mapped column up through {@code values}.
     * Blank values become null; an unparseable update date is treated as missing.
     *
     * @param values returns the raw value of a column, or null when the column is absent
     */
    public EntityRecord.Builder toBuilder(Function<String, String> values) {
        EntityRecord.Builder builder = EntityRecord.builder()
                .key(FieldParsers.text(lookup(values, keyColumn)))
                .name(FieldParsers.text(lookup(values, nameColumn)))
                .country(FieldParsers.text(lookup(values, countryColumn)))
                .city(FieldParsers.text(lookup(values, cityColumn)))
                .street(FieldParsers.text(lookup(values, streetColumn)))
                .postcode(FieldParsers.text(lookup(values, postcodeColumn)))
                .companyType(FieldParsers.text(lookup(values, companyTypeColumn)))
                .websiteUrl(FieldParsers.text(lookup(values, websiteColumn)))
                .lastUpdatedAt(FieldParsers.parseTimestamp(lookup(values, lastUpdatedColumn)));
        for (String column : socialColumns) {
            builder.socialUrl(FieldParsers.text(lookup(values, column)));
        }
        return builder;
    }

    private static String lookup(Function<String, String> values, String column) {
        return column == null ? null : values.apply(column);
    }
}
