package org.salesintel.service.transform;

import org.salesintel.models.enums.FieldDataType;
import org.salesintel.models.enums.TransformType;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Flags transform choices that are unlikely to work for the declared field types. The result is a
 * warning message only; callers never reject a mapping because of it.
 */
public final class TransformCompatibility {

    private static final Set<FieldDataType> NOT_NUMERIC = EnumSet.of(
            FieldDataType.BOOLEAN, FieldDataType.DATE, FieldDataType.DATETIME,
            FieldDataType.REFERENCE, FieldDataType.LIST, FieldDataType.OBJECT);

    private static final Set<FieldDataType> NOT_BOOLEAN = EnumSet.of(
            FieldDataType.DATE, FieldDataType.DATETIME, FieldDataType.REFERENCE, FieldDataType.LIST,
            FieldDataType.OBJECT, FieldDataType.FLOAT, FieldDataType.MONETARY);

    private static final Set<FieldDataType> DATE_SOURCES = EnumSet.of(
            FieldDataType.DATE, FieldDataType.DATETIME, FieldDataType.TEXT, FieldDataType.INTEGER);

    private TransformCompatibility() {
    }

    /**
     * @param sourceType declared type of the source field, or null when the field is not in the schema
     * @param targetType declared type of the canonical field, or null when unknown
     */
    public static Optional<String> check(TransformType transform, FieldDataType sourceType, FieldDataType targetType) {
        if (sourceType == null) {
            return Optional.empty();
        }
        TransformType effective = transform == null ? TransformType.NONE : transform;
        return switch (effective) {
            case EXTRACT_ID, EXTRACT_NAME -> sourceType == FieldDataType.REFERENCE
                    ? Optional.empty()
                    : warn(effective, sourceType, "needs a reference source field");
            case TO_FLOAT, TO_INT -> NOT_NUMERIC.contains(sourceType)
                    ? warn(effective, sourceType, "cannot read a number from this type")
                    : Optional.empty();
            case BOOLEAN -> NOT_BOOLEAN.contains(sourceType)
                    ? warn(effective, sourceType, "cannot read a boolean from this type")
                    : Optional.empty();
            case DATE_PARSE -> DATE_SOURCES.contains(sourceType)
                    ? Optional.empty()
                    : warn(effective, sourceType, "cannot read a date from this type");
            case NONE -> checkDirectCopy(sourceType, targetType);
            default -> Optional.empty();
        };
    }

    private static Optional<String> checkDirectCopy(FieldDataType sourceType, FieldDataType targetType) {
        boolean composite = sourceType == FieldDataType.REFERENCE || sourceType == FieldDataType.LIST;
        if (!composite || targetType == null || targetType.isStructured()) {
            return Optional.empty();
        }
        return Optional.of("Copying a " + sourceType.wireName() + " field into the " + targetType.wireName()
                + " field as-is; consider extract_id or extract_name");
    }

    private static Optional<String> warn(TransformType transform, FieldDataType sourceType, String reason) {
        return Optional.of("Transform " + transform.wireName() + " on a " + sourceType.wireName()
                + " field: " + reason);
    }
}
