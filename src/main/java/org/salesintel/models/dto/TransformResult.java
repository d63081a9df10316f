package org.salesintel.models.dto;

public record TransformResult(boolean successful, Object value, String error) {

    public static TransformResult success(Object value) {
        return new TransformResult(true, value, null);
    }

    public static TransformResult failure(String error) {
        return new TransformResult(false, null, error);
    }
}
