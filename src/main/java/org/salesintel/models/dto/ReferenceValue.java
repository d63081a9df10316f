package org.salesintel.models.dto;

/**
 * Relational pointer as returned by an external system: the related record's identifier plus its
 * display label (an Odoo many2one {@code [7, "Acme Inc"]}, for example).
 */
public record ReferenceValue(Object id, String label) {
}
